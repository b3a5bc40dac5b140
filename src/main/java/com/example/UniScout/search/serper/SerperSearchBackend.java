package com.example.UniScout.search.serper;

import com.example.UniScout.config.SerperProperties;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchResult;
import com.example.UniScout.search.BackendException;
import com.example.UniScout.search.SearchBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google SERP via Serper. Serper has no relevance score, so the score is
 * derived from the SERP position (1 / position). Depth is ignored.
 */
@Component
public class SerperSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(SerperSearchBackend.class);

    private final WebClient serper;
    private final SerperProperties props;

    public SerperSearchBackend(@Qualifier("serperWebClient") WebClient serper, SerperProperties props) {
        this.serper = serper;
        this.props = props;
    }

    @Override
    public BackendId id() {
        return BackendId.SERPER;
    }

    @Override
    public boolean isConfigured() {
        return props.hasApiKey();
    }

    @Override
    public boolean domainScoped() {
        return true;
    }

    @Override
    public List<SearchResult> search(String expression, int limit, SearchDepth depth) {
        SerperResponse response;
        try {
            response = serper.post()
                    .uri("/search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("q", expression, "num", Math.max(1, limit)))
                    .retrieve()
                    .bodyToMono(SerperResponse.class)
                    .timeout(Duration.ofMillis(props.timeoutMs()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new BackendException(id(), "Serper returned HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new BackendException(id(), "Serper call failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new BackendException(id(), "Serper returned an empty body");
        }
        // Serper omits "organic" when nothing matched
        if (response.organic() == null) {
            return List.of();
        }
        log.debug("[Serper] '{}' -> {} results", expression, response.organic().size());
        return toResults(response, limit);
    }

    List<SearchResult> toResults(SerperResponse response, int limit) {
        List<SearchResult> out = new ArrayList<>();
        int rank = 0;
        for (SerperResponse.Item item : response.organic()) {
            rank++;
            if (item == null || item.link() == null || item.link().isBlank()) {
                continue;
            }
            int position = item.position() == null || item.position() <= 0 ? rank : item.position();
            out.add(SearchResult.of(item.title(), item.link(), item.snippet(), 1.0 / position, id()));
            if (out.size() >= Math.max(1, limit)) {
                break;
            }
        }
        return out;
    }
}
