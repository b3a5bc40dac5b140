package com.example.UniScout.search.tavily;

import com.example.UniScout.config.TavilyProperties;
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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tavily web search. Results carry Tavily's own relevance score and, when
 * requested, the extracted page text instead of the short snippet.
 */
@Component
public class TavilySearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(TavilySearchBackend.class);

    private final WebClient tavily;
    private final TavilyProperties props;

    public TavilySearchBackend(@Qualifier("tavilyWebClient") WebClient tavily, TavilyProperties props) {
        this.tavily = tavily;
        this.props = props;
    }

    @Override
    public BackendId id() {
        return BackendId.TAVILY;
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
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", expression);
        body.put("search_depth", (depth == null ? SearchDepth.BASIC : depth).wireValue());
        body.put("max_results", Math.max(1, limit));
        body.put("include_answer", false);
        body.put("include_images", false);
        body.put("include_raw_content", props.includeRawContent());

        TavilyResponse response;
        try {
            response = tavily.post()
                    .uri("/search")
                    .headers(h -> h.setBearerAuth(props.apiKey()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(TavilyResponse.class)
                    .timeout(Duration.ofMillis(props.timeoutMs()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new BackendException(id(), "Tavily returned HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new BackendException(id(), "Tavily call failed: " + e.getMessage(), e);
        }

        if (response == null || response.results() == null) {
            throw new BackendException(id(), "Tavily payload has no results field");
        }
        log.debug("[Tavily] '{}' -> {} results", expression, response.results().size());
        return toResults(response, limit);
    }

    List<SearchResult> toResults(TavilyResponse response, int limit) {
        return response.results().stream()
                .filter(Objects::nonNull)
                .filter(item -> item.url() != null && !item.url().isBlank())
                .limit(Math.max(1, limit))
                .map(item -> SearchResult.of(
                        item.title(),
                        item.url(),
                        item.rawContent() != null && !item.rawContent().isBlank() ? item.rawContent() : item.content(),
                        item.score(),
                        id()))
                .toList();
    }
}
