package com.example.UniScout.search.kb;

import com.example.UniScout.config.KnowledgeBaseProperties;
import com.example.UniScout.model.BackendId;
import com.example.UniScout.model.KbDocument;
import com.example.UniScout.model.ScoredDocument;
import com.example.UniScout.model.SearchDepth;
import com.example.UniScout.model.SearchResult;
import com.example.UniScout.repository.KbDocumentVectorRepository;
import com.example.UniScout.search.BackendException;
import com.example.UniScout.search.SearchBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Semantic search over the curated document corpus:
 * - embed the search expression
 * - query pgvector for the nearest documents above the similarity floor
 * - normalize rows into {@link SearchResult}, taking title/url from metadata
 *
 * Depth is ignored; the corpus has a single retrieval mode.
 */
@Component
public class KnowledgeBaseSearchBackend implements SearchBackend {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseSearchBackend.class);

    private final EmbeddingModel embeddingModel;
    private final KbDocumentVectorRepository repository;
    private final KnowledgeBaseProperties props;

    public KnowledgeBaseSearchBackend(ObjectProvider<EmbeddingModel> embeddingModel,
                                      KbDocumentVectorRepository repository,
                                      KnowledgeBaseProperties props) {
        this.embeddingModel = embeddingModel.getIfAvailable();
        this.repository = repository;
        this.props = props;
    }

    @Override
    public BackendId id() {
        return BackendId.KNOWLEDGE_BASE;
    }

    @Override
    public boolean isConfigured() {
        return props.enabled() && embeddingModel != null;
    }

    @Override
    public boolean domainScoped() {
        return false;
    }

    @Override
    public List<SearchResult> search(String expression, int limit, SearchDepth depth) {
        List<ScoredDocument> nearest;
        try {
            float[] queryEmbedding = embeddingModel.embed(expression);
            nearest = repository.findNearest(queryEmbedding, Math.max(1, limit), props.minScore());
        } catch (RuntimeException e) {
            throw new BackendException(id(), "Knowledge base lookup failed: " + e.getMessage(), e);
        }

        if (nearest == null || nearest.isEmpty()) {
            log.debug("[KB] no documents above {} for '{}'", props.minScore(), expression);
            return List.of();
        }
        return nearest.stream().map(this::toResult).toList();
    }

    private SearchResult toResult(ScoredDocument scored) {
        KbDocument doc = scored.document();
        String title = doc.metadataText("title");
        String url = doc.metadataText("url");
        return SearchResult.of(
                title != null ? title : doc.getDocType() + " #" + doc.getId(),
                url != null ? url : "kb://" + doc.getDocType() + "/" + doc.getId(),
                doc.getContent(),
                scored.score(),
                id());
    }
}
