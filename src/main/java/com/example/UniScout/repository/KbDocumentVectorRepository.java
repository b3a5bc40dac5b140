package com.example.UniScout.repository;

import com.example.UniScout.model.KbDocument;
import com.example.UniScout.model.ScoredDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class KbDocumentVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(KbDocumentVectorRepository.class);

    /**
     * Cosine distance via pgvector's {@code <=>}; similarity score = 1 - distance.
     * Rows below the similarity floor are excluded in SQL.
     */
    private static final String NEAREST_SQL = """
            SELECT id,
                   doc_type,
                   content,
                   metadata,
                   1 - (embedding <=> ?) AS score
            FROM kb_documents
            WHERE 1 - (embedding <=> ?) >= ?
            ORDER BY embedding <=> ?
            LIMIT ?
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public List<ScoredDocument> findNearest(float[] embedding, int limit, double minScore) {
        PGvector queryVector = new PGvector(embedding);

        return jdbcTemplate.query(NEAREST_SQL, ps -> {
            ps.setObject(1, queryVector);
            ps.setObject(2, queryVector);
            ps.setDouble(3, minScore);
            ps.setObject(4, queryVector);
            ps.setInt(5, limit);
        }, (rs, rowNum) -> mapRow(rs));
    }

    private ScoredDocument mapRow(ResultSet rs) throws SQLException {
        KbDocument doc = new KbDocument();
        doc.setId(rs.getLong("id"));
        doc.setDocType(rs.getString("doc_type"));
        doc.setContent(rs.getString("content"));

        String metadataJson = rs.getString("metadata");
        if (metadataJson != null) {
            try {
                doc.setMetadata(objectMapper.readTree(metadataJson));
            } catch (JsonProcessingException e) {
                // title and url fall back to synthetic values downstream
                log.warn("Unreadable metadata on kb_documents row {}", doc.getId());
            }
        }
        return new ScoredDocument(doc, rs.getDouble("score"));
    }
}
