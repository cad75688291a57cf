package com.example.Lily.repository;


import com.example.Lily.model.KbDocument;
import com.example.Lily.model.ScoredDocument;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class KbDocumentVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(KbDocumentVectorRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Nearest documents of one doc_type by pgvector cosine distance `<=>`,
     * with similarity score = 1 - distance.
     */
    public List<ScoredDocument> findNearest(float[] embedding, String docType, int limit) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT id,
                       doc_type,
                       content,
                       metadata,
                       1 - (embedding <=> ?) AS score
                FROM kb_documents
                WHERE doc_type = ?
                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector); // for 1 - (embedding <=> ?)
            ps.setString(2, docType);
            ps.setObject(3, queryVector); // for ORDER BY embedding <=> ?
            ps.setInt(4, limit);
        }, new ScoredDocumentRowMapper());
    }

    private class ScoredDocumentRowMapper implements RowMapper<ScoredDocument> {
        @Override
        public ScoredDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
            KbDocument doc = new KbDocument();
            doc.setId(rs.getLong("id"));
            doc.setDocType(rs.getString("doc_type"));
            doc.setContent(rs.getString("content"));

            String metadataJson = rs.getString("metadata");
            if (metadataJson != null) {
                try {
                    JsonNode node = objectMapper.readTree(metadataJson);
                    doc.setMetadata(node);
                } catch (JsonProcessingException e) {
                    // Metadata is informational only; keep the document without it
                    log.debug("Unreadable metadata on kb document {}", doc.getId(), e);
                    doc.setMetadata(null);
                }
            }

            double score = rs.getDouble("score");
            return new ScoredDocument(doc, score);
        }
    }
}
