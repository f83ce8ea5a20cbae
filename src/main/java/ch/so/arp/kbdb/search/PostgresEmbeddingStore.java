package ch.so.arp.kbdb.search;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * PostgreSQL backed {@link EmbeddingStore}. Nearest neighbour ordering is done
 * by pgvector; each distance metric gets its own statement so that the matching
 * HNSW index ({@code vector_cosine_ops}, {@code vector_ip_ops} or
 * {@code vector_l2_ops}) can serve the query.
 */
class PostgresEmbeddingStore implements EmbeddingStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresEmbeddingStore.class);

    private static final String SEARCH_SQL_TEMPLATE = """
            SELECT
              d.id AS document_id,
              d.name AS document_name,
              c."index" AS chunk_index,
              c.content AS content,
              (e.embedding %1$s :embedding::vector) AS distance
            FROM embeddings e
            JOIN document_chunks c ON e.chunk_id = c.id
            JOIN documents d ON c.document_id = d.id
            WHERE e.model = :model AND e.task = :task
            ORDER BY e.embedding %1$s :embedding::vector ASC, c.document_id ASC, c."index" ASC
            LIMIT :limit
            """;

    private static final Map<DistanceMetric, String> SEARCH_SQL = new EnumMap<>(DistanceMetric.class);

    static {
        for (DistanceMetric metric : DistanceMetric.values()) {
            SEARCH_SQL.put(metric, SEARCH_SQL_TEMPLATE.formatted(metric.operator()));
        }
    }

    private final JdbcClient jdbcClient;

    PostgresEmbeddingStore(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    @Override
    public List<SearchResult> findNearest(float[] queryVector, Modality modality, int limit) {
        DistanceMetric metric = modality.metric();
        List<SearchResult> results;
        try {
            results = jdbcClient.sql(searchSql(metric))
                    .param("embedding", toPgVectorLiteral(queryVector))
                    .param("model", modality.strategy().model())
                    .param("task", modality.task())
                    .param("limit", limit)
                    .query(new SearchResultMapper(metric))
                    .list();
        } catch (DataAccessException ex) {
            throw new DocumentStoreException("Nearest neighbour query for modality '" + modality.name()
                    + "' failed: " + ex.getMostSpecificCause().getMessage(), ex);
        }
        LOGGER.debug("Nearest neighbour query for model {} and task {} returned {} rows (limit={})",
                modality.strategy().model(), modality.task(), results.size(), limit);
        return results;
    }

    static String searchSql(DistanceMetric metric) {
        return SEARCH_SQL.get(metric);
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(embedding[i]);
        }
        builder.append(']');
        return builder.toString();
    }

    private static final class SearchResultMapper implements RowMapper<SearchResult> {

        private final DistanceMetric metric;

        SearchResultMapper(DistanceMetric metric) {
            this.metric = metric;
        }

        @Override
        public SearchResult mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new SearchResult(
                    rs.getLong("document_id"),
                    rs.getString("document_name"),
                    rs.getInt("chunk_index"),
                    rs.getString("content"),
                    metric.score(rs.getDouble("distance")));
        }
    }
}
