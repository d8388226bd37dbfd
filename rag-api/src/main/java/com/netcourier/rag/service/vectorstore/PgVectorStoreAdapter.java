package com.netcourier.rag.service.vectorstore;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import com.pgvector.PGvector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Vector table in PostgreSQL using the pgvector extension. Similarity is {@code 1 - cosine distance}.
 */
@Component
@ConditionalOnProperty(prefix = "rag.vector-store", name = "backend", havingValue = "pgvector")
public class PgVectorStoreAdapter implements VectorStoreAdapter {

    private static final Logger log = LoggerFactory.getLogger(PgVectorStoreAdapter.class);
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");
    private static final TypeReference<Map<String, String>> PAYLOAD = new TypeReference<>() {
    };

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final String table;
    private final int dimension;
    private final double minScore;
    private volatile boolean schemaReady;

    public PgVectorStoreAdapter(JdbcClient jdbcClient,
                                TransactionTemplate transactionTemplate,
                                ObjectMapper objectMapper,
                                RagProperties properties) {
        String configured = properties.vectorStore().table();
        if (!TABLE_NAME.matcher(configured).matches()) {
            throw new IllegalArgumentException("Invalid vector table name " + configured);
        }
        this.jdbcClient = jdbcClient;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.table = configured;
        this.dimension = properties.embedding().dimension();
        this.minScore = properties.vectorStore().minScore();
    }

    @Override
    public void upsert(List<VectorRecord> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        records.forEach(record -> VectorStoreAdapter.requireDimension(dimension, record.vector()));
        ensureSchema();
        String sql = "INSERT INTO " + table + " (id, document_id, embedding, payload) "
                + "VALUES (:id, :documentId, :embedding, CAST(:payload AS jsonb)) "
                + "ON CONFLICT (id) DO UPDATE SET document_id = EXCLUDED.document_id, "
                + "embedding = EXCLUDED.embedding, payload = EXCLUDED.payload, updated_at = now()";
        execute("upsert", () -> transactionTemplate.execute(status -> {
            for (VectorRecord record : records) {
                jdbcClient.sql(sql)
                        .param("id", record.id())
                        .param("documentId", record.documentId() == null ? "" : record.documentId())
                        .param("embedding", new PGvector(record.vector()))
                        .param("payload", writePayload(record.payload()))
                        .update();
            }
            return records.size();
        }));
    }

    @Override
    public List<VectorMatch> search(float[] query, int topK, Map<String, String> filters) {
        VectorStoreAdapter.requireDimension(dimension, query);
        ensureSchema();
        boolean filtered = filters != null && !filters.isEmpty();
        String sql = "SELECT id, payload::text AS payload, 1 - (embedding <=> :query) AS score FROM " + table
                + (filtered ? " WHERE payload @> CAST(:filter AS jsonb)" : "")
                + " ORDER BY embedding <=> :query, id LIMIT :limit";
        List<VectorMatch> matches = execute("search", () -> {
            JdbcClient.StatementSpec statement = jdbcClient.sql(sql)
                    .param("query", new PGvector(query))
                    .param("limit", topK);
            if (filtered) {
                statement = statement.param("filter", writePayload(filters));
            }
            return statement
                    .query((rs, rowNum) -> new VectorMatch(rs.getString("id"), rs.getDouble("score"),
                            readPayload(rs.getString("payload"))))
                    .list();
        });
        return VectorRanking.rank(matches, topK, minScore);
    }

    @Override
    public int delete(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        ensureSchema();
        return execute("delete", () -> jdbcClient.sql("DELETE FROM " + table + " WHERE id IN (:ids)")
                .param("ids", List.copyOf(ids))
                .update());
    }

    @Override
    public VectorStoreStats stats() {
        ensureSchema();
        Long total = execute("stats", () -> jdbcClient.sql("SELECT count(*) FROM " + table)
                .query(Long.class)
                .single());
        return new VectorStoreStats("pgvector", similarityMetric(), total == null ? 0 : total, dimension);
    }

    private synchronized void ensureSchema() {
        if (schemaReady) {
            return;
        }
        execute("schema setup", () -> {
            jdbcClient.sql("CREATE EXTENSION IF NOT EXISTS vector").update();
            jdbcClient.sql("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id varchar(64) PRIMARY KEY, "
                    + "document_id varchar(64) NOT NULL, "
                    + "embedding vector(" + dimension + ") NOT NULL, "
                    + "payload jsonb NOT NULL DEFAULT '{}'::jsonb, "
                    + "updated_at timestamptz NOT NULL DEFAULT now())").update();
            jdbcClient.sql("CREATE INDEX IF NOT EXISTS " + table + "_embedding_idx ON " + table
                    + " USING hnsw (embedding vector_cosine_ops)").update();
            return null;
        });
        log.info("pgvector table {} ready (dimension {})", table, dimension);
        schemaReady = true;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            log.warn("pgvector {} failed: {}", operation, e.getMessage());
            throw new VectorStoreUnavailableException("pgvector unavailable during " + operation, e);
        } catch (DataAccessException e) {
            log.error("pgvector {} failed", operation, e);
            throw new PipelineException(HttpStatus.BAD_GATEWAY, PipelineStage.RETRIEVAL,
                    "pgvector " + operation + " failed", e);
        }
    }

    private String writePayload(Map<String, String> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable vector payload", e);
        }
    }

    private Map<String, String> readPayload(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt vector payload", e);
        }
    }
}
