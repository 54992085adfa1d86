package ch.so.arp.rag.qa;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * PostgreSQL backed {@link SimilarityStore} using pgvector for the cosine
 * distance and a jsonb column for the metadata. Several named collections share
 * one table; equality filters are evaluated with jsonb containment. The table is
 * created by {@code schema-postgres.sql}.
 */
class PostgresSimilarityStore implements SimilarityStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresSimilarityStore.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {
    };

    private static final String INSERT_SQL = """
            INSERT INTO qa_documents (collection, id, document, metadata, embedding)
            VALUES (:collection, :id, :document, CAST(:metadata AS jsonb), CAST(:embedding AS vector))
            """;

    private static final String UPDATE_SQL = """
            UPDATE qa_documents
               SET document = :document,
                   metadata = CAST(:metadata AS jsonb),
                   embedding = CAST(:embedding AS vector)
             WHERE collection = :collection AND id = :id
            """;

    private static final String QUERY_SQL = """
            SELECT id, document, metadata::text AS metadata,
                   (embedding <=> CAST(:embedding AS vector)) AS distance
              FROM qa_documents
             WHERE collection = :collection
               AND metadata @> CAST(:filter AS jsonb)
             ORDER BY embedding <=> CAST(:embedding AS vector)
             LIMIT :limit
            """;

    private static final String GET_SQL = """
            SELECT id, document, metadata::text AS metadata
              FROM qa_documents
             WHERE collection = :collection
               AND metadata @> CAST(:filter AS jsonb)
             ORDER BY seq
            """;

    private final JdbcClient jdbcClient;
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper;
    private final String collection;

    PostgresSimilarityStore(JdbcClient jdbcClient, EmbeddingProvider embeddingProvider, ObjectMapper objectMapper,
            String collection) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.collection = Objects.requireNonNull(collection, "collection");
    }

    @Override
    public void add(List<SimilarityDocument> documents) {
        execute("add documents", () -> {
            for (SimilarityDocument document : documents) {
                jdbcClient.sql(INSERT_SQL)
                        .param("collection", collection)
                        .param("id", document.id())
                        .param("document", document.document())
                        .param("metadata", toJson(document.metadata()))
                        .param("embedding", toPgVectorLiteral(embeddingProvider.embed(document.document())))
                        .update();
            }
            return null;
        });
        LOGGER.debug("Added {} documents to collection '{}'", documents.size(), collection);
    }

    @Override
    public List<SimilarityHit> query(String queryText, int limit, Map<String, ?> filter) {
        if (limit <= 0) {
            return List.of();
        }
        String embedding = toPgVectorLiteral(embeddingProvider.embed(queryText));
        return execute("query documents", () -> jdbcClient.sql(QUERY_SQL)
                .param("embedding", embedding)
                .param("collection", collection)
                .param("filter", toJson(filter))
                .param("limit", limit)
                .query((rs, rowNum) -> new SimilarityHit(mapDocument(rs), rs.getDouble("distance")))
                .list());
    }

    @Override
    public void update(List<SimilarityDocument> documents) {
        execute("update documents", () -> {
            for (SimilarityDocument document : documents) {
                int updated = jdbcClient.sql(UPDATE_SQL)
                        .param("document", document.document())
                        .param("metadata", toJson(document.metadata()))
                        .param("embedding", toPgVectorLiteral(embeddingProvider.embed(document.document())))
                        .param("collection", collection)
                        .param("id", document.id())
                        .update();
                if (updated == 0) {
                    throw new ExternalServiceException("Document id " + document.id() + " does not exist");
                }
            }
            return null;
        });
    }

    @Override
    public List<SimilarityDocument> get(Map<String, ?> filter) {
        return execute("get documents", () -> jdbcClient.sql(GET_SQL)
                .param("collection", collection)
                .param("filter", toJson(filter))
                .query(this::mapRow)
                .list());
    }

    @Override
    public void delete(Collection<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        execute("delete documents", () -> jdbcClient
                .sql("DELETE FROM qa_documents WHERE collection = :collection AND id IN (:ids)")
                .param("collection", collection)
                .param("ids", List.copyOf(ids))
                .update());
    }

    @Override
    public long count() {
        return execute("count documents", () -> jdbcClient
                .sql("SELECT COUNT(*) FROM qa_documents WHERE collection = :collection")
                .param("collection", collection)
                .query(Long.class)
                .single());
    }

    @Override
    public void reset() {
        int removed = execute("reset collection", () -> jdbcClient
                .sql("DELETE FROM qa_documents WHERE collection = :collection")
                .param("collection", collection)
                .update());
        LOGGER.info("Collection '{}' reset, {} documents removed", collection, removed);
    }

    private <T> T execute(String action, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (DataAccessException ex) {
            throw new ExternalServiceException("Similarity store failed to " + action + " in collection '"
                    + collection + "': " + ex.getMessage(), ex);
        }
    }

    private SimilarityDocument mapRow(ResultSet rs, int rowNum) throws SQLException {
        return mapDocument(rs);
    }

    private SimilarityDocument mapDocument(ResultSet rs) throws SQLException {
        try {
            Map<String, Object> metadata = objectMapper.readValue(rs.getString("metadata"), METADATA_TYPE);
            return new SimilarityDocument(rs.getString("id"), rs.getString("document"), metadata);
        } catch (JsonProcessingException ex) {
            throw new SQLException("Failed to deserialize metadata of document " + rs.getString("id"), ex);
        }
    }

    private String toJson(Map<String, ?> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? Map.of() : SimilarityDocument.normalize(metadata));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Metadata cannot be serialized: " + metadata, ex);
        }
    }

    private String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }
}
