package ch.so.arp.rag.qa;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SimilarityStore} keeping all documents in memory. Distances are cosine
 * distances between the embeddings of the query and the stored document text,
 * so identical texts have distance zero. Used for local development and tests.
 */
class InMemorySimilarityStore implements SimilarityStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemorySimilarityStore.class);

    private final EmbeddingProvider embeddingProvider;
    private final Map<String, StoredDocument> documents = new LinkedHashMap<>();

    InMemorySimilarityStore(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    @Override
    public synchronized void add(List<SimilarityDocument> newDocuments) {
        for (SimilarityDocument document : newDocuments) {
            if (documents.containsKey(document.id())) {
                throw new ExternalServiceException("Document id " + document.id() + " already exists");
            }
        }
        newDocuments.forEach(document -> documents.put(document.id(),
                new StoredDocument(document, embeddingProvider.embed(document.document()))));
        LOGGER.debug("Added {} documents, collection holds {}", newDocuments.size(), documents.size());
    }

    @Override
    public synchronized List<SimilarityHit> query(String queryText, int limit, Map<String, ?> filter) {
        if (limit <= 0 || documents.isEmpty()) {
            return List.of();
        }
        float[] queryEmbedding = embeddingProvider.embed(queryText);
        return documents.values().stream()
                .filter(stored -> stored.document().matches(filter))
                .map(stored -> new SimilarityHit(stored.document(), cosineDistance(queryEmbedding, stored.embedding())))
                .sorted(Comparator.comparingDouble(SimilarityHit::distance))
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized void update(List<SimilarityDocument> changed) {
        for (SimilarityDocument document : changed) {
            if (!documents.containsKey(document.id())) {
                throw new ExternalServiceException("Document id " + document.id() + " does not exist");
            }
        }
        changed.forEach(document -> documents.put(document.id(),
                new StoredDocument(document, embeddingProvider.embed(document.document()))));
    }

    @Override
    public synchronized List<SimilarityDocument> get(Map<String, ?> filter) {
        List<SimilarityDocument> result = new ArrayList<>();
        for (StoredDocument stored : documents.values()) {
            if (stored.document().matches(filter)) {
                result.add(stored.document());
            }
        }
        return result;
    }

    @Override
    public synchronized void delete(Collection<String> ids) {
        ids.forEach(documents::remove);
    }

    @Override
    public synchronized long count() {
        return documents.size();
    }

    @Override
    public synchronized void reset() {
        documents.clear();
        LOGGER.debug("In-memory collection reset");
    }

    private static double cosineDistance(float[] left, float[] right) {
        if (left.length != right.length) {
            throw new ExternalServiceException(
                    "Embedding dimensions differ: " + left.length + " vs " + right.length);
        }
        double dot = 0.0d;
        double leftNorm = 0.0d;
        double rightNorm = 0.0d;
        for (int i = 0; i < left.length; i++) {
            dot += left[i] * right[i];
            leftNorm += left[i] * left[i];
            rightNorm += right[i] * right[i];
        }
        if (leftNorm == 0.0d || rightNorm == 0.0d) {
            return 1.0d;
        }
        return 1.0d - dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
    }

    private record StoredDocument(SimilarityDocument document, float[] embedding) {
    }
}
