package ch.so.arp.rag.qa;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Similarity-searchable collection of text documents with metadata. Filters are
 * equality constraints on metadata keys; all entries of a filter must match.
 * Implementations report failures as {@link ExternalServiceException}.
 */
public interface SimilarityStore {

    void add(List<SimilarityDocument> documents);

    /**
     * Find the documents closest to the query text.
     *
     * @param queryText the text to search for
     * @param limit     the maximum amount of hits
     * @param filter    equality metadata filter, {@code null} or empty for none
     * @return hits ordered by ascending distance
     */
    List<SimilarityHit> query(String queryText, int limit, Map<String, ?> filter);

    /**
     * Replace text and metadata of existing documents, matched by id.
     */
    void update(List<SimilarityDocument> documents);

    /**
     * All documents matching the filter, in insertion order.
     */
    List<SimilarityDocument> get(Map<String, ?> filter);

    void delete(Collection<String> ids);

    long count();

    /**
     * Drop the collection and create it again empty.
     */
    void reset();
}
