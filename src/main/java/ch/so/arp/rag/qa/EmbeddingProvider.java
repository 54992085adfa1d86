package ch.so.arp.rag.qa;

/**
 * Computes the embedding vectors the similarity store compares. Implementations
 * either call a remote embedding API or derive deterministic placeholders for
 * tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding represented as a float array
     * @throws ExternalServiceException if a remote embedding call fails
     */
    float[] embed(String text);
}
