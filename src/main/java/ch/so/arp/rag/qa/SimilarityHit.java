package ch.so.arp.rag.qa;

/**
 * One nearest-neighbour match as reported by the similarity store. The distance
 * is store-native, lower means closer.
 */
public record SimilarityHit(SimilarityDocument document, double distance) {
}
