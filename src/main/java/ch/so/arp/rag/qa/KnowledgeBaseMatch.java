package ch.so.arp.rag.qa;

import java.util.Map;

/**
 * One result of a knowledge base query. The metadata excludes the answer,
 * which is exposed separately; similarity is {@code 1 - distance}.
 */
public record KnowledgeBaseMatch(String question, String answer, Map<String, Object> metadata, double similarity) {
}
