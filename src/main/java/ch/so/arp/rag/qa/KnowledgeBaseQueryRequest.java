package ch.so.arp.rag.qa;

import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Incoming payload for knowledge base queries. Missing numbers fall back to the
 * configured result count and no rephrasings.
 */
public record KnowledgeBaseQueryRequest(
        @NotBlank String question,
        @Positive Integer nResults,
        Map<String, Object> metadataFilter,
        @PositiveOrZero Integer numRewordings) {
}
