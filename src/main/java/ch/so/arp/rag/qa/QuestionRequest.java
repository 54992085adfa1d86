package ch.so.arp.rag.qa;

import jakarta.validation.constraints.NotBlank;

/**
 * Incoming payload for adding a question; {@code parentId} is optional.
 */
public record QuestionRequest(@NotBlank String question, Long parentId) {
}
