package ch.so.arp.rag.qa;

import jakarta.validation.constraints.NotNull;

/**
 * Incoming payload for answering a question. Non-text answers are expected to
 * be serialized to a string by the caller.
 */
public record AnswerRequest(@NotNull String answer) {
}
