package ch.so.arp.rag.qa;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record KnowledgeBaseAnswerRequest(@NotBlank String question, @NotNull String answer) {
}
