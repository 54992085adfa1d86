package ch.so.arp.rag.qa;

import jakarta.validation.constraints.NotBlank;

public record QaExtractionRequest(@NotBlank String text, boolean index) {
}
