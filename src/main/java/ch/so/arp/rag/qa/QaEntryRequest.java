package ch.so.arp.rag.qa;

import java.util.List;
import java.util.Map;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Incoming payload for indexing a question/answer pair. A single question with
 * {@code numRewordings > 0} is expanded by the language model, several
 * questions are indexed as given.
 */
public record QaEntryRequest(
        @NotEmpty List<@NotBlank String> questions,
        String answer,
        Map<String, Object> metadata,
        @PositiveOrZero int numRewordings) {
}
