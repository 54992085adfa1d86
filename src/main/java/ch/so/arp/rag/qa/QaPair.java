package ch.so.arp.rag.qa;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A question/answer pair extracted from prose. Serialized with the short keys
 * the extraction prompt asks for.
 */
public record QaPair(@JsonProperty("q") String question, @JsonProperty("a") String answer) {
}
