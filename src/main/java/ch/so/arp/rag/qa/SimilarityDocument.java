package ch.so.arp.rag.qa;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A text document stored in the similarity store together with its metadata.
 * Metadata values are strings, booleans or numbers; integral numbers are kept
 * as {@link Long}.
 */
public record SimilarityDocument(String id, String document, Map<String, Object> metadata) {

    public SimilarityDocument {
        metadata = Collections.unmodifiableMap(normalize(metadata));
    }

    public Object metadataValue(String key) {
        return metadata.get(key);
    }

    /**
     * Whether every entry of the equality filter is present in the metadata.
     * Numbers compare by value regardless of their boxed type.
     */
    public boolean matches(Map<String, ?> filter) {
        if (filter == null) {
            return true;
        }
        for (Map.Entry<String, ?> entry : filter.entrySet()) {
            Object actual = metadata.get(entry.getKey());
            Object expected = normalizeValue(entry.getValue());
            if (actual instanceof Number a && expected instanceof Number e) {
                if (Double.compare(a.doubleValue(), e.doubleValue()) != 0) {
                    return false;
                }
            } else if (!Objects.equals(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    public SimilarityDocument withMetadata(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(metadata);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new SimilarityDocument(id, document, copy);
    }

    /**
     * Copy the map, dropping {@code null} values and widening integral numbers
     * to {@link Long} so that equality filters compare consistently.
     */
    static Map<String, Object> normalize(Map<String, ?> metadata) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        if (metadata == null) {
            return normalized;
        }
        metadata.forEach((key, value) -> {
            if (value != null) {
                normalized.put(key, normalizeValue(value));
            }
        });
        return normalized;
    }

    static Object normalizeValue(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return value;
    }
}
