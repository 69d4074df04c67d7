package com.example.chatorchestrator.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strips absent values ({@code null} and empty {@link Optional}) from documents before
 * they reach the store, recursing into nested maps and lists. Present optionals are unwrapped.
 */
public final class DocumentSanitizer {

    private DocumentSanitizer() {
    }

    public static Map<String, Object> sanitize(Map<String, ?> doc) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (doc == null) {
            return out;
        }
        doc.forEach((key, value) -> {
            Object clean = clean(value);
            if (clean != null) {
                out.put(key, clean);
            }
        });
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object clean(Object value) {
        if (value instanceof Optional) {
            return ((Optional<Object>) value).map(DocumentSanitizer::clean).orElse(null);
        }
        if (value instanceof Map) {
            return sanitize((Map<String, ?>) value);
        }
        if (value instanceof Collection) {
            List<Object> items = new ArrayList<>();
            for (Object item : (Collection<?>) value) {
                Object clean = clean(item);
                if (clean != null) {
                    items.add(clean);
                }
            }
            return items;
        }
        return value;
    }
}
