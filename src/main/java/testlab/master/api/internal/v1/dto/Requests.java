package testlab.master.api.internal.v1.dto;

import java.util.Collection;
import java.util.Map;

final class Requests {

    private Requests() {
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " is required");
        }
    }

    /** Null maps are fine; null keys or values are not. */
    static void requireNoNulls(Map<String, String> map, String field) {
        if (map == null) {
            return;
        }
        map.forEach((k, v) -> {
            if (k == null || v == null) {
                throw new IllegalArgumentException(field + " must not contain null keys or values");
            }
        });
    }

    static void requireNoNulls(Collection<String> values, String field) {
        if (values != null && values.stream().anyMatch(v -> v == null)) {
            throw new IllegalArgumentException(field + " must not contain null entries");
        }
    }
}
