package work.lcod.meshdeploy.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Copies {
    private Copies() {}

    // Keeps insertion order and tolerates null values (e.g. `networks: {default: null}`).
    static <K, V> Map<K, V> map(Map<K, V> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    static <T> List<T> list(List<T> source) {
        if (source == null || source.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(source));
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
