package work.lcod.meshdeploy.cluster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PruneFilters {
    public static final String DANGLING = "dangling";

    private PruneFilters() {}

    /**
     * Parses {@code name=value} filters into a multimap. With {@code all}, unused tagged images are
     * pruned too, not just dangling ones.
     *
     * @throws IllegalArgumentException when an entry has no {@code =}
     */
    public static Map<String, List<String>> parse(List<String> filters, boolean all) {
        var parsed = new LinkedHashMap<String, List<String>>();
        if (all) {
            parsed.computeIfAbsent(DANGLING, key -> new ArrayList<>()).add("false");
        }
        if (filters != null) {
            for (String filter : filters) {
                int separator = filter.indexOf('=');
                if (separator < 0) {
                    throw new IllegalArgumentException("invalid filter '" + filter + "'");
                }
                parsed.computeIfAbsent(filter.substring(0, separator), key -> new ArrayList<>())
                    .add(filter.substring(separator + 1));
            }
        }
        var frozen = new LinkedHashMap<String, List<String>>();
        parsed.forEach((name, values) -> frozen.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(frozen);
    }
}
