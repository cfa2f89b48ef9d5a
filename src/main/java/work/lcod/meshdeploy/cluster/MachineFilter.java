package work.lcod.meshdeploy.cluster;

import java.util.LinkedHashSet;
import java.util.List;

public final class MachineFilter {
    private MachineFilter() {}

    /**
     * Flattens repeated and comma-separated {@code --machine} values: trimmed, blanks dropped,
     * first occurrence wins.
     */
    public static List<String> expand(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        var expanded = new LinkedHashSet<String>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            for (String part : value.split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    expanded.add(trimmed);
                }
            }
        }
        return List.copyOf(expanded);
    }
}
