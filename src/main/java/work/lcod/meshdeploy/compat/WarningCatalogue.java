package work.lcod.meshdeploy.compat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered table of warning rules. Keys are unique; registration order is kept.
 */
public final class WarningCatalogue {
    private final Map<String, WarningRule> rules = new LinkedHashMap<>();

    public static WarningCatalogue standard() {
        var catalogue = new WarningCatalogue();
        ServiceRules.register(catalogue);
        DeployRules.register(catalogue);
        return catalogue;
    }

    public WarningCatalogue register(String key, String message, ServiceCheck check) {
        return register(new WarningRule(key, message, check));
    }

    public WarningCatalogue register(WarningRule rule) {
        if (rules.containsKey(rule.key())) {
            throw new IllegalArgumentException("Duplicate warning key: " + rule.key());
        }
        rules.put(rule.key(), rule);
        return this;
    }

    public Optional<WarningRule> get(String key) {
        return Optional.ofNullable(rules.get(key));
    }

    public List<WarningRule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules.values()));
    }

    public List<String> keys() {
        return List.copyOf(rules.keySet());
    }

    public int size() {
        return rules.size();
    }
}
