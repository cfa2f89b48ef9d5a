package work.lcod.meshdeploy.compat;

import java.util.Comparator;
import java.util.Objects;

/**
 * Non-blocking notice about a configuration key the mesh runtime ignores.
 * An empty {@code service} marks a project-level warning.
 */
public record Warning(String service, String key, String message) {
    public static final Comparator<Warning> BY_KEY = Comparator.comparing(Warning::key);

    public Warning {
        service = service == null ? "" : service;
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(message, "message");
    }

    public boolean isProjectLevel() {
        return service.isEmpty();
    }

    @Override
    public String toString() {
        if (isProjectLevel()) {
            return message;
        }
        return "service '" + service + "': " + message;
    }
}
