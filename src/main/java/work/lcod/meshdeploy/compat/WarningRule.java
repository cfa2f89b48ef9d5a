package work.lcod.meshdeploy.compat;

import java.util.Objects;
import java.util.Optional;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.ServiceConfig;

/**
 * One catalogue entry: a stable key, the message shown to users and the check that triggers it.
 */
public record WarningRule(String key, String message, ServiceCheck check) {
    public WarningRule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(check, "check");
        if (key.isBlank()) {
            throw new IllegalArgumentException("warning key must not be blank");
        }
    }

    public Optional<Warning> evaluate(Project project, ServiceConfig service) {
        if (!check.test(project, service)) {
            return Optional.empty();
        }
        return Optional.of(new Warning(service.name(), key, message));
    }
}
