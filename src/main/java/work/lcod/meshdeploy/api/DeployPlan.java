package work.lcod.meshdeploy.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.meshdeploy.compat.Warning;

/**
 * Everything the deploy pipeline needs from a project: advisory warnings and per-service secret plans.
 */
public record DeployPlan(String projectName, List<Warning> warnings, List<ServicePlan> services) {
    public DeployPlan {
        Objects.requireNonNull(projectName, "projectName");
        warnings = List.copyOf(warnings);
        services = List.copyOf(services);
    }

    public Optional<ServicePlan> service(String name) {
        return services.stream().filter(plan -> plan.service().equals(name)).findFirst();
    }
}
