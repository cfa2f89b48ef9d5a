package work.lcod.meshdeploy.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fully loaded compose project: services in declaration order plus project-level secret definitions.
 * The project name doubles as the identifier of the implicit default network.
 */
public record Project(String name, List<ServiceConfig> services, Map<String, SecretConfig> secrets, Path workingDirectory) {
    public static final String DEFAULT_NETWORK = "default";

    public Project {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(workingDirectory, "workingDirectory");
        services = Copies.list(services);
        secrets = Copies.map(secrets);
        var seen = new LinkedHashSet<String>();
        for (var service : services) {
            if (!seen.add(service.name())) {
                throw new IllegalArgumentException("Duplicate service name: " + service.name());
            }
        }
    }

    public List<String> serviceNames() {
        var names = new ArrayList<String>(services.size());
        for (var service : services) {
            names.add(service.name());
        }
        return names;
    }

    public Optional<ServiceConfig> service(String serviceName) {
        return services.stream().filter(service -> service.name().equals(serviceName)).findFirst();
    }

    /**
     * Keeps only the named services, in project order.
     */
    public Project select(Collection<String> serviceNames) {
        if (serviceNames == null || serviceNames.isEmpty()) {
            return this;
        }
        var known = serviceNames();
        for (var requested : serviceNames) {
            if (!known.contains(requested)) {
                throw new IllegalArgumentException("No such service: " + requested);
            }
        }
        var selected = services.stream().filter(service -> serviceNames.contains(service.name())).toList();
        return new Project(name, selected, secrets, workingDirectory);
    }
}
