package work.lcod.meshdeploy.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.meshdeploy.compat.CompatibilityScanner;
import work.lcod.meshdeploy.compat.Warning;
import work.lcod.meshdeploy.loader.LoadOptions;
import work.lcod.meshdeploy.loader.ProjectLoader;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.secret.SecretMount;
import work.lcod.meshdeploy.secret.SecretResolutionException;
import work.lcod.meshdeploy.secret.SecretResolver;
import work.lcod.meshdeploy.secret.SecretSpec;
import work.lcod.meshdeploy.secret.SecretValidationException;
import work.lcod.meshdeploy.secret.SecretValidator;

/**
 * Public entry point: scans a project for unsupported keys and resolves the secrets of every service.
 * Warnings are advisory; a secret failure aborts the whole plan.
 */
public final class DeployPlanner {
    private static final Logger log = LoggerFactory.getLogger(DeployPlanner.class);

    private final CompatibilityScanner scanner;
    private final SecretResolver resolver;

    public DeployPlanner() {
        this(new CompatibilityScanner(), new SecretResolver());
    }

    public DeployPlanner(CompatibilityScanner scanner, SecretResolver resolver) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public DeployPlan plan(Project project) {
        var warnings = scanner.scan(project);
        var services = new ArrayList<ServicePlan>(project.services().size());
        for (var service : project.services()) {
            try {
                var resolution = resolver.resolve(project, service);
                SecretValidator.validate(resolution);
                services.add(new ServicePlan(service.name(), resolution.specs(), resolution.mounts()));
            } catch (SecretResolutionException | SecretValidationException ex) {
                throw new DeployPlanException(service.name(), ex);
            }
        }
        log.debug("Planned project '{}': {} service(s), {} warning(s)", project.name(), services.size(), warnings.size());
        return new DeployPlan(project.name(), warnings, services);
    }

    public PlanResult run(PlanConfiguration configuration) {
        var started = Instant.now();
        try {
            var options = LoadOptions.defaults()
                .withWorkingDirectory(configuration.workingDirectory().orElse(null))
                .withProjectName(configuration.projectName().orElse(null));
            var project = ProjectLoader.loadFromFile(configuration.projectFile(), options)
                .select(configuration.services());
            var plan = plan(project);

            var metadata = new LinkedHashMap<String, Object>();
            metadata.put("projectFile", configuration.projectFile().toString());
            metadata.put("project", plan.projectName());
            metadata.put("warnings", describeWarnings(plan.warnings()));
            metadata.put("services", describeServices(plan.services()));
            metadata.put("logLevel", configuration.logLevel().name());
            return PlanResult.success(metadata, started);
        } catch (RuntimeException ex) {
            var errorMeta = new LinkedHashMap<String, Object>();
            errorMeta.put("projectFile", configuration.projectFile().toString());
            if (ex instanceof DeployPlanException planError) {
                errorMeta.put("service", planError.service());
                errorMeta.put("code", planError.code());
            }
            if (Boolean.getBoolean("meshdeploy.debug")) {
                log.error("Planning failed", ex);
            }
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            return PlanResult.failure(message, errorMeta, started);
        }
    }

    private static List<Map<String, Object>> describeWarnings(List<Warning> warnings) {
        var described = new ArrayList<Map<String, Object>>(warnings.size());
        for (var warning : warnings) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("service", warning.service());
            entry.put("key", warning.key());
            entry.put("message", warning.message());
            described.add(entry);
        }
        return described;
    }

    private static List<Map<String, Object>> describeServices(List<ServicePlan> plans) {
        var described = new ArrayList<Map<String, Object>>(plans.size());
        for (var plan : plans) {
            var secrets = new ArrayList<Map<String, Object>>();
            for (SecretSpec spec : plan.secrets()) {
                var secret = new LinkedHashMap<String, Object>();
                secret.put("name", spec.name());
                secret.put("size", spec.size());
                secrets.add(secret);
            }
            var mounts = new ArrayList<Map<String, Object>>();
            for (SecretMount mount : plan.mounts()) {
                var entry = new LinkedHashMap<String, Object>();
                entry.put("secret", mount.secretName());
                mount.containerPath().ifPresent(path -> entry.put("path", path));
                mount.uid().ifPresent(uid -> entry.put("uid", uid));
                mount.gid().ifPresent(gid -> entry.put("gid", gid));
                mount.mode().ifPresent(mode -> entry.put("mode", String.format("%04o", mode)));
                mounts.add(entry);
            }
            var entry = new LinkedHashMap<String, Object>();
            entry.put("service", plan.service());
            entry.put("secrets", secrets);
            entry.put("mounts", mounts);
            described.add(entry);
        }
        return described;
    }
}
