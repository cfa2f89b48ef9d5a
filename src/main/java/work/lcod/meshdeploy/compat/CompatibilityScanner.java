package work.lcod.meshdeploy.compat;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.ServiceConfig;

/**
 * Walks a project and reports every configured key the mesh runtime ignores.
 *
 * <p>Services are visited in project order; warnings of one service are sorted by key.
 * The scan never rejects a project.
 */
public final class CompatibilityScanner {
    private static final Logger log = LoggerFactory.getLogger(CompatibilityScanner.class);

    private final List<WarningRule> rules;

    public CompatibilityScanner() {
        this(WarningCatalogue.standard());
    }

    public CompatibilityScanner(WarningCatalogue catalogue) {
        Objects.requireNonNull(catalogue, "catalogue");
        this.rules = catalogue.rules();
    }

    public List<Warning> scan(Project project) {
        var warnings = new ArrayList<Warning>();
        for (var service : project.services()) {
            warnings.addAll(scanService(project, service));
        }
        return List.copyOf(warnings);
    }

    public List<Warning> scanService(Project project, ServiceConfig service) {
        var warnings = new ArrayList<Warning>();
        for (var rule : rules) {
            rule.evaluate(project, service).ifPresent(warnings::add);
        }
        warnings.sort(Warning.BY_KEY);
        if (!warnings.isEmpty()) {
            log.debug("Service '{}' uses {} unsupported key(s)", service.name(), warnings.size());
        }
        return warnings;
    }
}
