package work.lcod.meshdeploy.compat;

import work.lcod.meshdeploy.model.Project;
import work.lcod.meshdeploy.model.ServiceConfig;

/**
 * Predicate telling whether a service uses an unsupported feature.
 */
@FunctionalInterface
public interface ServiceCheck {
    boolean test(Project project, ServiceConfig service);
}
