package work.lcod.meshdeploy.compat;

import static work.lcod.meshdeploy.compat.ServiceRules.isSet;

import java.util.function.Predicate;
import work.lcod.meshdeploy.model.DeployConfig;
import work.lcod.meshdeploy.model.UpdateConfig;

/**
 * Keys under {@code deploy} the mesh runtime ignores. {@code replicas} and {@code update_config.order} are honored.
 */
public final class DeployRules {
    private DeployRules() {}

    public static WarningCatalogue register(WarningCatalogue catalogue) {
        deploy(catalogue, "deploy.labels", "'deploy.labels' is not supported.",
            deploy -> isSet(deploy.labels()));
        deploy(catalogue, "deploy.rollback_config", "'deploy.rollback_config' is not supported.",
            deploy -> deploy.rollbackConfig() != null);
        deploy(catalogue, "deploy.restart_policy",
            "'deploy.restart_policy' is not supported. Container lifecycle is managed automatically.",
            deploy -> deploy.restartPolicy() != null);
        deploy(catalogue, "deploy.endpoint_mode", "'deploy.endpoint_mode' is not supported.",
            deploy -> isSet(deploy.endpointMode()));
        deploy(catalogue, "deploy.placement",
            "'deploy.placement' is not supported. Use the 'x-machines' extension for machine placement.",
            deploy -> deploy.placement().constraints() != null || isSet(deploy.placement().preferences()));

        update(catalogue, "parallelism", update -> update.parallelism() != null);
        update(catalogue, "delay", UpdateConfig::hasDelay);
        update(catalogue, "failure_action", update -> isSet(update.failureAction()));
        update(catalogue, "monitor", UpdateConfig::hasMonitor);
        update(catalogue, "max_failure_ratio", update -> update.maxFailureRatio() > 0);
        return catalogue;
    }

    private static void deploy(WarningCatalogue catalogue, String key, String message, Predicate<DeployConfig> check) {
        catalogue.register(key, message, (project, service) -> service.deploy() != null && check.test(service.deploy()));
    }

    private static void update(WarningCatalogue catalogue, String field, Predicate<UpdateConfig> check) {
        String key = "deploy.update_config." + field;
        deploy(catalogue, key, "'" + key + "' is not supported.",
            deploy -> deploy.updateConfig() != null && check.test(deploy.updateConfig()));
    }
}
