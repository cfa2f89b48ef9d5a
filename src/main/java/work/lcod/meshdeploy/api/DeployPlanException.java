package work.lcod.meshdeploy.api;

import work.lcod.meshdeploy.secret.SecretResolutionException;
import work.lcod.meshdeploy.secret.SecretValidationException;

/**
 * Planning failure for one service; the cause is the resolution or validation error.
 */
public final class DeployPlanException extends RuntimeException {
    private final String service;

    public DeployPlanException(String service, RuntimeException cause) {
        super("service '" + service + "': " + cause.getMessage(), cause);
        this.service = service;
    }

    public String service() {
        return service;
    }

    public String code() {
        if (getCause() instanceof SecretResolutionException resolution) {
            return resolution.code();
        }
        if (getCause() instanceof SecretValidationException validation) {
            return validation.code();
        }
        return "plan_failed";
    }
}
