package work.lcod.meshdeploy.api;

import java.util.List;
import java.util.Objects;
import work.lcod.meshdeploy.secret.SecretMount;
import work.lcod.meshdeploy.secret.SecretSpec;

/**
 * Validated secrets and mounts of one service.
 */
public record ServicePlan(String service, List<SecretSpec> secrets, List<SecretMount> mounts) {
    public ServicePlan {
        Objects.requireNonNull(service, "service");
        secrets = List.copyOf(secrets);
        mounts = List.copyOf(mounts);
    }
}
