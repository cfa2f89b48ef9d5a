package work.lcod.meshdeploy.secret;

import java.util.List;

/**
 * Specs and mounts resolved for one service, in reference order.
 */
public record SecretResolution(List<SecretSpec> specs, List<SecretMount> mounts) {
    public SecretResolution {
        specs = List.copyOf(specs);
        mounts = List.copyOf(mounts);
    }

    public static SecretResolution empty() {
        return new SecretResolution(List.of(), List.of());
    }

    public boolean isEmpty() {
        return specs.isEmpty() && mounts.isEmpty();
    }
}
