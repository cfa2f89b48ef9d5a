package work.lcod.meshdeploy.secret;

import java.util.HashSet;
import java.util.List;

/**
 * Checks that secret specs are well formed and that every mount points at one of them.
 * Purely referential: no file content or filesystem state is inspected.
 */
public final class SecretValidator {
    private SecretValidator() {}

    public static void validate(List<SecretSpec> specs, List<SecretMount> mounts) {
        var names = new HashSet<String>();
        for (var spec : specs) {
            spec.validate();
            if (!names.add(spec.name())) {
                throw new SecretValidationException(
                    SecretValidationException.Reason.DUPLICATE_NAME,
                    spec.name(),
                    "duplicate secret name: '" + spec.name() + "'"
                );
            }
        }

        for (var mount : mounts) {
            mount.validate();
            if (!names.contains(mount.secretName())) {
                throw new SecretValidationException(
                    SecretValidationException.Reason.DANGLING_REFERENCE,
                    mount.secretName(),
                    "secret mount source '" + mount.secretName() + "' does not refer to any defined secret"
                );
            }
        }
    }

    public static void validate(SecretResolution resolution) {
        validate(resolution.specs(), resolution.mounts());
    }
}
