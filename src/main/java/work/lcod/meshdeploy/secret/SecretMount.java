package work.lcod.meshdeploy.secret;

import java.nio.file.attribute.PosixFilePermission;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Where and how a secret is exposed inside a container.
 *
 * @param secretName name of the {@link SecretSpec} this mount binds to
 * @param containerPath absolute path inside the container
 * @param uid owner uid as a decimal string
 * @param gid owner gid as a decimal string
 * @param mode permission bits; empty means runtime default
 */
public record SecretMount(
    String secretName,
    Optional<String> containerPath,
    Optional<String> uid,
    Optional<String> gid,
    Optional<Integer> mode
) {
    private static final Pattern DECIMAL = Pattern.compile("\\d+");
    private static final PosixFilePermission[] PERMISSION_BITS = {
        PosixFilePermission.OTHERS_EXECUTE,
        PosixFilePermission.OTHERS_WRITE,
        PosixFilePermission.OTHERS_READ,
        PosixFilePermission.GROUP_EXECUTE,
        PosixFilePermission.GROUP_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OWNER_EXECUTE,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.OWNER_READ
    };

    public SecretMount {
        Objects.requireNonNull(secretName, "secretName");
        containerPath = nonBlank(containerPath);
        uid = nonBlank(uid);
        gid = nonBlank(gid);
        Objects.requireNonNull(mode, "mode");
    }

    public static SecretMount at(String secretName, String containerPath) {
        return new SecretMount(secretName, Optional.of(containerPath), Optional.empty(), Optional.empty(), Optional.empty());
    }

    public OptionalLong numericUid() {
        return parseId("Uid", uid);
    }

    public OptionalLong numericGid() {
        return parseId("Gid", gid);
    }

    public Optional<Set<PosixFilePermission>> permissions() {
        return mode.map(bits -> {
            var permissions = EnumSet.noneOf(PosixFilePermission.class);
            for (int i = 0; i < PERMISSION_BITS.length; i++) {
                if ((bits & (1 << i)) != 0) {
                    permissions.add(PERMISSION_BITS[i]);
                }
            }
            return permissions;
        });
    }

    public void validate() {
        if (secretName.isEmpty()) {
            throw invalid(SecretValidationException.Reason.MISSING_SOURCE, "secret mount source is required");
        }
        numericUid();
        numericGid();
        // Container paths are POSIX regardless of the host platform.
        if (containerPath.isPresent() && !containerPath.get().startsWith("/")) {
            throw invalid(SecretValidationException.Reason.RELATIVE_PATH, "container path must be absolute");
        }
    }

    // Accepts 0..Long.MAX_VALUE, written without sign.
    private OptionalLong parseId(String label, Optional<String> raw) {
        if (raw.isEmpty()) {
            return OptionalLong.empty();
        }
        String value = raw.get();
        if (!DECIMAL.matcher(value).matches()) {
            throw invalid(SecretValidationException.Reason.INVALID_ID,
                "invalid " + label + " '" + value + "': not a non-negative integer");
        }
        long parsed;
        try {
            parsed = Long.parseUnsignedLong(value);
        } catch (NumberFormatException ex) {
            throw invalid(SecretValidationException.Reason.INVALID_ID,
                "invalid " + label + " '" + value + "': value out of range");
        }
        if (parsed < 0) {
            throw invalid(SecretValidationException.Reason.INVALID_ID, "invalid " + label + " '" + value + "': value too high");
        }
        return OptionalLong.of(parsed);
    }

    private SecretValidationException invalid(SecretValidationException.Reason reason, String detail) {
        return new SecretValidationException(reason, secretName, "invalid secret mount: " + detail);
    }

    private static Optional<String> nonBlank(Optional<String> value) {
        Objects.requireNonNull(value);
        return value.filter(v -> !v.isBlank());
    }
}
