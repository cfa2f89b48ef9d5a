package work.lcod.meshdeploy.secret;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SecretMountTest {
    @Test
    void parsesOwnerIds() {
        var mount = withOwner("0", "9223372036854775807");
        assertEquals(0L, mount.numericUid().getAsLong());
        assertEquals(Long.MAX_VALUE, mount.numericGid().getAsLong());
        assertDoesNotThrow(mount::validate);
    }

    @Test
    void blankOwnerIsAbsent() {
        var mount = withOwner(" ", "");
        assertTrue(mount.uid().isEmpty());
        assertTrue(mount.numericGid().isEmpty());
    }

    @Test
    void rejectsNonNumericUid() {
        var error = assertThrows(SecretValidationException.class, () -> withOwner("root", null).validate());
        assertEquals("invalid secret mount: invalid Uid 'root': not a non-negative integer", error.getMessage());
        assertEquals(SecretValidationException.Reason.INVALID_ID, error.reason());
    }

    @Test
    void rejectsNegativeGid() {
        var error = assertThrows(SecretValidationException.class, () -> withOwner(null, "-1").validate());
        assertTrue(error.getMessage().startsWith("invalid secret mount: invalid Gid '-1'"));
    }

    @Test
    void rejectsIdsAboveSignedRange() {
        var tooHigh = assertThrows(SecretValidationException.class, () -> withOwner("9223372036854775808", null).validate());
        assertEquals("invalid secret mount: invalid Uid '9223372036854775808': value too high", tooHigh.getMessage());
        var outOfRange = assertThrows(SecretValidationException.class,
            () -> withOwner("99999999999999999999999", null).validate());
        assertTrue(outOfRange.getMessage().endsWith("value out of range"));
    }

    @Test
    void requiresAbsoluteContainerPath() {
        var error = assertThrows(SecretValidationException.class, () -> SecretMount.at("token", "run/secrets/token").validate());
        assertEquals("invalid secret mount: container path must be absolute", error.getMessage());
        assertEquals("relative_container_path", error.code());
        assertDoesNotThrow(() -> SecretMount.at("token", "/run/secrets/token").validate());
    }

    @Test
    void requiresSource() {
        var error = assertThrows(SecretValidationException.class, () -> SecretMount.at("", "/run/secrets/x").validate());
        assertEquals("invalid secret mount: secret mount source is required", error.getMessage());
    }

    @Test
    void mapsModeToPermissions() {
        var mount = new SecretMount("token", Optional.empty(), Optional.empty(), Optional.empty(), Optional.of(0440));
        assertEquals(PosixFilePermissions.fromString("r--r-----"), mount.permissions().orElseThrow());
        assertTrue(SecretMount.at("token", "/x").permissions().isEmpty());
    }

    private static SecretMount withOwner(String uid, String gid) {
        return new SecretMount("token", Optional.of("/run/secrets/token"), Optional.ofNullable(uid), Optional.ofNullable(gid),
            Optional.empty());
    }
}
