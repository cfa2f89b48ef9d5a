package work.lcod.meshdeploy.secret;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class SecretSpecTest {
    @Test
    void equalityComparesContent() {
        var empty = new SecretSpec("test-secret", null);
        assertEquals(empty, new SecretSpec("test-secret", new byte[0]));
        assertNotEquals(empty, new SecretSpec("test-secret", bytes("some content")));
        assertEquals(new SecretSpec("a", bytes("x")).hashCode(), new SecretSpec("a", bytes("x")).hashCode());
    }

    @Test
    void contentIsCopied() {
        byte[] raw = bytes("abc");
        var spec = new SecretSpec("a", raw);
        raw[0] = 'z';
        spec.content()[1] = 'z';
        assertEquals("abc", new String(spec.content(), StandardCharsets.UTF_8));
    }

    @Test
    void toStringHidesContent() {
        var spec = new SecretSpec("db", bytes("hunter2"));
        assertEquals("SecretSpec[name=db, size=7]", spec.toString());
        assertFalse(spec.toString().contains("hunter2"));
    }

    @Test
    void nameIsRequired() {
        var error = assertThrows(SecretValidationException.class, () -> new SecretSpec("", bytes("x")).validate());
        assertEquals("invalid secret: secret name is required", error.getMessage());
        assertEquals("secret_name_required", error.code());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
