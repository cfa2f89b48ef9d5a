package work.lcod.meshdeploy.model;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Project-level secret definition.
 */
public record SecretConfig(String name, String content, String file, String environment, boolean external) {
    public SecretConfig {
        Objects.requireNonNull(name, "name");
    }

    public static SecretConfig inline(String name, String content) {
        return new SecretConfig(name, content, null, null, false);
    }

    public static SecretConfig fromFile(String name, String file) {
        return new SecretConfig(name, null, file, null, false);
    }

    public static SecretConfig externalSecret(String name) {
        return new SecretConfig(name, null, null, null, true);
    }

    /**
     * A non-empty {@code file} wins over inline {@code content}.
     */
    public SecretSource source() {
        if (file != null && !file.isEmpty()) {
            return new SecretSource.FileBacked(Path.of(file));
        }
        byte[] bytes = content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8);
        return new SecretSource.Inline(bytes);
    }

    public boolean hasConflictingSources() {
        return content != null && !content.isEmpty() && file != null && !file.isEmpty();
    }

    public SecretConfig withContent(String newContent) {
        return new SecretConfig(name, newContent, file, environment, external);
    }
}
