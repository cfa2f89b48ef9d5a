package work.lcod.meshdeploy.model;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;

/**
 * Where a secret's payload comes from.
 */
public sealed interface SecretSource permits SecretSource.Inline, SecretSource.FileBacked {

    record Inline(byte[] content) implements SecretSource {
        public Inline {
            content = content == null ? new byte[0] : content.clone();
        }

        @Override
        public byte[] content() {
            return content.clone();
        }

        @Override
        public boolean equals(Object other) {
            return other instanceof Inline inline && Arrays.equals(content, inline.content);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(content);
        }

        @Override
        public String toString() {
            return "Inline[" + content.length + " bytes]";
        }
    }

    record FileBacked(Path path) implements SecretSource {
        public FileBacked {
            Objects.requireNonNull(path, "path");
        }
    }
}
