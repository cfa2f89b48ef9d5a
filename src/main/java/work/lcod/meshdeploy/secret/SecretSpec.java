package work.lcod.meshdeploy.secret;

import java.util.Arrays;
import java.util.Objects;

/**
 * Deployable secret: a name and its resolved bytes.
 */
public record SecretSpec(String name, byte[] content) {
    public SecretSpec {
        Objects.requireNonNull(name, "name");
        content = content == null ? new byte[0] : content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public int size() {
        return content.length;
    }

    public void validate() {
        if (name.isEmpty()) {
            throw new SecretValidationException(
                SecretValidationException.Reason.MISSING_NAME, name, "invalid secret: secret name is required"
            );
        }
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SecretSpec spec && name.equals(spec.name) && Arrays.equals(content, spec.content);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(content);
    }

    // Never print the payload.
    @Override
    public String toString() {
        return "SecretSpec[name=" + name + ", size=" + content.length + "]";
    }
}
