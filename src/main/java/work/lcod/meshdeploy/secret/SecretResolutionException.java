package work.lcod.meshdeploy.secret;

/**
 * A service secret reference that cannot be turned into a deployable secret.
 */
public final class SecretResolutionException extends RuntimeException {
    private final Reason reason;
    private final String secretName;

    public SecretResolutionException(Reason reason, String secretName, String message) {
        this(reason, secretName, message, null);
    }

    public SecretResolutionException(Reason reason, String secretName, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.secretName = secretName;
    }

    public Reason reason() {
        return reason;
    }

    public String code() {
        return reason.code();
    }

    public String secretName() {
        return secretName;
    }

    public enum Reason {
        NOT_FOUND("secret_not_found"),
        EXTERNAL_UNSUPPORTED("external_secret_unsupported"),
        READ_FAILED("secret_read_failed");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
