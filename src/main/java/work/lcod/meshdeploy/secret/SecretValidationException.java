package work.lcod.meshdeploy.secret;

/**
 * Secret specs and mounts that do not fit together. Terminal for the deploy attempt.
 */
public final class SecretValidationException extends RuntimeException {
    private final Reason reason;
    private final String subject;

    public SecretValidationException(Reason reason, String subject, String message) {
        super(message);
        this.reason = reason;
        this.subject = subject;
    }

    public Reason reason() {
        return reason;
    }

    public String code() {
        return reason.code();
    }

    /**
     * Name of the offending secret or mount source.
     */
    public String subject() {
        return subject;
    }

    public enum Reason {
        MISSING_NAME("secret_name_required"),
        DUPLICATE_NAME("duplicate_secret_name"),
        MISSING_SOURCE("secret_mount_source_required"),
        INVALID_ID("invalid_secret_mount_owner"),
        RELATIVE_PATH("relative_container_path"),
        DANGLING_REFERENCE("undefined_secret_reference");

        private final String code;

        Reason(String code) {
            this.code = code;
        }

        public String code() {
            return code;
        }
    }
}
