package work.lcod.meshdeploy.api;

import java.util.Locale;

/**
 * How the CLI prints a plan.
 */
public enum OutputFormat {
    TEXT,
    JSON;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return TEXT;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
