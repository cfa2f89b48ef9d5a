package work.lcod.meshdeploy.shared;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/**
 * Parses memory sizes written the way compose files do ({@code 64m}, {@code 1gb}, {@code 512KiB}, {@code 1048576}).
 * Suffixes are binary multiples.
 */
public final class ByteSizeParser {
    private static final Pattern SIZE = Pattern.compile("^(\\d+(?:\\.\\d+)?) ?([kmgtp])?i?b?$");

    private ByteSizeParser() {}

    public static OptionalLong parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return OptionalLong.empty();
        }
        var matcher = SIZE.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid size: " + raw);
        }
        var value = new BigDecimal(matcher.group(1));
        String unit = matcher.group(2);
        long multiplier = unit == null ? 1L : multiplier(unit.charAt(0));
        return OptionalLong.of(value.multiply(BigDecimal.valueOf(multiplier)).longValue());
    }

    private static long multiplier(char unit) {
        return switch (unit) {
            case 'k' -> 1L << 10;
            case 'm' -> 1L << 20;
            case 'g' -> 1L << 30;
            case 't' -> 1L << 40;
            case 'p' -> 1L << 50;
            default -> throw new IllegalArgumentException("Unsupported size unit: " + unit);
        };
    }
}
