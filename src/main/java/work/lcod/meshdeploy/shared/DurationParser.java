package work.lcod.meshdeploy.shared;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Parses compose-style durations ({@code 30s}, {@code 1m30s}, {@code 1.5s}, {@code 500ms}).
 * A bare integer is read as milliseconds.
 */
public final class DurationParser {
    private static final Pattern BARE_NUMBER = Pattern.compile("\\d+");
    private static final Pattern SEGMENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|µs|ms|s|m|h)");
    private static final Map<String, Long> UNIT_NANOS = Map.of(
        "ns", 1L,
        "us", 1_000L,
        "µs", 1_000L,
        "ms", 1_000_000L,
        "s", 1_000_000_000L,
        "m", 60_000_000_000L,
        "h", 3_600_000_000_000L
    );

    private DurationParser() {}

    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        if ("0".equals(trimmed)) {
            return Optional.of(Duration.ZERO);
        }
        if (BARE_NUMBER.matcher(trimmed).matches()) {
            return Optional.of(Duration.ofMillis(Long.parseLong(trimmed)));
        }
        var matcher = SEGMENT.matcher(trimmed);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (matcher.find() && matcher.start() == position) {
            var value = new BigDecimal(matcher.group(1));
            nanos = nanos.add(value.multiply(BigDecimal.valueOf(UNIT_NANOS.get(matcher.group(2)))));
            position = matcher.end();
        }
        if (position == 0 || position != trimmed.length()) {
            throw new IllegalArgumentException("Invalid duration: " + raw);
        }
        return Optional.of(Duration.ofNanos(nanos.longValue()));
    }
}
