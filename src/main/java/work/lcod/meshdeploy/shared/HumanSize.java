package work.lcod.meshdeploy.shared;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Formats byte counts with decimal units and four significant digits ({@code 1.5MB}, {@code 512B}).
 */
public final class HumanSize {
    private static final String[] UNITS = {"B", "kB", "MB", "GB", "TB", "PB", "EB"};
    private static final MathContext FOUR_DIGITS = new MathContext(4);

    private HumanSize() {}

    public static String format(long bytes) {
        double size = bytes;
        int unit = 0;
        while (size >= 1000.0 && unit < UNITS.length - 1) {
            size /= 1000.0;
            unit++;
        }
        var rounded = new BigDecimal(size).round(FOUR_DIGITS).stripTrailingZeros();
        return rounded.toPlainString() + UNITS[unit];
    }
}
