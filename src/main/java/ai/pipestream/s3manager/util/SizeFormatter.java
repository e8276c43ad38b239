package ai.pipestream.s3manager.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Human-readable byte sizes in binary units.
 * Bytes are printed as an integer ({@code 512 B}); larger units with one decimal
 * ({@code 1.5 KiB}), moving to the next unit when rounding reaches 1024.
 */
public final class SizeFormatter {

    private static final String[] UNITS = {"B", "KiB", "MiB", "GiB", "TiB", "PiB"};
    private static final BigDecimal STEP = BigDecimal.valueOf(1024);

    private SizeFormatter() {}

    public static String format(long bytes) {
        if (bytes < 0) {
            throw new IllegalArgumentException("Size must not be negative: " + bytes);
        }
        if (bytes < 1024) {
            return bytes + " B";
        }
        BigDecimal value = BigDecimal.valueOf(bytes);
        int unit = 0;
        while (unit < UNITS.length - 1 && value.compareTo(STEP) >= 0) {
            value = value.divide(STEP);
            unit++;
        }
        BigDecimal rounded = value.setScale(1, RoundingMode.HALF_UP);
        if (rounded.compareTo(STEP) >= 0 && unit < UNITS.length - 1) {
            unit++;
            rounded = value.divide(STEP).setScale(1, RoundingMode.HALF_UP);
        }
        return rounded.toPlainString() + " " + UNITS[unit];
    }
}
