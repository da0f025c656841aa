package de.bsommerfeld.mindshare.pipeline.export;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal rendering for exports and log output. All methods produce plain
 * notation (never exponents) without trailing zeros.
 */
public final class NumberFormats {

    private NumberFormats() {
    }

    /**
     * Rounds half-up to {@code scale} fraction digits, then strips trailing
     * zeros: {@code fixed(1.50004, 4)} is {@code "1.5"}.
     */
    public static String fixed(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }

    /**
     * Shortest plain representation of {@code value}: {@code 42.0} is
     * {@code "42"}, {@code 0.1} is {@code "0.1"}.
     */
    public static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    /**
     * Rounds half-up to exactly {@code scale} fraction digits, keeping
     * trailing zeros. Used for the human-readable summary.
     */
    public static String padded(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    public static String percent(double share, int scale) {
        return fixed(share * 100, scale);
    }
}
