package io.github.yok.ordersync.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Helpers for monetary {@link BigDecimal} values read from the store.
 *
 * @author Yasuharu.Okawauchi
 */
public final class Decimals {

    /**
     * Scale used for totals shown in reports and written to the export.
     */
    public static final int MONEY_SCALE = 2;

    private Decimals() {
        // Utility class; do not instantiate.
    }

    /**
     * Removes the padding zeros introduced by the fixed-scale store column, without switching to
     * exponent notation ({@code 100.0000000000} becomes {@code 100}, not {@code 1E+2}).
     *
     * @param value decimal value
     * @return normalized value, or {@code null} if {@code value} is {@code null}
     */
    public static BigDecimal normalize(BigDecimal value) {
        if (value == null) {
            return null;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    /**
     * Rounds a monetary value to {@link #MONEY_SCALE} places, half up.
     *
     * @param value decimal value
     * @return rounded value, or {@code null} if {@code value} is {@code null}
     */
    public static BigDecimal toMoney(BigDecimal value) {
        if (value == null) {
            return null;
        }
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
