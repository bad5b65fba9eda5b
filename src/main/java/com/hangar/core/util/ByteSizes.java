package com.hangar.core.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Human-readable byte counts: {@code 0 B}, {@code 512 B}, {@code 1.5 KB}, {@code 256 MB}.
 */
public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteSizes() {}

    public static String format(long bytes) {
        if (bytes <= 0) {
            return "0 B";
        }
        int unit = (int) Math.floor(Math.log(bytes) / Math.log(1024));
        unit = Math.min(unit, UNITS.length - 1);
        BigDecimal value = BigDecimal.valueOf(bytes / Math.pow(1024, unit))
                .setScale(2, RoundingMode.HALF_UP)
                .stripTrailingZeros();
        return value.toPlainString() + " " + UNITS[unit];
    }
}
