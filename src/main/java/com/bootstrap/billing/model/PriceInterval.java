package com.bootstrap.billing.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Stripe recurring interval
 */
public enum PriceInterval {

    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    YEAR("year");

    private final String value;

    PriceInterval(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 不分大小寫比對，無法辨識時回傳 empty
     */
    public static Optional<PriceInterval> fromValue(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(interval -> interval.value.equals(normalized))
                .findFirst();
    }
}
