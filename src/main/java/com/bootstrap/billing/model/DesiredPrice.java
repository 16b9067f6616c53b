package com.bootstrap.billing.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * 期望的價格定義
 *
 * 身分 = (amount, currency, interval, intervalCount)，任何欄位改變都視為「另一個價格」，
 * Stripe 的 price 建立後不可修改金額，所以永遠不會有 in-place update。
 *
 * @param amount        最小貨幣單位（cents）
 * @param currency      小寫 ISO 幣別
 * @param interval      null = 一次性收費
 * @param intervalCount 預設 1；一次性價格固定為 1
 */
public record DesiredPrice(
        long amount,
        String currency,
        PriceInterval interval,
        int intervalCount,
        Map<String, String> metadata
) {

    public static final String ONE_TIME = "one_time";

    public DesiredPrice {
        currency = currency.toLowerCase(Locale.ROOT);
        intervalCount = interval == null || intervalCount <= 0 ? 1 : intervalCount;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DesiredPrice of(long amount, String currency, PriceInterval interval) {
        return new DesiredPrice(amount, currency, interval, 1, Map.of());
    }

    public boolean isRecurring() {
        return interval != null;
    }

    /** idempotency key 使用的 interval 片段 */
    public String intervalToken() {
        return interval != null ? interval.value() : ONE_TIME;
    }

    /**
     * 顯示用格式，例如 {@code 25.00 USD/month}、{@code 120.00 USD/3 months}、{@code 99.99 USD}
     */
    public String displayLabel() {
        String formatted = BigDecimal.valueOf(amount).movePointLeft(2).setScale(2).toPlainString()
                + " " + currency.toUpperCase(Locale.ROOT);
        if (interval == null) {
            return formatted;
        }
        String intervalPart = intervalCount == 1
                ? interval.value()
                : intervalCount + " " + interval.value() + "s";
        return formatted + "/" + intervalPart;
    }
}
