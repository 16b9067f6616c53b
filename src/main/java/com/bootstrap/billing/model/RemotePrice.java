package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Stripe Price 快照
 */
@Data
@Builder(toBuilder = true)
public class RemotePrice {

    private String id;
    private String productId;
    private Long unitAmount;      // 自訂金額（customer chooses）時為 null
    private String currency;
    private String interval;      // null = 一次性
    private Long intervalCount;
    @Builder.Default
    private boolean active = true;
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public String idempotencyKey() {
        return metadata != null ? metadata.get(MetadataKeys.IDEMPOTENCY_KEY) : null;
    }

    /**
     * 與期望定義的 (amount, currency, interval, intervalCount) 是否完全一致
     */
    public boolean matches(DesiredPrice desired) {
        if (unitAmount == null || unitAmount != desired.amount()) {
            return false;
        }
        if (currency == null || !currency.equalsIgnoreCase(desired.currency())) {
            return false;
        }
        String desiredInterval = desired.isRecurring() ? desired.interval().value() : null;
        if (desiredInterval == null) {
            return interval == null;
        }
        if (!desiredInterval.equals(interval)) {
            return false;
        }
        long remoteCount = intervalCount != null ? intervalCount : 1L;
        return remoteCount == desired.intervalCount();
    }
}
