package com.bootstrap.billing.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 應用程式需要訂閱的 Stripe webhook 事件
 */
public final class StripeWebhookEvents {

    /** 代表「所有事件」的萬用字元 */
    public static final String ALL_EVENTS = "*";

    public static final List<String> REQUIRED = List.of(
            "customer.subscription.created",
            "customer.subscription.updated",
            "customer.subscription.deleted",
            "invoice.payment_succeeded",
            "invoice.payment_failed"
    );

    private StripeWebhookEvents() {
    }

    /**
     * 既有 endpoint 缺少的必要事件（保持 REQUIRED 的順序）
     */
    public static List<String> missingFrom(Collection<String> enabledEvents) {
        if (enabledEvents == null) {
            return REQUIRED;
        }
        if (enabledEvents.contains(ALL_EVENTS)) {
            return List.of();
        }
        return REQUIRED.stream()
                .filter(event -> !enabledEvents.contains(event))
                .toList();
    }

    /**
     * 既有事件 ∪ 必要事件，既有的自訂事件保留在前面
     */
    public static List<String> union(Collection<String> enabledEvents) {
        Set<String> merged = new LinkedHashSet<>();
        if (enabledEvents != null) {
            merged.addAll(enabledEvents);
        }
        if (merged.contains(ALL_EVENTS)) {
            return List.of(ALL_EVENTS);
        }
        merged.addAll(REQUIRED);
        return new ArrayList<>(merged);
    }
}
