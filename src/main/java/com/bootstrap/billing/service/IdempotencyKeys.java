package com.bootstrap.billing.service;

import com.bootstrap.billing.model.DesiredPrice;

/**
 * 寫入 Stripe metadata.idempotency_key 的 key 產生規則
 *
 * <pre>
 * product: bootstrap:&lt;projectId&gt;:&lt;productName&gt;
 * price:   bootstrap:&lt;projectId&gt;:&lt;productName&gt;:price:&lt;amount&gt;:&lt;currency&gt;:&lt;interval|one_time&gt;:&lt;intervalCount&gt;
 * webhook: bootstrap:&lt;projectId&gt;:webhook
 * </pre>
 *
 * 格式一旦改變，既有資源全部對不上，會被重複建立。
 */
public final class IdempotencyKeys {

    private static final String PREFIX = "bootstrap";

    private IdempotencyKeys() {
    }

    public static String productKey(String projectId, String productName) {
        return PREFIX + ":" + projectId + ":" + productName;
    }

    public static String priceKey(String projectId, String productName, DesiredPrice price) {
        return productKey(projectId, productName)
                + ":price:" + price.amount()
                + ":" + price.currency()
                + ":" + price.intervalToken()
                + ":" + price.intervalCount();
    }

    public static String webhookKey(String projectId) {
        return PREFIX + ":" + projectId + ":webhook";
    }

    /** 是否為 bootstrap 工具建立的 price key（用來判斷是否為 drift） */
    public static boolean isPriceKeyOf(String projectId, String productName, String key) {
        return key != null && key.startsWith(productKey(projectId, productName) + ":price:");
    }
}
