package com.bootstrap.billing.model;

/**
 * 寫進 Stripe metadata 的欄位名稱
 *
 * idempotency_key 是下一次 run 認出既有資源的唯一依據，不可改名。
 */
public final class MetadataKeys {

    public static final String IDEMPOTENCY_KEY = "idempotency_key";
    public static final String PROJECT_ID = "project_id";

    private MetadataKeys() {}
}
