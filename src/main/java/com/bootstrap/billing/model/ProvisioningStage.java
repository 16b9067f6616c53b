package com.bootstrap.billing.model;

/**
 * 固定的三段 dependency chain：product → price → webhook
 *
 * 後一段只消費前一段解析出來的 ID，不依賴陣列順序。
 */
public enum ProvisioningStage {
    PRODUCT,
    PRICE,
    WEBHOOK
}
