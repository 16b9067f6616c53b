package com.bootstrap.billing.dto;

import lombok.Builder;
import lombok.Data;

/**
 * 一次 Stripe 佈建所需的已解析輸入
 *
 * 由 CLI 選項 + StripeConfig 合併而成，plan builder / executor 只看這個物件。
 */
@Data
@Builder
public class StripeProvisioningRequest {

    private String projectId;

    /** 產品定義原始字串（JSON 或 legacy 格式） */
    private String productDefinitions;

    /** 來源設定名稱，錯誤訊息用（STRIPE_PRODUCT_DEFINITIONS / STRIPE_PRODUCTS） */
    private String definitionsField;

    /** null = 不處理 webhook */
    private String webhookUrl;

    /** 既有 endpoint 的 secret 無法再取回，只能沿用設定值 */
    private String configuredWebhookSecret;

    private boolean dryRun;
}
