package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProvisionedWebhook {

    private String webhookId;
    private String webhookSecret;  // 既有 endpoint 且未設定 STRIPE_WEBHOOK_SECRET 時為 null
    private String webhookUrl;
}
