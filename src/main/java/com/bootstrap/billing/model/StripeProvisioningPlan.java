package com.bootstrap.billing.model;

import com.bootstrap.shared.model.Plan;

import java.util.List;

/**
 * Stripe 佈建計畫：顯示用的 {@link Plan} + executor 需要的比對結果
 *
 * @param webhook 未設定 webhook URL 時為 null
 */
public record StripeProvisioningPlan(
        String projectId,
        Plan plan,
        List<ProductDecision> products,
        WebhookDecision webhook
) {

    public StripeProvisioningPlan {
        products = products == null ? List.of() : List.copyOf(products);
    }
}
