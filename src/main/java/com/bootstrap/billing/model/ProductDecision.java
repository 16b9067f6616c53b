package com.bootstrap.billing.model;

import com.bootstrap.shared.model.StepStatus;

import java.util.List;

/**
 * 單一產品（含其價格）的比對結果
 *
 * @param remoteProductId EXISTING / UPDATE 時為既有 product ID，CREATE 時為 null
 */
public record ProductDecision(
        String stepId,
        DesiredProduct desired,
        String idempotencyKey,
        StepStatus status,
        String remoteProductId,
        String detail,
        List<PriceDecision> prices
) {

    public ProductDecision {
        prices = prices == null ? List.of() : List.copyOf(prices);
    }
}
