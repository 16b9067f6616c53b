package com.bootstrap.billing.model;

import com.bootstrap.shared.model.StepStatus;

/**
 * 單一價格的比對結果
 *
 * @param remotePriceId EXISTING 時為既有 price ID，CREATE 時為 null
 */
public record PriceDecision(
        String stepId,
        DesiredPrice desired,
        String idempotencyKey,
        StepStatus status,
        String remotePriceId,
        String detail
) {
}
