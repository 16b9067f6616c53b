package com.bootstrap.billing.model;

import com.bootstrap.shared.model.StepStatus;

import java.util.List;

/**
 * Webhook endpoint 的比對結果
 *
 * @param remoteEndpointId 既有 endpoint ID，CREATE 時為 null
 * @param missingEvents    既有 endpoint 缺少的必要事件
 * @param eventsToApply    create / update 時送出的完整事件清單（既有自訂事件 ∪ 必要事件）
 * @param urlChanged       只靠 idempotency key 找到、URL 已不同
 */
public record WebhookDecision(
        String url,
        String idempotencyKey,
        StepStatus status,
        String remoteEndpointId,
        List<String> missingEvents,
        List<String> eventsToApply,
        boolean urlChanged,
        String detail
) {

    public WebhookDecision {
        missingEvents = missingEvents == null ? List.of() : List.copyOf(missingEvents);
        eventsToApply = eventsToApply == null ? List.of() : List.copyOf(eventsToApply);
    }
}
