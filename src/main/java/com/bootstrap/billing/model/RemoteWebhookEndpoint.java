package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Stripe Webhook Endpoint 快照
 *
 * secret 只有在建立當下的回應才拿得到，list 回來的一律為 null。
 */
@Data
@Builder(toBuilder = true)
public class RemoteWebhookEndpoint {

    private String id;
    private String url;
    @Builder.Default
    private List<String> enabledEvents = new ArrayList<>();
    private String status;
    private String secret;
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public String idempotencyKey() {
        return metadata != null ? metadata.get(MetadataKeys.IDEMPOTENCY_KEY) : null;
    }
}
