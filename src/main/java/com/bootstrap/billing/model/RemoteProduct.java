package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Stripe Product 快照
 */
@Data
@Builder(toBuilder = true)
public class RemoteProduct {

    private String id;
    private String name;
    private String description;
    @Builder.Default
    private boolean active = true;
    @Builder.Default
    private Map<String, String> metadata = new HashMap<>();

    public String idempotencyKey() {
        return metadata != null ? metadata.get(MetadataKeys.IDEMPOTENCY_KEY) : null;
    }
}
