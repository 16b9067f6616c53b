package com.bootstrap.billing.dto;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Builder
public class WebhookEndpointCreateRequest {

    private String url;
    private List<String> enabledEvents;
    private Map<String, String> metadata;
}
