package com.bootstrap.billing.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ProductUpdateRequest {

    private Boolean active;
    private Map<String, String> metadata;
}
