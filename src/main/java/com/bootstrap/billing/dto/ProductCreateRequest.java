package com.bootstrap.billing.dto;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class ProductCreateRequest {

    private String name;
    private String description;
    private Map<String, String> metadata;
}
