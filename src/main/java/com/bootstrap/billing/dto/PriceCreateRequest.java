package com.bootstrap.billing.dto;

import com.bootstrap.billing.model.PriceInterval;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

@Data
@Builder
public class PriceCreateRequest {

    private String productId;
    private long unitAmount;
    private String currency;
    private PriceInterval interval;   // null = 一次性
    private Integer intervalCount;    // 1 時不送，維持 Stripe 預設
    private Map<String, String> metadata;
}
