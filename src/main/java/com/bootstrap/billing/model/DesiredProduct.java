package com.bootstrap.billing.model;

import java.util.List;
import java.util.Map;

/**
 * 期望的產品定義，name 為身分（區分大小寫、單次 run 內唯一）
 */
public record DesiredProduct(
        String name,
        String description,
        Map<String, String> metadata,
        List<DesiredPrice> prices
) {

    public DesiredProduct {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        prices = prices == null ? List.of() : List.copyOf(prices);
    }

    public static DesiredProduct of(String name, DesiredPrice... prices) {
        return new DesiredProduct(name, null, Map.of(), List.of(prices));
    }
}
