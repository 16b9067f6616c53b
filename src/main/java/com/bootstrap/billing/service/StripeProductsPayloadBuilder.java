package com.bootstrap.billing.service;

import com.bootstrap.billing.model.DesiredPrice;
import com.bootstrap.billing.model.DesiredProduct;
import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.ProvisionedProduct;
import com.bootstrap.shared.exception.ConfigParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 產生前端使用的 STRIPE_PRODUCTS JSON
 *
 * 每個 (產品, 價格) 一筆:
 * {"id":"prod_...","name":"Founders","priceId":"price_...","unitAmount":2500,"currency":"usd","interval":"month","metadata":{}}
 * 產品 ID 未知時以名稱 slug 代替；metadata = 產品 metadata 被價格 metadata 覆蓋。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripeProductsPayloadBuilder {

    private final ProductDefinitionParser definitionParser;
    private final ObjectMapper objectMapper;

    /**
     * @param result 執行結果，null 時 id / priceId 皆為 fallback
     * @return 定義無法解析時原樣回傳 raw
     */
    public String build(String field, String raw, ExecutionResult result) {
        if (raw == null || raw.isBlank()) {
            return "[]";
        }

        List<DesiredProduct> definitions;
        try {
            definitions = definitionParser.parse(field, raw);
        } catch (ConfigParseException e) {
            log.warn("產品定義無法解析，STRIPE_PRODUCTS 沿用原始值: {}", e.getMessage());
            return raw;
        }

        List<Map<String, Object>> payload = new ArrayList<>();
        for (DesiredProduct definition : definitions) {
            Optional<ProvisionedProduct> provisioned = findProvisioned(result, definition.name());
            String id = provisioned.map(ProvisionedProduct::getProductId).orElse(slug(definition.name()));
            List<String> priceIds = provisioned.map(ProvisionedProduct::getPriceIds).orElse(List.of());

            for (int i = 0; i < definition.prices().size(); i++) {
                DesiredPrice price = definition.prices().get(i);

                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", id);
                entry.put("name", definition.name());
                if (definition.description() != null) {
                    entry.put("description", definition.description());
                }
                entry.put("priceId", i < priceIds.size() ? priceIds.get(i) : "");
                entry.put("unitAmount", price.amount());
                entry.put("currency", price.currency());
                if (price.interval() != null) {
                    entry.put("interval", price.interval().value());
                }
                Map<String, String> metadata = new LinkedHashMap<>(definition.metadata());
                metadata.putAll(price.metadata());
                entry.put("metadata", metadata);
                payload.add(entry);
            }
        }

        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize STRIPE_PRODUCTS payload", e);
        }
    }

    private Optional<ProvisionedProduct> findProvisioned(ExecutionResult result, String name) {
        if (result == null) {
            return Optional.empty();
        }
        return result.getProducts().stream()
                .filter(product -> name.equals(product.getProductName()))
                .filter(product -> product.getProductId() != null)
                .findFirst();
    }

    static String slug(String name) {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }
}
