package com.bootstrap.billing.service;

import com.bootstrap.billing.model.DefinitionSource;
import com.bootstrap.billing.model.DesiredPrice;
import com.bootstrap.billing.model.DesiredProduct;
import com.bootstrap.billing.model.PriceInterval;
import com.bootstrap.shared.exception.ConfigParseException;
import com.bootstrap.shared.exception.ConfigParseException.Kind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 產品定義解析器 - 把 STRIPE_PRODUCT_DEFINITIONS / STRIPE_PRODUCTS 轉成 desired state
 *
 * 支援兩種格式:
 * 1. JSON 陣列（建議）:
 *    [{"name":"Founders","prices":[{"amount":2500,"currency":"usd","interval":"month"}]}]
 * 2. legacy 分號格式:
 *    Founders:2500,usd,month;Scale:4900,usd,month
 *
 * 判斷順序: 先當 JSON 讀（不允許尾端多餘字元），
 * 合法 JSON 一律走結構化驗證；不合法且以 [ 或 { 開頭視為 JSON 語法錯誤；其餘才走 legacy。
 * 所有錯誤都在任何 Stripe 呼叫之前拋出 {@link ConfigParseException}。
 */
@Slf4j
@Service
public class ProductDefinitionParser {

    private final ObjectMapper objectMapper;

    public ProductDefinitionParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * 解析產品定義
     *
     * @param field 設定名稱，只用在錯誤訊息
     * @param raw   原始字串，null / 空白 → 空清單
     */
    public List<DesiredProduct> parse(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        Optional<JsonNode> json = readJson(field, raw);
        DefinitionSource source = json.isPresent() ? DefinitionSource.STRUCTURED : DefinitionSource.LEGACY;

        List<DesiredProduct> products = switch (source) {
            case STRUCTURED -> parseStructured(field, json.get());
            case LEGACY -> parseLegacy(field, raw);
        };

        checkDuplicates(field, products);
        log.debug("產品定義解析完成: field={}, format={}, products={}", field, source, products.size());
        return products;
    }

    /**
     * 合法 JSON → present；看起來像 JSON 但語法錯誤 → 拋錯；其他 → empty（交給 legacy）
     */
    private Optional<JsonNode> readJson(String field, String raw) {
        try {
            return Optional.of(objectMapper.readTree(raw));
        } catch (JsonProcessingException e) {
            String trimmed = raw.trim();
            if (trimmed.startsWith("[") || trimmed.startsWith("{")) {
                throw new ConfigParseException(Kind.JSON_SYNTAX, field,
                        "Failed to parse " + field + " as JSON: " + e.getOriginalMessage(), e);
            }
            return Optional.empty();
        }
    }

    // ==================== JSON 格式 ====================

    private List<DesiredProduct> parseStructured(String field, JsonNode root) {
        if (!root.isArray()) {
            throw structuredError(field, field + " must be a JSON array of product objects");
        }

        List<DesiredProduct> products = new ArrayList<>();
        for (int i = 0; i < root.size(); i++) {
            JsonNode node = root.get(i);
            if (!node.isObject()) {
                throw structuredError(field, "Invalid product definition at index " + i + ": expected an object");
            }
            products.add(toProduct(field, i, node));
        }
        return products;
    }

    private DesiredProduct toProduct(String field, int index, JsonNode node) {
        JsonNode nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual() || nameNode.asText().isBlank()) {
            throw structuredError(field, "Invalid product definition at index " + index + ": \"name\" is required");
        }
        String name = nameNode.asText().trim();

        JsonNode descriptionNode = node.get("description");
        String description = null;
        if (descriptionNode != null && !descriptionNode.isNull()) {
            if (!descriptionNode.isTextual()) {
                throw structuredError(field, "Invalid description for \"" + name + "\": expected a string");
            }
            description = descriptionNode.asText();
        }

        Map<String, String> metadata = toMetadata(field, name, node.get("metadata"));

        JsonNode pricesNode = node.get("prices");
        if (pricesNode == null || !pricesNode.isArray()) {
            throw structuredError(field, "Invalid prices for \"" + name + "\": expected an array");
        }
        List<DesiredPrice> prices = new ArrayList<>();
        for (JsonNode priceNode : pricesNode) {
            if (!priceNode.isObject()) {
                throw structuredError(field, "Invalid price for \"" + name + "\": expected an object");
            }
            prices.add(toPrice(field, name, priceNode));
        }

        return new DesiredProduct(name, description, metadata, prices);
    }

    private DesiredPrice toPrice(String field, String productName, JsonNode node) {
        JsonNode amountNode = node.get("amount");
        if (amountNode == null || !amountNode.isIntegralNumber() || !amountNode.canConvertToLong()) {
            throw structuredError(field, "Invalid amount for \"" + productName + "\": expected an integer in minor units");
        }
        long amount = amountNode.asLong();
        if (amount < 0) {
            throw structuredError(field, "Invalid amount for \"" + productName + "\": " + amount + " must not be negative");
        }

        JsonNode currencyNode = node.get("currency");
        if (currencyNode == null || !currencyNode.isTextual() || currencyNode.asText().isBlank()) {
            throw structuredError(field, "Invalid currency for \"" + productName + "\": \"currency\" is required");
        }

        PriceInterval interval = null;
        JsonNode intervalNode = node.get("interval");
        if (intervalNode != null && !intervalNode.isNull()) {
            interval = PriceInterval.fromValue(intervalNode.asText())
                    .orElseThrow(() -> structuredError(field, invalidIntervalMessage(productName, intervalNode.asText())));
        }

        JsonNode countNode = node.has("interval_count") ? node.get("interval_count") : node.get("intervalCount");
        int intervalCount = 1;
        if (countNode != null && !countNode.isNull()) {
            if (!countNode.isIntegralNumber() || !countNode.canConvertToInt() || countNode.asInt() < 1) {
                throw structuredError(field, "Invalid interval_count for \"" + productName + "\": expected a positive integer");
            }
            if (interval == null) {
                throw structuredError(field, "Invalid interval_count for \"" + productName
                        + "\": interval_count requires an interval");
            }
            intervalCount = countNode.asInt();
        }

        Map<String, String> metadata = toMetadata(field, productName, node.get("metadata"));
        return new DesiredPrice(amount, currencyNode.asText().trim(), interval, intervalCount, metadata);
    }

    private Map<String, String> toMetadata(String field, String productName, JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw structuredError(field, "Invalid metadata for \"" + productName + "\": expected an object");
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (!entry.getValue().isValueNode() || entry.getValue().isNull()) {
                throw structuredError(field, "Invalid metadata value for \"" + productName + "\": \""
                        + entry.getKey() + "\" must be a string");
            }
            metadata.put(entry.getKey(), entry.getValue().asText());
        }
        return metadata;
    }

    // ==================== legacy 格式 ====================

    /**
     * Name:amount,currency[,interval] 以 ; 分隔，每個分隔符號前後空白都會去掉
     */
    private List<DesiredProduct> parseLegacy(String field, String raw) {
        List<DesiredProduct> products = new ArrayList<>();

        for (String entry : raw.split(";")) {
            if (entry.isBlank()) {
                continue;
            }

            int colon = entry.indexOf(':');
            String name = colon >= 0 ? entry.substring(0, colon).trim() : "";
            if (colon < 0 || name.isEmpty()) {
                throw legacyError(field, "Invalid product entry: \"" + entry.trim() + "\"");
            }

            String[] parts = entry.substring(colon + 1).split(",", -1);
            String amountText = parts[0].trim();
            String currency = parts.length > 1 ? parts[1].trim() : "";
            if (amountText.isEmpty() || currency.isEmpty() || parts.length > 3) {
                throw legacyError(field, "Invalid price format for \"" + name
                        + "\": expected \"amount,currency[,interval]\"");
            }

            long amount;
            try {
                amount = Long.parseLong(amountText);
            } catch (NumberFormatException e) {
                throw legacyError(field, "Invalid amount for \"" + name + "\": \"" + amountText + "\" is not a number");
            }
            if (amount < 0) {
                throw legacyError(field, "Invalid amount for \"" + name + "\": \"" + amountText + "\" must not be negative");
            }

            PriceInterval interval = null;
            String intervalText = parts.length > 2 ? parts[2].trim() : "";
            if (!intervalText.isEmpty()) {
                interval = PriceInterval.fromValue(intervalText)
                        .orElseThrow(() -> legacyError(field, invalidIntervalMessage(name, intervalText)));
            }

            products.add(DesiredProduct.of(name, DesiredPrice.of(amount, currency, interval)));
        }
        return products;
    }

    // ==================== 共用驗證 ====================

    private void checkDuplicates(String field, List<DesiredProduct> products) {
        Set<String> names = new HashSet<>();
        for (DesiredProduct product : products) {
            if (!names.add(product.name())) {
                throw new ConfigParseException(Kind.DUPLICATE_DEFINITION, field,
                        "Duplicate product name \"" + product.name() + "\" in " + field);
            }

            Set<String> identities = new HashSet<>();
            for (DesiredPrice price : product.prices()) {
                String identity = price.amount() + ":" + price.currency() + ":"
                        + price.intervalToken() + ":" + price.intervalCount();
                if (!identities.add(identity)) {
                    throw new ConfigParseException(Kind.DUPLICATE_DEFINITION, field,
                            "Duplicate price " + price.displayLabel() + " for \"" + product.name() + "\" in " + field);
                }
            }
        }
    }

    private static String invalidIntervalMessage(String productName, String interval) {
        return "Invalid interval for \"" + productName + "\": \"" + interval
                + "\" (must be day, week, month, or year)";
    }

    private static ConfigParseException structuredError(String field, String message) {
        return new ConfigParseException(Kind.STRUCTURED_VALIDATION, field, message);
    }

    private static ConfigParseException legacyError(String field, String message) {
        return new ConfigParseException(Kind.LEGACY_GRAMMAR, field, message);
    }
}
