package com.bootstrap.shared.service;

import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.ProvisionedProduct;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 把佈建結果合併寫入 {@code <output-dir>/.env.local.generated}
 *
 * 檔案中原有的 key 保留，本次結果覆蓋同名 key；
 * 值含有 [A-Za-z0-9_./:-] 以外的字元時以 JSON 字串加引號。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GeneratedEnvWriter {

    public static final String FILE_NAME = ".env.local.generated";

    private static final Pattern PLAIN_VALUE = Pattern.compile("^[A-Za-z0-9_./:-]+$");

    private final ObjectMapper objectMapper;

    /**
     * @param updates null 值的 key 不寫入
     * @return 寫入的檔案路徑
     */
    public Path write(Path outputDir, Map<String, String> updates) throws IOException {
        Path file = outputDir.resolve(FILE_NAME);

        Map<String, String> merged = new LinkedHashMap<>();
        if (Files.exists(file)) {
            merged.putAll(read(file));
        }
        updates.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });

        Files.createDirectories(outputDir);
        StringBuilder content = new StringBuilder();
        for (Map.Entry<String, String> entry : merged.entrySet()) {
            content.append(entry.getKey()).append('=').append(escape(entry.getValue())).append('\n');
        }
        Files.writeString(file, content.toString(), StandardCharsets.UTF_8);

        log.info("已寫入 {} ({} 個 key，本次更新: {})", file, merged.size(), updates.keySet());
        return file;
    }

    /**
     * Stripe 結果對應的環境變數
     */
    public static Map<String, String> stripeEntries(ExecutionResult result, String productsPayload) {
        Map<String, String> entries = new LinkedHashMap<>();
        List<ProvisionedProduct> products = result.getProducts();
        if (!products.isEmpty()) {
            entries.put("STRIPE_PRODUCT_IDS", products.stream()
                    .map(ProvisionedProduct::getProductId)
                    .filter(Objects::nonNull)
                    .collect(Collectors.joining(",")));
            entries.put("STRIPE_PRICE_IDS", products.stream()
                    .flatMap(product -> product.getPriceIds().stream())
                    .collect(Collectors.joining(",")));
            entries.put("STRIPE_PRODUCTS", productsPayload);
        }
        if (result.getWebhook() != null) {
            entries.put("STRIPE_WEBHOOK_ID", result.getWebhook().getWebhookId());
            entries.put("STRIPE_WEBHOOK_SECRET", result.getWebhook().getWebhookSecret());
            entries.put("STRIPE_WEBHOOK_URL", result.getWebhook().getWebhookUrl());
        }
        return entries;
    }

    // ==================== dotenv ====================

    Map<String, String> read(Path file) throws IOException {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            values.put(trimmed.substring(0, eq).trim(), unescape(trimmed.substring(eq + 1).trim()));
        }
        return values;
    }

    String escape(String value) {
        if (value.isEmpty() || PLAIN_VALUE.matcher(value).matches()) {
            return value;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to quote env value", e);
        }
    }

    private String unescape(String raw) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            try {
                return objectMapper.readValue(raw, String.class);
            } catch (JsonProcessingException e) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }
}
