package com.bootstrap.billing.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Stripe 設定
 *
 * 對應 application.yml:
 * stripe:
 *   secret-key: sk_test_...
 *   product-definitions: '[{"name":"Founders","prices":[{"amount":2500,"currency":"usd","interval":"month"}]}]'
 *   products: Founders:2500,usd,month;Scale:4900,usd,month   # legacy
 *   webhook-url: https://example.com/api/webhooks/stripe
 *   webhook-secret: whsec_...
 */
@Getter
@ConfigurationProperties(prefix = "stripe")
public class StripeConfig {

    static final String PRODUCT_DEFINITIONS_FIELD = "STRIPE_PRODUCT_DEFINITIONS";
    static final String PRODUCTS_FIELD = "STRIPE_PRODUCTS";

    private final String secretKey;
    private final String products;
    private final String productDefinitions;
    private final String webhookUrl;
    private final String webhookSecret;
    private final String webhookPath;
    private final int maxNetworkRetries;
    private final int connectTimeoutMs;
    private final int readTimeoutMs;

    public StripeConfig(
            String secretKey,
            String products,
            String productDefinitions,
            String webhookUrl,
            String webhookSecret,
            @DefaultValue("/api/webhooks/stripe") String webhookPath,
            @DefaultValue("2") int maxNetworkRetries,
            @DefaultValue("30000") int connectTimeoutMs,
            @DefaultValue("80000") int readTimeoutMs
    ) {
        this.secretKey = secretKey;
        this.products = products;
        this.productDefinitions = productDefinitions;
        this.webhookUrl = webhookUrl;
        this.webhookSecret = webhookSecret;
        this.webhookPath = webhookPath;
        this.maxNetworkRetries = maxNetworkRetries;
        this.connectTimeoutMs = connectTimeoutMs;
        this.readTimeoutMs = readTimeoutMs;
    }

    /**
     * STRIPE_PRODUCT_DEFINITIONS 優先，其次 STRIPE_PRODUCTS
     */
    public String resolveProductDefinitions() {
        if (productDefinitions != null && !productDefinitions.isBlank()) {
            return productDefinitions;
        }
        return products != null ? products : "";
    }

    /** 錯誤訊息中顯示的設定名稱 */
    public String resolveDefinitionsField() {
        if (productDefinitions != null && !productDefinitions.isBlank()) {
            return PRODUCT_DEFINITIONS_FIELD;
        }
        return PRODUCTS_FIELD;
    }

    public boolean hasSecretKey() {
        return secretKey != null && !secretKey.isBlank();
    }
}
