package com.bootstrap.edge.config;

import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Cloudflare 設定
 *
 * 對應 application.yml:
 * cloudflare:
 *   account-id: ...          # CLOUDFLARE_ACCOUNT_ID
 *   api-token: ...           # CLOUDFLARE_API_TOKEN
 *   zone-id: ...             # CLOUDFLARE_ZONE_ID
 *   d1-database-name: ...    # D1_DATABASE_NAME
 *   r2-bucket: ...           # CLOUDFLARE_R2_BUCKET
 */
@Getter
@ConfigurationProperties(prefix = "cloudflare")
public class CloudflareConfig {

    private final String accountId;
    private final String apiToken;
    private final String zoneId;
    private final String d1DatabaseName;
    private final String r2Bucket;
    private final String apiBaseUrl;

    public CloudflareConfig(String accountId,
                            String apiToken,
                            String zoneId,
                            String d1DatabaseName,
                            String r2Bucket,
                            @DefaultValue("https://api.cloudflare.com/client/v4") String apiBaseUrl) {
        this.accountId = accountId;
        this.apiToken = apiToken;
        this.zoneId = zoneId;
        this.d1DatabaseName = d1DatabaseName;
        this.r2Bucket = r2Bucket;
        this.apiBaseUrl = apiBaseUrl;
    }

    public boolean hasApiToken() {
        return apiToken != null && !apiToken.isBlank();
    }
}
