package com.bootstrap.edge.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Cloudflare 計畫輸入（CLI 選項 + CloudflareConfig 合併後）
 */
@Data
@Builder
public class CloudflarePlanRequest {

    private String projectId;
    private String accountId;
    private String zoneId;

    /** null / 空白 → {@code <projectId>-d1} */
    private String d1DatabaseName;

    /** null / 空白 → {@code <projectId>-assets} */
    private String r2Bucket;

    private boolean stripeWebhookConfigured;
}
