package com.bootstrap.edge.service;

import com.bootstrap.edge.config.CloudflareConfig;
import com.bootstrap.edge.model.CloudflareCapabilities;
import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSyntaxException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;

/**
 * Cloudflare API token 權限探測
 *
 * 直接透過 OkHttp 呼叫 Cloudflare REST API:
 * 1. GET /user/tokens/verify                      → token 是否有效
 * 2. GET /user                                    → 顯示用 email（token 沒有 user 權限時略過）
 * 3. GET /accounts/{id}/d1/database?per_page=1    → D1 權限
 * 4. GET /accounts/{id}/r2/buckets?per_page=1     → R2 權限
 *
 * 只有 401 / 403 判定為沒有權限；網路錯誤、5xx 重試後仍失敗一律視為「無法判斷」。
 * 探測失敗永遠不會中止 run。
 */
@Slf4j
@Service
public class CloudflareCapabilityProbe {

    private final OkHttpClient httpClient;
    private final CloudflareConfig cloudflareConfig;
    private final Gson gson = new Gson();

    public CloudflareCapabilityProbe(OkHttpClient httpClient, CloudflareConfig cloudflareConfig) {
        this.httpClient = httpClient;
        this.cloudflareConfig = cloudflareConfig;
    }

    /**
     * @param accountId 可被 CLI 覆蓋，null 時 D1 / R2 為無法判斷
     * @param attempts  每個 API 最多嘗試次數（至少 1）
     * @param delayMs   重試間隔
     * @return token 未設定時回傳 empty（不探測）
     */
    public Optional<CloudflareCapabilities> probe(String accountId, int attempts, long delayMs) {
        if (!cloudflareConfig.hasApiToken()) {
            log.info("CLOUDFLARE_API_TOKEN 未設定，跳過權限探測");
            return Optional.empty();
        }

        int maxAttempts = Math.max(1, attempts);
        String base = trimTrailingSlash(cloudflareConfig.getApiBaseUrl());

        Optional<ProbeResponse> verify = get(base + "/user/tokens/verify", maxAttempts, delayMs);
        Boolean authenticated = verify.map(this::isActiveToken).orElse(null);

        String email = null;
        if (Boolean.TRUE.equals(authenticated)) {
            email = get(base + "/user", maxAttempts, delayMs)
                    .filter(ProbeResponse::isSuccess)
                    .map(response -> resultString(response, "email"))
                    .orElse(null);
        }

        Boolean canUseD1 = null;
        Boolean canUseR2 = null;
        if (accountId == null || accountId.isBlank()) {
            log.warn("CLOUDFLARE_ACCOUNT_ID 未設定，無法探測 D1 / R2 權限");
        } else if (Boolean.FALSE.equals(authenticated)) {
            canUseD1 = false;
            canUseR2 = false;
        } else {
            canUseD1 = get(base + "/accounts/" + accountId + "/d1/database?per_page=1", maxAttempts, delayMs)
                    .map(ProbeResponse::permission)
                    .orElse(null);
            canUseR2 = get(base + "/accounts/" + accountId + "/r2/buckets?per_page=1", maxAttempts, delayMs)
                    .map(ProbeResponse::permission)
                    .orElse(null);
        }

        CloudflareCapabilities capabilities = CloudflareCapabilities.builder()
                .authenticated(authenticated)
                .canUseD1(canUseD1)
                .canUseR2(canUseR2)
                .userEmail(email)
                .build();
        log.info("Cloudflare 權限探測完成: authenticated={}, d1={}, r2={}", authenticated, canUseD1, canUseR2);
        return Optional.of(capabilities);
    }

    // ==================== HTTP ====================

    /**
     * GET + 有限次數重試
     * 只有 IOException、429、5xx 才重試；收到其他 HTTP 回應（含 401/403）直接回傳
     *
     * @return 重試用完仍失敗時回傳 empty
     */
    private Optional<ProbeResponse> get(String url, int maxAttempts, long delayMs) {
        Request request = new Request.Builder()
                .url(url)
                .get()
                .addHeader("Authorization", "Bearer " + cloudflareConfig.getApiToken())
                .build();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Response response = httpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";
                int code = response.code();
                if (code != 429 && code < 500) {
                    return Optional.of(new ProbeResponse(code, parseBody(body)));
                }
                log.warn("Cloudflare API 回應異常 (attempt {}/{}): HTTP {} - {}", attempt, maxAttempts, code, url);
            } catch (IOException e) {
                log.warn("Cloudflare API 呼叫失敗 (attempt {}/{}): {} - {}", attempt, maxAttempts, url, e.getMessage());
            }

            if (attempt < maxAttempts && delayMs > 0) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
        return Optional.empty();
    }

    private JsonObject parseBody(String body) {
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement element = gson.fromJson(body, JsonElement.class);
            return element != null && element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
        } catch (JsonSyntaxException e) {
            log.warn("Cloudflare 回覆不是合法 JSON: {}", e.getMessage());
            return new JsonObject();
        }
    }

    /**
     * tokens/verify: {"success":true,"result":{"status":"active"}}
     */
    private Boolean isActiveToken(ProbeResponse response) {
        if (response.isDenied()) {
            return false;
        }
        if (!response.isSuccess()) {
            return null;
        }
        return "active".equals(resultString(response, "status"));
    }

    private String resultString(ProbeResponse response, String field) {
        JsonElement result = response.body().get("result");
        if (result == null || !result.isJsonObject()) {
            return null;
        }
        JsonElement value = result.getAsJsonObject().get(field);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record ProbeResponse(int code, JsonObject body) {

        boolean isSuccess() {
            JsonElement success = body.get("success");
            return code >= 200 && code < 300
                    && success != null && success.isJsonPrimitive() && success.getAsBoolean();
        }

        boolean isDenied() {
            return code == 401 || code == 403;
        }

        /** true = 有權限、false = 沒權限、null = 無法判斷 */
        Boolean permission() {
            if (isSuccess()) {
                return true;
            }
            return isDenied() ? false : null;
        }
    }
}
