package com.bootstrap.shared.util;

import java.util.regex.Pattern;

/**
 * 敏感值遮罩工具
 *
 * 任何 API Key / Token / Webhook Secret 寫進 log 或 CLI 輸出前都要經過這裡。
 */
public class SecretMasker {

    private static final Pattern SENSITIVE_KEY = Pattern.compile(
            "(TOKEN|SECRET|KEY|PASSWORD|CLIENT|AUTH)", Pattern.CASE_INSENSITIVE);

    private SecretMasker() {}

    /**
     * 依 key 名稱決定是否遮罩
     *
     * @param key   設定名稱（例如 STRIPE_SECRET_KEY）
     * @param value 原始值
     * @return 不敏感的 key 原樣回傳，敏感的 key 回傳遮罩後的值
     */
    public static String redact(String key, String value) {
        if (value == null || value.isEmpty()) {
            return "<empty>";
        }
        if (key == null || !SENSITIVE_KEY.matcher(key).find()) {
            return value;
        }
        return mask(value);
    }

    /**
     * 無條件遮罩：保留前 4 碼與後 2 碼
     */
    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "<empty>";
        }
        if (value.length() <= 4) {
            return value.charAt(0) + "***";
        }
        return value.substring(0, 4) + "..." + value.substring(value.length() - 2);
    }
}
