package com.bootstrap.cli;

import com.bootstrap.shared.model.Provider;
import com.bootstrap.shared.util.SecretMasker;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * 解析後的 CLI 選項
 *
 * 未指定的值為 null，由 runner 退回 application.yml 的設定。
 */
@Data
@Builder
public class BootstrapOptions {

    private BootstrapCommand command;

    /** null = stripe + cloudflare 都處理 */
    private Provider provider;

    private boolean dryRun;
    private String webhookUrl;
    private String baseUrl;

    private String outputDir;
    private boolean skipWrangler;

    @Builder.Default
    private int attempts = 3;

    @Builder.Default
    private long delayMs = 1000L;

    /*
     * 以下是給外層 smoke 測試用的選項，原樣保留不做驗證，
     * bootstrap 只在 describe() 記錄，不依賴它們的值
     */
    private String mode;
    private String routes;
    @ToString.Exclude
    private String token;
    private String stamp;

    @Builder.Default
    private boolean headless = true;

    private String projectId;
    private String d1Name;
    private String r2Bucket;
    private boolean failOnWarnings;

    public boolean includes(Provider target) {
        return provider == null || provider == target;
    }

    /**
     * log 用摘要，token 遮罩
     */
    public String describe() {
        return "command=" + (command != null ? command.value() : null)
                + ", provider=" + (provider != null ? provider.label() : "all")
                + ", dryRun=" + dryRun
                + ", projectId=" + projectId
                + ", webhookUrl=" + webhookUrl
                + ", baseUrl=" + baseUrl
                + ", outputDir=" + outputDir
                + ", skipWrangler=" + skipWrangler
                + ", attempts=" + attempts
                + ", delayMs=" + delayMs
                + ", failOnWarnings=" + failOnWarnings
                + ", mode=" + mode
                + ", routes=" + routes
                + ", stamp=" + stamp
                + ", headless=" + headless
                + ", token=" + (token != null ? SecretMasker.mask(token) : null);
    }
}
