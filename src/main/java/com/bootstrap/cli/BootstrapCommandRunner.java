package com.bootstrap.cli;

import com.bootstrap.billing.config.StripeConfig;
import com.bootstrap.billing.dto.StripeProvisioningRequest;
import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.StripeProvisioningPlan;
import com.bootstrap.billing.service.StripePlanBuilder;
import com.bootstrap.billing.service.StripePlanExecutor;
import com.bootstrap.billing.service.StripeProductsPayloadBuilder;
import com.bootstrap.edge.config.CloudflareConfig;
import com.bootstrap.edge.dto.CloudflarePlanRequest;
import com.bootstrap.edge.model.CloudflareCapabilities;
import com.bootstrap.edge.service.CloudflareCapabilityProbe;
import com.bootstrap.edge.service.CloudflarePlanBuilder;
import com.bootstrap.shared.config.BootstrapConfig;
import com.bootstrap.shared.exception.ConfigParseException;
import com.bootstrap.shared.exception.MissingConfigurationException;
import com.bootstrap.shared.exception.ProviderCallException;
import com.bootstrap.shared.model.Plan;
import com.bootstrap.shared.model.Provider;
import com.bootstrap.shared.service.GeneratedEnvWriter;
import com.bootstrap.shared.service.PlanFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * CLI 入口：preflight / apply
 *
 * 結果印到 stdout，exit code 透過 {@link ExitCodeGenerator} 交給 SpringApplication.exit():
 * 0 成功、1 有失敗步驟（或 --fail-on-warnings 且有 warning、或內部錯誤）、2 設定錯誤、3 建立計畫時 provider 呼叫失敗
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BootstrapCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_CONFIG_ERROR = 2;
    static final int EXIT_PROVIDER_ERROR = 3;

    private final BootstrapOptionsParser optionsParser;
    private final BootstrapConfig bootstrapConfig;
    private final StripeConfig stripeConfig;
    private final CloudflareConfig cloudflareConfig;
    private final StripePlanBuilder stripePlanBuilder;
    private final StripePlanExecutor stripePlanExecutor;
    private final StripeProductsPayloadBuilder productsPayloadBuilder;
    private final CloudflarePlanBuilder cloudflarePlanBuilder;
    private final CloudflareCapabilityProbe capabilityProbe;
    private final PlanFormatter planFormatter;
    private final GeneratedEnvWriter generatedEnvWriter;

    private PrintStream out = System.out;
    private int exitCode = EXIT_OK;

    void setOut(PrintStream out) {
        this.out = out;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void run(ApplicationArguments args) {
        BootstrapOptions options;
        try {
            options = optionsParser.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            out.println(BootstrapOptionsParser.USAGE);
            exitCode = EXIT_CONFIG_ERROR;
            return;
        }

        log.info("開始執行 bootstrap: {}", options.describe());
        try {
            exitCode = switch (options.getCommand()) {
                case PREFLIGHT -> preflight(options);
                case APPLY -> apply(options);
            };
        } catch (ConfigParseException e) {
            log.error("產品定義錯誤 ({}): {}", e.getField(), e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
        } catch (MissingConfigurationException e) {
            log.error("缺少設定 {}: {}", e.getSetting(), e.getMessage());
            out.println("Configuration error: " + e.getMessage());
            exitCode = EXIT_CONFIG_ERROR;
        } catch (ProviderCallException e) {
            log.error("Provider 呼叫失敗 ({}): {}", e.getOperation(), e.getMessage());
            out.println("Provider error: " + e.getMessage());
            exitCode = EXIT_PROVIDER_ERROR;
        } catch (IllegalStateException e) {
            // 序列化 / 寫檔等內部錯誤，可能發生在已套用修改之後
            log.error("bootstrap 中斷: {}", e.getMessage(), e);
            out.println("Error: " + e.getMessage());
            exitCode = EXIT_FAILED;
        }
        log.info("bootstrap 結束: exitCode={}", exitCode);
    }

    // ==================== preflight ====================

    private int preflight(BootstrapOptions options) {
        boolean hasWarnings = false;

        if (options.includes(Provider.STRIPE)) {
            StripeProvisioningPlan plan = stripePlanBuilder.buildPlan(stripeRequest(options));
            out.println(planFormatter.format(plan.plan()));
            hasWarnings = !plan.plan().getWarnings().isEmpty();
        }

        if (options.includes(Provider.CLOUDFLARE)) {
            out.println(planFormatter.format(cloudflarePlan(options)));
        }

        return hasWarnings && options.isFailOnWarnings() ? EXIT_FAILED : EXIT_OK;
    }

    // ==================== apply ====================

    private int apply(BootstrapOptions options) {
        Map<String, String> envUpdates = new LinkedHashMap<>();
        boolean failed = false;
        boolean hasWarnings = false;

        if (options.includes(Provider.STRIPE)) {
            StripeProvisioningRequest request = stripeRequest(options);
            StripeProvisioningPlan plan = stripePlanBuilder.buildPlan(request);
            out.println(planFormatter.format(plan.plan()));

            ExecutionResult result = stripePlanExecutor.execute(plan, request);
            out.println(planFormatter.format(result));

            failed = result.isFailed();
            hasWarnings = !result.getWarnings().isEmpty();
            if (!failed) {
                String payload = productsPayloadBuilder.build(
                        request.getDefinitionsField(), request.getProductDefinitions(), result);
                envUpdates.putAll(GeneratedEnvWriter.stripeEntries(result, payload));
            }
        }

        if (options.includes(Provider.CLOUDFLARE)) {
            CloudflarePlanRequest request = cloudflareRequest(options);
            out.println(planFormatter.format(cloudflarePlan(options)));
            envUpdates.put("D1_DATABASE_NAME", CloudflarePlanBuilder.resolveD1Name(request));
            envUpdates.put("CLOUDFLARE_R2_BUCKET", CloudflarePlanBuilder.resolveR2Bucket(request));
        }

        if (options.isDryRun()) {
            out.println("Dry run completed without side effects.");
        } else if (failed) {
            out.println("Apply finished with failures; " + GeneratedEnvWriter.FILE_NAME + " was not updated.");
        } else {
            try {
                Path written = generatedEnvWriter.write(outputDir(options), envUpdates);
                out.println("Wrote " + written);
            } catch (IOException e) {
                log.error("寫入 {} 失敗: {}", GeneratedEnvWriter.FILE_NAME, e.getMessage());
                out.println("Failed to write " + GeneratedEnvWriter.FILE_NAME + ": " + e.getMessage());
                return EXIT_FAILED;
            }
        }

        if (failed) {
            return EXIT_FAILED;
        }
        return hasWarnings && options.isFailOnWarnings() ? EXIT_FAILED : EXIT_OK;
    }

    // ==================== 輸入組裝 ====================

    StripeProvisioningRequest stripeRequest(BootstrapOptions options) {
        return StripeProvisioningRequest.builder()
                .projectId(projectId(options))
                .productDefinitions(stripeConfig.resolveProductDefinitions())
                .definitionsField(stripeConfig.resolveDefinitionsField())
                .webhookUrl(resolveWebhookUrl(options))
                .configuredWebhookSecret(stripeConfig.getWebhookSecret())
                .dryRun(options.isDryRun())
                .build();
    }

    /**
     * --webhook-url → STRIPE_WEBHOOK_URL → (--base-url 或 PROJECT_DOMAIN) + webhook path
     */
    String resolveWebhookUrl(BootstrapOptions options) {
        if (notBlank(options.getWebhookUrl())) {
            return options.getWebhookUrl();
        }
        if (notBlank(stripeConfig.getWebhookUrl())) {
            return stripeConfig.getWebhookUrl();
        }
        String base = notBlank(options.getBaseUrl()) ? options.getBaseUrl() : bootstrapConfig.getProjectDomain();
        if (!notBlank(base)) {
            return null;
        }
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String path = stripeConfig.getWebhookPath().startsWith("/")
                ? stripeConfig.getWebhookPath()
                : "/" + stripeConfig.getWebhookPath();
        return trimmed + path;
    }

    private Plan cloudflarePlan(BootstrapOptions options) {
        CloudflarePlanRequest request = cloudflareRequest(options);
        CloudflareCapabilities capabilities = null;
        if (options.isSkipWrangler()) {
            log.info("--skip-wrangler: 跳過 Cloudflare 權限探測");
        } else {
            Optional<CloudflareCapabilities> probed = capabilityProbe.probe(
                    request.getAccountId(), options.getAttempts(), options.getDelayMs());
            capabilities = probed.orElse(null);
        }
        return cloudflarePlanBuilder.buildPlan(request, capabilities);
    }

    private CloudflarePlanRequest cloudflareRequest(BootstrapOptions options) {
        return CloudflarePlanRequest.builder()
                .projectId(projectId(options))
                .accountId(cloudflareConfig.getAccountId())
                .zoneId(cloudflareConfig.getZoneId())
                .d1DatabaseName(notBlank(options.getD1Name()) ? options.getD1Name() : cloudflareConfig.getD1DatabaseName())
                .r2Bucket(notBlank(options.getR2Bucket()) ? options.getR2Bucket() : cloudflareConfig.getR2Bucket())
                .stripeWebhookConfigured(notBlank(stripeConfig.getWebhookSecret()))
                .build();
    }

    private String projectId(BootstrapOptions options) {
        String projectId = notBlank(options.getProjectId()) ? options.getProjectId() : bootstrapConfig.getProjectId();
        if (!notBlank(projectId)) {
            throw new MissingConfigurationException("PROJECT_ID",
                    "PROJECT_ID is required (set PROJECT_ID or pass --project-id=<id>)");
        }
        return projectId.trim();
    }

    private Path outputDir(BootstrapOptions options) {
        return Path.of(notBlank(options.getOutputDir()) ? options.getOutputDir() : bootstrapConfig.getOutputDir());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
