package com.bootstrap.billing.service;

import com.bootstrap.billing.client.BillingProviderClient;
import com.bootstrap.billing.dto.PriceCreateRequest;
import com.bootstrap.billing.dto.ProductCreateRequest;
import com.bootstrap.billing.dto.ProductUpdateRequest;
import com.bootstrap.billing.dto.StripeProvisioningRequest;
import com.bootstrap.billing.dto.WebhookEndpointCreateRequest;
import com.bootstrap.billing.dto.WebhookEndpointUpdateRequest;
import com.bootstrap.billing.model.DesiredPrice;
import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.MetadataKeys;
import com.bootstrap.billing.model.PriceDecision;
import com.bootstrap.billing.model.ProductDecision;
import com.bootstrap.billing.model.ProvisionedProduct;
import com.bootstrap.billing.model.ProvisionedWebhook;
import com.bootstrap.billing.model.ProvisioningStage;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.RemoteWebhookEndpoint;
import com.bootstrap.billing.model.StepOutcome;
import com.bootstrap.billing.model.StripeProvisioningPlan;
import com.bootstrap.billing.model.WebhookDecision;
import com.bootstrap.shared.exception.ProviderCallException;
import com.bootstrap.shared.model.StepStatus;
import com.bootstrap.shared.util.SecretMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stripe 佈建執行器
 *
 * 三個階段依序執行: PRODUCT → PRICE → WEBHOOK，後一階段使用前一階段拿到的 ID。
 * - dry-run: 不呼叫任何 create / update，新資源以 placeholder ID 代替
 * - 產品失敗: 該產品的價格全部 skipped，其他產品與 webhook 照常執行
 * - 價格失敗: 只影響該價格
 * - 不回滾，下次 run 會依 idempotency key 從斷點續做
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripePlanExecutor {

    public static final String DRY_RUN_PRODUCT_ID = "prod_dry_run_id";
    public static final String DRY_RUN_PRICE_ID = "price_dry_run_id";
    public static final String DRY_RUN_WEBHOOK_ID = "we_dry_run_id";
    public static final String DRY_RUN_WEBHOOK_SECRET = "whsec_dry_run_secret";

    private final BillingProviderClient billingClient;
    private final StripePlanBuilder planBuilder;

    /**
     * 重新建立計畫後執行（apply 的標準入口）
     */
    public ExecutionResult executePlan(StripeProvisioningRequest request) {
        return execute(planBuilder.buildPlan(request), request);
    }

    /**
     * 執行已建立的計畫
     */
    public ExecutionResult execute(StripeProvisioningPlan plan, StripeProvisioningRequest request) {
        ExecutionContext context = new ExecutionContext(plan.projectId(), request.isDryRun());
        context.warnings.addAll(plan.plan().getWarnings());

        log.info("{} 開始執行 Stripe 計畫: project={}, products={}, webhook={}",
                context.mode(), plan.projectId(), plan.products().size(), plan.webhook() != null);

        // ==================== Stage 1: PRODUCT ====================
        Map<String, String> productIds = new LinkedHashMap<>();
        for (ProductDecision decision : plan.products()) {
            productIds.put(decision.desired().name(), applyProduct(decision, context));
        }

        // ==================== Stage 2: PRICE ====================
        List<ProvisionedProduct> provisioned = new ArrayList<>();
        for (ProductDecision decision : plan.products()) {
            String productId = productIds.get(decision.desired().name());
            List<String> priceIds = new ArrayList<>();

            for (PriceDecision price : decision.prices()) {
                if (productId == null) {
                    context.record(price.stepId(), ProvisioningStage.PRICE, StepOutcome.Status.SKIPPED,
                            "Skipped: product " + decision.desired().name() + " failed");
                    continue;
                }
                String priceId = applyPrice(productId, price, context);
                if (priceId != null) {
                    priceIds.add(priceId);
                }
            }

            provisioned.add(ProvisionedProduct.builder()
                    .productName(decision.desired().name())
                    .productId(productId)
                    .priceIds(priceIds)
                    .build());
        }

        // ==================== Stage 3: WEBHOOK ====================
        ProvisionedWebhook webhook = null;
        if (plan.webhook() != null) {
            webhook = applyWebhook(plan.webhook(), request.getConfiguredWebhookSecret(), context);
        }

        ExecutionResult result = ExecutionResult.builder()
                .dryRun(context.dryRun)
                .products(provisioned)
                .webhook(webhook)
                .warnings(context.warnings)
                .outcomes(context.outcomes)
                .build();

        if (result.isFailed()) {
            log.warn("{} Stripe 計畫部分失敗，已套用的步驟不回滾", context.mode());
        } else {
            log.info("{} Stripe 計畫執行完成", context.mode());
        }
        return result;
    }

    // ==================== Product ====================

    /**
     * @return 產品 ID（dry-run 新建為 placeholder），失敗回傳 null
     */
    private String applyProduct(ProductDecision decision, ExecutionContext context) {
        String name = decision.desired().name();
        switch (decision.status()) {
            case EXISTING -> {
                context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.UNCHANGED,
                        decision.detail());
                return decision.remoteProductId();
            }
            case UPDATE -> {
                if (context.dryRun) {
                    log.info("{} 重新啟用產品: {} ({})", context.mode(), name, decision.remoteProductId());
                    context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.DRY_RUN,
                            "Would reactivate " + decision.remoteProductId());
                    return decision.remoteProductId();
                }
                try {
                    RemoteProduct updated = billingClient.updateProduct(decision.remoteProductId(),
                            ProductUpdateRequest.builder()
                                    .active(true)
                                    .metadata(tags(decision.idempotencyKey(), context.projectId, Map.of()))
                                    .build());
                    log.info("{} 重新啟用產品: {} ({})", context.mode(), name, updated.getId());
                    context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.APPLIED,
                            "Reactivated " + updated.getId());
                    return updated.getId();
                } catch (ProviderCallException e) {
                    return productFailed(decision, e, context);
                }
            }
            default -> {
                if (context.dryRun) {
                    log.info("{} 建立產品: {}", context.mode(), name);
                    context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.DRY_RUN,
                            "Would create product " + name);
                    return DRY_RUN_PRODUCT_ID;
                }
                try {
                    RemoteProduct created = billingClient.createProduct(ProductCreateRequest.builder()
                            .name(name)
                            .description(decision.desired().description())
                            .metadata(tags(decision.idempotencyKey(), context.projectId, decision.desired().metadata()))
                            .build());
                    log.info("{} 建立產品: {} → {}", context.mode(), name, created.getId());
                    context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.APPLIED,
                            "Created " + created.getId());
                    return created.getId();
                } catch (ProviderCallException e) {
                    return productFailed(decision, e, context);
                }
            }
        }
    }

    private String productFailed(ProductDecision decision, ProviderCallException e, ExecutionContext context) {
        log.error("{} 產品步驟失敗: {} - {}", context.mode(), decision.desired().name(), e.getMessage());
        context.record(decision.stepId(), ProvisioningStage.PRODUCT, StepOutcome.Status.FAILED, e.getMessage());
        return null;
    }

    // ==================== Price ====================

    /**
     * @return 價格 ID（dry-run 新建為 placeholder），失敗回傳 null
     */
    private String applyPrice(String productId, PriceDecision decision, ExecutionContext context) {
        DesiredPrice desired = decision.desired();

        if (decision.status() == StepStatus.EXISTING) {
            context.record(decision.stepId(), ProvisioningStage.PRICE, StepOutcome.Status.UNCHANGED, decision.detail());
            return decision.remotePriceId();
        }

        if (context.dryRun) {
            log.info("{} 建立價格: {} ({})", context.mode(), desired.displayLabel(), productId);
            context.record(decision.stepId(), ProvisioningStage.PRICE, StepOutcome.Status.DRY_RUN,
                    "Would create price " + desired.displayLabel());
            return DRY_RUN_PRICE_ID;
        }

        try {
            RemotePrice created = billingClient.createPrice(PriceCreateRequest.builder()
                    .productId(productId)
                    .unitAmount(desired.amount())
                    .currency(desired.currency())
                    .interval(desired.interval())
                    .intervalCount(desired.isRecurring() && desired.intervalCount() != 1 ? desired.intervalCount() : null)
                    .metadata(tags(decision.idempotencyKey(), context.projectId, desired.metadata()))
                    .build());
            log.info("{} 建立價格: {} → {}", context.mode(), desired.displayLabel(), created.getId());
            context.record(decision.stepId(), ProvisioningStage.PRICE, StepOutcome.Status.APPLIED,
                    "Created " + created.getId());
            return created.getId();
        } catch (ProviderCallException e) {
            log.error("{} 價格步驟失敗: {} - {}", context.mode(), desired.displayLabel(), e.getMessage());
            context.record(decision.stepId(), ProvisioningStage.PRICE, StepOutcome.Status.FAILED, e.getMessage());
            return null;
        }
    }

    // ==================== Webhook ====================

    private ProvisionedWebhook applyWebhook(WebhookDecision decision, String configuredSecret, ExecutionContext context) {
        String url = decision.url();
        try {
            switch (decision.status()) {
                case CREATE -> {
                    if (context.dryRun) {
                        log.info("{} 建立 webhook endpoint: {}", context.mode(), url);
                        context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.DRY_RUN,
                                "Would create webhook for " + url);
                        return webhook(DRY_RUN_WEBHOOK_ID, DRY_RUN_WEBHOOK_SECRET, url);
                    }
                    RemoteWebhookEndpoint created = billingClient.createWebhookEndpoint(
                            WebhookEndpointCreateRequest.builder()
                                    .url(url)
                                    .enabledEvents(decision.eventsToApply())
                                    .metadata(tags(decision.idempotencyKey(), context.projectId, Map.of()))
                                    .build());
                    log.info("{} 建立 webhook endpoint: {} → {} (secret={})", context.mode(), url,
                            created.getId(), SecretMasker.mask(created.getSecret()));
                    context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.APPLIED,
                            "Created " + created.getId());
                    String secret = created.getSecret();
                    if (secret == null || secret.isBlank()) {
                        context.warnings.add("Stripe did not return a signing secret for webhook " + created.getId()
                                + "; copy it from the Stripe dashboard into STRIPE_WEBHOOK_SECRET");
                        secret = null;
                    }
                    return webhook(created.getId(), secret, url);
                }
                case UPDATE -> {
                    if (context.dryRun) {
                        log.info("{} 更新 webhook endpoint: {} ({})", context.mode(), url, decision.remoteEndpointId());
                        context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.DRY_RUN,
                                "Would update " + decision.remoteEndpointId() + " with "
                                        + String.join(", ", decision.eventsToApply()));
                        return webhook(decision.remoteEndpointId(), DRY_RUN_WEBHOOK_SECRET, url);
                    }
                    RemoteWebhookEndpoint updated = billingClient.updateWebhookEndpoint(decision.remoteEndpointId(),
                            WebhookEndpointUpdateRequest.builder()
                                    .url(decision.urlChanged() ? url : null)
                                    .enabledEvents(decision.eventsToApply())
                                    .metadata(tags(decision.idempotencyKey(), context.projectId, Map.of()))
                                    .build());
                    log.info("{} 更新 webhook endpoint: {} ({})", context.mode(), url, updated.getId());
                    context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.APPLIED,
                            "Updated " + updated.getId());
                    return webhook(decision.remoteEndpointId(), existingSecret(decision, configuredSecret, context), url);
                }
                default -> {
                    context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.UNCHANGED, decision.detail());
                    return webhook(decision.remoteEndpointId(), existingSecret(decision, configuredSecret, context), url);
                }
            }
        } catch (ProviderCallException e) {
            log.error("{} webhook 步驟失敗: {} - {}", context.mode(), url, e.getMessage());
            context.record("webhook", ProvisioningStage.WEBHOOK, StepOutcome.Status.FAILED, e.getMessage());
            return null;
        }
    }

    /**
     * Stripe 只在建立時回傳 signing secret，既有 endpoint 只能沿用設定值
     */
    private String existingSecret(WebhookDecision decision, String configuredSecret, ExecutionContext context) {
        if (configuredSecret != null && !configuredSecret.isBlank()) {
            return configuredSecret;
        }
        context.warnings.add("Webhook secret for existing endpoint " + decision.remoteEndpointId()
                + " cannot be retrieved from Stripe; set STRIPE_WEBHOOK_SECRET");
        return null;
    }

    private static ProvisionedWebhook webhook(String id, String secret, String url) {
        return ProvisionedWebhook.builder()
                .webhookId(id)
                .webhookSecret(secret)
                .webhookUrl(url)
                .build();
    }

    /**
     * 使用者 metadata + idempotency_key + project_id（後兩者不可被覆蓋）
     */
    private static Map<String, String> tags(String idempotencyKey, String projectId, Map<String, String> userMetadata) {
        Map<String, String> metadata = new LinkedHashMap<>(userMetadata);
        metadata.put(MetadataKeys.IDEMPOTENCY_KEY, idempotencyKey);
        metadata.put(MetadataKeys.PROJECT_ID, projectId);
        return metadata;
    }

    /**
     * 單次執行的累加狀態
     */
    private static final class ExecutionContext {

        private final String projectId;
        private final boolean dryRun;
        private final List<String> warnings = new ArrayList<>();
        private final List<StepOutcome> outcomes = new ArrayList<>();

        private ExecutionContext(String projectId, boolean dryRun) {
            this.projectId = projectId;
            this.dryRun = dryRun;
        }

        private String mode() {
            return dryRun ? "[dry-run]" : "[apply]";
        }

        private void record(String stepId, ProvisioningStage stage, StepOutcome.Status status, String detail) {
            outcomes.add(new StepOutcome(stepId, stage, status, detail));
        }
    }
}
