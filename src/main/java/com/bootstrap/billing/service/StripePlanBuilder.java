package com.bootstrap.billing.service;

import com.bootstrap.billing.client.BillingProviderClient;
import com.bootstrap.billing.dto.StripeProvisioningRequest;
import com.bootstrap.billing.model.DesiredProduct;
import com.bootstrap.billing.model.PriceDecision;
import com.bootstrap.billing.model.ProductDecision;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.StripeProvisioningPlan;
import com.bootstrap.billing.model.WebhookDecision;
import com.bootstrap.shared.exception.MissingConfigurationException;
import com.bootstrap.shared.model.Plan;
import com.bootstrap.shared.model.PlanStep;
import com.bootstrap.shared.model.Provider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Stripe 佈建計畫產生器
 *
 * 只呼叫 list API（products / prices / webhook endpoints），不做任何修改。
 * 任何 list 失敗（ProviderCallException）直接往上拋，不產生不完整的計畫。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StripePlanBuilder {

    private final BillingProviderClient billingClient;
    private final ProductDefinitionParser definitionParser;
    private final ReconciliationEngine reconciliationEngine;

    public StripeProvisioningPlan buildPlan(StripeProvisioningRequest request) {
        String projectId = request.getProjectId();
        if (projectId == null || projectId.isBlank()) {
            throw new MissingConfigurationException("PROJECT_ID", "PROJECT_ID is required to build the Stripe plan");
        }

        // 先解析，格式錯誤時不打任何 API
        List<DesiredProduct> desired = definitionParser.parse(
                request.getDefinitionsField(), request.getProductDefinitions());

        List<String> warnings = new ArrayList<>();
        List<ProductDecision> productDecisions = new ArrayList<>();

        if (!desired.isEmpty()) {
            List<RemoteProduct> remoteProducts = billingClient.listProducts();
            List<RemotePrice> remotePrices = billingClient.listPrices();
            log.info("Stripe 快照: products={}, activePrices={}", remoteProducts.size(), remotePrices.size());

            for (DesiredProduct product : desired) {
                productDecisions.add(reconciliationEngine.decideProduct(
                        projectId, product, remoteProducts, remotePrices, warnings));
            }
        }

        WebhookDecision webhookDecision = null;
        String webhookUrl = request.getWebhookUrl();
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            webhookDecision = reconciliationEngine.decideWebhook(
                    projectId, webhookUrl, billingClient.listWebhookEndpoints(), warnings);
        }

        Plan plan = Plan.builder()
                .provider(Provider.STRIPE)
                .steps(toSteps(productDecisions, webhookDecision))
                .notes(buildNotes(projectId, desired.size(), webhookUrl))
                .warnings(warnings)
                .build();

        log.info("Stripe 計畫完成: steps={}, pendingChanges={}, warnings={}",
                plan.getSteps().size(), plan.hasPendingChanges(), warnings.size());
        return new StripeProvisioningPlan(projectId, plan, productDecisions, webhookDecision);
    }

    /**
     * 順序: 全部產品 → 依產品分組的價格 → webhook
     */
    private List<PlanStep> toSteps(List<ProductDecision> products, WebhookDecision webhook) {
        List<PlanStep> steps = new ArrayList<>();
        for (ProductDecision product : products) {
            steps.add(new PlanStep(product.stepId(), "Product: " + product.desired().name(),
                    product.status(), product.detail()));
        }
        for (ProductDecision product : products) {
            for (PriceDecision price : product.prices()) {
                steps.add(new PlanStep(price.stepId(), "Price: " + price.desired().displayLabel(),
                        price.status(), price.detail()));
            }
        }
        if (webhook != null) {
            steps.add(new PlanStep("webhook", "Webhook endpoint", webhook.status(), webhook.detail()));
        }
        return steps;
    }

    private List<String> buildNotes(String projectId, int productCount, String webhookUrl) {
        List<String> notes = new ArrayList<>();
        notes.add("Project: " + projectId);
        notes.add("Products configured: " + productCount);
        if (webhookUrl != null && !webhookUrl.isBlank()) {
            notes.add("Webhook URL: " + webhookUrl);
        }
        return notes;
    }
}
