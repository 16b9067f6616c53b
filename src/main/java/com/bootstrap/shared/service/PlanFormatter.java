package com.bootstrap.shared.service;

import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.ProvisionedProduct;
import com.bootstrap.billing.model.ProvisionedWebhook;
import com.bootstrap.billing.model.StepOutcome;
import com.bootstrap.shared.model.Plan;
import com.bootstrap.shared.model.PlanStep;
import com.bootstrap.shared.model.Provider;
import com.bootstrap.shared.util.SecretMasker;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 計畫 / 執行結果的 CLI 文字輸出
 *
 * <pre>
 * Provider: stripe
 *   create: Product: Founders — Create new product
 *   create: Price: 25.00 USD/month — Create price for new product
 * Notes:
 *   Project: my-saas
 * Warnings:
 *   ⚠ ...
 * </pre>
 */
@Service
public class PlanFormatter {

    public String format(Plan plan) {
        StringBuilder out = new StringBuilder();
        out.append("Provider: ").append(plan.getProvider().label());
        if (plan.getProvider() == Provider.CLOUDFLARE) {
            String account = plan.getAccountId();
            out.append(" (account ").append(account == null || account.isBlank() ? "not set" : account).append(')');
        }
        out.append('\n');

        for (PlanStep step : plan.getSteps()) {
            out.append("  ").append(step.status().label()).append(": ")
                    .append(step.title()).append(" — ").append(step.detail()).append('\n');
        }

        appendBlock(out, "Notes:", "  ", plan.getNotes());
        appendBlock(out, "Warnings:", "  ⚠ ", plan.getWarnings());
        return out.toString();
    }

    /**
     * 執行結果，webhook secret 一律遮罩
     */
    public String format(ExecutionResult result) {
        StringBuilder out = new StringBuilder();
        out.append("Stripe apply").append(result.isDryRun() ? " (dry run)" : "").append('\n');

        if (result.getProducts() != null && !result.getProducts().isEmpty()) {
            out.append("Products:\n");
            for (ProvisionedProduct product : result.getProducts()) {
                out.append("  ").append(product.getProductName()).append(": ")
                        .append(product.getProductId() != null ? product.getProductId() : "<failed>");
                List<String> priceIds = product.getPriceIds();
                if (priceIds != null && !priceIds.isEmpty()) {
                    out.append(" [").append(String.join(", ", priceIds)).append(']');
                }
                out.append('\n');
            }
        }

        ProvisionedWebhook webhook = result.getWebhook();
        if (webhook != null) {
            out.append("Webhook: ").append(webhook.getWebhookId())
                    .append(" (").append(webhook.getWebhookUrl()).append(")")
                    .append(" secret=").append(webhook.getWebhookSecret() != null
                            ? SecretMasker.mask(webhook.getWebhookSecret())
                            : "<not available>")
                    .append('\n');
        }

        if (result.getOutcomes() != null && !result.getOutcomes().isEmpty()) {
            out.append("Steps:\n");
            for (StepOutcome outcome : result.getOutcomes()) {
                out.append("  ").append(outcome.status().label()).append(": ")
                        .append(outcome.stepId()).append(" — ").append(outcome.detail()).append('\n');
            }
        }

        appendBlock(out, "Warnings:", "  ⚠ ", result.getWarnings());
        return out.toString();
    }

    private static void appendBlock(StringBuilder out, String header, String prefix, List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return;
        }
        out.append(header).append('\n');
        for (String line : lines) {
            out.append(prefix).append(line).append('\n');
        }
    }
}
