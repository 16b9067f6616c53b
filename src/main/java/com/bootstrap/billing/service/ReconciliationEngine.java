package com.bootstrap.billing.service;

import com.bootstrap.billing.model.DesiredPrice;
import com.bootstrap.billing.model.DesiredProduct;
import com.bootstrap.billing.model.PriceDecision;
import com.bootstrap.billing.model.ProductDecision;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.RemoteWebhookEndpoint;
import com.bootstrap.billing.model.WebhookDecision;
import com.bootstrap.shared.model.StepStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 比對 desired state 與 Stripe 快照，決定每個資源要 create / update / existing
 *
 * 純函式：相同的 (desired, remote snapshot) 一定得到相同結果，不呼叫任何 API。
 * warnings 只累加到呼叫端傳入的清單，不會拋出。
 */
@Slf4j
@Service
public class ReconciliationEngine {

    // ==================== Product ====================

    /**
     * 以 metadata.idempotency_key 找產品，再比對它底下的價格
     *
     * @param remotePrices Stripe 上所有 active price（不限產品）
     */
    public ProductDecision decideProduct(String projectId,
                                         DesiredProduct desired,
                                         List<RemoteProduct> remoteProducts,
                                         List<RemotePrice> remotePrices,
                                         List<String> warnings) {
        String key = IdempotencyKeys.productKey(projectId, desired.name());
        String stepId = "product:" + desired.name();

        // 同一個 key 有多個時，優先用 active 的
        Optional<RemoteProduct> match = remoteProducts.stream()
                .filter(product -> key.equals(product.idempotencyKey()))
                .min(Comparator.comparing((RemoteProduct product) -> !product.isActive()));

        if (match.isEmpty()) {
            List<PriceDecision> prices = desired.prices().stream()
                    .map(price -> newProductPrice(projectId, desired, price))
                    .toList();
            return new ProductDecision(stepId, desired, key, StepStatus.CREATE, null,
                    "Create new product", prices);
        }

        RemoteProduct existing = match.get();
        List<PriceDecision> prices = decidePrices(projectId, desired, existing.getId(), remotePrices, warnings);

        if (!existing.isActive()) {
            return new ProductDecision(stepId, desired, key, StepStatus.UPDATE, existing.getId(),
                    "Reactivate archived product (" + existing.getId() + ")", prices);
        }
        return new ProductDecision(stepId, desired, key, StepStatus.EXISTING, existing.getId(),
                "Existing product found (" + existing.getId() + ")", prices);
    }

    // ==================== Price ====================

    /**
     * 比對既有產品底下的 active price
     *
     * key 相同但金額/幣別/週期不同 → 建新價格 + warning（Stripe price 不可修改）。
     * key 對不到、但產品上有本工具建立且已不在定義中的價格 → 同樣視為定義變更。
     */
    public List<PriceDecision> decidePrices(String projectId,
                                            DesiredProduct desired,
                                            String remoteProductId,
                                            List<RemotePrice> remotePrices,
                                            List<String> warnings) {
        List<RemotePrice> productPrices = remotePrices.stream()
                .filter(RemotePrice::isActive)
                .filter(price -> Objects.equals(remoteProductId, price.getProductId()))
                .toList();

        Set<String> desiredKeys = desired.prices().stream()
                .map(price -> IdempotencyKeys.priceKey(projectId, desired.name(), price))
                .collect(Collectors.toSet());

        List<RemotePrice> orphaned = productPrices.stream()
                .filter(price -> IdempotencyKeys.isPriceKeyOf(projectId, desired.name(), price.idempotencyKey()))
                .filter(price -> !desiredKeys.contains(price.idempotencyKey()))
                .toList();

        List<PriceDecision> decisions = new ArrayList<>();
        for (DesiredPrice price : desired.prices()) {
            String key = IdempotencyKeys.priceKey(projectId, desired.name(), price);
            String stepId = "price:" + desired.name() + ":" + key;

            Optional<RemotePrice> keyMatch = productPrices.stream()
                    .filter(remote -> key.equals(remote.idempotencyKey()))
                    .findFirst();

            if (keyMatch.isPresent() && keyMatch.get().matches(price)) {
                decisions.add(new PriceDecision(stepId, price, key, StepStatus.EXISTING, keyMatch.get().getId(),
                        "Existing price matches (" + keyMatch.get().getId() + ")"));
                continue;
            }

            if (keyMatch.isPresent()) {
                warnings.add("Price definition changed for " + desired.name() + ": price "
                        + keyMatch.get().getId() + " no longer matches " + price.displayLabel()
                        + ", creating new price instead of updating");
                decisions.add(new PriceDecision(stepId, price, key, StepStatus.CREATE, null,
                        "Create new price (definition changed)"));
                continue;
            }

            if (!orphaned.isEmpty()) {
                String previous = orphaned.stream().map(RemotePrice::getId).collect(Collectors.joining(", "));
                warnings.add("Price definition changed for " + desired.name() + ": creating new price "
                        + price.displayLabel() + " (previous: " + previous + ")");
                decisions.add(new PriceDecision(stepId, price, key, StepStatus.CREATE, null,
                        "Create new price (definition changed)"));
                continue;
            }

            decisions.add(new PriceDecision(stepId, price, key, StepStatus.CREATE, null, "Create new price"));
        }
        return decisions;
    }

    private PriceDecision newProductPrice(String projectId, DesiredProduct desired, DesiredPrice price) {
        String key = IdempotencyKeys.priceKey(projectId, desired.name(), price);
        return new PriceDecision("price:" + desired.name() + ":" + key, price, key, StepStatus.CREATE, null,
                "Create price for new product");
    }

    // ==================== Webhook ====================

    /**
     * 先以 URL 找，同 URL 多個時優先有 idempotency key 的；URL 找不到才用 key 找（代表 URL 已搬家）
     */
    public WebhookDecision decideWebhook(String projectId,
                                         String url,
                                         List<RemoteWebhookEndpoint> endpoints,
                                         List<String> warnings) {
        String key = IdempotencyKeys.webhookKey(projectId);

        List<RemoteWebhookEndpoint> onUrl = endpoints.stream()
                .filter(endpoint -> url.equals(endpoint.getUrl()))
                .toList();

        RemoteWebhookEndpoint chosen = onUrl.stream()
                .filter(endpoint -> key.equals(endpoint.idempotencyKey()))
                .findFirst()
                .orElse(onUrl.isEmpty() ? null : onUrl.get(0));

        if (onUrl.size() > 1) {
            String ids = onUrl.stream().map(RemoteWebhookEndpoint::getId).collect(Collectors.joining(", "));
            warnings.add("duplicate webhook endpoints detected for " + url + " (" + ids + "); using "
                    + chosen.getId() + ". Consider cleaning up manually.");
            log.warn("同一個 URL 有 {} 個 webhook endpoint: {}", onUrl.size(), ids);
        }

        boolean urlChanged = false;
        if (chosen == null) {
            chosen = endpoints.stream()
                    .filter(endpoint -> key.equals(endpoint.idempotencyKey()))
                    .findFirst()
                    .orElse(null);
            urlChanged = chosen != null;
        }

        if (chosen == null) {
            return new WebhookDecision(url, key, StepStatus.CREATE, null, StripeWebhookEvents.REQUIRED,
                    StripeWebhookEvents.REQUIRED, false, "Create webhook for " + url);
        }

        List<String> missing = StripeWebhookEvents.missingFrom(chosen.getEnabledEvents());
        List<String> eventsToApply = StripeWebhookEvents.union(chosen.getEnabledEvents());

        if (!missing.isEmpty() || urlChanged) {
            StringBuilder detail = new StringBuilder();
            if (urlChanged) {
                detail.append("Move endpoint ").append(chosen.getId())
                        .append(" from ").append(chosen.getUrl()).append(" to ").append(url);
            } else {
                detail.append("Update events for ").append(url);
            }
            if (!missing.isEmpty()) {
                detail.append(urlChanged ? "; add " : ": add ").append(String.join(", ", missing));
            }
            return new WebhookDecision(url, key, StepStatus.UPDATE, chosen.getId(), missing, eventsToApply,
                    urlChanged, detail.toString());
        }

        return new WebhookDecision(url, key, StepStatus.EXISTING, chosen.getId(), List.of(), eventsToApply,
                false, "Existing endpoint matches (" + chosen.getId() + ")");
    }
}
