package com.bootstrap.billing.client;

import com.bootstrap.billing.config.StripeConfig;
import com.bootstrap.billing.dto.PriceCreateRequest;
import com.bootstrap.billing.dto.ProductCreateRequest;
import com.bootstrap.billing.dto.ProductUpdateRequest;
import com.bootstrap.billing.dto.WebhookEndpointCreateRequest;
import com.bootstrap.billing.dto.WebhookEndpointUpdateRequest;
import com.bootstrap.billing.model.PriceInterval;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.RemoteWebhookEndpoint;
import com.bootstrap.shared.exception.MissingConfigurationException;
import com.bootstrap.shared.exception.ProviderCallException;
import com.bootstrap.shared.util.SecretMasker;
import com.stripe.exception.StripeException;
import com.stripe.model.Price;
import com.stripe.model.Product;
import com.stripe.model.WebhookEndpoint;
import com.stripe.net.ApiRequestParams;
import com.stripe.net.RequestOptions;
import com.stripe.param.PriceCreateParams;
import com.stripe.param.PriceListParams;
import com.stripe.param.ProductCreateParams;
import com.stripe.param.ProductListParams;
import com.stripe.param.ProductUpdateParams;
import com.stripe.param.WebhookEndpointCreateParams;
import com.stripe.param.WebhookEndpointListParams;
import com.stripe.param.WebhookEndpointUpdateParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 以 stripe-java SDK 實作的 {@link BillingProviderClient}
 *
 * 每次呼叫帶自己的 RequestOptions（api key、逾時、network retry），
 * 不寫入 Stripe.apiKey 全域狀態。
 * 暫時性網路錯誤由 SDK 的 maxNetworkRetries 重試，重試用完才轉成 ProviderCallException。
 */
@Slf4j
@Component
public class StripeBillingClient implements BillingProviderClient {

    private static final long PAGE_SIZE = 100L;

    private final StripeConfig stripeConfig;

    public StripeBillingClient(StripeConfig stripeConfig) {
        this.stripeConfig = stripeConfig;
        if (stripeConfig.hasSecretKey()) {
            log.info("Stripe client 已初始化 (apiKey={}, maxNetworkRetries={})",
                    SecretMasker.mask(stripeConfig.getSecretKey()), stripeConfig.getMaxNetworkRetries());
        } else {
            log.warn("STRIPE_SECRET_KEY 未設定，Stripe 佈建將無法執行");
        }
    }

    // ==================== Products ====================

    @Override
    public List<RemoteProduct> listProducts() {
        ProductListParams params = ProductListParams.builder()
                .setLimit(PAGE_SIZE)
                .build();
        try {
            List<RemoteProduct> products = new ArrayList<>();
            for (Product product : Product.list(params, requestOptions()).autoPagingIterable()) {
                products.add(toRemoteProduct(product));
            }
            log.debug("Stripe products.list 取得 {} 筆", products.size());
            return products;
        } catch (StripeException e) {
            throw providerError("products.list", e);
        } catch (RuntimeException e) {
            throw unwrapPagingError("products.list", e);
        }
    }

    @Override
    public RemoteProduct createProduct(ProductCreateRequest request) {
        ProductCreateParams.Builder builder = ProductCreateParams.builder()
                .setName(request.getName())
                .putAllMetadata(nonNull(request.getMetadata()));
        if (request.getDescription() != null && !request.getDescription().isBlank()) {
            builder.setDescription(request.getDescription());
        }
        try {
            return toRemoteProduct(Product.create(builder.build(), requestOptions()));
        } catch (StripeException e) {
            throw providerError("products.create", e);
        }
    }

    @Override
    public RemoteProduct updateProduct(String productId, ProductUpdateRequest request) {
        ProductUpdateParams.Builder builder = ProductUpdateParams.builder()
                .putAllMetadata(nonNull(request.getMetadata()));
        if (request.getActive() != null) {
            builder.setActive(request.getActive());
        }
        try {
            RequestOptions options = requestOptions();
            Product product = Product.retrieve(productId, options);
            return toRemoteProduct(product.update(builder.build(), options));
        } catch (StripeException e) {
            throw providerError("products.update", e);
        }
    }

    // ==================== Prices ====================

    @Override
    public List<RemotePrice> listPrices() {
        PriceListParams params = PriceListParams.builder()
                .setActive(true)
                .setLimit(PAGE_SIZE)
                .build();
        try {
            List<RemotePrice> prices = new ArrayList<>();
            for (Price price : Price.list(params, requestOptions()).autoPagingIterable()) {
                prices.add(toRemotePrice(price));
            }
            log.debug("Stripe prices.list 取得 {} 筆", prices.size());
            return prices;
        } catch (StripeException e) {
            throw providerError("prices.list", e);
        } catch (RuntimeException e) {
            throw unwrapPagingError("prices.list", e);
        }
    }

    @Override
    public RemotePrice createPrice(PriceCreateRequest request) {
        PriceCreateParams.Builder builder = PriceCreateParams.builder()
                .setProduct(request.getProductId())
                .setUnitAmount(request.getUnitAmount())
                .setCurrency(request.getCurrency())
                .putAllMetadata(nonNull(request.getMetadata()));

        if (request.getInterval() != null) {
            PriceCreateParams.Recurring.Builder recurring = PriceCreateParams.Recurring.builder()
                    .setInterval(toRecurringInterval(request.getInterval()));
            if (request.getIntervalCount() != null) {
                recurring.setIntervalCount(request.getIntervalCount().longValue());
            }
            builder.setRecurring(recurring.build());
        }

        try {
            return toRemotePrice(Price.create(builder.build(), requestOptions()));
        } catch (StripeException e) {
            throw providerError("prices.create", e);
        }
    }

    // ==================== Webhook Endpoints ====================

    @Override
    public List<RemoteWebhookEndpoint> listWebhookEndpoints() {
        WebhookEndpointListParams params = WebhookEndpointListParams.builder()
                .setLimit(PAGE_SIZE)
                .build();
        try {
            List<RemoteWebhookEndpoint> endpoints = new ArrayList<>();
            for (WebhookEndpoint endpoint : WebhookEndpoint.list(params, requestOptions()).autoPagingIterable()) {
                endpoints.add(toRemoteWebhookEndpoint(endpoint));
            }
            log.debug("Stripe webhookEndpoints.list 取得 {} 筆", endpoints.size());
            return endpoints;
        } catch (StripeException e) {
            throw providerError("webhookEndpoints.list", e);
        } catch (RuntimeException e) {
            throw unwrapPagingError("webhookEndpoints.list", e);
        }
    }

    @Override
    public RemoteWebhookEndpoint createWebhookEndpoint(WebhookEndpointCreateRequest request) {
        WebhookEndpointCreateParams.Builder builder = WebhookEndpointCreateParams.builder()
                .setUrl(request.getUrl())
                .putAllMetadata(nonNull(request.getMetadata()));

        Optional<List<WebhookEndpointCreateParams.EnabledEvent>> typed =
                toEnabledEvents(request.getEnabledEvents(), WebhookEndpointCreateParams.EnabledEvent.values());
        if (typed.isPresent()) {
            builder.addAllEnabledEvent(typed.get());
        } else {
            builder.putExtraParam("enabled_events", request.getEnabledEvents());
        }

        try {
            return toRemoteWebhookEndpoint(WebhookEndpoint.create(builder.build(), requestOptions()));
        } catch (StripeException e) {
            throw providerError("webhookEndpoints.create", e);
        }
    }

    @Override
    public RemoteWebhookEndpoint updateWebhookEndpoint(String endpointId, WebhookEndpointUpdateRequest request) {
        WebhookEndpointUpdateParams.Builder builder = WebhookEndpointUpdateParams.builder()
                .putAllMetadata(nonNull(request.getMetadata()));
        if (request.getUrl() != null) {
            builder.setUrl(request.getUrl());
        }

        Optional<List<WebhookEndpointUpdateParams.EnabledEvent>> typed =
                toEnabledEvents(request.getEnabledEvents(), WebhookEndpointUpdateParams.EnabledEvent.values());
        if (typed.isPresent()) {
            builder.addAllEnabledEvent(typed.get());
        } else {
            builder.putExtraParam("enabled_events", request.getEnabledEvents());
        }

        try {
            RequestOptions options = requestOptions();
            WebhookEndpoint endpoint = WebhookEndpoint.retrieve(endpointId, options);
            return toRemoteWebhookEndpoint(endpoint.update(builder.build(), options));
        } catch (StripeException e) {
            throw providerError("webhookEndpoints.update", e);
        }
    }

    // ==================== 轉換 ====================

    static RemoteProduct toRemoteProduct(Product product) {
        return RemoteProduct.builder()
                .id(product.getId())
                .name(product.getName())
                .description(product.getDescription())
                .active(!Boolean.FALSE.equals(product.getActive()))
                .metadata(copyOf(product.getMetadata()))
                .build();
    }

    static RemotePrice toRemotePrice(Price price) {
        Price.Recurring recurring = price.getRecurring();
        return RemotePrice.builder()
                .id(price.getId())
                .productId(price.getProduct())
                .unitAmount(price.getUnitAmount())
                .currency(price.getCurrency())
                .interval(recurring != null ? recurring.getInterval() : null)
                .intervalCount(recurring != null ? recurring.getIntervalCount() : null)
                .active(!Boolean.FALSE.equals(price.getActive()))
                .metadata(copyOf(price.getMetadata()))
                .build();
    }

    static RemoteWebhookEndpoint toRemoteWebhookEndpoint(WebhookEndpoint endpoint) {
        return RemoteWebhookEndpoint.builder()
                .id(endpoint.getId())
                .url(endpoint.getUrl())
                .enabledEvents(endpoint.getEnabledEvents() != null
                        ? new ArrayList<>(endpoint.getEnabledEvents())
                        : new ArrayList<>())
                .status(endpoint.getStatus())
                .secret(endpoint.getSecret())
                .metadata(copyOf(endpoint.getMetadata()))
                .build();
    }

    private static PriceCreateParams.Recurring.Interval toRecurringInterval(PriceInterval interval) {
        return switch (interval) {
            case DAY -> PriceCreateParams.Recurring.Interval.DAY;
            case WEEK -> PriceCreateParams.Recurring.Interval.WEEK;
            case MONTH -> PriceCreateParams.Recurring.Interval.MONTH;
            case YEAR -> PriceCreateParams.Recurring.Interval.YEAR;
        };
    }

    /**
     * 字串事件轉 SDK enum；任何一個事件不在此 SDK 版本的 enum 內就回傳 empty，
     * 改由 extra param 原樣送出（保留既有 endpoint 上較新的自訂事件）
     */
    private static <E extends Enum<E> & ApiRequestParams.EnumParam> Optional<List<E>> toEnabledEvents(
            List<String> events, E[] candidates) {
        List<E> typed = new ArrayList<>();
        for (String event : events) {
            Optional<E> match = Arrays.stream(candidates)
                    .filter(candidate -> candidate.getValue().equals(event))
                    .findFirst();
            if (match.isEmpty()) {
                return Optional.empty();
            }
            typed.add(match.get());
        }
        return Optional.of(typed);
    }

    private RequestOptions requestOptions() {
        if (!stripeConfig.hasSecretKey()) {
            throw new MissingConfigurationException("STRIPE_SECRET_KEY", "STRIPE_SECRET_KEY is required to call Stripe");
        }
        return RequestOptions.builder()
                .setApiKey(stripeConfig.getSecretKey())
                .setMaxNetworkRetries(stripeConfig.getMaxNetworkRetries())
                .setConnectTimeout(stripeConfig.getConnectTimeoutMs())
                .setReadTimeout(stripeConfig.getReadTimeoutMs())
                .build();
    }

    private ProviderCallException providerError(String operation, StripeException e) {
        String status = e.getStatusCode() != null ? " (HTTP " + e.getStatusCode() + ")" : "";
        log.error("Stripe {} 失敗{}: {}", operation, status, e.getMessage());
        return new ProviderCallException(operation, e.getMessage() + status, e);
    }

    /**
     * autoPagingIterable 翻頁失敗時 SDK 會把 StripeException 包成 RuntimeException
     */
    private RuntimeException unwrapPagingError(String operation, RuntimeException e) {
        if (e.getCause() instanceof StripeException stripeException) {
            return providerError(operation, stripeException);
        }
        return e;
    }

    private static Map<String, String> nonNull(Map<String, String> metadata) {
        return metadata != null ? metadata : Map.of();
    }

    private static Map<String, String> copyOf(Map<String, String> metadata) {
        return metadata != null ? new HashMap<>(metadata) : new HashMap<>();
    }
}
