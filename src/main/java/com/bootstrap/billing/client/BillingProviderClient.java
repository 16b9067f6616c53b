package com.bootstrap.billing.client;

import com.bootstrap.billing.dto.PriceCreateRequest;
import com.bootstrap.billing.dto.ProductCreateRequest;
import com.bootstrap.billing.dto.ProductUpdateRequest;
import com.bootstrap.billing.dto.WebhookEndpointCreateRequest;
import com.bootstrap.billing.dto.WebhookEndpointUpdateRequest;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.RemoteWebhookEndpoint;

import java.util.List;

/**
 * 計費供應商的最小能力介面
 *
 * plan builder / executor 只依賴這個介面，實際 HTTP 呼叫由實作負責。
 * 所有方法失敗時拋出 {@link com.bootstrap.shared.exception.ProviderCallException}。
 */
public interface BillingProviderClient {

    List<RemoteProduct> listProducts();

    RemoteProduct createProduct(ProductCreateRequest request);

    RemoteProduct updateProduct(String productId, ProductUpdateRequest request);

    /** 只回傳 active 的價格，已封存的價格視為不存在 */
    List<RemotePrice> listPrices();

    RemotePrice createPrice(PriceCreateRequest request);

    List<RemoteWebhookEndpoint> listWebhookEndpoints();

    RemoteWebhookEndpoint createWebhookEndpoint(WebhookEndpointCreateRequest request);

    RemoteWebhookEndpoint updateWebhookEndpoint(String endpointId, WebhookEndpointUpdateRequest request);
}
