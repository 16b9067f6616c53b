package com.bootstrap.billing.service;

import com.bootstrap.billing.client.BillingProviderClient;
import com.bootstrap.billing.dto.PriceCreateRequest;
import com.bootstrap.billing.dto.ProductCreateRequest;
import com.bootstrap.billing.dto.ProductUpdateRequest;
import com.bootstrap.billing.dto.StripeProvisioningRequest;
import com.bootstrap.billing.dto.WebhookEndpointCreateRequest;
import com.bootstrap.billing.dto.WebhookEndpointUpdateRequest;
import com.bootstrap.billing.model.ExecutionResult;
import com.bootstrap.billing.model.MetadataKeys;
import com.bootstrap.billing.model.PriceInterval;
import com.bootstrap.billing.model.ProvisioningStage;
import com.bootstrap.billing.model.RemotePrice;
import com.bootstrap.billing.model.RemoteProduct;
import com.bootstrap.billing.model.RemoteWebhookEndpoint;
import com.bootstrap.billing.model.StepOutcome;
import com.bootstrap.shared.exception.ProviderCallException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * StripePlanExecutor 單元測試
 *
 * 覆蓋：dry-run placeholder、metadata 標記、interval_count、失敗隔離、webhook secret 來源
 */
class StripePlanExecutorTest {

    private static final String URL = "https://demo.example.com/api/webhooks/stripe";

    private BillingProviderClient billingClient;
    private StripePlanExecutor executor;

    @BeforeEach
    void setUp() {
        billingClient = mock(BillingProviderClient.class);
        when(billingClient.listProducts()).thenReturn(List.of());
        when(billingClient.listPrices()).thenReturn(List.of());
        when(billingClient.listWebhookEndpoints()).thenReturn(List.of());

        StripePlanBuilder planBuilder = new StripePlanBuilder(billingClient,
                new ProductDefinitionParser(new ObjectMapper()), new ReconciliationEngine());
        executor = new StripePlanExecutor(billingClient, planBuilder);
    }

    @Nested
    @DisplayName("dry-run")
    class DryRunTests {

        @Test
        @DisplayName("不呼叫任何 create / update，回傳 placeholder")
        void noMutations() {
            ExecutionResult result = executor.executePlan(request("Founders:2500,usd,month", true, null));

            verify(billingClient, never()).createProduct(any());
            verify(billingClient, never()).createPrice(any());
            verify(billingClient, never()).createWebhookEndpoint(any());
            verify(billingClient, never()).updateProduct(any(), any());
            verify(billingClient, never()).updateWebhookEndpoint(any(), any());

            assertThat(result.isDryRun()).isTrue();
            assertThat(result.getProducts()).singleElement().satisfies(product -> {
                assertThat(product.getProductId()).isEqualTo(StripePlanExecutor.DRY_RUN_PRODUCT_ID);
                assertThat(product.getPriceIds()).containsExactly(StripePlanExecutor.DRY_RUN_PRICE_ID);
            });
            assertThat(result.getWebhook().getWebhookId()).isEqualTo(StripePlanExecutor.DRY_RUN_WEBHOOK_ID);
            assertThat(result.getWebhook().getWebhookSecret()).isEqualTo(StripePlanExecutor.DRY_RUN_WEBHOOK_SECRET);
            assertThat(result.getOutcomes()).extracting(StepOutcome::status).containsOnly(StepOutcome.Status.DRY_RUN);
        }

        @Test
        @DisplayName("已封存的產品在 dry-run 也不會被更新")
        void archivedProductNotTouched() {
            when(billingClient.listProducts()).thenReturn(List.of(RemoteProduct.builder()
                    .id("prod_1").name("Founders").active(false)
                    .metadata(Map.of(MetadataKeys.IDEMPOTENCY_KEY, "bootstrap:demo:Founders")).build()));

            ExecutionResult result = executor.executePlan(request("Founders:2500,usd,month", true, null));

            verify(billingClient, never()).updateProduct(any(), any());
            assertThat(result.getProducts().get(0).getProductId()).isEqualTo("prod_1");
        }
    }

    @Nested
    @DisplayName("apply")
    class ApplyTests {

        @Test
        @DisplayName("建立的資源帶 idempotency_key / project_id / 使用者 metadata")
        void createdResourcesAreTagged() {
            stubCreates();
            String json = """
                    [{"name":"Founders","description":"Early access","metadata":{"tier":"founders"},
                      "prices":[{"amount":2500,"currency":"usd","interval":"month","metadata":{"plan":"monthly"}}]}]
                    """;

            executor.executePlan(request(json, false, URL));

            ArgumentCaptor<ProductCreateRequest> productCaptor = ArgumentCaptor.forClass(ProductCreateRequest.class);
            verify(billingClient).createProduct(productCaptor.capture());
            assertThat(productCaptor.getValue().getName()).isEqualTo("Founders");
            assertThat(productCaptor.getValue().getDescription()).isEqualTo("Early access");
            assertThat(productCaptor.getValue().getMetadata())
                    .containsEntry(MetadataKeys.IDEMPOTENCY_KEY, "bootstrap:demo:Founders")
                    .containsEntry(MetadataKeys.PROJECT_ID, "demo")
                    .containsEntry("tier", "founders");

            ArgumentCaptor<PriceCreateRequest> priceCaptor = ArgumentCaptor.forClass(PriceCreateRequest.class);
            verify(billingClient).createPrice(priceCaptor.capture());
            PriceCreateRequest price = priceCaptor.getValue();
            assertThat(price.getProductId()).isEqualTo("prod_new");
            assertThat(price.getUnitAmount()).isEqualTo(2500L);
            assertThat(price.getInterval()).isEqualTo(PriceInterval.MONTH);
            assertThat(price.getIntervalCount()).isNull();
            assertThat(price.getMetadata())
                    .containsEntry(MetadataKeys.IDEMPOTENCY_KEY, "bootstrap:demo:Founders:price:2500:usd:month:1")
                    .containsEntry("plan", "monthly");

            ArgumentCaptor<WebhookEndpointCreateRequest> webhookCaptor =
                    ArgumentCaptor.forClass(WebhookEndpointCreateRequest.class);
            verify(billingClient).createWebhookEndpoint(webhookCaptor.capture());
            assertThat(webhookCaptor.getValue().getEnabledEvents()).containsExactlyElementsOf(StripeWebhookEvents.REQUIRED);
            assertThat(webhookCaptor.getValue().getMetadata())
                    .containsEntry(MetadataKeys.IDEMPOTENCY_KEY, "bootstrap:demo:webhook");
        }

        @Test
        @DisplayName("interval_count 不為 1 時才送出")
        void intervalCountSentWhenNotOne() {
            stubCreates();
            String json = """
                    [{"name":"Quarterly","prices":[{"amount":7500,"currency":"usd","interval":"month","interval_count":3}]}]
                    """;

            executor.executePlan(request(json, false, null));

            ArgumentCaptor<PriceCreateRequest> captor = ArgumentCaptor.forClass(PriceCreateRequest.class);
            verify(billingClient).createPrice(captor.capture());
            assertThat(captor.getValue().getIntervalCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("新建 webhook 的 secret 取自 create 回應")
        void createdWebhookSecret() {
            stubCreates();

            ExecutionResult result = executor.executePlan(request("", false, URL));

            assertThat(result.getWebhook().getWebhookId()).isEqualTo("we_new");
            assertThat(result.getWebhook().getWebhookSecret()).isEqualTo("whsec_new");
            assertThat(result.getWebhook().getWebhookUrl()).isEqualTo(URL);
        }

        @Test
        @DisplayName("封存的產品 → 重新啟用")
        void reactivatesArchivedProduct() {
            when(billingClient.listProducts()).thenReturn(List.of(RemoteProduct.builder()
                    .id("prod_1").name("Founders").active(false)
                    .metadata(Map.of(MetadataKeys.IDEMPOTENCY_KEY, "bootstrap:demo:Founders")).build()));
            when(billingClient.updateProduct(eq("prod_1"), any()))
                    .thenReturn(RemoteProduct.builder().id("prod_1").name("Founders").build());
            stubCreates();

            ExecutionResult result = executor.executePlan(request("Founders:2500,usd,month", false, null));

            ArgumentCaptor<ProductUpdateRequest> captor = ArgumentCaptor.forClass(ProductUpdateRequest.class);
            verify(billingClient).updateProduct(eq("prod_1"), captor.capture());
            assertThat(captor.getValue().getActive()).isTrue();
            verify(billingClient, never()).createProduct(any());
            assertThat(result.getProducts().get(0).getProductId()).isEqualTo("prod_1");
        }
    }

    @Nested
    @DisplayName("既有 webhook")
    class ExistingWebhookTests {

        @Test
        @DisplayName("缺少事件 → update 送出既有 ∪ 必要事件")
        void updateSendsUnion() {
            RemoteWebhookEndpoint existing = RemoteWebhookEndpoint.builder()
                    .id("we_1").url(URL)
                    .enabledEvents(new ArrayList<>(List.of("customer.subscription.created", "checkout.session.completed")))
                    .build();
            when(billingClient.listWebhookEndpoints()).thenReturn(List.of(existing));
            when(billingClient.updateWebhookEndpoint(eq("we_1"), any())).thenReturn(existing);

            ExecutionResult result = executor.executePlan(
                    requestWithSecret("", false, URL, "whsec_configured"));

            ArgumentCaptor<WebhookEndpointUpdateRequest> captor = ArgumentCaptor.forClass(WebhookEndpointUpdateRequest.class);
            verify(billingClient).updateWebhookEndpoint(eq("we_1"), captor.capture());
            assertThat(captor.getValue().getEnabledEvents())
                    .containsExactlyInAnyOrder(
                            "checkout.session.completed",
                            "customer.subscription.created",
                            "customer.subscription.updated",
                            "customer.subscription.deleted",
                            "invoice.payment_succeeded",
                            "invoice.payment_failed");
            assertThat(captor.getValue().getUrl()).isNull();
            assertThat(result.getWebhook().getWebhookSecret()).isEqualTo("whsec_configured");
        }

        @Test
        @DisplayName("existing 且未設定 STRIPE_WEBHOOK_SECRET → secret 為 null + warning")
        void missingConfiguredSecret() {
            RemoteWebhookEndpoint existing = RemoteWebhookEndpoint.builder()
                    .id("we_1").url(URL).enabledEvents(new ArrayList<>(StripeWebhookEvents.REQUIRED)).build();
            when(billingClient.listWebhookEndpoints()).thenReturn(List.of(existing));

            ExecutionResult result = executor.executePlan(request("", false, URL));

            verify(billingClient, never()).updateWebhookEndpoint(any(), any());
            assertThat(result.getWebhook().getWebhookId()).isEqualTo("we_1");
            assertThat(result.getWebhook().getWebhookSecret()).isNull();
            assertThat(result.getWarnings()).anyMatch(warning -> warning.contains("STRIPE_WEBHOOK_SECRET"));
        }

        @Test
        @DisplayName("dry-run 的 update → placeholder secret，不產生 secret warning")
        void dryRunUpdateUsesPlaceholderSecret() {
            RemoteWebhookEndpoint existing = RemoteWebhookEndpoint.builder()
                    .id("we_1").url(URL)
                    .enabledEvents(new ArrayList<>(List.of("customer.subscription.created")))
                    .build();
            when(billingClient.listWebhookEndpoints()).thenReturn(List.of(existing));

            ExecutionResult result = executor.executePlan(request("", true, URL));

            verify(billingClient, never()).updateWebhookEndpoint(any(), any());
            assertThat(outcome(result, "webhook").status()).isEqualTo(StepOutcome.Status.DRY_RUN);
            assertThat(result.getWebhook().getWebhookId()).isEqualTo("we_1");
            assertThat(result.getWebhook().getWebhookSecret()).isEqualTo(StripePlanExecutor.DRY_RUN_WEBHOOK_SECRET);
            assertThat(result.getWarnings()).noneMatch(warning -> warning.contains("STRIPE_WEBHOOK_SECRET"));
        }
    }

    @Nested
    @DisplayName("失敗隔離")
    class FailureTests {

        @Test
        @DisplayName("產品失敗 → 該產品價格 skipped，其他產品與 webhook 照常執行")
        void productFailureSkipsItsPrices() {
            when(billingClient.createProduct(argThat(request -> request != null && "Founders".equals(request.getName()))))
                    .thenThrow(new ProviderCallException("products.create", "HTTP 500"));
            when(billingClient.createProduct(argThat(request -> request != null && "Scale".equals(request.getName()))))
                    .thenReturn(RemoteProduct.builder().id("prod_scale").name("Scale").build());
            when(billingClient.createPrice(any())).thenReturn(RemotePrice.builder().id("price_scale").build());
            when(billingClient.createWebhookEndpoint(any()))
                    .thenReturn(RemoteWebhookEndpoint.builder().id("we_new").secret("whsec_new").build());

            ExecutionResult result = executor.executePlan(
                    request("Founders:2500,usd,month;Scale:4900,usd,month", false, URL));

            assertThat(result.isFailed()).isTrue();
            assertThat(outcome(result, "product:Founders").status()).isEqualTo(StepOutcome.Status.FAILED);
            assertThat(outcome(result, "price:Founders:bootstrap:demo:Founders:price:2500:usd:month:1").status())
                    .isEqualTo(StepOutcome.Status.SKIPPED);
            assertThat(outcome(result, "product:Scale").status()).isEqualTo(StepOutcome.Status.APPLIED);
            assertThat(outcome(result, "webhook").status()).isEqualTo(StepOutcome.Status.APPLIED);
            assertThat(result.getProducts().get(0).getProductId()).isNull();
            assertThat(result.getProducts().get(1).getPriceIds()).containsExactly("price_scale");

            // 失敗的產品不會建立價格
            verify(billingClient, times(1)).createPrice(any());
        }

        @Test
        @DisplayName("價格失敗只影響該價格")
        void priceFailureIsolated() {
            when(billingClient.createProduct(any())).thenReturn(RemoteProduct.builder().id("prod_new").build());
            when(billingClient.createPrice(argThat(request -> request != null && request.getUnitAmount() == 2500L)))
                    .thenThrow(new ProviderCallException("prices.create", "HTTP 400"));
            when(billingClient.createPrice(argThat(request -> request != null && request.getUnitAmount() == 25000L)))
                    .thenReturn(RemotePrice.builder().id("price_yearly").build());
            String json = """
                    [{"name":"Founders","prices":[
                      {"amount":2500,"currency":"usd","interval":"month"},
                      {"amount":25000,"currency":"usd","interval":"year"}]}]
                    """;

            ExecutionResult result = executor.executePlan(request(json, false, null));

            assertThat(result.getOutcomes()).filteredOn(outcome -> outcome.stage() == ProvisioningStage.PRICE)
                    .extracting(StepOutcome::status)
                    .containsExactly(StepOutcome.Status.FAILED, StepOutcome.Status.APPLIED);
            assertThat(result.getProducts().get(0).getPriceIds()).containsExactly("price_yearly");
            assertThat(outcome(result, "product:Founders").status()).isEqualTo(StepOutcome.Status.APPLIED);
        }

        @Test
        @DisplayName("webhook 失敗不影響已完成的產品")
        void webhookFailure() {
            stubCreates();
            when(billingClient.createWebhookEndpoint(any()))
                    .thenThrow(new ProviderCallException("webhookEndpoints.create", "HTTP 500"));

            ExecutionResult result = executor.executePlan(request("Founders:2500,usd,month", false, URL));

            assertThat(result.getWebhook()).isNull();
            assertThat(outcome(result, "webhook").status()).isEqualTo(StepOutcome.Status.FAILED);
            assertThat(result.getProducts().get(0).getProductId()).isEqualTo("prod_new");
        }

        @Test
        @DisplayName("計畫的 warnings 會帶到結果")
        void planWarningsCopied() {
            RemoteWebhookEndpoint first = RemoteWebhookEndpoint.builder()
                    .id("we_1").url(URL).enabledEvents(new ArrayList<>(StripeWebhookEvents.REQUIRED)).build();
            RemoteWebhookEndpoint second = RemoteWebhookEndpoint.builder()
                    .id("we_2").url(URL).enabledEvents(new ArrayList<>(StripeWebhookEvents.REQUIRED)).build();
            when(billingClient.listWebhookEndpoints()).thenReturn(List.of(first, second));

            ExecutionResult result = executor.executePlan(requestWithSecret("", false, URL, "whsec_x"));

            assertThat(result.getWarnings()).anyMatch(warning -> warning.contains("duplicate webhook endpoints detected"));
        }
    }

    // ========== helper ==========

    private void stubCreates() {
        when(billingClient.createProduct(any())).thenReturn(RemoteProduct.builder().id("prod_new").build());
        when(billingClient.createPrice(any())).thenReturn(RemotePrice.builder().id("price_new").build());
        when(billingClient.createWebhookEndpoint(any()))
                .thenReturn(RemoteWebhookEndpoint.builder().id("we_new").secret("whsec_new").build());
    }

    private static StepOutcome outcome(ExecutionResult result, String stepId) {
        return result.getOutcomes().stream()
                .filter(outcome -> outcome.stepId().equals(stepId))
                .findFirst()
                .orElseThrow();
    }

    private static StripeProvisioningRequest request(String definitions, boolean dryRun, String webhookUrl) {
        return requestWithSecret(definitions, dryRun, webhookUrl, null);
    }

    private static StripeProvisioningRequest requestWithSecret(String definitions, boolean dryRun,
                                                               String webhookUrl, String secret) {
        return StripeProvisioningRequest.builder()
                .projectId("demo")
                .productDefinitions(definitions)
                .definitionsField("STRIPE_PRODUCTS")
                .webhookUrl(webhookUrl)
                .configuredWebhookSecret(secret)
                .dryRun(dryRun)
                .build();
    }
}
