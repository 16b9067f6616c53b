package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Stripe 佈建執行結果
 *
 * products 順序與 desired state 相同；productId / priceIds 交由呼叫端寫回環境設定。
 */
@Data
@Builder
public class ExecutionResult {

    private boolean dryRun;
    @Builder.Default
    private List<ProvisionedProduct> products = new ArrayList<>();
    private ProvisionedWebhook webhook;
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<StepOutcome> outcomes = new ArrayList<>();

    /**
     * 是否有任何步驟失敗（部分成功仍算失敗，下一次 run 會從斷點續做）
     */
    public boolean isFailed() {
        return outcomes.stream().anyMatch(outcome -> outcome.status() == StepOutcome.Status.FAILED);
    }
}
