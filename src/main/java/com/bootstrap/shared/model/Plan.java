package com.bootstrap.shared.model;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 佈建計畫（唯讀）
 *
 * 由 plan builder 產生，只描述「要做什麼」，不含任何副作用。
 * warnings 為非致命問題（drift、重複 webhook），交由呼叫端決定是否中止。
 */
@Getter
@Builder
public class Plan {

    private final Provider provider;

    /** Cloudflare 計畫顯示用，Stripe 為 null */
    private final String accountId;

    @Builder.Default
    private final List<PlanStep> steps = new ArrayList<>();

    @Builder.Default
    private final List<String> notes = new ArrayList<>();

    @Builder.Default
    private final List<String> warnings = new ArrayList<>();

    public Optional<PlanStep> findStep(String id) {
        return steps.stream()
                .filter(step -> step.id().equals(id))
                .findFirst();
    }

    public List<PlanStep> stepsWithStatus(StepStatus status) {
        return steps.stream()
                .filter(step -> step.status() == status)
                .toList();
    }

    /**
     * 是否有需要呼叫 create / update 的步驟
     */
    public boolean hasPendingChanges() {
        return steps.stream().anyMatch(step -> step.status().isMutation());
    }
}
