package com.bootstrap.shared.model;

/**
 * 計畫中的單一步驟
 *
 * id 在同一份計畫內唯一，且相同 desired state 重複建構時保持不變
 * （例如 {@code product:Founders}、{@code webhook}）。
 */
public record PlanStep(
        String id,
        String title,
        StepStatus status,
        String detail
) {
}
