package com.bootstrap.billing.model;

/**
 * 執行階段每個步驟的結果
 */
public record StepOutcome(
        String stepId,
        ProvisioningStage stage,
        Status status,
        String detail
) {

    public enum Status {
        APPLIED("applied"),
        UNCHANGED("unchanged"),
        DRY_RUN("dry_run"),
        FAILED("failed"),
        SKIPPED("skipped");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
