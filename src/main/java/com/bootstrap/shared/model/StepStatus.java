package com.bootstrap.shared.model;

/**
 * 計畫步驟狀態
 *
 * 計費資源只會用到 CREATE / UPDATE / EXISTING，
 * ENSURE / SKIPPED 給 edge-compute 的固定步驟使用。
 */
public enum StepStatus {

    CREATE("create"),
    UPDATE("update"),
    EXISTING("existing"),
    ENSURE("ensure"),
    SKIPPED("skipped");

    private final String label;

    StepStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** 是否需要呼叫 mutating API */
    public boolean isMutation() {
        return this == CREATE || this == UPDATE;
    }
}
