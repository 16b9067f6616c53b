package com.bootstrap.shared.exception;

import lombok.Getter;

/**
 * 外部供應商 API 呼叫失敗（網路錯誤、4xx/5xx）
 *
 * 建構計畫時遇到 → 整個 run 中止（不能信任不完整的 remote snapshot）。
 * 執行時遇到 → 只中止該資源的 dependency chain，已套用的步驟不回滾。
 */
@Getter
public class ProviderCallException extends RuntimeException {

    private final String operation;

    public ProviderCallException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public ProviderCallException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }
}
