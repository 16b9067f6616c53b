package com.bootstrap.shared.exception;

import lombok.Getter;

/**
 * 產品定義（desired state）解析失敗
 *
 * 一律在任何 provider 呼叫之前拋出，整個 run 直接中止。
 */
@Getter
public class ConfigParseException extends RuntimeException {

    public enum Kind {
        /** 看起來是 JSON 但語法錯誤 */
        JSON_SYNTAX,
        /** JSON 語法正確，但不是「物件陣列」或欄位不合法 */
        STRUCTURED_VALIDATION,
        /** legacy 分號格式不合法 */
        LEGACY_GRAMMAR,
        /** 產品名稱或價格定義重複 */
        DUPLICATE_DEFINITION
    }

    private final Kind kind;
    private final String field;

    public ConfigParseException(Kind kind, String field, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
    }

    public ConfigParseException(Kind kind, String field, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.field = field;
    }
}
