package com.bootstrap.billing.model;

/**
 * 產品定義字串的格式
 */
public enum DefinitionSource {
    /** JSON 陣列（建議） */
    STRUCTURED,
    /** {@code Name:amount,currency[,interval];...} 舊格式 */
    LEGACY
}
