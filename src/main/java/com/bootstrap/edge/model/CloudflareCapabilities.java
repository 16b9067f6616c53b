package com.bootstrap.edge.model;

import lombok.Builder;
import lombok.Data;

/**
 * Cloudflare API token 權限探測結果
 *
 * Boolean 欄位為 null 代表無法判斷（網路錯誤、未設定 account），不視為沒有權限。
 */
@Data
@Builder
public class CloudflareCapabilities {

    private Boolean authenticated;
    private Boolean canUseD1;
    private Boolean canUseR2;
    private String userEmail;

    public boolean isD1Denied() {
        return Boolean.FALSE.equals(canUseD1);
    }

    public boolean isR2Denied() {
        return Boolean.FALSE.equals(canUseR2);
    }
}
