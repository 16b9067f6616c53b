package com.bootstrap.billing.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ProvisionedProduct {

    private String productName;
    private String productId;     // 產品步驟失敗時為 null
    @Builder.Default
    private List<String> priceIds = new ArrayList<>();
}
