package com.flagship.ledger_invoicing.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.catalog.Product;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ProductResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("tax_applicable")
    boolean taxApplicable;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ProductResponse from(Product product) {
        return ProductResponse.builder()
            .id(product.getId())
            .code(product.getCode())
            .name(product.getName())
            .unitPrice(product.getUnitPrice())
            .taxApplicable(product.isTaxApplicable())
            .active(product.isActive())
            .createdAt(product.getCreatedAt())
            .build();
    }
}
