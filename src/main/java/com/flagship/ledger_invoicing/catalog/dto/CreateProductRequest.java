package com.flagship.ledger_invoicing.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateProductRequest {

    @Size(max = 50, message = "Product code must be at most 50 characters")
    @JsonProperty("code")
    private String code;

    @NotBlank(message = "Product name is required")
    @Size(max = 150, message = "Product name must be at most 150 characters")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Unit price is required")
    @DecimalMin(value = "0.00", message = "Unit price must be zero or positive")
    @Digits(integer = 10, fraction = 2, message = "Unit price allows at most 10 integer digits and 2 decimals")
    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("tax_applicable")
    private Boolean taxApplicable;
}
