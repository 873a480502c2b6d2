package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.LineRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Inputs of one invoice line. Computed amounts are never accepted from callers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InvoiceLinePayload {

    @JsonProperty("product_id")
    private UUID productId;

    @JsonProperty("description")
    private String description;

    @Positive(message = "Quantity must be greater than zero")
    @Digits(integer = 10, fraction = 2, message = "Quantity allows at most 10 integer digits and 2 decimals")
    @JsonProperty("quantity")
    private BigDecimal quantity;

    @DecimalMin(value = "0.00", message = "Unit price must be zero or positive")
    @Digits(integer = 10, fraction = 2, message = "Unit price allows at most 10 integer digits and 2 decimals")
    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @DecimalMin(value = "0", message = "Discount percentage must be between 0 and 100")
    @DecimalMax(value = "100", message = "Discount percentage must be between 0 and 100")
    @Digits(integer = 3, fraction = 2, message = "Discount percentage allows at most 2 decimals")
    @JsonProperty("discount_percentage")
    private BigDecimal discountPercentage;

    @DecimalMin(value = "0.00", message = "Discount amount must be zero or positive")
    @Digits(integer = 10, fraction = 2, message = "Discount amount allows at most 10 integer digits and 2 decimals")
    @JsonProperty("discount_amount")
    private BigDecimal discountAmount;

    public LineRequest toDomain() {
        return new LineRequest(productId, description, quantity, unitPrice, discountPercentage, discountAmount);
    }
}
