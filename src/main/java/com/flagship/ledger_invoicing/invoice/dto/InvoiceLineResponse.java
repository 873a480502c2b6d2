package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.InvoiceLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class InvoiceLineResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("description")
    String description;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("discount_percentage")
    BigDecimal discountPercentage;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("line_subtotal")
    BigDecimal lineSubtotal;

    @JsonProperty("line_tax")
    BigDecimal lineTax;

    @JsonProperty("line_total")
    BigDecimal lineTotal;

    @JsonProperty("created_at")
    Instant createdAt;

    public static InvoiceLineResponse from(InvoiceLine line) {
        return InvoiceLineResponse.builder()
            .id(line.getId())
            .invoiceId(line.getInvoiceId())
            .productId(line.getProductId())
            .description(line.getDescription())
            .quantity(line.getQuantity())
            .unitPrice(line.getUnitPrice())
            .discountPercentage(line.getDiscountPercentage())
            .discountAmount(line.getDiscountAmount())
            .lineSubtotal(line.getLineSubtotal())
            .lineTax(line.getLineTax())
            .lineTotal(line.getLineTotal())
            .createdAt(line.getCreatedAt())
            .build();
    }
}
