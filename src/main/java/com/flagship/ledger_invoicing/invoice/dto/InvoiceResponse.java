package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.Invoice;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("tax")
    BigDecimal tax;

    @JsonProperty("grand_total")
    BigDecimal grandTotal;

    @JsonProperty("payment_terms")
    String paymentTerms;

    @JsonProperty("salesperson")
    String salesperson;

    @JsonProperty("issued_at")
    Instant issuedAt;

    @JsonProperty("due_at")
    Instant dueAt;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("version")
    Long version;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("lines")
    List<InvoiceLineResponse> lines;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
            .id(invoice.getId())
            .invoiceNumber(invoice.getInvoiceNumber())
            .clientId(invoice.getClientId())
            .transactionId(invoice.getTransactionId())
            .subtotal(invoice.getSubtotal())
            .discount(invoice.getDiscount())
            .tax(invoice.getTax())
            .grandTotal(invoice.getGrandTotal())
            .paymentTerms(invoice.getPaymentTerms())
            .salesperson(invoice.getSalesperson())
            .issuedAt(invoice.getIssuedAt())
            .dueAt(invoice.getDueAt())
            .notes(invoice.getNotes())
            .version(invoice.getVersion())
            .createdAt(invoice.getCreatedAt())
            .updatedAt(invoice.getUpdatedAt())
            .lines(invoice.getLines().stream().map(InvoiceLineResponse::from).toList())
            .build();
    }
}
