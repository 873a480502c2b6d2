package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.InvoiceHeader;
import com.flagship.ledger_invoicing.invoice.LineRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Request DTO for creating an invoice. Has no total fields: totals always
 * derive from the lines.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateInvoiceRequest {

    @JsonProperty("client_id")
    private UUID clientId;

    @JsonProperty("transaction_id")
    private UUID transactionId;

    @DecimalMin(value = "0.00", message = "Discount must be zero or positive")
    @Digits(integer = 13, fraction = 2, message = "Discount allows at most 13 integer digits and 2 decimals")
    @JsonProperty("discount")
    private BigDecimal discount;

    @Size(max = 50, message = "Payment terms must be at most 50 characters")
    @JsonProperty("payment_terms")
    private String paymentTerms;

    @Size(max = 100, message = "Salesperson must be at most 100 characters")
    @JsonProperty("salesperson")
    private String salesperson;

    @JsonProperty("issued_at")
    private Instant issuedAt;

    @JsonProperty("due_at")
    private Instant dueAt;

    @JsonProperty("notes")
    private String notes;

    @Valid
    @JsonProperty("lines")
    private List<InvoiceLinePayload> lines;

    public InvoiceHeader toHeader() {
        return new InvoiceHeader(clientId, transactionId, discount, paymentTerms, salesperson, issuedAt, dueAt, notes);
    }

    public List<LineRequest> toLineRequests() {
        if (lines == null) {
            return List.of();
        }
        return lines.stream().map(InvoiceLinePayload::toDomain).toList();
    }
}
