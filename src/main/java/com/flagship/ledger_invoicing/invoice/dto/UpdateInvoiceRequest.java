package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.InvoiceHeaderUpdate;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Partial header update. Omitted fields are left as they are.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInvoiceRequest {

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

    @JsonProperty("due_at")
    private Instant dueAt;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("version")
    private Long version;

    public InvoiceHeaderUpdate toDomain() {
        return new InvoiceHeaderUpdate(clientId, transactionId, discount, paymentTerms, salesperson, dueAt, notes, version);
    }
}
