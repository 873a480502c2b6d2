package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.CurrencyCode;
import com.flagship.ledger_invoicing.ledger.Transaction;
import com.flagship.ledger_invoicing.ledger.TransactionRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Body of transaction create and update calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransactionHeaderRequest {

    @NotBlank(message = "Description is required")
    @JsonProperty("description")
    private String description;

    @JsonProperty("occurred_at")
    private Instant occurredAt;

    @NotNull(message = "Direction is required")
    @JsonProperty("direction")
    private Transaction.Direction direction;

    @JsonProperty("currency")
    private CurrencyCode currency;

    @NotBlank(message = "Creator is required")
    @Size(max = 50, message = "Creator must be at most 50 characters")
    @JsonProperty("created_by")
    private String createdBy;

    @JsonProperty("period_id")
    private UUID periodId;

    public TransactionRequest toDomain() {
        return new TransactionRequest(description, occurredAt, direction, currency, createdBy, periodId);
    }
}
