package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.CurrencyCode;
import com.flagship.ledger_invoicing.ledger.Transaction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("occurred_at")
    Instant occurredAt;

    @JsonProperty("description")
    String description;

    @JsonProperty("direction")
    Transaction.Direction direction;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("created_by")
    String createdBy;

    @JsonProperty("period_id")
    UUID periodId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .occurredAt(transaction.getOccurredAt())
            .description(transaction.getDescription())
            .direction(transaction.getDirection())
            .currency(transaction.getCurrency())
            .createdBy(transaction.getCreatedBy())
            .periodId(transaction.getPeriodId())
            .createdAt(transaction.getCreatedAt())
            .build();
    }
}
