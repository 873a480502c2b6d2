package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.EntryType;
import com.flagship.ledger_invoicing.ledger.LedgerEntry;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("transaction_id")
    UUID transactionId;

    @JsonProperty("account_id")
    UUID accountId;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("entry_type")
    EntryType entryType;

    @JsonProperty("sequence_number")
    Long sequenceNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static LedgerEntryResponse from(LedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .accountId(entry.getAccountId())
            .debit(entry.getDebit())
            .credit(entry.getCredit())
            .entryType(entry.getEntryType())
            .sequenceNumber(entry.getSequenceNumber())
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
