package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.LedgerEntryRequest;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of ledger entry create and update calls. Amount rules are checked by
 * the ledger itself so that every caller gets the same answer.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEntryPayload {

    @JsonProperty("transaction_id")
    private UUID transactionId;

    @NotNull(message = "Account ID is required")
    @JsonProperty("account_id")
    private UUID accountId;

    @JsonProperty("debit")
    private BigDecimal debit;

    @JsonProperty("credit")
    private BigDecimal credit;

    public LedgerEntryRequest toDomain() {
        return new LedgerEntryRequest(transactionId, accountId, debit, credit);
    }
}
