package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    @JsonProperty("account_type")
    Account.AccountType accountType;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .id(account.getId())
            .code(account.getCode())
            .name(account.getName())
            .accountType(account.getAccountType())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
