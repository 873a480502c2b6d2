package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.Account;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateAccountRequest {

    @NotBlank(message = "Account code is required")
    @Size(max = 20, message = "Account code must be at most 20 characters")
    @JsonProperty("code")
    private String code;

    @NotBlank(message = "Account name is required")
    @Size(max = 100, message = "Account name must be at most 100 characters")
    @JsonProperty("name")
    private String name;

    @NotNull(message = "Account type is required")
    @JsonProperty("account_type")
    private Account.AccountType accountType;
}
