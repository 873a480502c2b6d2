package com.flagship.ledger_invoicing.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CreateClientRequest {

    @NotBlank(message = "Client name is required")
    @Size(max = 150, message = "Client name must be at most 150 characters")
    @JsonProperty("name")
    private String name;

    @Size(max = 20, message = "Tax ID must be at most 20 characters")
    @JsonProperty("tax_id")
    private String taxId;

    @Email(message = "Email must be valid")
    @Size(max = 100, message = "Email must be at most 100 characters")
    @JsonProperty("email")
    private String email;
}
