package com.flagship.ledger_invoicing.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.catalog.Client;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ClientResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("tax_id")
    String taxId;

    @JsonProperty("email")
    String email;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static ClientResponse from(Client client) {
        return ClientResponse.builder()
            .id(client.getId())
            .name(client.getName())
            .taxId(client.getTaxId())
            .email(client.getEmail())
            .active(client.isActive())
            .createdAt(client.getCreatedAt())
            .build();
    }
}
