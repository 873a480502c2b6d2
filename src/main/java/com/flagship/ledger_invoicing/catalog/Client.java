package com.flagship.ledger_invoicing.catalog;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class Client {
    UUID id;
    String name;
    String taxId;
    String email;
    boolean active;
    Instant createdAt;
}
