package com.flagship.ledger_invoicing.invoice;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class ClientSales {
    UUID clientId;
    String name;
    String taxId;
    long invoiceCount;
    BigDecimal grandTotal;
}
