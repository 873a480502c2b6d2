package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.ClientSales;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class ClientSalesResponse {

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("name")
    String name;

    @JsonProperty("tax_id")
    String taxId;

    @JsonProperty("invoice_count")
    long invoiceCount;

    @JsonProperty("grand_total")
    BigDecimal grandTotal;

    public static ClientSalesResponse from(ClientSales sales) {
        return ClientSalesResponse.builder()
            .clientId(sales.getClientId())
            .name(sales.getName())
            .taxId(sales.getTaxId())
            .invoiceCount(sales.getInvoiceCount())
            .grandTotal(sales.getGrandTotal())
            .build();
    }
}
