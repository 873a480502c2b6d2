package com.flagship.ledger_invoicing.invoice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.invoice.InvoiceStatistics;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class InvoiceStatisticsResponse {

    @JsonProperty("invoice_count")
    long invoiceCount;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax")
    BigDecimal tax;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("grand_total")
    BigDecimal grandTotal;

    @JsonProperty("average_total")
    BigDecimal averageTotal;

    public static InvoiceStatisticsResponse from(InvoiceStatistics statistics) {
        return InvoiceStatisticsResponse.builder()
            .invoiceCount(statistics.getInvoiceCount())
            .subtotal(statistics.getSubtotal())
            .tax(statistics.getTax())
            .discount(statistics.getDiscount())
            .grandTotal(statistics.getGrandTotal())
            .averageTotal(statistics.getAverageTotal())
            .build();
    }
}
