package com.flagship.ledger_invoicing.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_invoicing.ledger.Period;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PeriodResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    @JsonProperty("period_type")
    Period.PeriodType periodType;

    @JsonProperty("status")
    Period.Status status;

    public static PeriodResponse from(Period period) {
        return PeriodResponse.builder()
            .id(period.getId())
            .startDate(period.getStartDate())
            .endDate(period.getEndDate())
            .periodType(period.getPeriodType())
            .status(period.getStatus())
            .build();
    }
}
