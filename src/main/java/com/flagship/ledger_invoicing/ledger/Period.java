package com.flagship.ledger_invoicing.ledger;

import lombok.Value;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Accounting period. The ledger only uses it as a reference from transactions;
 * opening and closing periods is handled elsewhere.
 */
@Value
public class Period {
    UUID id;
    LocalDate startDate;
    LocalDate endDate;
    PeriodType periodType;
    Status status;

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public enum PeriodType {
        MONTHLY,
        QUARTERLY,
        ANNUAL
    }

    public enum Status {
        OPEN,
        CLOSED
    }
}
