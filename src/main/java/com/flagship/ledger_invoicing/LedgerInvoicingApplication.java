package com.flagship.ledger_invoicing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LedgerInvoicingApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerInvoicingApplication.class, args);
    }
}
