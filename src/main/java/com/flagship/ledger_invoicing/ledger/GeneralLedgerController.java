package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.ledger.dto.GeneralLedgerResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

@RestController
@RequestMapping("/api/ledger")
@RequiredArgsConstructor
public class GeneralLedgerController {

    private final GeneralLedgerService generalLedgerService;

    @GetMapping("/general")
    public GeneralLedgerResponse generalLedger(
            @RequestParam(value = "digits", defaultValue = "4") int digits,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestParam(value = "include_detail", defaultValue = "false") boolean includeDetail) {
        return GeneralLedgerResponse.from(generalLedgerService.generate(digits, from, to, includeDetail));
    }
}
