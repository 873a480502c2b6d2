package com.flagship.ledger_invoicing.ledger;

import com.flagship.ledger_invoicing.ledger.dto.CreatePeriodRequest;
import com.flagship.ledger_invoicing.ledger.dto.PeriodResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/periods")
@RequiredArgsConstructor
public class PeriodController {

    private final PeriodService periodService;

    @PostMapping
    public ResponseEntity<PeriodResponse> createPeriod(@Valid @RequestBody CreatePeriodRequest request) {
        Period period = periodService.createPeriod(request.getStartDate(), request.getEndDate(), request.getPeriodType());
        return ResponseEntity.status(HttpStatus.CREATED).body(PeriodResponse.from(period));
    }

    @GetMapping
    public List<PeriodResponse> listPeriods() {
        return periodService.listPeriods().stream().map(PeriodResponse::from).toList();
    }

    @GetMapping("/{id}")
    public PeriodResponse getPeriod(@PathVariable("id") UUID id) {
        return PeriodResponse.from(periodService.getPeriod(id));
    }
}
