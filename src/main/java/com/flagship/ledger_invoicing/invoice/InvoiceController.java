package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.invoice.dto.ClientSalesResponse;
import com.flagship.ledger_invoicing.invoice.dto.CreateInvoiceRequest;
import com.flagship.ledger_invoicing.invoice.dto.InvoiceLinePayload;
import com.flagship.ledger_invoicing.invoice.dto.InvoiceLineResponse;
import com.flagship.ledger_invoicing.invoice.dto.InvoiceResponse;
import com.flagship.ledger_invoicing.invoice.dto.InvoiceStatisticsResponse;
import com.flagship.ledger_invoicing.invoice.dto.UpdateInvoiceRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * REST controller for invoices and their lines.
 *
 * Every line endpoint returns the whole invoice so callers see the
 * recomputed totals in the same response.
 */
@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
@Slf4j
public class InvoiceController {

    private final InvoiceService invoiceService;

    @PostMapping
    public ResponseEntity<InvoiceResponse> createInvoice(@Valid @RequestBody CreateInvoiceRequest request) {
        log.info("Received invoice creation request: clientId={}, lines={}",
            request.getClientId(), request.getLines() != null ? request.getLines().size() : 0);
        Invoice invoice = invoiceService.createInvoice(request.toHeader(), request.toLineRequests());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResponse.from(invoice));
    }

    /**
     * With {@code number} the lookup is by invoice number and the other filters are ignored.
     */
    @GetMapping
    public List<InvoiceResponse> listInvoices(
            @RequestParam(value = "client_id", required = false) UUID clientId,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "number", required = false) String number) {
        if (number != null) {
            return List.of(InvoiceResponse.from(invoiceService.getInvoiceByNumber(number)));
        }
        return invoiceService.listInvoices(clientId, from, to).stream().map(InvoiceResponse::from).toList();
    }

    @GetMapping("/statistics")
    public InvoiceStatisticsResponse getStatistics(
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return InvoiceStatisticsResponse.from(invoiceService.getStatistics(from, to));
    }

    @GetMapping("/top-clients")
    public List<ClientSalesResponse> getTopClients(
            @RequestParam(value = "limit", defaultValue = "10") int limit,
            @RequestParam(value = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return invoiceService.getTopClients(limit, from, to).stream().map(ClientSalesResponse::from).toList();
    }

    @GetMapping("/{id}")
    public InvoiceResponse getInvoice(@PathVariable("id") UUID id) {
        return InvoiceResponse.from(invoiceService.getInvoice(id));
    }

    @PatchMapping("/{id}")
    public InvoiceResponse updateInvoice(@PathVariable("id") UUID id,
                                         @Valid @RequestBody UpdateInvoiceRequest request) {
        return InvoiceResponse.from(invoiceService.updateInvoiceHeader(id, request.toDomain()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteInvoice(@PathVariable("id") UUID id) {
        invoiceService.deleteInvoice(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/lines")
    public List<InvoiceLineResponse> getLines(@PathVariable("id") UUID id) {
        return invoiceService.getLines(id).stream().map(InvoiceLineResponse::from).toList();
    }

    @PostMapping("/{id}/lines")
    public ResponseEntity<InvoiceResponse> addLine(@PathVariable("id") UUID id,
                                                   @Valid @RequestBody InvoiceLinePayload payload) {
        Invoice invoice = invoiceService.addLine(id, payload.toDomain());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResponse.from(invoice));
    }

    @PutMapping("/{id}/lines/{lineId}")
    public InvoiceResponse updateLine(@PathVariable("id") UUID id,
                                      @PathVariable("lineId") UUID lineId,
                                      @Valid @RequestBody InvoiceLinePayload payload) {
        return InvoiceResponse.from(invoiceService.updateLine(id, lineId, payload.toDomain()));
    }

    @DeleteMapping("/{id}/lines/{lineId}")
    public InvoiceResponse removeLine(@PathVariable("id") UUID id, @PathVariable("lineId") UUID lineId) {
        return InvoiceResponse.from(invoiceService.removeLine(id, lineId));
    }
}
