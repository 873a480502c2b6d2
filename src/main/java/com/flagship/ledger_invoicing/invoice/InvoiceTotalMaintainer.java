package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * The only writer of an invoice's subtotal, tax and grand total.
 *
 * Runs inside the caller's unit of work ({@code MANDATORY}): the line
 * mutation and the recomputation commit or roll back together. The invoice
 * row lock serializes concurrent line mutations on the same invoice, so each
 * recomputation sees every committed line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceTotalMaintainer {

    private final InvoiceRepository invoiceRepository;
    private final InvoiceLineRepository lineRepository;
    private final LedgerMetrics ledgerMetrics;

    @Transactional(propagation = Propagation.MANDATORY)
    public InvoiceTotals recomputeInvoiceTotals(UUID invoiceId) {
        return ledgerMetrics.timeRecompute(() -> {
            InvoiceEntity invoice = invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));

            // Pending line changes must be visible to the sum
            lineRepository.flush();
            List<InvoiceLineEntity> lines = lineRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId);

            InvoiceTotals totals = InvoiceTotals.of(lines);
            if (!Money.fitsIntegerDigits(totals.getGrandTotal(), Money.AMOUNT_INTEGER_DIGITS)) {
                throw new ConstraintViolationException(
                    "Invoice " + invoiceId + " grand total out of range: " + totals.getGrandTotal());
            }
            invoice.applyTotals(totals);
            invoiceRepository.save(invoice);

            log.debug("Recomputed totals for invoice {} from {} lines: subtotal={}, tax={}, total={}",
                invoiceId, lines.size(), totals.getSubtotal(), totals.getTax(), totals.getGrandTotal());
            return totals;
        });
    }
}
