package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.catalog.Client;
import com.flagship.ledger_invoicing.catalog.ClientService;
import com.flagship.ledger_invoicing.catalog.Product;
import com.flagship.ledger_invoicing.catalog.ProductService;
import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConcurrencyConflictException;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.ledger.TransactionService;
import com.flagship.ledger_invoicing.observability.CorrelationContext;
import com.flagship.ledger_invoicing.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Invoice headers and their lines.
 *
 * Every line mutation follows the same sequence inside one transaction:
 * 1. lock the invoice row
 * 2. resolve the product and compute the line with {@link InvoiceLineCalculator}
 * 3. write the line
 * 4. recompute the header totals with {@link InvoiceTotalMaintainer}
 *
 * Initial lines passed to {@link #createInvoice} take the same path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    static final String CASH_TERMS = "CASH";

    // Open-ended listing bounds
    private static final Instant MIN_ISSUED_AT = Instant.parse("1900-01-01T00:00:00Z");
    private static final Instant MAX_ISSUED_AT = Instant.parse("9999-12-31T23:59:59Z");

    static final int MAX_TOP_CLIENTS = 100;

    private final InvoiceRepository invoiceRepository;
    private final InvoiceLineRepository lineRepository;
    private final InvoiceLineCalculator lineCalculator;
    private final InvoiceTotalMaintainer totalMaintainer;
    private final InvoiceNumberGenerator numberGenerator;
    private final ProductService productService;
    private final ClientService clientService;
    private final TransactionService transactionService;
    private final LedgerMetrics ledgerMetrics;
    private final JdbcTemplate jdbcTemplate;

    @Value("${invoicing.default-credit-days:30}")
    private int defaultCreditDays;

    /**
     * Creates an invoice with a freshly allocated number, then adds the given
     * lines one by one.
     *
     * @throws NotFoundException if the client, transaction or a product does not exist
     * @throws ConstraintViolationException if the client or a product is inactive, or a line is invalid
     * @throws ConcurrencyConflictException if the allocated number was taken concurrently
     */
    @Transactional
    public Invoice createInvoice(InvoiceHeader header, List<LineRequest> lines) {
        validateClient(header.getClientId());
        validateTransaction(header.getTransactionId());
        validateDiscount(header.getDiscount());

        Instant issuedAt = header.getIssuedAt() != null ? header.getIssuedAt() : Instant.now();
        InvoiceHeader resolved = new InvoiceHeader(
            header.getClientId(),
            header.getTransactionId(),
            header.getDiscount(),
            header.getPaymentTerms(),
            header.getSalesperson(),
            issuedAt,
            resolveDueAt(issuedAt, header.getDueAt(), header.getPaymentTerms()),
            header.getNotes()
        );

        UUID invoiceId = UUID.randomUUID();
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            String number = numberGenerator.nextNumber(issuedAt);
            try {
                invoiceRepository.saveAndFlush(InvoiceEntity.fromHeader(invoiceId, number, resolved));
            } catch (DataIntegrityViolationException e) {
                ledgerMetrics.recordInvoiceCreated("conflict");
                throw new ConcurrencyConflictException("Invoice number " + number + " was taken concurrently", e);
            }

            List<LineRequest> initialLines = lines != null ? lines : List.of();
            for (LineRequest line : initialLines) {
                insertLine(invoiceId, line);
            }

            ledgerMetrics.recordInvoiceCreated("success");
            log.info("Created invoice {} with {} lines", number, initialLines.size());
            return currentInvoice(invoiceId);
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public Invoice getInvoice(UUID invoiceId) {
        InvoiceEntity invoice = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
        return invoice.toDomain(linesOf(invoiceId));
    }

    @Transactional(readOnly = true)
    public Invoice getInvoiceByNumber(String invoiceNumber) {
        InvoiceEntity invoice = invoiceRepository.findByInvoiceNumber(invoiceNumber)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceNumber));
        return invoice.toDomain(linesOf(invoice.getId()));
    }

    /**
     * Lists invoices newest first. All criteria are optional; the date range is inclusive.
     */
    @Transactional(readOnly = true)
    public List<Invoice> listInvoices(UUID clientId, Instant issuedFrom, Instant issuedTo) {
        Instant from = issuedFrom != null ? issuedFrom : MIN_ISSUED_AT;
        Instant to = issuedTo != null ? issuedTo : MAX_ISSUED_AT;

        List<InvoiceEntity> invoices = clientId != null
            ? invoiceRepository.findByClientIdAndIssuedAtBetweenOrderByIssuedAtDesc(clientId, from, to)
            : invoiceRepository.findByIssuedAtBetweenOrderByIssuedAtDesc(from, to);
        if (invoices.isEmpty()) {
            return List.of();
        }

        Map<UUID, List<InvoiceLine>> linesByInvoice = lineRepository
            .findByInvoiceIdInOrderByCreatedAtAsc(invoices.stream().map(InvoiceEntity::getId).toList())
            .stream()
            .map(InvoiceLineEntity::toDomain)
            .collect(Collectors.groupingBy(InvoiceLine::getInvoiceId));

        return invoices.stream()
            .map(invoice -> invoice.toDomain(linesByInvoice.getOrDefault(invoice.getId(), List.of())))
            .toList();
    }

    /**
     * Count and sums of the stored header totals for invoices issued within
     * the inclusive range; open bounds when null.
     */
    @Transactional(readOnly = true)
    public InvoiceStatistics getStatistics(Instant issuedFrom, Instant issuedTo) {
        Instant from = issuedFrom != null ? issuedFrom : MIN_ISSUED_AT;
        Instant to = issuedTo != null ? issuedTo : MAX_ISSUED_AT;
        validateRange(from, to);

        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS invoice_count, " +
            "       COALESCE(SUM(subtotal), 0) AS subtotal, " +
            "       COALESCE(SUM(tax), 0) AS tax, " +
            "       COALESCE(SUM(discount), 0) AS discount, " +
            "       COALESCE(SUM(grand_total), 0) AS grand_total, " +
            "       COALESCE(AVG(grand_total), 0) AS average_total " +
            "FROM invoices WHERE issued_at BETWEEN ? AND ?",
            (rs, rowNum) -> new InvoiceStatistics(
                rs.getLong("invoice_count"),
                Money.normalize(rs.getBigDecimal("subtotal")),
                Money.normalize(rs.getBigDecimal("tax")),
                Money.normalize(rs.getBigDecimal("discount")),
                Money.normalize(rs.getBigDecimal("grand_total")),
                Money.normalize(rs.getBigDecimal("average_total"))
            ),
            Timestamp.from(from), Timestamp.from(to));
    }

    /**
     * Clients ranked by the grand total of their invoices issued within the
     * inclusive range, highest first.
     *
     * @throws ConstraintViolationException if the limit is outside 1..{@value #MAX_TOP_CLIENTS}
     */
    @Transactional(readOnly = true)
    public List<ClientSales> getTopClients(int limit, Instant issuedFrom, Instant issuedTo) {
        if (limit < 1 || limit > MAX_TOP_CLIENTS) {
            throw new ConstraintViolationException(
                String.format("Limit must be between 1 and %d, got %d", MAX_TOP_CLIENTS, limit));
        }
        Instant from = issuedFrom != null ? issuedFrom : MIN_ISSUED_AT;
        Instant to = issuedTo != null ? issuedTo : MAX_ISSUED_AT;
        validateRange(from, to);

        return jdbcTemplate.query(
            "SELECT c.id, c.name, c.tax_id, COUNT(i.id) AS invoice_count, SUM(i.grand_total) AS grand_total " +
            "FROM clients c JOIN invoices i ON i.client_id = c.id " +
            "WHERE i.issued_at BETWEEN ? AND ? " +
            "GROUP BY c.id, c.name, c.tax_id " +
            "ORDER BY SUM(i.grand_total) DESC, c.name " +
            "LIMIT ?",
            (rs, rowNum) -> new ClientSales(
                UUID.fromString(rs.getString("id")),
                rs.getString("name"),
                rs.getString("tax_id"),
                rs.getLong("invoice_count"),
                Money.normalize(rs.getBigDecimal("grand_total"))
            ),
            Timestamp.from(from), Timestamp.from(to), limit);
    }

    @Transactional(readOnly = true)
    public List<InvoiceLine> getLines(UUID invoiceId) {
        if (!invoiceRepository.existsById(invoiceId)) {
            throw new NotFoundException("Invoice", invoiceId);
        }
        return linesOf(invoiceId);
    }

    /**
     * Partial update of the caller-settable header fields.
     *
     * @throws ConcurrencyConflictException if {@code expectedVersion} no longer matches
     */
    @Transactional
    public Invoice updateInvoiceHeader(UUID invoiceId, InvoiceHeaderUpdate update) {
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            InvoiceEntity invoice = lockInvoice(invoiceId);
            if (update.getExpectedVersion() != null && !update.getExpectedVersion().equals(invoice.getVersion())) {
                throw new ConcurrencyConflictException(String.format(
                    "Invoice %s was modified concurrently: expected version %d, current version %d",
                    invoiceId, update.getExpectedVersion(), invoice.getVersion()));
            }
            if (update.getClientId() != null) {
                validateClient(update.getClientId());
            }
            validateTransaction(update.getTransactionId());
            validateDiscount(update.getDiscount());

            invoice.updateHeader(update);
            invoiceRepository.saveAndFlush(invoice);

            log.info("Updated header of invoice {}", invoice.getInvoiceNumber());
            return invoice.toDomain(linesOf(invoiceId));
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Invoice " + invoiceId + " was modified concurrently", e);
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Deletes the invoice together with all of its lines.
     */
    @Transactional
    public void deleteInvoice(UUID invoiceId) {
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            InvoiceEntity invoice = lockInvoice(invoiceId);
            long lineCount = lineRepository.countByInvoiceId(invoiceId);
            lineRepository.deleteByInvoiceId(invoiceId);
            invoiceRepository.delete(invoice);
            invoiceRepository.flush();
            log.info("Deleted invoice {} and {} lines", invoice.getInvoiceNumber(), lineCount);
        } finally {
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Transactional
    public Invoice addLine(UUID invoiceId, LineRequest request) {
        return mutateLine("add", invoiceId, () -> {
            lockInvoice(invoiceId);
            InvoiceLineEntity line = insertLine(invoiceId, request);
            log.info("Added line {} ({} x {}) total={}", line.getId(), line.getQuantity(),
                line.getUnitPrice(), line.getLineTotal());
        });
    }

    /**
     * Replaces a line's inputs. Null product, description or quantity keep the
     * current value; a null unit price keeps the current price unless the
     * product changes, in which case the new product's price applies.
     * Discount fields are always replaced.
     */
    @Transactional
    public Invoice updateLine(UUID invoiceId, UUID lineId, LineRequest request) {
        return mutateLine("update", invoiceId, () -> {
            lockInvoice(invoiceId);
            InvoiceLineEntity line = lineRepository.findByIdAndInvoiceId(lineId, invoiceId)
                .orElseThrow(() -> new NotFoundException("InvoiceLine", lineId));

            boolean productChanged = request.getProductId() != null && !request.getProductId().equals(line.getProductId());
            Product product = productChanged
                ? requireActiveProduct(request.getProductId())
                : productService.getProduct(line.getProductId());

            BigDecimal unitPrice = request.getUnitPrice() != null
                ? request.getUnitPrice()
                : productChanged ? product.getUnitPrice() : line.getUnitPrice();
            BigDecimal quantity = request.getQuantity() != null ? request.getQuantity() : line.getQuantity();
            String description = request.getDescription() != null ? request.getDescription() : line.getDescription();

            LineAggregate aggregate = lineCalculator.computeLine(quantity, unitPrice,
                request.getDiscountPercentage(), request.getDiscountAmount(), product.isTaxApplicable());

            line.apply(product.getId(), description, aggregate);
            lineRepository.saveAndFlush(line);
            totalMaintainer.recomputeInvoiceTotals(invoiceId);
            log.info("Updated line {} total={}", lineId, aggregate.getLineTotal());
        });
    }

    @Transactional
    public Invoice removeLine(UUID invoiceId, UUID lineId) {
        return mutateLine("remove", invoiceId, () -> {
            lockInvoice(invoiceId);
            InvoiceLineEntity line = lineRepository.findByIdAndInvoiceId(lineId, invoiceId)
                .orElseThrow(() -> new NotFoundException("InvoiceLine", lineId));
            lineRepository.delete(line);
            lineRepository.flush();
            totalMaintainer.recomputeInvoiceTotals(invoiceId);
            log.info("Removed line {}", lineId);
        });
    }

    private Invoice mutateLine(String operation, UUID invoiceId, Runnable mutation) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.INVOICE_ID_MDC_KEY, invoiceId.toString());
        try {
            mutation.run();
            Invoice invoice = currentInvoice(invoiceId);
            ledgerMetrics.recordLineMutation(operation, "success");
            return invoice;
        } catch (OptimisticLockingFailureException e) {
            ledgerMetrics.recordLineMutation(operation, "conflict");
            throw new ConcurrencyConflictException("Invoice " + invoiceId + " was modified concurrently", e);
        } catch (RuntimeException e) {
            ledgerMetrics.recordLineMutation(operation, "error");
            throw e;
        } finally {
            ledgerMetrics.recordLineMutationLatency(operation, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    /**
     * Writes a new line and recomputes the totals. The caller holds the invoice lock.
     */
    private InvoiceLineEntity insertLine(UUID invoiceId, LineRequest request) {
        if (request.getProductId() == null) {
            throw new ConstraintViolationException("Invoice line product is required");
        }
        Product product = requireActiveProduct(request.getProductId());
        BigDecimal unitPrice = request.getUnitPrice() != null ? request.getUnitPrice() : product.getUnitPrice();
        String description = request.getDescription() != null ? request.getDescription() : product.getName();

        LineAggregate aggregate = lineCalculator.computeLine(request.getQuantity(), unitPrice,
            request.getDiscountPercentage(), request.getDiscountAmount(), product.isTaxApplicable());

        InvoiceLineEntity line = lineRepository.saveAndFlush(
            InvoiceLineEntity.create(invoiceId, product.getId(), description, aggregate));
        totalMaintainer.recomputeInvoiceTotals(invoiceId);
        return line;
    }

    private InvoiceEntity lockInvoice(UUID invoiceId) {
        try {
            return invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
        } catch (PessimisticLockingFailureException e) {
            throw new ConcurrencyConflictException("Could not lock invoice " + invoiceId, e);
        }
    }

    /**
     * Reads back the invoice after pending writes are flushed, so the version is current.
     */
    private Invoice currentInvoice(UUID invoiceId) {
        invoiceRepository.flush();
        InvoiceEntity invoice = invoiceRepository.findById(invoiceId)
            .orElseThrow(() -> new NotFoundException("Invoice", invoiceId));
        return invoice.toDomain(linesOf(invoiceId));
    }

    private List<InvoiceLine> linesOf(UUID invoiceId) {
        return lineRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId).stream()
            .map(InvoiceLineEntity::toDomain)
            .toList();
    }

    private Product requireActiveProduct(UUID productId) {
        Product product = productService.getProduct(productId);
        if (!product.isActive()) {
            throw new ConstraintViolationException("Product " + productId + " is inactive");
        }
        return product;
    }

    private void validateClient(UUID clientId) {
        if (clientId == null) {
            return;
        }
        Client client = clientService.getClient(clientId);
        if (!client.isActive()) {
            throw new ConstraintViolationException("Client " + clientId + " is inactive");
        }
    }

    private void validateTransaction(UUID transactionId) {
        if (transactionId != null && transactionService.findById(transactionId).isEmpty()) {
            throw new NotFoundException("Transaction", transactionId);
        }
    }

    private void validateRange(Instant from, Instant to) {
        if (from.isAfter(to)) {
            throw new ConstraintViolationException(
                String.format("Start %s is after end %s", from, to));
        }
    }

    private void validateDiscount(BigDecimal discount) {
        if (Money.isNegative(discount)) {
            throw new ConstraintViolationException("Invoice discount must be zero or positive: " + discount);
        }
        if (!Money.hasStorageScale(discount) || !Money.fitsIntegerDigits(discount, Money.AMOUNT_INTEGER_DIGITS)) {
            throw new ConstraintViolationException("Invoice discount must have at most 2 decimals and be in range: " + discount);
        }
    }

    private Instant resolveDueAt(Instant issuedAt, Instant dueAt, String paymentTerms) {
        if (dueAt != null) {
            return dueAt;
        }
        if (paymentTerms != null && CASH_TERMS.equalsIgnoreCase(paymentTerms.trim())) {
            return null;
        }
        return issuedAt.plus(Duration.ofDays(defaultCreditDays));
    }
}
