package com.flagship.ledger_invoicing.invoice;

import com.flagship.ledger_invoicing.common.Money;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for the invoice header.
 *
 * - No setters: header fields change through {@link #updateHeader}, totals
 *   only through {@link #applyTotals(InvoiceTotals)}
 * - New invoices start with zero totals, whatever the caller sent
 * - {@code @Version} rejects writes based on a stale read
 */
@Entity
@Table(name = "invoices")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_number", nullable = false, unique = true, updatable = false, length = 30)
    private String invoiceNumber;

    @Column(name = "client_id")
    private UUID clientId;

    @Column(name = "transaction_id")
    private UUID transactionId;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal subtotal;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal discount;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal tax;

    @Column(name = "grand_total", nullable = false, precision = 15, scale = 2)
    private BigDecimal grandTotal;

    @Column(name = "payment_terms", length = 50)
    private String paymentTerms;

    @Column(length = 100)
    private String salesperson;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "due_at")
    private Instant dueAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates an empty invoice. The number and dates must already be resolved.
     */
    static InvoiceEntity fromHeader(UUID id, String invoiceNumber, InvoiceHeader header) {
        return new InvoiceEntity(
            id,
            invoiceNumber,
            header.getClientId(),
            header.getTransactionId(),
            Money.ZERO,
            Money.normalize(header.getDiscount()),
            Money.ZERO,
            Money.ZERO,
            header.getPaymentTerms(),
            header.getSalesperson(),
            header.getIssuedAt(),
            header.getDueAt(),
            header.getNotes(),
            null, // version - null marks the entity as new
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    /**
     * Applies the non-null fields of a partial update. Totals are not reachable from here.
     */
    void updateHeader(InvoiceHeaderUpdate update) {
        if (update.getClientId() != null) {
            this.clientId = update.getClientId();
        }
        if (update.getTransactionId() != null) {
            this.transactionId = update.getTransactionId();
        }
        if (update.getDiscount() != null) {
            this.discount = Money.normalize(update.getDiscount());
        }
        if (update.getPaymentTerms() != null) {
            this.paymentTerms = update.getPaymentTerms();
        }
        if (update.getSalesperson() != null) {
            this.salesperson = update.getSalesperson();
        }
        if (update.getDueAt() != null) {
            this.dueAt = update.getDueAt();
        }
        if (update.getNotes() != null) {
            this.notes = update.getNotes();
        }
    }

    /**
     * Only {@link InvoiceTotalMaintainer} calls this.
     */
    void applyTotals(InvoiceTotals totals) {
        this.subtotal = totals.getSubtotal();
        this.tax = totals.getTax();
        this.grandTotal = totals.getGrandTotal();
    }

    public Invoice toDomain(List<InvoiceLine> lines) {
        return new Invoice(
            id,
            invoiceNumber,
            clientId,
            transactionId,
            subtotal,
            discount,
            tax,
            grandTotal,
            paymentTerms,
            salesperson,
            issuedAt,
            dueAt,
            notes,
            version,
            createdAt,
            updatedAt,
            List.copyOf(lines)
        );
    }
}
