package com.flagship.ledger_invoicing.invoice;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for an invoice line. Derived amounts are only written from a
 * {@link LineAggregate}, never field by field.
 */
@Entity
@Table(
    name = "invoice_lines",
    indexes = {
        @Index(name = "idx_invoice_lines_invoice", columnList = "invoice_id"),
        @Index(name = "idx_invoice_lines_product", columnList = "product_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvoiceLineEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "invoice_id", nullable = false, updatable = false)
    private UUID invoiceId;

    @Column(name = "product_id", nullable = false)
    private UUID productId;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal quantity;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "discount_percentage", precision = 5, scale = 2)
    private BigDecimal discountPercentage;

    @Column(name = "discount_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "line_subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal lineSubtotal;

    @Column(name = "line_tax", nullable = false, precision = 12, scale = 2)
    private BigDecimal lineTax;

    @Column(name = "line_total", nullable = false, precision = 12, scale = 2)
    private BigDecimal lineTotal;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static InvoiceLineEntity create(UUID invoiceId, UUID productId, String description, LineAggregate aggregate) {
        return new InvoiceLineEntity(
            UUID.randomUUID(),
            invoiceId,
            productId,
            description,
            aggregate.getQuantity(),
            aggregate.getUnitPrice(),
            aggregate.getDiscountPercentage(),
            aggregate.getDiscountAmount(),
            aggregate.getLineSubtotal(),
            aggregate.getLineTax(),
            aggregate.getLineTotal(),
            null, // version - null marks the entity as new
            null  // createdAt - set by @PrePersist
        );
    }

    void apply(UUID productId, String description, LineAggregate aggregate) {
        this.productId = productId;
        this.description = description;
        this.quantity = aggregate.getQuantity();
        this.unitPrice = aggregate.getUnitPrice();
        this.discountPercentage = aggregate.getDiscountPercentage();
        this.discountAmount = aggregate.getDiscountAmount();
        this.lineSubtotal = aggregate.getLineSubtotal();
        this.lineTax = aggregate.getLineTax();
        this.lineTotal = aggregate.getLineTotal();
    }

    public InvoiceLine toDomain() {
        return new InvoiceLine(
            id,
            invoiceId,
            productId,
            description,
            quantity,
            unitPrice,
            discountPercentage,
            discountAmount,
            lineSubtotal,
            lineTax,
            lineTotal,
            createdAt
        );
    }
}
