package com.flagship.ledger_invoicing.catalog;

import com.flagship.ledger_invoicing.common.Money;
import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import com.flagship.ledger_invoicing.exception.ReferentialIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Product catalog. A product referenced by any invoice line cannot be deleted,
 * only deactivated.
 */
@Service
@Slf4j
public class ProductService {

    private static final String SELECT_PRODUCT =
        "SELECT id, code, name, unit_price, tax_applicable, active, created_at FROM products ";

    private final JdbcTemplate jdbcTemplate;

    public ProductService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Product createProduct(String code, String name, BigDecimal unitPrice, boolean taxApplicable) {
        if (name == null || name.isBlank()) {
            throw new ConstraintViolationException("Product name is required");
        }
        if (unitPrice == null || Money.isNegative(unitPrice)) {
            throw new ConstraintViolationException("Product unit price must be zero or positive");
        }
        if (!Money.hasStorageScale(unitPrice) || !Money.fitsIntegerDigits(unitPrice, Money.LINE_INTEGER_DIGITS)) {
            throw new ConstraintViolationException("Product unit price must have at most 2 decimals and be in range: " + unitPrice);
        }

        UUID productId = UUID.randomUUID();
        Instant now = Instant.now();
        BigDecimal price = Money.normalize(unitPrice);
        String trimmedCode = code != null && !code.isBlank() ? code.trim() : null;
        try {
            jdbcTemplate.update(
                "INSERT INTO products (id, code, name, unit_price, tax_applicable, active, created_at) " +
                "VALUES (?, ?, ?, ?, ?, TRUE, ?)",
                productId,
                trimmedCode,
                name.trim(),
                price,
                taxApplicable,
                Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            throw new ConstraintViolationException("Product code already exists: " + trimmedCode);
        }

        log.info("Created product {} ({}) price={} taxable={}", name.trim(), productId, price, taxApplicable);
        return new Product(productId, trimmedCode, name.trim(), price, taxApplicable, true, now);
    }

    @Transactional(readOnly = true)
    public Optional<Product> findById(UUID productId) {
        return jdbcTemplate.query(SELECT_PRODUCT + "WHERE id = ?", productRowMapper(), productId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Product getProduct(UUID productId) {
        return findById(productId).orElseThrow(() -> new NotFoundException("Product", productId));
    }

    @Transactional(readOnly = true)
    public List<Product> listProducts(boolean activeOnly) {
        String where = activeOnly ? "WHERE active = TRUE " : "";
        return jdbcTemplate.query(SELECT_PRODUCT + where + "ORDER BY name", productRowMapper());
    }

    @Transactional
    public Product setActive(UUID productId, boolean active) {
        int updated = jdbcTemplate.update("UPDATE products SET active = ? WHERE id = ?", active, productId);
        if (updated == 0) {
            throw new NotFoundException("Product", productId);
        }
        log.info("Product {} active={}", productId, active);
        return getProduct(productId);
    }

    /**
     * @throws NotFoundException if the product does not exist
     * @throws ReferentialIntegrityException if any invoice line references it
     */
    @Transactional
    public void deleteProduct(UUID productId) {
        if (findById(productId).isEmpty()) {
            throw new NotFoundException("Product", productId);
        }

        Integer references = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM invoice_lines WHERE product_id = ?",
            Integer.class,
            productId
        );
        if (references != null && references > 0) {
            throw new ReferentialIntegrityException(
                String.format("Product %s is referenced by %d invoice lines and cannot be deleted",
                    productId, references));
        }

        try {
            jdbcTemplate.update("DELETE FROM products WHERE id = ?", productId);
        } catch (DataIntegrityViolationException e) {
            throw new ReferentialIntegrityException(
                "Product " + productId + " is referenced by invoice lines and cannot be deleted", e);
        }
        log.info("Deleted product {}", productId);
    }

    private RowMapper<Product> productRowMapper() {
        return (rs, rowNum) -> new Product(
            UUID.fromString(rs.getString("id")),
            rs.getString("code"),
            rs.getString("name"),
            rs.getBigDecimal("unit_price"),
            rs.getBoolean("tax_applicable"),
            rs.getBoolean("active"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
