package com.flagship.ledger_invoicing.invoice;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<InvoiceEntity, UUID> {

    /**
     * Loads the invoice with a row lock held until the surrounding transaction ends.
     * Every line mutation goes through this first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvoiceEntity i WHERE i.id = :id")
    Optional<InvoiceEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<InvoiceEntity> findByInvoiceNumber(String invoiceNumber);

    List<InvoiceEntity> findByIssuedAtBetweenOrderByIssuedAtDesc(Instant from, Instant to);

    List<InvoiceEntity> findByClientIdAndIssuedAtBetweenOrderByIssuedAtDesc(UUID clientId, Instant from, Instant to);

    /**
     * Highest numeric suffix among invoice numbers starting with the given prefix.
     */
    @Query(value = "SELECT COALESCE(MAX(CAST(SUBSTRING(invoice_number FROM LENGTH(:prefix) + 1) AS INTEGER)), 0) " +
                   "FROM invoices WHERE invoice_number LIKE CONCAT(:prefix, '%')",
           nativeQuery = true)
    int findMaxSequence(@Param("prefix") String prefix);
}
