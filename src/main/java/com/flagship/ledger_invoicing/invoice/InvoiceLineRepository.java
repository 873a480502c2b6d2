package com.flagship.ledger_invoicing.invoice;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceLineRepository extends JpaRepository<InvoiceLineEntity, UUID> {

    List<InvoiceLineEntity> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);

    List<InvoiceLineEntity> findByInvoiceIdInOrderByCreatedAtAsc(Collection<UUID> invoiceIds);

    Optional<InvoiceLineEntity> findByIdAndInvoiceId(UUID id, UUID invoiceId);

    long countByInvoiceId(UUID invoiceId);

    void deleteByInvoiceId(UUID invoiceId);
}
