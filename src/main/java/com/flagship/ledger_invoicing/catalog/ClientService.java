package com.flagship.ledger_invoicing.catalog;

import com.flagship.ledger_invoicing.exception.ConstraintViolationException;
import com.flagship.ledger_invoicing.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class ClientService {

    private static final String SELECT_CLIENT =
        "SELECT id, name, tax_id, email, active, created_at FROM clients ";

    private final JdbcTemplate jdbcTemplate;

    public ClientService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional
    public Client createClient(String name, String taxId, String email) {
        if (name == null || name.isBlank()) {
            throw new ConstraintViolationException("Client name is required");
        }

        UUID clientId = UUID.randomUUID();
        Instant now = Instant.now();
        String trimmedTaxId = taxId != null && !taxId.isBlank() ? taxId.trim() : null;
        try {
            jdbcTemplate.update(
                "INSERT INTO clients (id, name, tax_id, email, active, created_at) VALUES (?, ?, ?, ?, TRUE, ?)",
                clientId,
                name.trim(),
                trimmedTaxId,
                email,
                Timestamp.from(now)
            );
        } catch (DuplicateKeyException e) {
            throw new ConstraintViolationException("Client tax ID already exists: " + trimmedTaxId);
        }

        log.info("Created client {} ({})", name.trim(), clientId);
        return new Client(clientId, name.trim(), trimmedTaxId, email, true, now);
    }

    @Transactional(readOnly = true)
    public Optional<Client> findById(UUID clientId) {
        return jdbcTemplate.query(SELECT_CLIENT + "WHERE id = ?", clientRowMapper(), clientId)
            .stream()
            .findFirst();
    }

    @Transactional(readOnly = true)
    public Client getClient(UUID clientId) {
        return findById(clientId).orElseThrow(() -> new NotFoundException("Client", clientId));
    }

    @Transactional(readOnly = true)
    public List<Client> listClients(boolean activeOnly) {
        String where = activeOnly ? "WHERE active = TRUE " : "";
        return jdbcTemplate.query(SELECT_CLIENT + where + "ORDER BY name", clientRowMapper());
    }

    @Transactional
    public Client setActive(UUID clientId, boolean active) {
        int updated = jdbcTemplate.update("UPDATE clients SET active = ? WHERE id = ?", active, clientId);
        if (updated == 0) {
            throw new NotFoundException("Client", clientId);
        }
        log.info("Client {} active={}", clientId, active);
        return getClient(clientId);
    }

    private RowMapper<Client> clientRowMapper() {
        return (rs, rowNum) -> new Client(
            UUID.fromString(rs.getString("id")),
            rs.getString("name"),
            rs.getString("tax_id"),
            rs.getString("email"),
            rs.getBoolean("active"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
