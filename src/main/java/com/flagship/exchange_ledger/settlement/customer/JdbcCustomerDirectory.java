package com.flagship.exchange_ledger.settlement.customer;

import com.flagship.exchange_ledger.exception.NotFoundException;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer directory over the {@code customers} table.
 *
 * Resolution order: explicit id, then phone (reused or registered), then name
 * (always registered), otherwise anonymous.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JdbcCustomerDirectory implements CustomerDirectory {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ResolvedCustomer resolve(CustomerReference reference, UUID operatorId) {
        if (reference == null || reference.isEmpty()) {
            return ResolvedCustomer.anonymous();
        }

        if (reference.getCustomerId() != null) {
            CustomerRow row = findById(reference.getCustomerId())
                .orElseThrow(() -> new NotFoundException("Customer not found: " + reference.getCustomerId()));
            return toResolved(row, false);
        }

        if (reference.getPhone() != null && !reference.getPhone().isBlank()) {
            String phone = reference.getPhone().trim();
            // concurrent registrations of one phone number end up on the same row
            int inserted = jdbcTemplate.update(
                "INSERT INTO customers (id, full_name, phone, id_type, id_number, created_by, created_at) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?) ON CONFLICT (phone) DO NOTHING",
                UUID.randomUUID(), trimToNull(reference.getName()), phone,
                trimToNull(reference.getIdType()), trimToNull(reference.getIdNumber()),
                operatorId, Timestamp.from(clock.instant())
            );
            CustomerRow row = findByPhone(phone)
                .orElseThrow(() -> new IllegalStateException("Customer row missing after registration: " + phone));
            if (inserted == 1) {
                log.info("Registered customer by phone: customerId={}", row.id);
            }
            return toResolved(row, inserted == 1);
        }

        UUID id = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO customers (id, full_name, id_type, id_number, created_by, created_at) VALUES (?, ?, ?, ?, ?, ?)",
            id, reference.getName().trim(), trimToNull(reference.getIdType()), trimToNull(reference.getIdNumber()),
            operatorId, Timestamp.from(clock.instant())
        );
        log.info("Registered customer by name: customerId={}", id);
        return new ResolvedCustomer(id, reference.getName().trim(), null, true);
    }

    private Optional<CustomerRow> findById(UUID id) {
        return query("SELECT id, full_name, phone, blocked FROM customers WHERE id = ?", id);
    }

    private Optional<CustomerRow> findByPhone(String phone) {
        return query("SELECT id, full_name, phone, blocked FROM customers WHERE phone = ?", phone);
    }

    private Optional<CustomerRow> query(String sql, Object arg) {
        List<CustomerRow> rows = jdbcTemplate.query(sql,
            (rs, rowNum) -> new CustomerRow(
                rs.getObject("id", UUID.class),
                rs.getString("full_name"),
                rs.getString("phone"),
                rs.getBoolean("blocked")
            ),
            arg);
        return rows.stream().findFirst();
    }

    private static ResolvedCustomer toResolved(CustomerRow row, boolean created) {
        if (row.blocked) {
            throw new ValidationException("Customer is blocked from transactions: " + row.id);
        }
        return new ResolvedCustomer(row.id, row.name, row.phone, created);
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static final class CustomerRow {
        final UUID id;
        final String name;
        final String phone;
        final boolean blocked;

        CustomerRow(UUID id, String name, String phone, boolean blocked) {
            this.id = id;
            this.name = name;
            this.phone = phone;
            this.blocked = blocked;
        }
    }
}
