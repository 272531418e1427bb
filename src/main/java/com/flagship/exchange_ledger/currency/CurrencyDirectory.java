package com.flagship.exchange_ledger.currency;

import com.flagship.exchange_ledger.exception.NotFoundException;
import com.flagship.exchange_ledger.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-only access to the currency catalogue. Currency maintenance lives in the
 * back office; this service only checks codes against it.
 */
@Repository
@RequiredArgsConstructor
public class CurrencyDirectory {

    private static final RowMapper<Currency> CURRENCY_ROW_MAPPER = (rs, rowNum) -> new Currency(
        rs.getString("code"),
        rs.getString("name"),
        rs.getBoolean("active"),
        rs.getBigDecimal("high_value_threshold")
    );

    private final JdbcTemplate jdbcTemplate;

    public Optional<Currency> findByCode(String code) {
        List<Currency> result = jdbcTemplate.query(
            "SELECT code, name, active, high_value_threshold FROM currencies WHERE code = ?",
            CURRENCY_ROW_MAPPER,
            code
        );
        return result.stream().findFirst();
    }

    /**
     * Resolves a currency code that is about to be used in a balance mutation.
     *
     * @throws ValidationException if the code is blank or the currency is inactive
     * @throws NotFoundException if the code is unknown
     */
    public Currency requireActive(String code) {
        String normalized = normalize(code);
        Currency currency = findByCode(normalized)
            .orElseThrow(() -> new NotFoundException("Currency not found: " + normalized));
        if (!currency.isActive()) {
            throw new ValidationException("Currency is not active: " + normalized);
        }
        return currency;
    }

    public List<Currency> findAllActive() {
        return jdbcTemplate.query(
            "SELECT code, name, active, high_value_threshold FROM currencies WHERE active ORDER BY code",
            CURRENCY_ROW_MAPPER
        );
    }

    public static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new ValidationException("Currency is required");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (!normalized.matches("[A-Z]{3}")) {
            throw new ValidationException("Currency must be a 3-letter ISO code: " + code);
        }
        return normalized;
    }
}
