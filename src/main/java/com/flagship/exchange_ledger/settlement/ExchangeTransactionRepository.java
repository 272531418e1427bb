package com.flagship.exchange_ledger.settlement;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExchangeTransactionRepository extends JpaRepository<ExchangeTransactionEntity, UUID> {

    Optional<ExchangeTransactionEntity> findByIdempotencyKey(String idempotencyKey);

    List<ExchangeTransactionEntity> findByDrawerIdAndCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByCreatedAtDesc(
        UUID drawerId, Instant from, Instant to);

    /**
     * Profit of every exchange settled in [from, to), across all drawers.
     */
    @Query("SELECT COALESCE(SUM(t.profit), 0) FROM ExchangeTransactionEntity t " +
           "WHERE t.createdAt >= :from AND t.createdAt < :to")
    BigDecimal sumProfitBetween(@Param("from") Instant from, @Param("to") Instant to);
}
