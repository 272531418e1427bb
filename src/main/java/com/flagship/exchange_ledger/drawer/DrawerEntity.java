package com.flagship.exchange_ledger.drawer;

import com.flagship.exchange_ledger.exception.ValidationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for cash drawers.
 *
 * Key design principles:
 * - No setters: state changes go through the named methods below
 * - Drawers are never deleted; {@link #deactivate()} is the retirement path
 * - Deactivating a drawer releases its operator assignment
 */
@Entity
@Table(
    name = "drawers",
    indexes = {
        @Index(name = "idx_drawers_assigned_operator", columnList = "assigned_operator_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DrawerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 200)
    private String location;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "low_balance_threshold", nullable = false, precision = 18, scale = 2)
    private BigDecimal lowBalanceThreshold;

    @Column(name = "assigned_operator_id")
    private UUID assignedOperatorId;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

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

    static DrawerEntity create(String name, String location, BigDecimal lowBalanceThreshold, UUID createdBy) {
        return new DrawerEntity(
            UUID.randomUUID(),
            name,
            location,
            true,
            lowBalanceThreshold,
            null,
            createdBy,
            null, // set by @PrePersist
            null
        );
    }

    public Drawer toDomain() {
        return new Drawer(
            id,
            name,
            location,
            active,
            lowBalanceThreshold,
            assignedOperatorId,
            createdBy,
            createdAt,
            updatedAt
        );
    }

    void rename(String name) {
        this.name = name;
    }

    void relocate(String location) {
        this.location = location;
    }

    void changeLowBalanceThreshold(BigDecimal threshold) {
        this.lowBalanceThreshold = threshold;
    }

    void activate() {
        this.active = true;
    }

    void deactivate() {
        this.active = false;
        this.assignedOperatorId = null;
    }

    void assignTo(UUID operatorId) {
        if (!active) {
            throw new ValidationException("Cannot assign inactive drawer " + id);
        }
        this.assignedOperatorId = operatorId;
    }

    void releaseAssignment() {
        this.assignedOperatorId = null;
    }
}
