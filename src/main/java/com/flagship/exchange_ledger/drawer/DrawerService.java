package com.flagship.exchange_ledger.drawer;

import com.flagship.exchange_ledger.common.Amounts;
import com.flagship.exchange_ledger.common.UnitOfWork;
import com.flagship.exchange_ledger.exception.NoActiveDrawerException;
import com.flagship.exchange_ledger.exception.NotFoundException;
import com.flagship.exchange_ledger.exception.ValidationException;
import com.flagship.exchange_ledger.operator.Operator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drawer administration and drawer lookups used by the balance and settlement flows.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrawerService {

    private static final int MAX_NAME_LENGTH = 100;
    private static final int MAX_LOCATION_LENGTH = 200;

    private final DrawerRepository drawerRepository;
    private final UnitOfWork unitOfWork;

    public Drawer createDrawer(String name, String location, BigDecimal lowBalanceThreshold, Operator operator) {
        operator.requireAdmin("create cash drawers");
        String validName = requireName(name);
        String validLocation = optionalLocation(location);
        BigDecimal threshold = lowBalanceThreshold == null
            ? Amounts.zero()
            : Amounts.requireNonNegative("Low balance threshold", lowBalanceThreshold);

        return unitOfWork.execute("createDrawer", () -> {
            if (drawerRepository.existsByName(validName)) {
                throw new ValidationException("A drawer named '" + validName + "' already exists");
            }
            DrawerEntity saved = drawerRepository.save(
                DrawerEntity.create(validName, validLocation, threshold, operator.getId()));
            log.info("Drawer created: drawerId={}, name={}, createdBy={}", saved.getId(), validName, operator.getId());
            return saved.toDomain();
        });
    }

    /**
     * Partial update; null arguments leave the field unchanged.
     */
    public Drawer updateDrawer(UUID drawerId, String name, String location, Boolean active,
                               BigDecimal lowBalanceThreshold, Operator operator) {
        operator.requireAdmin("update cash drawers");
        String validName = name != null ? requireName(name) : null;
        String validLocation = location != null ? optionalLocation(location) : null;
        BigDecimal threshold = lowBalanceThreshold != null
            ? Amounts.requireNonNegative("Low balance threshold", lowBalanceThreshold)
            : null;

        return unitOfWork.execute("updateDrawer", () -> {
            DrawerEntity entity = loadEntity(drawerId);
            if (validName != null && !validName.equals(entity.getName())) {
                if (drawerRepository.existsByNameAndIdNot(validName, drawerId)) {
                    throw new ValidationException("A drawer named '" + validName + "' already exists");
                }
                entity.rename(validName);
            }
            if (validLocation != null) {
                entity.relocate(validLocation);
            }
            if (threshold != null) {
                entity.changeLowBalanceThreshold(threshold);
            }
            if (active != null) {
                if (active) {
                    entity.activate();
                } else {
                    entity.deactivate();
                }
            }
            DrawerEntity saved = drawerRepository.save(entity);
            log.info("Drawer updated: drawerId={}, active={}, threshold={}",
                    drawerId, saved.isActive(), saved.getLowBalanceThreshold());
            return saved.toDomain();
        });
    }

    /**
     * Makes the drawer the operator's working drawer. Any drawer previously
     * assigned to the same operator is released first.
     */
    public Drawer assignDrawer(UUID drawerId, UUID operatorId, Operator admin) {
        admin.requireAdmin("assign cash drawers");
        if (operatorId == null) {
            throw new ValidationException("Operator id is required");
        }

        return unitOfWork.execute("assignDrawer", () -> {
            DrawerEntity entity = loadEntity(drawerId);
            drawerRepository.findFirstByAssignedOperatorIdAndActiveTrue(operatorId)
                .filter(previous -> !previous.getId().equals(drawerId))
                .ifPresent(previous -> {
                    previous.releaseAssignment();
                    // must reach the database before the new assignment: unique index on active assignments
                    drawerRepository.saveAndFlush(previous);
                    log.info("Released previous drawer assignment: drawerId={}, operatorId={}",
                            previous.getId(), operatorId);
                });
            entity.assignTo(operatorId);
            DrawerEntity saved = drawerRepository.save(entity);
            log.info("Drawer assigned: drawerId={}, operatorId={}", drawerId, operatorId);
            return saved.toDomain();
        });
    }

    @Transactional(readOnly = true)
    public Drawer getDrawer(UUID drawerId) {
        return loadEntity(drawerId).toDomain();
    }

    /**
     * @throws NotFoundException if the drawer does not exist
     * @throws ValidationException if the drawer has been deactivated
     */
    @Transactional(readOnly = true)
    public Drawer requireActiveDrawer(UUID drawerId) {
        Drawer drawer = getDrawer(drawerId);
        if (!drawer.isActive()) {
            throw new ValidationException("Cash drawer is not active: " + drawerId);
        }
        return drawer;
    }

    /**
     * Resolves the drawer an operator is currently working from.
     *
     * @throws NoActiveDrawerException if no active drawer is assigned to the operator
     */
    @Transactional(readOnly = true)
    public Drawer resolveActiveDrawer(UUID operatorId) {
        return drawerRepository.findFirstByAssignedOperatorIdAndActiveTrue(operatorId)
            .map(DrawerEntity::toDomain)
            .orElseThrow(() -> new NoActiveDrawerException(operatorId));
    }

    @Transactional(readOnly = true)
    public List<Drawer> listDrawers(boolean activeOnly) {
        List<DrawerEntity> entities = activeOnly
            ? drawerRepository.findByActiveTrueOrderByNameAsc()
            : drawerRepository.findAllByOrderByNameAsc();
        return entities.stream()
            .map(DrawerEntity::toDomain)
            .collect(Collectors.toList());
    }

    private DrawerEntity loadEntity(UUID drawerId) {
        if (drawerId == null) {
            throw new ValidationException("Drawer id is required");
        }
        return drawerRepository.findById(drawerId)
            .orElseThrow(() -> new NotFoundException("Cash drawer not found: " + drawerId));
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Drawer name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("Drawer name cannot exceed " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private static String optionalLocation(String location) {
        if (location == null || location.isBlank()) {
            return null;
        }
        String trimmed = location.trim();
        if (trimmed.length() > MAX_LOCATION_LENGTH) {
            throw new ValidationException("Drawer location cannot exceed " + MAX_LOCATION_LENGTH + " characters");
        }
        return trimmed;
    }
}
