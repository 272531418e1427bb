package com.flagship.exchange_ledger.drawer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface DrawerRepository extends JpaRepository<DrawerEntity, UUID> {

    Optional<DrawerEntity> findFirstByAssignedOperatorIdAndActiveTrue(UUID operatorId);

    List<DrawerEntity> findAllByOrderByNameAsc();

    List<DrawerEntity> findByActiveTrueOrderByNameAsc();

    boolean existsByName(String name);

    boolean existsByNameAndIdNot(String name, UUID id);
}
