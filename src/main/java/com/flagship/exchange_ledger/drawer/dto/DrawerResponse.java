package com.flagship.exchange_ledger.drawer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.exchange_ledger.balance.CurrencyBalance;
import com.flagship.exchange_ledger.balance.dto.BalanceResponse;
import com.flagship.exchange_ledger.drawer.Drawer;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Value
@Builder
public class DrawerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("location")
    String location;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("low_balance_threshold")
    BigDecimal lowBalanceThreshold;

    @JsonProperty("assigned_operator_id")
    UUID assignedOperatorId;

    @JsonProperty("created_by")
    UUID createdBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("balances")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    List<BalanceResponse> balances;

    public static DrawerResponse from(Drawer drawer) {
        return base(drawer).build();
    }

    public static DrawerResponse from(Drawer drawer, List<CurrencyBalance> balances) {
        return base(drawer)
            .balances(balances.stream().map(BalanceResponse::from).collect(Collectors.toList()))
            .build();
    }

    private static DrawerResponseBuilder base(Drawer drawer) {
        return DrawerResponse.builder()
            .id(drawer.getId())
            .name(drawer.getName())
            .location(drawer.getLocation())
            .active(drawer.isActive())
            .lowBalanceThreshold(drawer.getLowBalanceThreshold())
            .assignedOperatorId(drawer.getAssignedOperatorId())
            .createdBy(drawer.getCreatedBy())
            .createdAt(drawer.getCreatedAt())
            .updatedAt(drawer.getUpdatedAt());
    }
}
