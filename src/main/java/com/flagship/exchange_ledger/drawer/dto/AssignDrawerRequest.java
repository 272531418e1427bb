package com.flagship.exchange_ledger.drawer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.UUID;

@Value
public class AssignDrawerRequest {

    @NotNull(message = "Operator ID is required")
    @JsonProperty("operator_id")
    UUID operatorId;
}
