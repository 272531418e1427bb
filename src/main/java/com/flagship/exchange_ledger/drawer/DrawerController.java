package com.flagship.exchange_ledger.drawer;

import com.flagship.exchange_ledger.balance.DrawerBalanceService;
import com.flagship.exchange_ledger.drawer.dto.AssignDrawerRequest;
import com.flagship.exchange_ledger.drawer.dto.CreateDrawerRequest;
import com.flagship.exchange_ledger.drawer.dto.DrawerResponse;
import com.flagship.exchange_ledger.drawer.dto.UpdateDrawerRequest;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Drawer administration endpoints. Mutations are restricted to administrators.
 */
@RestController
@RequestMapping("/api/drawers")
@RequiredArgsConstructor
public class DrawerController {

    private final DrawerService drawerService;
    private final DrawerBalanceService drawerBalanceService;

    @PostMapping
    public ResponseEntity<DrawerResponse> createDrawer(
            @Valid @RequestBody CreateDrawerRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        Drawer drawer = drawerService.createDrawer(
            request.getName(),
            request.getLocation(),
            request.getLowBalanceThreshold(),
            Operator.of(operatorId, role)
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(DrawerResponse.from(drawer));
    }

    @GetMapping
    public List<DrawerResponse> listDrawers(
            @RequestParam(value = "active_only", defaultValue = "false") boolean activeOnly) {
        return drawerService.listDrawers(activeOnly).stream()
            .map(DrawerResponse::from)
            .collect(Collectors.toList());
    }

    @GetMapping("/{drawerId}")
    public DrawerResponse getDrawer(@PathVariable("drawerId") UUID drawerId) {
        Drawer drawer = drawerService.getDrawer(drawerId);
        return DrawerResponse.from(drawer, drawerBalanceService.getBalances(drawerId));
    }

    @PatchMapping("/{drawerId}")
    public DrawerResponse updateDrawer(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody UpdateDrawerRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        Drawer drawer = drawerService.updateDrawer(
            drawerId,
            request.getName(),
            request.getLocation(),
            request.getActive(),
            request.getLowBalanceThreshold(),
            Operator.of(operatorId, role)
        );
        return DrawerResponse.from(drawer);
    }

    @PutMapping("/{drawerId}/assignment")
    public DrawerResponse assignDrawer(
            @PathVariable("drawerId") UUID drawerId,
            @Valid @RequestBody AssignDrawerRequest request,
            @RequestHeader(Operator.ID_HEADER) UUID operatorId,
            @RequestHeader(value = Operator.ROLE_HEADER, required = false) OperatorRole role) {

        return DrawerResponse.from(
            drawerService.assignDrawer(drawerId, request.getOperatorId(), Operator.of(operatorId, role)));
    }
}
