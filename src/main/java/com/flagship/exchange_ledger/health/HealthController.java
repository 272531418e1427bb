package com.flagship.exchange_ledger.health;

import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.MigrationInfo;
import org.flywaydb.core.api.MigrationInfoService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint. Unlike the Actuator health endpoint, this does not require authorization.
 *
 * The ledger cannot serve anything without its database, and balance and
 * ledger writes assume the latest migration, so the applied schema version is
 * reported alongside the connection check. Pending migrations mark the service DOWN.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final ObjectProvider<Flyway> flywayProvider;
    private final Clock clock;

    public HealthController(DataSource dataSource, ObjectProvider<Flyway> flywayProvider, Clock clock) {
        this.dataSource = dataSource;
        this.flywayProvider = flywayProvider;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "exchange-ledger");
        response.put("timestamp", clock.instant().toString());

        boolean dbHealthy = checkDatabase();
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        Flyway flyway = flywayProvider.getIfAvailable();
        if (flyway != null) {
            SchemaState schema = checkSchema(flyway);
            response.put("schema_version", schema.version);
            response.put("pending_migrations", schema.pending);
            if (schema.pending != 0) {
                response.put("status", "DOWN");
                return ResponseEntity.status(503).body(response);
            }
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private SchemaState checkSchema(Flyway flyway) {
        try {
            MigrationInfoService info = flyway.info();
            MigrationInfo current = info.current();
            String version = current != null && current.getVersion() != null
                ? current.getVersion().getVersion()
                : "none";
            return new SchemaState(version, info.pending().length);
        } catch (Exception e) {
            log.warn("Schema version check failed: {}", e.getMessage());
            return new SchemaState("unknown", -1);
        }
    }

    private static final class SchemaState {
        private final String version;
        private final int pending;

        private SchemaState(String version, int pending) {
            this.version = version;
            this.pending = pending;
        }
    }
}
