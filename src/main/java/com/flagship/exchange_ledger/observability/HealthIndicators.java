package com.flagship.exchange_ledger.observability;

import com.flagship.exchange_ledger.alert.LowBalanceMonitor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Custom health indicators for the exchange ledger.
 */
public class HealthIndicators {

    /**
     * Reports open low-balance alerts. Drawers running low is an operational
     * warning, not an outage.
     */
    @Component("lowBalanceHealth")
    public static class LowBalanceHealthIndicator implements HealthIndicator {

        private final LowBalanceMonitor lowBalanceMonitor;

        public LowBalanceHealthIndicator(LowBalanceMonitor lowBalanceMonitor) {
            this.lowBalanceMonitor = lowBalanceMonitor;
        }

        @Override
        public Health health() {
            try {
                long alerts = lowBalanceMonitor.countAlerts();
                Health.Builder builder = alerts == 0 ? Health.up() : Health.status("WARNING");
                return builder
                        .withDetail("lowBalanceAlerts", alerts)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis connectivity for the idempotency fast path. Replaces Boot's default
     * Redis indicator: without Redis the service falls back to the database,
     * so the status is DEGRADED rather than DOWN.
     */
    @Component("redisHealthIndicator")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Idempotency checks fall back to the database";

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            RedisConnectionFactory connectionFactory = redisTemplate.getConnectionFactory();
            if (connectionFactory == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "No connection factory configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }

            try (RedisConnection connection = connectionFactory.getConnection()) {
                String result = connection.ping();
                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.status("DEGRADED")
                        .withDetail("response", result != null ? result : "null")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }
}
