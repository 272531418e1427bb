package com.flagship.exchange_ledger.support;

import com.flagship.exchange_ledger.balance.DrawerBalanceService;
import com.flagship.exchange_ledger.drawer.Drawer;
import com.flagship.exchange_ledger.drawer.DrawerService;
import com.flagship.exchange_ledger.operator.Operator;
import com.flagship.exchange_ledger.operator.OperatorRole;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Shared Spring context against a real PostgreSQL.
 *
 * The container is started once per JVM and never stopped by a test class, so
 * every subclass reuses the same cached application context. Redis is mocked
 * as always-miss; idempotency then rests on the database, as it does in
 * production when Redis is down. Kafka broadcasting is replaced by the logging notifier.
 */
@SpringBootTest(properties = {
    "exchange.broadcast.kafka.enabled=false",
    "metrics.refresh.interval=3600000"
})
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestBase {

    protected static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_exchange_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        POSTGRES.start();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @MockBean
    protected StringRedisTemplate redisTemplate;

    @Autowired
    protected DrawerService drawerService;

    @Autowired
    protected DrawerBalanceService drawerBalanceService;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    protected final Operator admin = Operator.of(UUID.randomUUID(), OperatorRole.ADMIN);

    @BeforeEach
    @SuppressWarnings("unchecked")
    void stubRedisAsEmpty() {
        ValueOperations<String, String> values = mock(ValueOperations.class);
        when(values.get(anyString())).thenReturn(null);
        when(redisTemplate.opsForValue()).thenReturn(values);
    }

    /**
     * Creates a drawer with a unique name, assigned to {@code operatorId} when one is given.
     */
    protected Drawer newDrawer(UUID operatorId, BigDecimal lowBalanceThreshold) {
        Drawer drawer = drawerService.createDrawer(
            "Drawer " + UUID.randomUUID(), "Test branch", lowBalanceThreshold, admin);
        if (operatorId != null) {
            drawer = drawerService.assignDrawer(drawer.getId(), operatorId, admin);
        }
        return drawer;
    }

    protected Drawer newDrawer(UUID operatorId) {
        return newDrawer(operatorId, null);
    }

    protected void fund(UUID drawerId, String currency, String amount) {
        drawerBalanceService.deposit(drawerId, currency, new BigDecimal(amount), "Opening float", admin);
    }

    protected BigDecimal balanceOf(UUID drawerId, String currency) {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE((SELECT balance FROM drawer_balances WHERE drawer_id = ? AND currency_code = ?), 0.00)",
            BigDecimal.class, drawerId, currency);
    }

    protected long ledgerEntryCount(UUID drawerId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ledger_entries WHERE drawer_id = ?", Long.class, drawerId);
        return count != null ? count : 0L;
    }
}
