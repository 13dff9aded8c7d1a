package com.flagship.retail_ledger;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Status;
import org.springframework.jdbc.core.JdbcTemplate;

import com.flagship.retail_ledger.observability.LedgerHealthIndicator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class RetailLedgerApplicationTests extends PostgresIntegrationTest {

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private LedgerHealthIndicator ledgerHealthIndicator;

    @Test
    void contextLoads() {
        Integer migrations = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM flyway_schema_history WHERE success", Integer.class);
        assertNotNull(migrations);
        assertEquals(3, migrations);
    }

    @Test
    void ledgerStoreHealthIsUp() {
        assertEquals(Status.UP, ledgerHealthIndicator.health().getStatus());
    }
}
