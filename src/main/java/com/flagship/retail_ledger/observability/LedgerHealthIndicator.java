package com.flagship.retail_ledger.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Reports whether the ledger store answers queries, with its row counts.
 * Used by readiness probes: without the store no operation can succeed.
 */
@Component("ledgerStore")
public class LedgerHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;

    public LedgerHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            Long accounts = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM accounts", Long.class);
            Long lastTransactionId = jdbcTemplate.queryForObject(
                "SELECT COALESCE(MAX(id), 0) FROM ledger_transactions", Long.class);

            return Health.up()
                    .withDetail("accounts", accounts)
                    .withDetail("lastTransactionId", lastTransactionId)
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                    .build();
        }
    }
}
