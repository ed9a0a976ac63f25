package com.flagship.reconciliation.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;

/**
 * Wipes every table between integration tests, including snapshot copies.
 */
public final class TestDatabase {

    private static final List<String> TABLES = List.of(
        "links", "audit_log", "snapshots", "unresolved_items", "reconciliation_runs",
        "ledger_transactions", "financial_records", "aggregates");

    private TestDatabase() {
    }

    public static void reset(JdbcTemplate jdbcTemplate) {
        List<String> snapshotTables = jdbcTemplate.queryForList(
            "SELECT table_name FROM information_schema.tables " +
            "WHERE LOWER(table_name) LIKE 'snap%' AND LOWER(table_name) <> 'snapshots'",
            String.class);
        for (String table : snapshotTables) {
            jdbcTemplate.execute("DROP TABLE " + table.toLowerCase());
        }
        for (String table : TABLES) {
            jdbcTemplate.update("DELETE FROM " + table);
        }
    }

    public static int count(JdbcTemplate jdbcTemplate, String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    public static BigDecimal balanceOf(JdbcTemplate jdbcTemplate, long aggregateId) {
        return jdbcTemplate.queryForObject("SELECT balance FROM aggregates WHERE id = ?", BigDecimal.class,
            aggregateId);
    }

    public static BigDecimal amountPaidOf(JdbcTemplate jdbcTemplate, long aggregateId) {
        return jdbcTemplate.queryForObject("SELECT amount_paid FROM aggregates WHERE id = ?", BigDecimal.class,
            aggregateId);
    }
}
