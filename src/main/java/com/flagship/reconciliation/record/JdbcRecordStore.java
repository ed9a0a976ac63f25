package com.flagship.reconciliation.record;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC-backed record store.
 *
 * Set-based SQL against the record tables; no ORM so that lookups stay on the
 * amount, (account, amount) and date indexes.
 */
@Repository
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private static final String LEDGER_COLUMNS =
        "lt.id, lt.account_id, lt.posting_date, lt.amount, lt.description, lt.natural_key, " +
        "lt.origin_reference, lt.link_id";

    private static final String RECORD_COLUMNS =
        "fr.id, fr.record_date, fr.amount, fr.nature, fr.natural_key, fr.account_id, fr.description, " +
        "fr.reserve_number, fr.aggregate_id, fr.origin_reference";

    private static final String AGGREGATE_COLUMNS =
        "a.id, a.reserve_number, a.charter_date, a.amount_owed, a.amount_paid, a.balance, a.cancelled";

    private static final String LEDGER_UNLINKED =
        "NOT EXISTS (SELECT 1 FROM links l WHERE l.ledger_transaction_id = lt.id)";

    private static final String RECORD_UNLINKED =
        "NOT EXISTS (SELECT 1 FROM links l WHERE l.financial_record_id = fr.id AND l.link_kind = 'LEDGER_TO_RECORD')";

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, NamedParameterJdbcTemplate namedJdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = namedJdbcTemplate;
    }

    @Override
    public Optional<LedgerTransaction> findLedgerTransaction(long id) {
        return jdbcTemplate.query(
            "SELECT " + LEDGER_COLUMNS + " FROM ledger_transactions lt WHERE lt.id = ?",
            ledgerRowMapper(), id
        ).stream().findFirst();
    }

    @Override
    public Optional<FinancialRecord> findFinancialRecord(long id) {
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM financial_records fr WHERE fr.id = ?",
            recordRowMapper(), id
        ).stream().findFirst();
    }

    @Override
    public Optional<Aggregate> findAggregate(long id) {
        return jdbcTemplate.query(
            "SELECT " + AGGREGATE_COLUMNS + " FROM aggregates a WHERE a.id = ?",
            aggregateRowMapper(), id
        ).stream().findFirst();
    }

    @Override
    public Optional<Aggregate> findAggregateByReserveNumber(String reserveNumber) {
        if (reserveNumber == null || reserveNumber.isBlank()) {
            return Optional.empty();
        }
        return jdbcTemplate.query(
            "SELECT " + AGGREGATE_COLUMNS + " FROM aggregates a WHERE a.reserve_number = ?",
            aggregateRowMapper(), reserveNumber.trim()
        ).stream().findFirst();
    }

    @Override
    public List<Aggregate> findAllAggregates() {
        return jdbcTemplate.query(
            "SELECT " + AGGREGATE_COLUMNS + " FROM aggregates a ORDER BY a.id",
            aggregateRowMapper());
    }

    @Override
    public LinkCoverage coverage(RecordFamily family) {
        String sql = family == RecordFamily.LEDGER
            ? coverageSql("ledger_transactions lt", "lt.amount", "NOT (" + LEDGER_UNLINKED + ")")
            : coverageSql("financial_records fr", "fr.amount", "NOT (" + RECORD_UNLINKED + ")");
        return jdbcTemplate.queryForObject(sql, (rs, rowNum) -> new LinkCoverage(
            family,
            rs.getInt("matched_count"),
            nonNull(rs.getBigDecimal("matched_amount")),
            rs.getInt("unmatched_count"),
            nonNull(rs.getBigDecimal("unmatched_amount"))));
    }

    private static String coverageSql(String table, String amount, String linked) {
        return "SELECT " +
            "COALESCE(SUM(CASE WHEN " + linked + " THEN 1 ELSE 0 END), 0) AS matched_count, " +
            "COALESCE(SUM(CASE WHEN " + linked + " THEN ABS(" + amount + ") ELSE 0 END), 0) AS matched_amount, " +
            "COALESCE(SUM(CASE WHEN " + linked + " THEN 0 ELSE 1 END), 0) AS unmatched_count, " +
            "COALESCE(SUM(CASE WHEN " + linked + " THEN 0 ELSE ABS(" + amount + ") END), 0) AS unmatched_amount " +
            "FROM " + table;
    }

    private static BigDecimal nonNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    @Override
    public List<LedgerTransaction> findLedgerTransactions(MatchCondition condition) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT ").append(LEDGER_COLUMNS)
            .append(" FROM ledger_transactions lt WHERE 1 = 1");
        appendAmountRange(sql, params, "lt.amount", condition);
        appendDateRange(sql, params, "lt.posting_date", condition);
        appendAccountAndText(sql, params, "lt", condition);
        if (condition.isExcludeLinked()) {
            sql.append(" AND ").append(LEDGER_UNLINKED);
        }
        appendLimit(sql, params, "lt", condition);
        return namedJdbcTemplate.query(sql.toString(), params, ledgerRowMapper());
    }

    @Override
    public List<FinancialRecord> findFinancialRecords(MatchCondition condition) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        StringBuilder sql = new StringBuilder("SELECT ").append(RECORD_COLUMNS)
            .append(" FROM financial_records fr WHERE 1 = 1");
        appendAmountRange(sql, params, "fr.amount", condition);
        appendDateRange(sql, params, "fr.record_date", condition);
        appendAccountAndText(sql, params, "fr", condition);
        if (condition.isExcludeLinked()) {
            sql.append(" AND ").append(RECORD_UNLINKED);
        }
        appendLimit(sql, params, "fr", condition);
        return namedJdbcTemplate.query(sql.toString(), params, recordRowMapper());
    }

    @Override
    public List<LedgerTransaction> findLedgerTransactionsByNaturalKey(String naturalKey, boolean excludeLinked) {
        if (naturalKey == null || naturalKey.isBlank()) {
            return List.of();
        }
        String sql = "SELECT " + LEDGER_COLUMNS + " FROM ledger_transactions lt WHERE lt.natural_key = ?" +
            (excludeLinked ? " AND " + LEDGER_UNLINKED : "") + " ORDER BY lt.id";
        return jdbcTemplate.query(sql, ledgerRowMapper(), naturalKey.trim());
    }

    @Override
    public List<FinancialRecord> findFinancialRecordsByNaturalKey(String naturalKey, boolean excludeLinked) {
        if (naturalKey == null || naturalKey.isBlank()) {
            return List.of();
        }
        String sql = "SELECT " + RECORD_COLUMNS + " FROM financial_records fr WHERE fr.natural_key = ?" +
            (excludeLinked ? " AND " + RECORD_UNLINKED : "") + " ORDER BY fr.id";
        return jdbcTemplate.query(sql, recordRowMapper(), naturalKey.trim());
    }

    @Override
    public List<Long> findUnlinkedLedgerTransactionIds() {
        return jdbcTemplate.queryForList(
            "SELECT lt.id FROM ledger_transactions lt WHERE " + LEDGER_UNLINKED + " ORDER BY lt.id",
            Long.class);
    }

    @Override
    public List<Long> findUnlinkedFinancialRecordIds() {
        return jdbcTemplate.queryForList(
            "SELECT fr.id FROM financial_records fr WHERE " + RECORD_UNLINKED + " ORDER BY fr.id",
            Long.class);
    }

    @Override
    public List<FinancialRecord> findRecordsAwaitingAggregate() {
        return jdbcTemplate.query(
            "SELECT " + RECORD_COLUMNS + " FROM financial_records fr " +
            "WHERE fr.reserve_number IS NOT NULL AND fr.aggregate_id IS NULL " +
            "AND NOT EXISTS (SELECT 1 FROM links l WHERE l.financial_record_id = fr.id " +
            "AND l.link_kind = 'RECORD_TO_AGGREGATE') ORDER BY fr.id",
            recordRowMapper());
    }

    @Override
    public boolean ledgerTransactionExists(long id) {
        return count("SELECT COUNT(*) FROM ledger_transactions WHERE id = ?", id) > 0;
    }

    @Override
    public boolean financialRecordExists(long id) {
        return count("SELECT COUNT(*) FROM financial_records WHERE id = ?", id) > 0;
    }

    @Override
    public boolean aggregateExists(long id) {
        return count("SELECT COUNT(*) FROM aggregates WHERE id = ?", id) > 0;
    }

    @Override
    public void insertLedgerTransaction(LedgerTransaction transaction) {
        jdbcTemplate.update(
            "INSERT INTO ledger_transactions (id, account_id, posting_date, amount, description, natural_key, " +
            "origin_reference, link_id, imported_at) VALUES (?, ?, ?, ?, ?, ?, ?, NULL, CURRENT_TIMESTAMP)",
            transaction.getId(),
            transaction.getAccountId(),
            transaction.getPostingDate(),
            transaction.getAmount(),
            transaction.getDescription(),
            transaction.getNaturalKey(),
            transaction.getOriginReference()
        );
    }

    @Override
    public void insertFinancialRecord(FinancialRecord record) {
        jdbcTemplate.update(
            "INSERT INTO financial_records (id, record_date, amount, nature, natural_key, account_id, description, " +
            "reserve_number, aggregate_id, origin_reference, imported_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)",
            record.getId(),
            record.getRecordDate(),
            record.getAmount(),
            record.getNature().name(),
            record.getNaturalKey(),
            record.getAccountId(),
            record.getDescription(),
            record.getReserveNumber(),
            record.getAggregateId(),
            record.getOriginReference()
        );
    }

    @Override
    public void insertAggregate(Aggregate aggregate) {
        jdbcTemplate.update(
            "INSERT INTO aggregates (id, reserve_number, charter_date, amount_owed, amount_paid, balance, cancelled) " +
            "VALUES (?, ?, ?, ?, 0, ?, ?)",
            aggregate.getId(),
            aggregate.getReserveNumber(),
            aggregate.getCharterDate(),
            aggregate.getAmountOwed(),
            aggregate.getAmountOwed(),
            aggregate.isCancelled()
        );
    }

    @Override
    public void setLedgerLinkReference(long ledgerTransactionId, UUID linkId) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_transactions SET link_id = ? WHERE id = ?", linkId, ledgerTransactionId);
        if (updated != 1) {
            throw new IllegalArgumentException("Ledger transaction not found: " + ledgerTransactionId);
        }
    }

    @Override
    public void clearLedgerLinkReference(long ledgerTransactionId) {
        int updated = jdbcTemplate.update(
            "UPDATE ledger_transactions SET link_id = NULL WHERE id = ?", ledgerTransactionId);
        if (updated != 1) {
            throw new IllegalArgumentException("Ledger transaction not found: " + ledgerTransactionId);
        }
    }

    @Override
    public void assignAggregate(long financialRecordId, long aggregateId) {
        int updated = jdbcTemplate.update(
            "UPDATE financial_records SET aggregate_id = ? WHERE id = ?", aggregateId, financialRecordId);
        if (updated != 1) {
            throw new IllegalArgumentException("Financial record not found: " + financialRecordId);
        }
    }

    @Override
    public void clearAggregate(long financialRecordId) {
        int updated = jdbcTemplate.update(
            "UPDATE financial_records SET aggregate_id = NULL WHERE id = ?", financialRecordId);
        if (updated != 1) {
            throw new IllegalArgumentException("Financial record not found: " + financialRecordId);
        }
    }

    @Override
    public void updateAggregateBalance(long aggregateId, BigDecimal amountPaid, BigDecimal balance) {
        int updated = jdbcTemplate.update(
            "UPDATE aggregates SET amount_paid = ?, balance = ?, recalculated_at = CURRENT_TIMESTAMP WHERE id = ?",
            amountPaid, balance, aggregateId);
        if (updated != 1) {
            throw new IllegalArgumentException("Aggregate not found: " + aggregateId);
        }
    }

    @Override
    public int deleteLedgerTransactions(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return namedJdbcTemplate.update(
            "DELETE FROM ledger_transactions WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", ids));
    }

    private long count(String sql, Object... args) {
        Long count = jdbcTemplate.queryForObject(sql, Long.class, args);
        return count == null ? 0 : count;
    }

    private void appendAmountRange(StringBuilder sql, MapSqlParameterSource params, String column,
                                   MatchCondition condition) {
        if (condition.getMinAbsAmount() == null || condition.getMaxAbsAmount() == null) {
            return;
        }
        BigDecimal min = condition.getMinAbsAmount().max(BigDecimal.ZERO);
        BigDecimal max = condition.getMaxAbsAmount();
        sql.append(" AND (").append(column).append(" BETWEEN :minAmount AND :maxAmount OR ")
            .append(column).append(" BETWEEN :negMaxAmount AND :negMinAmount)");
        params.addValue("minAmount", min)
            .addValue("maxAmount", max)
            .addValue("negMaxAmount", max.negate())
            .addValue("negMinAmount", min.negate());
    }

    private void appendDateRange(StringBuilder sql, MapSqlParameterSource params, String column,
                                 MatchCondition condition) {
        if (condition.getFromDate() != null) {
            sql.append(" AND ").append(column).append(" >= :fromDate");
            params.addValue("fromDate", condition.getFromDate());
        }
        if (condition.getToDate() != null) {
            sql.append(" AND ").append(column).append(" <= :toDate");
            params.addValue("toDate", condition.getToDate());
        }
    }

    private void appendAccountAndText(StringBuilder sql, MapSqlParameterSource params, String alias,
                                      MatchCondition condition) {
        if (condition.getAccountId() != null) {
            sql.append(" AND ").append(alias).append(".account_id = :accountId");
            params.addValue("accountId", condition.getAccountId());
        }
        if (condition.getTextPattern() != null && !condition.getTextPattern().isBlank()) {
            sql.append(" AND LOWER(").append(alias).append(".description) LIKE :textPattern");
            params.addValue("textPattern", "%" + condition.getTextPattern().toLowerCase(Locale.ROOT) + "%");
        }
    }

    private void appendLimit(StringBuilder sql, MapSqlParameterSource params, String alias,
                             MatchCondition condition) {
        sql.append(" ORDER BY ").append(alias).append(".id");
        if (condition.getLimit() > 0) {
            sql.append(" LIMIT :limit");
            params.addValue("limit", condition.getLimit());
        }
    }

    private RowMapper<LedgerTransaction> ledgerRowMapper() {
        return (rs, rowNum) -> new LedgerTransaction(
            rs.getLong("id"),
            rs.getString("account_id"),
            rs.getObject("posting_date", LocalDate.class),
            rs.getBigDecimal("amount"),
            rs.getString("description"),
            rs.getString("natural_key"),
            rs.getString("origin_reference"),
            rs.getObject("link_id", UUID.class)
        );
    }

    private RowMapper<FinancialRecord> recordRowMapper() {
        return (rs, rowNum) -> {
            long aggregateId = rs.getLong("aggregate_id");
            Long aggregate = rs.wasNull() ? null : aggregateId;
            return new FinancialRecord(
                rs.getLong("id"),
                rs.getObject("record_date", LocalDate.class),
                rs.getBigDecimal("amount"),
                RecordNature.valueOf(rs.getString("nature")),
                rs.getString("natural_key"),
                rs.getString("account_id"),
                rs.getString("description"),
                rs.getString("reserve_number"),
                aggregate,
                rs.getString("origin_reference")
            );
        };
    }

    private RowMapper<Aggregate> aggregateRowMapper() {
        return (rs, rowNum) -> new Aggregate(
            rs.getLong("id"),
            rs.getString("reserve_number"),
            rs.getObject("charter_date", LocalDate.class),
            rs.getBigDecimal("amount_owed"),
            rs.getBigDecimal("amount_paid"),
            rs.getBigDecimal("balance"),
            rs.getBoolean("cancelled")
        );
    }
}
