package com.flagship.reconciliation.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.reconciliation.balance.BalanceAudit;
import com.flagship.reconciliation.balance.BalanceCheck;
import com.flagship.reconciliation.balance.BalanceStatus;
import com.flagship.reconciliation.config.JacksonConfig;
import com.flagship.reconciliation.record.LinkCoverage;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.run.ReportOutcome;
import com.flagship.reconciliation.run.ReportRow;
import com.flagship.reconciliation.run.RunOperation;
import com.flagship.reconciliation.run.RunSummary;
import com.flagship.reconciliation.matching.StrategyKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private static final List<LinkCoverage> COVERAGE = List.of(
        new LinkCoverage(RecordFamily.LEDGER, 1, new BigDecimal("300.00"), 2, new BigDecimal("81.00")),
        new LinkCoverage(RecordFamily.RECORDS, 0, BigDecimal.ZERO, 0, BigDecimal.ZERO));

    private final JacksonConfig jacksonConfig = new JacksonConfig();
    private final ObjectMapper objectMapper = jacksonConfig.objectMapper();
    private final ReportWriter writer = new ReportWriter(jacksonConfig.csvMapper(), objectMapper);

    @Test
    @DisplayName("Markdown, CSV and JSON artifacts are written with one row per record and candidate")
    void writesEveryArtifact(@TempDir Path directory) throws Exception {
        // Given
        RunSummary summary = summary();

        // When
        List<Path> written = writer.writeArtifacts(summary, COVERAGE, directory.resolve("nested"),
            List.of(ReportFormat.MARKDOWN, ReportFormat.CSV, ReportFormat.JSON));

        // Then
        assertEquals(3, written.size());
        assertEquals("reconciliation_match_write_20240305_090000.md", written.get(0).getFileName().toString());
        assertEquals("reconciliation_match_write_20240305_090000.csv", written.get(1).getFileName().toString());

        List<String> csv = Files.readAllLines(written.get(1), StandardCharsets.UTF_8);
        assertEquals("record_family,record_id,candidate_id,strategy,confidence,outcome,detail", csv.get(0));
        assertTrue(csv.get(1).startsWith("LEDGER,1,11,AMOUNT_DATE_NARROW,80,APPLIED,"), csv.get(1));
        assertTrue(csv.get(2).startsWith("LEDGER,2,,,,NO_CANDIDATE,"), csv.get(2));
        assertEquals(4, csv.stream().filter(line -> !line.isBlank()).count());

        String markdown = Files.readString(written.get(0), StandardCharsets.UTF_8);
        assertTrue(markdown.contains("# Reconciliation MATCH (WRITE)"));
        assertTrue(markdown.contains("| APPLIED | 1 |"));
        assertTrue(markdown.contains("| AMBIGUOUS | 1 |"));
        assertTrue(markdown.contains("- Records evaluated: 3"));
        assertTrue(markdown.contains("a \\| b"), "pipes in details are escaped");

        JsonNode json = objectMapper.readTree(written.get(2).toFile());
        assertEquals("reconciliation_match_write_20240305_090000.json", written.get(2).getFileName().toString());
        assertEquals("WRITE", json.get("mode").asText());
        assertEquals("2024-03-05T09:00:00Z", json.get("startedAt").asText());
        assertEquals(3, json.get("rows").size());
        assertEquals(11, json.get("rows").get(0).get("candidate_id").asLong());
        assertEquals(1, json.get("counts").get("APPLIED").asInt());
    }

    @Test
    @DisplayName("The match-rate section reports linked and unlinked counts, amounts and percentage per family")
    void matchRateSection() {
        // When
        String markdown = writer.toMarkdown(summary(), COVERAGE);

        // Then
        assertTrue(markdown.contains("## Match rate"));
        assertTrue(markdown.contains("| LEDGER | 1 | 300.00 | 2 | 81.00 | 33.3% |"), markdown);
        assertTrue(markdown.contains("| RECORDS | 0 | 0 | 0 | 0 | 0.0% |"), markdown);
    }

    @Test
    @DisplayName("Without coverage figures the match-rate section is left out")
    void noCoverageNoSection() {
        assertFalse(writer.toMarkdown(summary(), List.of()).contains("## Match rate"));
    }

    @Test
    @DisplayName("A balance check report lists drifted, unpaid and overpaid aggregates")
    void balanceAuditArtifacts(@TempDir Path directory) throws Exception {
        // Given: one settled, one drifted, one unpaid and one overpaid charter
        BalanceAudit audit = new BalanceAudit(Instant.parse("2024-03-05T09:00:00Z"), List.of(
            check(1, "019000", BalanceStatus.SETTLED, false, "100.00", "100.00", "0.00", "100.00", "0.00"),
            check(2, "019001", BalanceStatus.PARTIALLY_PAID, true, "200.00", "0.00", "200.00", "50.00", "150.00"),
            check(3, "019002", BalanceStatus.UNPAID, false, "75.00", "0.00", "75.00", "0.00", "75.00"),
            check(4, "019003", BalanceStatus.OVERPAID, false, "60.00", "80.00", "-20.00", "80.00", "-20.00")));

        // When
        List<Path> written = writer.writeBalanceAudit(audit, false, directory,
            List.of(ReportFormat.MARKDOWN, ReportFormat.CSV, ReportFormat.JSON));

        // Then
        assertEquals("reconciliation_balance_check_dry_run_20240305_090000.md",
            written.get(0).getFileName().toString());

        String markdown = Files.readString(written.get(0), StandardCharsets.UTF_8);
        assertTrue(markdown.contains("# Balance check (DRY_RUN)"));
        assertTrue(markdown.contains("- Drifted: 1"));
        assertTrue(markdown.contains("| 2 | 019001 | PARTIALLY_PAID | yes | 200.00 | 200.00 | 150.00 |"), markdown);
        assertTrue(markdown.contains("| 3 | 019002 | UNPAID | no |"));
        assertTrue(markdown.contains("| 4 | 019003 | OVERPAID | no |"));
        assertFalse(markdown.contains("| 1 | 019000 |"), "settled, current aggregates are not findings");

        List<String> csv = Files.readAllLines(written.get(1), StandardCharsets.UTF_8);
        assertEquals("aggregate_id,reserve_number,status,drifted,amount_owed,stored_paid,stored_balance,"
            + "computed_paid,computed_balance", csv.get(0));
        assertEquals(5, csv.stream().filter(line -> !line.isBlank()).count());

        JsonNode json = objectMapper.readTree(written.get(2).toFile());
        assertEquals(1, json.get("drifted").asInt());
        assertEquals(1, json.get("statusCounts").get("OVERPAID").asInt());
        assertEquals(4, json.get("checks").size());
    }

    @Test
    @DisplayName("An empty run renders without data rows")
    void emptyRun() throws Exception {
        Instant now = Instant.parse("2024-03-05T09:00:00Z");
        RunSummary empty = new RunSummary(UUID.randomUUID(), RunOperation.LINK_AGGREGATES, false,
            RecordFamily.RECORDS, now, now, List.of(), Map.of());

        String csv = writer.toCsv(empty);

        assertFalse(csv.contains("RECORDS,"));
        assertTrue(writer.toMarkdown(empty, List.of()).contains("- Records evaluated: 0"));
    }

    private static BalanceCheck check(long id, String reserve, BalanceStatus status, boolean drifted, String owed,
                                      String storedPaid, String storedBalance, String paid, String balance) {
        return new BalanceCheck(id, reserve, status, drifted, new BigDecimal(owed), new BigDecimal(storedPaid),
            new BigDecimal(storedBalance), new BigDecimal(paid), new BigDecimal(balance));
    }

    private static RunSummary summary() {
        Map<ReportOutcome, Integer> counts = new EnumMap<>(ReportOutcome.class);
        counts.put(ReportOutcome.APPLIED, 1);
        counts.put(ReportOutcome.NO_CANDIDATE, 1);
        counts.put(ReportOutcome.AMBIGUOUS, 1);
        List<ReportRow> rows = List.of(
            new ReportRow(RecordFamily.LEDGER, 1, 11L, StrategyKind.AMOUNT_DATE_NARROW, 80, ReportOutcome.APPLIED,
                "link"),
            ReportRow.withoutCandidate(RecordFamily.LEDGER, 2, ReportOutcome.NO_CANDIDATE, "none"),
            new ReportRow(RecordFamily.LEDGER, 3, 12L, StrategyKind.AMOUNT_DATE_NARROW, 80, ReportOutcome.AMBIGUOUS,
                "a | b"));
        return new RunSummary(UUID.fromString("00000000-0000-0000-0000-000000000001"), RunOperation.MATCH, true,
            RecordFamily.LEDGER, Instant.parse("2024-03-05T09:00:00Z"), Instant.parse("2024-03-05T09:00:04Z"),
            rows, counts);
    }
}
