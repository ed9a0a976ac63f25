package com.flagship.reconciliation.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flagship.reconciliation.balance.BalanceAudit;
import com.flagship.reconciliation.balance.BalanceCheck;
import com.flagship.reconciliation.balance.BalanceStatus;
import com.flagship.reconciliation.record.LinkCoverage;
import com.flagship.reconciliation.run.ReportOutcome;
import com.flagship.reconciliation.run.ReportRow;
import com.flagship.reconciliation.run.RunSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders run results for human reviewers: a console table through the log, plus
 * Markdown, CSV and JSON artifacts.
 *
 * Run reports carry one row per (record, candidate) and a match-rate section per record
 * family. Balance check reports carry one row per aggregate.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReportWriter {

    private static final DateTimeFormatter FILE_STAMP =
        DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);
    private static final String TABLE_HEADER = String.format("%-8s %12s %12s %-28s %10s  %-18s",
        "FAMILY", "RECORD", "CANDIDATE", "STRATEGY", "CONFIDENCE", "OUTCOME");

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;

    @FunctionalInterface
    private interface Renderer {
        String render(ReportFormat format) throws IOException;
    }

    public void printTable(RunSummary summary, List<LinkCoverage> coverage) {
        log.info("{} {} run {}: {} record(s) evaluated", summary.mode(), summary.getOperation(),
            summary.getRunId(), summary.evaluated());
        log.info(TABLE_HEADER);
        for (ReportRow row : summary.getRows()) {
            log.info(String.format("%-8s %12d %12s %-28s %10s  %-18s",
                row.getFamily(), row.getRecordId(), blankIfNull(row.getCandidateId()),
                blankIfNull(row.getStrategy()), blankIfNull(row.getConfidence()), row.getOutcome()));
        }
        for (ReportOutcome outcome : ReportOutcome.values()) {
            if (summary.count(outcome) > 0) {
                log.info("  {}: {}", outcome, summary.count(outcome));
            }
        }
        for (LinkCoverage family : coverage) {
            log.info("  {} matched {} ({}), unmatched {} ({}), match rate {}%", family.getFamily(),
                family.getMatchedCount(), family.getMatchedAmount(), family.getUnmatchedCount(),
                family.getUnmatchedAmount(), family.matchRate());
        }
    }

    /**
     * Writes one artifact per format into {@code directory}, creating it if needed.
     *
     * @return the files written
     */
    public List<Path> writeArtifacts(RunSummary summary, List<LinkCoverage> coverage, Path directory,
                                     Collection<ReportFormat> formats) {
        String baseName = String.format("reconciliation_%s_%s_%s",
            summary.getOperation().name().toLowerCase(Locale.ROOT),
            summary.mode().toLowerCase(Locale.ROOT),
            FILE_STAMP.format(summary.getStartedAt()));
        return write(directory, baseName, formats, format -> switch (format) {
            case MARKDOWN -> toMarkdown(summary, coverage);
            case CSV -> toCsv(summary);
            case JSON -> toJson(summary, coverage);
        });
    }

    public void printBalanceAudit(BalanceAudit audit) {
        log.info("Balance check at {}: {} aggregate(s), {} drifted", audit.getCheckedAt(),
            audit.getChecks().size(), audit.drifted().size());
        audit.countsByStatus().forEach((status, count) -> log.info("  {}: {}", status, count));
        for (BalanceCheck check : findings(audit)) {
            log.info(String.format("  aggregate %d (%s) %s%s owed %s stored balance %s computed %s",
                check.getAggregateId(), blankIfNull(check.getReserveNumber()), check.getStatus(),
                check.isDrifted() ? " DRIFTED" : "", check.getAmountOwed(), check.getStoredBalance(),
                check.getComputedBalance()));
        }
    }

    public List<Path> writeBalanceAudit(BalanceAudit audit, boolean writeEnabled, Path directory,
                                        Collection<ReportFormat> formats) {
        String mode = writeEnabled ? "write" : "dry_run";
        String baseName = String.format("reconciliation_balance_check_%s_%s", mode,
            FILE_STAMP.format(audit.getCheckedAt()));
        return write(directory, baseName, formats, format -> switch (format) {
            case MARKDOWN -> toMarkdown(audit, mode.toUpperCase(Locale.ROOT));
            case CSV -> toCsv(audit);
            case JSON -> toJson(audit, mode.toUpperCase(Locale.ROOT));
        });
    }

    private List<Path> write(Path directory, String baseName, Collection<ReportFormat> formats, Renderer renderer) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            for (ReportFormat format : formats) {
                Path target = directory.resolve(baseName + "." + format.extension());
                Files.writeString(target, renderer.render(format), StandardCharsets.UTF_8);
                written.add(target);
                log.info("Report written to {}", target.toAbsolutePath());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write report to " + directory, e);
        }
        return written;
    }

    String toCsv(RunSummary summary) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(ReportRow.class).withHeader();
        return csvMapper.writer(schema).writeValueAsString(summary.getRows());
    }

    String toJson(RunSummary summary, List<LinkCoverage> coverage) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("runId", summary.getRunId());
        document.put("operation", summary.getOperation());
        document.put("mode", summary.mode());
        document.put("direction", summary.getDirection());
        document.put("startedAt", summary.getStartedAt());
        document.put("finishedAt", summary.getFinishedAt());
        document.put("evaluated", summary.evaluated());
        document.put("counts", summary.getCounts());
        document.put("coverage", coverage);
        document.put("rows", summary.getRows());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    String toMarkdown(RunSummary summary, List<LinkCoverage> coverage) {
        StringBuilder md = new StringBuilder();
        md.append("# Reconciliation ").append(summary.getOperation()).append(" (").append(summary.mode())
            .append(")\n\n");
        md.append("- Run: `").append(summary.getRunId()).append("`\n");
        md.append("- Direction: ").append(summary.getDirection()).append('\n');
        md.append("- Started: ").append(summary.getStartedAt()).append('\n');
        md.append("- Finished: ").append(summary.getFinishedAt()).append('\n');
        md.append("- Records evaluated: ").append(summary.evaluated()).append("\n\n");

        md.append("## Counts\n\n| Outcome | Records |\n|---|---:|\n");
        for (ReportOutcome outcome : ReportOutcome.values()) {
            if (summary.count(outcome) > 0) {
                md.append("| ").append(outcome).append(" | ").append(summary.count(outcome)).append(" |\n");
            }
        }

        if (!coverage.isEmpty()) {
            md.append("\n## Match rate\n\n");
            md.append("| Family | Matched | Matched amount | Unmatched | Unmatched amount | Match rate |\n");
            md.append("|---|---:|---:|---:|---:|---:|\n");
            for (LinkCoverage family : coverage) {
                md.append("| ").append(family.getFamily())
                    .append(" | ").append(family.getMatchedCount())
                    .append(" | ").append(family.getMatchedAmount())
                    .append(" | ").append(family.getUnmatchedCount())
                    .append(" | ").append(family.getUnmatchedAmount())
                    .append(" | ").append(family.matchRate()).append("%")
                    .append(" |\n");
            }
        }

        md.append("\n## Rows\n\n");
        md.append("| Family | Record | Candidate | Strategy | Confidence | Outcome | Detail |\n");
        md.append("|---|---:|---:|---|---:|---|---|\n");
        for (ReportRow row : summary.getRows()) {
            md.append("| ").append(row.getFamily())
                .append(" | ").append(row.getRecordId())
                .append(" | ").append(blankIfNull(row.getCandidateId()))
                .append(" | ").append(blankIfNull(row.getStrategy()))
                .append(" | ").append(blankIfNull(row.getConfidence()))
                .append(" | ").append(row.getOutcome())
                .append(" | ").append(escape(row.getDetail()))
                .append(" |\n");
        }
        return md.toString();
    }

    String toCsv(BalanceAudit audit) throws IOException {
        CsvSchema schema = csvMapper.schemaFor(BalanceCheck.class).withHeader();
        return csvMapper.writer(schema).writeValueAsString(audit.getChecks());
    }

    String toJson(BalanceAudit audit, String mode) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("checkedAt", audit.getCheckedAt());
        document.put("mode", mode);
        document.put("aggregates", audit.getChecks().size());
        document.put("drifted", audit.drifted().size());
        document.put("statusCounts", audit.countsByStatus());
        document.put("checks", audit.getChecks());
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    String toMarkdown(BalanceAudit audit, String mode) {
        StringBuilder md = new StringBuilder();
        md.append("# Balance check (").append(mode).append(")\n\n");
        md.append("- Checked: ").append(audit.getCheckedAt()).append('\n');
        md.append("- Aggregates: ").append(audit.getChecks().size()).append('\n');
        md.append("- Drifted: ").append(audit.drifted().size()).append("\n\n");

        md.append("## Status\n\n| Status | Aggregates |\n|---|---:|\n");
        audit.countsByStatus().forEach((status, count) ->
            md.append("| ").append(status).append(" | ").append(count).append(" |\n"));

        md.append("\n## Findings\n\n");
        md.append("| Aggregate | Reserve | Status | Drifted | Owed | Stored balance | Computed balance |\n");
        md.append("|---:|---|---|---|---:|---:|---:|\n");
        for (BalanceCheck check : findings(audit)) {
            md.append("| ").append(check.getAggregateId())
                .append(" | ").append(escape(check.getReserveNumber()))
                .append(" | ").append(check.getStatus())
                .append(" | ").append(check.isDrifted() ? "yes" : "no")
                .append(" | ").append(check.getAmountOwed())
                .append(" | ").append(check.getStoredBalance())
                .append(" | ").append(check.getComputedBalance())
                .append(" |\n");
        }
        return md.toString();
    }

    /**
     * Aggregates a reviewer has to look at: stale caches, unpaid and overpaid charters.
     */
    private static List<BalanceCheck> findings(BalanceAudit audit) {
        return audit.getChecks().stream()
            .filter(check -> check.isDrifted()
                || check.getStatus() == BalanceStatus.UNPAID
                || check.getStatus() == BalanceStatus.OVERPAID)
            .toList();
    }

    private static String blankIfNull(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("|", "\\|").replace('\n', ' ');
    }
}
