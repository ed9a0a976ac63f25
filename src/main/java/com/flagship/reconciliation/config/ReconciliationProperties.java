package com.flagship.reconciliation.config;

import com.flagship.reconciliation.matching.EvaluationMode;
import com.flagship.reconciliation.matching.MatchingPolicy;
import com.flagship.reconciliation.record.RecordFamily;
import com.flagship.reconciliation.report.ReportFormat;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings bound from {@code reconciliation.*}.
 *
 * Only read at start-up: the engine receives the immutable {@link MatchingPolicy}
 * and {@code RunConfig} built from these values.
 */
@ConfigurationProperties(prefix = "reconciliation")
@Getter
@Setter
public class ReconciliationProperties {

    private Matching matching = new Matching();
    private Safety safety = new Safety();
    private Run run = new Run();
    private Report report = new Report();
    private Cli cli = new Cli();

    public MatchingPolicy toMatchingPolicy() {
        return MatchingPolicy.builder()
            .narrowWindowDays(matching.narrowWindowDays)
            .intermediateWindowDays(matching.intermediateWindowDays)
            .wideWindowDays(matching.wideWindowDays)
            .amountTolerance(matching.amountTolerance)
            .maxCandidates(matching.maxCandidates)
            .autoApplyThreshold(matching.autoApplyThreshold)
            .tieMargin(matching.tieMargin)
            .datePenaltyPerDay(matching.datePenaltyPerDay)
            .amountPenaltyPerPercent(matching.amountPenaltyPerPercent)
            .minTextSimilarity(matching.minTextSimilarity)
            .evaluationMode(matching.evaluationMode)
            .build();
    }

    @Getter
    @Setter
    public static class Matching {
        private int narrowWindowDays = 3;
        private int intermediateWindowDays = 7;
        private int wideWindowDays = 30;
        private BigDecimal amountTolerance = new BigDecimal("0.05");
        private int maxCandidates = 50;
        private int autoApplyThreshold = 40;
        private int tieMargin = 20;
        private int datePenaltyPerDay = 1;
        private int amountPenaltyPerPercent = 2;
        private double minTextSimilarity = 0.30;
        private EvaluationMode evaluationMode = EvaluationMode.FIRST_ACCEPT;
        private Map<String, List<String>> descriptionAliases = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Safety {
        private String overrideTokenPrefix = "ALLOW_DELETE_";
        private List<String> protectedTables = new ArrayList<>(List.of(
            "ledger_transactions", "financial_records", "aggregates", "links", "audit_log"));
    }

    @Getter
    @Setter
    public static class Run {
        private RecordFamily direction = RecordFamily.LEDGER;
        private Integer limit;
        private Duration maxDuration = Duration.ofMinutes(30);
    }

    @Getter
    @Setter
    public static class Report {
        private Path directory = Path.of("reports");
        private List<ReportFormat> formats = new ArrayList<>(
            List.of(ReportFormat.MARKDOWN, ReportFormat.CSV, ReportFormat.JSON));
    }

    @Getter
    @Setter
    public static class Cli {
        private boolean enabled = true;
    }
}
