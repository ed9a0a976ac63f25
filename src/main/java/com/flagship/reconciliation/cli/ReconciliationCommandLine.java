package com.flagship.reconciliation.cli;

import com.flagship.reconciliation.admin.LedgerAdministrationService;
import com.flagship.reconciliation.balance.BalanceAudit;
import com.flagship.reconciliation.balance.BalanceRecalculator;
import com.flagship.reconciliation.balance.BalanceRepair;
import com.flagship.reconciliation.config.ReconciliationProperties;
import com.flagship.reconciliation.link.LinkageLedger;
import com.flagship.reconciliation.record.LinkCoverage;
import com.flagship.reconciliation.run.AggregateLinker;
import com.flagship.reconciliation.run.ReconciliationRunner;
import com.flagship.reconciliation.run.RunSummary;
import com.flagship.reconciliation.report.ReportWriter;
import com.flagship.reconciliation.safety.AuditEntry;
import com.flagship.reconciliation.safety.GuardedResult;
import com.flagship.reconciliation.safety.RunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point. One invocation is one run.
 *
 * Exit code 0 on success, including "nothing to do" and runs with per-record failures
 * (those are reported, not fatal). Exit code 2 when an exception escapes the command.
 */
@Component
@ConditionalOnProperty(name = "reconciliation.cli.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ReconciliationCommandLine implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_UNRECOVERED = 2;

    private final ReconciliationProperties properties;
    private final ReconciliationRunner runner;
    private final AggregateLinker aggregateLinker;
    private final LinkageLedger linkageLedger;
    private final LedgerAdministrationService administration;
    private final BalanceRecalculator balanceRecalculator;
    private final ReportWriter reportWriter;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    int execute(String... rawArgs) {
        try {
            CommandLineOptions options = CommandLineOptions.parse(rawArgs);
            RunConfig config = toRunConfig(options);
            switch (options.getCommand()) {
                case MATCH -> report(runner.run(config, properties.toMatchingPolicy()), options);
                case LINK_AGGREGATES -> report(aggregateLinker.linkAll(config), options);
                case VERIFY_BALANCES -> verifyBalances(config, options);
                case UNLINK -> {
                    AuditEntry entry = linkageLedger.unlink(options.getUnlinkId(), options.getReason(), config);
                    log.info("Unlinked {}: audit entry {}, snapshot {}", options.getUnlinkId(), entry.getId(),
                        entry.getSnapshotName());
                }
                case PURGE_LEDGER -> {
                    GuardedResult<Integer> result = administration.purgeLedgerTransactions(
                        options.getPurgeIds(), options.getReason(), config);
                    log.info("Purged {} ledger transaction(s): audit entry {}, snapshot {}", result.getValue(),
                        result.getAuditEntry().getId(), result.getAuditEntry().getSnapshotName());
                }
            }
            return EXIT_OK;
        } catch (RuntimeException e) {
            log.error("Reconciliation command failed: {}", e.getMessage(), e);
            return EXIT_UNRECOVERED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    RunConfig toRunConfig(CommandLineOptions options) {
        ReconciliationProperties.Run run = properties.getRun();
        return RunConfig.builder()
            .writeEnabled(options.isWrite())
            .overrideToken(options.getOverrideKey())
            .limit(options.getLimit() != null ? options.getLimit() : run.getLimit())
            .maxDuration(options.getMaxDuration() != null ? options.getMaxDuration() : run.getMaxDuration())
            .direction(options.getDirection() != null ? options.getDirection() : run.getDirection())
            .build();
    }

    private void report(RunSummary summary, CommandLineOptions options) {
        List<LinkCoverage> coverage = runner.coverage();
        reportWriter.printTable(summary, coverage);
        reportWriter.writeArtifacts(summary, coverage, reportDirectory(options), properties.getReport().getFormats());
        if (summary.isWriteEnabled()) {
            log.info("Write run {} complete; guarded operations are recorded in the audit_log table",
                summary.getRunId());
        } else {
            log.info("Dry run {} complete; nothing was written. Re-run with --write to apply",
                summary.getRunId());
        }
    }

    private void verifyBalances(RunConfig config, CommandLineOptions options) {
        BalanceAudit audit;
        if (config.isWriteEnabled()) {
            BalanceRepair repair = balanceRecalculator.repairDrift(config);
            log.info("Balance check repaired {} aggregate(s){}", repair.getRepaired().size(),
                repair.audit().map(entry -> ", audit entry " + entry.getId()).orElse(""));
            audit = repair.getBefore();
        } else {
            audit = balanceRecalculator.verifyAll();
            if (!audit.isClean()) {
                log.info("Dry run found {} drifted balance(s). Re-run with --write to repair", audit.drifted().size());
            }
        }
        reportWriter.printBalanceAudit(audit);
        reportWriter.writeBalanceAudit(audit, config.isWriteEnabled(), reportDirectory(options),
            properties.getReport().getFormats());
    }

    private Path reportDirectory(CommandLineOptions options) {
        return options.getReportDir() != null ? options.getReportDir() : properties.getReport().getDirectory();
    }
}
