package com.flagship.reconciliation.cli;

import com.flagship.reconciliation.cli.CommandLineOptions.Command;
import com.flagship.reconciliation.record.RecordFamily;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @Test
    @DisplayName("No arguments means a dry-run match over ledger transactions")
    void defaults() {
        CommandLineOptions options = CommandLineOptions.parse();

        assertEquals(Command.MATCH, options.getCommand());
        assertFalse(options.isWrite());
        assertNull(options.getLimit());
        assertNull(options.getDirection());
        assertNull(options.getOverrideKey());
        assertTrue(options.getPurgeIds().isEmpty());
    }

    @Test
    @DisplayName("Valued options accept both --name=value and --name value")
    void valuedOptions() {
        CommandLineOptions options = CommandLineOptions.parse(
            "--write", "--limit", "25", "--direction=records", "--report-dir", "out/reports",
            "--override-key=ALLOW_DELETE_LINKS_20240301");

        assertTrue(options.isWrite());
        assertEquals(25, options.getLimit());
        assertEquals(RecordFamily.RECORDS, options.getDirection());
        assertEquals(Path.of("out/reports"), options.getReportDir());
        assertEquals("ALLOW_DELETE_LINKS_20240301", options.getOverrideKey());
    }

    @Test
    @DisplayName("Unlink needs a link id and a reason")
    void unlink() {
        UUID linkId = UUID.randomUUID();

        CommandLineOptions options = CommandLineOptions.parse(
            "--unlink=" + linkId, "--reason", "wrong charter", "--write");

        assertEquals(Command.UNLINK, options.getCommand());
        assertEquals(linkId, options.getUnlinkId());
        assertEquals("wrong charter", options.getReason());
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--unlink=" + linkId));
        assertThrows(IllegalArgumentException.class,
            () -> CommandLineOptions.parse("--unlink=not-a-uuid", "--reason=x"));
    }

    @Test
    @DisplayName("Purge takes a comma separated id list")
    void purge() {
        CommandLineOptions options = CommandLineOptions.parse("--purge-ledger=4, 7,9", "--reason=duplicate import");

        assertEquals(Command.PURGE_LEDGER, options.getCommand());
        assertEquals(List.of(4L, 7L, 9L), options.getPurgeIds());
        assertThrows(IllegalArgumentException.class,
            () -> CommandLineOptions.parse("--purge-ledger=4,x", "--reason=r"));
    }

    @Test
    @DisplayName("Balance verification is its own command and durations take ISO or simple form")
    void verifyBalancesAndDuration() {
        CommandLineOptions options = CommandLineOptions.parse("--verify-balances", "--max-duration", "PT2M");

        assertEquals(Command.VERIFY_BALANCES, options.getCommand());
        assertEquals(Duration.ofMinutes(2), options.getMaxDuration());
        assertEquals(Duration.ofSeconds(45), CommandLineOptions.parse("--max-duration=45s").getMaxDuration());
        assertNull(CommandLineOptions.parse().getMaxDuration());
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--max-duration=soon"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--max-duration=0s"));
        assertThrows(IllegalArgumentException.class,
            () -> CommandLineOptions.parse("--verify-balances", "--link-aggregates"));
    }

    @Test
    @DisplayName("Conflicting or malformed options are rejected")
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--write", "--dry-run"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--limit=-1"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--limit=ten"));
        assertThrows(IllegalArgumentException.class, () -> CommandLineOptions.parse("--direction=sideways"));
        assertThrows(IllegalArgumentException.class,
            () -> CommandLineOptions.parse("--link-aggregates", "--purge-ledger=1", "--reason=r"));
    }
}
