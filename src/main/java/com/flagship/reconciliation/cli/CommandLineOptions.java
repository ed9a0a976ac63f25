package com.flagship.reconciliation.cli;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.convert.DurationStyle;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Parsed command line.
 *
 * <pre>
 * --dry-run (default) | --write
 * --limit=N  --max-duration=DURATION  --override-key=TOKEN  --direction=LEDGER|RECORDS  --report-dir=PATH
 * --link-aggregates
 * --verify-balances
 * --unlink=LINK_ID --reason=TEXT
 * --purge-ledger=ID[,ID...] --reason=TEXT
 * </pre>
 *
 * Valued options may also be written with a space ({@code --limit 25}). Durations take the
 * ISO-8601 form ({@code PT10M}) or a simple one ({@code 10m}, {@code 90s}).
 * {@code --verify-balances} only reports drift in a dry run and repairs it with {@code --write}.
 */
@Value
public class CommandLineOptions {

    private static final Set<String> VALUED = Set.of(
        "--limit", "--max-duration", "--override-key", "--direction", "--report-dir", "--unlink", "--reason", "--purge-ledger");

    public enum Command {
        MATCH,
        LINK_AGGREGATES,
        VERIFY_BALANCES,
        UNLINK,
        PURGE_LEDGER
    }

    Command command;
    boolean write;
    Integer limit;
    Duration maxDuration;
    String overrideKey;
    RecordFamily direction;
    Path reportDir;
    UUID unlinkId;
    List<Long> purgeIds;
    String reason;

    public static CommandLineOptions parse(String... rawArgs) {
        ApplicationArguments args = new DefaultApplicationArguments(normalize(rawArgs));

        if (args.containsOption("write") && args.containsOption("dry-run")) {
            throw new IllegalArgumentException("--write and --dry-run are mutually exclusive");
        }
        boolean write = args.containsOption("write");

        Integer limit = single(args, "limit") == null ? null : parseLimit(single(args, "limit"));
        Duration maxDuration = single(args, "max-duration") == null
            ? null
            : parseDuration(single(args, "max-duration"));
        String direction = single(args, "direction");
        String reportDir = single(args, "report-dir");
        String reason = single(args, "reason");

        List<String> commands = new ArrayList<>();
        if (args.containsOption("link-aggregates")) {
            commands.add("--link-aggregates");
        }
        if (args.containsOption("verify-balances")) {
            commands.add("--verify-balances");
        }
        if (args.containsOption("unlink")) {
            commands.add("--unlink");
        }
        if (args.containsOption("purge-ledger")) {
            commands.add("--purge-ledger");
        }
        if (commands.size() > 1) {
            throw new IllegalArgumentException("Only one of " + commands + " may be given");
        }

        Command command = Command.MATCH;
        UUID unlinkId = null;
        List<Long> purgeIds = List.of();
        if (args.containsOption("link-aggregates")) {
            command = Command.LINK_AGGREGATES;
        } else if (args.containsOption("verify-balances")) {
            command = Command.VERIFY_BALANCES;
        } else if (args.containsOption("unlink")) {
            command = Command.UNLINK;
            unlinkId = parseUuid(required(args, "unlink"));
            requireReason(reason, "--unlink");
        } else if (args.containsOption("purge-ledger")) {
            command = Command.PURGE_LEDGER;
            purgeIds = parseIds(required(args, "purge-ledger"));
            requireReason(reason, "--purge-ledger");
        }

        return new CommandLineOptions(
            command,
            write,
            limit,
            maxDuration,
            single(args, "override-key"),
            direction == null ? null : parseDirection(direction),
            reportDir == null ? null : Path.of(reportDir),
            unlinkId,
            purgeIds,
            reason
        );
    }

    static String[] normalize(String... rawArgs) {
        List<String> joined = new ArrayList<>();
        for (int i = 0; i < rawArgs.length; i++) {
            String arg = rawArgs[i];
            if (VALUED.contains(arg) && i + 1 < rawArgs.length && !rawArgs[i + 1].startsWith("--")) {
                joined.add(arg + "=" + rawArgs[++i]);
            } else {
                joined.add(arg);
            }
        }
        return joined.toArray(new String[0]);
    }

    private static String single(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return null;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("--" + name + " needs a value");
        }
        if (values.size() > 1) {
            throw new IllegalArgumentException("--" + name + " given more than once");
        }
        return values.get(0).trim();
    }

    private static String required(ApplicationArguments args, String name) {
        String value = single(args, name);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("--" + name + " needs a value");
        }
        return value;
    }

    private static int parseLimit(String value) {
        try {
            int limit = Integer.parseInt(value);
            if (limit < 0) {
                throw new IllegalArgumentException("--limit must not be negative: " + value);
            }
            return limit;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit must be a number: " + value, e);
        }
    }

    private static Duration parseDuration(String value) {
        Duration duration;
        try {
            duration = DurationStyle.detectAndParse(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--max-duration must be a duration such as PT10M or 10m: " + value, e);
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException("--max-duration must be positive: " + value);
        }
        return duration;
    }

    private static RecordFamily parseDirection(String value) {
        try {
            return RecordFamily.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--direction must be one of " + Arrays.toString(RecordFamily.values())
                + ": " + value, e);
        }
    }

    private static UUID parseUuid(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("--unlink must be a link id: " + value, e);
        }
    }

    private static List<Long> parseIds(String value) {
        try {
            return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .map(Long::valueOf)
                .toList();
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--purge-ledger must be a comma separated id list: " + value, e);
        }
    }

    private static void requireReason(String reason, String option) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException(option + " requires --reason=TEXT");
        }
    }
}
