package com.flagship.reconciliation.safety;

import com.flagship.reconciliation.exception.OverrideTokenRequiredException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Checks override keys for destructive changes to protected tables.
 *
 * A key is only valid for one table on one calendar day:
 * {@code <prefix><TABLE>_<yyyyMMdd>}, e.g. {@code ALLOW_DELETE_LINKS_20120813}.
 */
public class OverrideTokenValidator {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private final String prefix;
    private final Clock clock;

    public OverrideTokenValidator(String prefix, Clock clock) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Override token prefix must not be blank");
        }
        this.prefix = prefix;
        this.clock = clock;
    }

    public String expectedToken(String table) {
        return tablePart(table) + LocalDate.now(clock).format(DAY);
    }

    public String expectedFormat(String table) {
        return tablePart(table) + "YYYYMMDD";
    }

    public boolean isValid(String table, String token) {
        return token != null && token.trim().equals(expectedToken(table));
    }

    public void requireValid(String table, String token) {
        if (!isValid(table, token)) {
            throw new OverrideTokenRequiredException(table, expectedFormat(table));
        }
    }

    private String tablePart(String table) {
        return prefix + table.toUpperCase(Locale.ROOT) + "_";
    }
}
