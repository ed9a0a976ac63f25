package com.flagship.reconciliation.safety;

import com.flagship.reconciliation.record.RecordFamily;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.UUID;

/**
 * Everything a run is allowed to do, fixed at start-up and passed by value into every
 * component that might mutate. Nothing consults global state to decide whether to write.
 */
@Value
@Builder(toBuilder = true)
public class RunConfig {
    @Builder.Default
    UUID runId = UUID.randomUUID();
    boolean writeEnabled;
    String overrideToken;
    /** Maximum number of applies for the run; {@code null} means unlimited. */
    Integer limit;
    Duration maxDuration;
    @Builder.Default
    RecordFamily direction = RecordFamily.LEDGER;

    public static RunConfig dryRun() {
        return RunConfig.builder().build();
    }

    public static RunConfig write() {
        return RunConfig.builder().writeEnabled(true).build();
    }

    public static RunConfig write(String overrideToken) {
        return RunConfig.builder().writeEnabled(true).overrideToken(overrideToken).build();
    }

    public String mode() {
        return writeEnabled ? "WRITE" : "DRY_RUN";
    }

    public boolean limitReached(int applies) {
        return limit != null && applies >= limit;
    }
}
