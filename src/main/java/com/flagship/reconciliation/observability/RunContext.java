package com.flagship.reconciliation.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC bookkeeping for a reconciliation run.
 *
 * The run id stays in the MDC for the whole run; the record key is set while a
 * single record is evaluated. Callers must clear both in {@code finally}.
 */
public final class RunContext {

    public static final String RUN_ID_MDC_KEY = "runId";
    public static final String RECORD_MDC_KEY = "recordId";

    private RunContext() {
        // Utility class
    }

    public static void startRun(UUID runId) {
        MDC.put(RUN_ID_MDC_KEY, shortId(runId));
    }

    public static void enterRecord(Object family, long recordId) {
        MDC.put(RECORD_MDC_KEY, family + ":" + recordId);
    }

    public static void leaveRecord() {
        MDC.remove(RECORD_MDC_KEY);
    }

    public static void endRun() {
        MDC.remove(RECORD_MDC_KEY);
        MDC.remove(RUN_ID_MDC_KEY);
    }

    /**
     * First eight characters of the run id, enough to tell runs apart in a log file.
     */
    public static String shortId(UUID runId) {
        return runId == null ? "-" : runId.toString().substring(0, 8);
    }
}
