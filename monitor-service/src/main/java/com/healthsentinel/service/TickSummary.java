package com.healthsentinel.service;

/**
 * Outcome of one scheduler tick.
 */
public final class TickSummary {

    private static final TickSummary ABORTED = new TickSummary(0, 0, 0, true);

    private final int processed;
    private final int failed;
    private final int anomalies;
    private final boolean aborted;

    TickSummary(int processed, int failed, int anomalies) {
        this(processed, failed, anomalies, false);
    }

    private TickSummary(int processed, int failed, int anomalies, boolean aborted) {
        this.processed = processed;
        this.failed = failed;
        this.anomalies = anomalies;
        this.aborted = aborted;
    }

    /** A tick that ended before any entity was processed. */
    static TickSummary aborted() {
        return ABORTED;
    }

    /** Entities collected and checked without error. */
    public int getProcessed() {
        return processed;
    }

    public int getFailed() {
        return failed;
    }

    public int getAnomalies() {
        return anomalies;
    }

    public boolean isAborted() {
        return aborted;
    }

    @Override
    public String toString() {
        return "TickSummary{processed=" + processed + ", failed=" + failed
                + ", anomalies=" + anomalies + ", aborted=" + aborted + '}';
    }
}
