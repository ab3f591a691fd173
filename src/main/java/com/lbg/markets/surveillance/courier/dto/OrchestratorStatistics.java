package com.lbg.markets.surveillance.courier.dto;

/**
 * Orchestrator statistics snapshot.
 */
public class OrchestratorStatistics {
    public long totalProcessed;
    public long totalSuccessful;
    public long totalFailed;
    public long deadLettered;
    public long deadLetterFailures;
    public long droppedMalformed;
    public long duplicates;
    public long deferred;
    public long abandoned;
    public long retries;
    public long totalBytes;
    public double avgDurationSeconds;
    public double successRate;
    public int inFlight;

    @Override
    public String toString() {
        return String.format("processed=%d successful=%d failed=%d dlq=%d dlqFailures=%d malformed=%d "
                        + "duplicates=%d deferred=%d abandoned=%d retries=%d bytes=%d avgDuration=%.3fs "
                        + "successRate=%.2f%% inFlight=%d",
                totalProcessed, totalSuccessful, totalFailed, deadLettered, deadLetterFailures, droppedMalformed,
                duplicates, deferred, abandoned, retries, totalBytes, avgDurationSeconds, successRate, inFlight);
    }
}
