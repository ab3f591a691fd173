package com.lbg.markets.surveillance.courier.model;

/**
 * Outcome of one successful transfer attempt.
 *
 * @param bytesTransferred bytes written to the destination
 * @param durationSeconds  attempt wall time
 * @param checksumSha256   hex SHA-256 of the transferred bytes
 */
public record TransferResult(long bytesTransferred, double durationSeconds, String checksumSha256) {
}
