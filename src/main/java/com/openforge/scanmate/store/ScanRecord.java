package com.openforge.scanmate.store;

import java.time.Instant;

/**
 * Persisted outcome of analysing one URL.
 *
 * @param page       the URL the user asked about
 * @param redirects  human-readable redirect description ("No", "Yes - a -> b", ...)
 * @param statusCode HTTP status of the content fetch, null when never fetched
 * @param result     normalised report text
 * @param scannedAt  when the record was written
 */
public record ScanRecord(
        String  page,
        String  redirects,
        Integer statusCode,
        String  result,
        Instant scannedAt
) {

    public ScanRecord withResult(String newResult) {
        return new ScanRecord(page, redirects, statusCode, newResult, scannedAt);
    }
}
