package com.openforge.scanmate.scan;

/**
 * Result handed back to the caller of a scan.
 *
 * @param response normalised (or degraded) report text
 * @param url      the URL that was scanned, as requested
 * @param degraded true when analysis did not finish and the report was
 *                 synthesised from redirect information alone
 */
public record ScanReport(String response, String url, boolean degraded) {
}
