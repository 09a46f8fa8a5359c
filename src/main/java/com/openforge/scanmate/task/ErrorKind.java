package com.openforge.scanmate.task;

/**
 * Failure taxonomy shared by every layer of the gateway.
 *
 *   VALIDATION           - missing/invalid user or URL; surfaced, never logged as a system failure
 *   UPSTREAM_UNAVAILABLE - model service or page fetch unreachable; operation aborted, session unaffected
 *   TIMEOUT              - a deadline or stage budget was exceeded
 *   CANCELLED            - the owning connection went away; logged for diagnostics only
 *   INTERNAL             - unexpected defect; closes the connection with an internal-error code
 */
public enum ErrorKind {
    VALIDATION,
    UPSTREAM_UNAVAILABLE,
    TIMEOUT,
    CANCELLED,
    INTERNAL
}
