package com.openforge.scanmate.scan;

/** States of one scan run; the order of declaration is the happy path. */
public enum ScanStage {
    REDIRECT_CHECK,
    CONTENT_FETCH,
    ANALYZE,
    COMPLETE,
    FAILED
}
