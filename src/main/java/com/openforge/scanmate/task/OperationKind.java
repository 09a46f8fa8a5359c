package com.openforge.scanmate.task;

/** At most one operation of each kind may be outstanding per session. */
public enum OperationKind {
    CHAT,
    SCAN
}
