package com.openforge.scanmate.task;

/** Why an operation's cancellation signal fired. */
public enum CancelReason {

    /** The absolute deadline passed. */
    DEADLINE,

    /** The owning connection was lost or closed. */
    DISCONNECTED,

    /** A caller asked for it explicitly. */
    REQUESTED
}
