package com.openforge.scanmate.connection;

import com.openforge.scanmate.task.OperationEvent;

/**
 * Everything that can wake a session's receive loop.  Client frames and
 * orchestrator events share one mailbox so the loop handles them strictly
 * one at a time, in arrival order.
 */
public sealed interface SessionSignal
        permits SessionSignal.InboundText, SessionSignal.OperationUpdate, SessionSignal.Disconnected {

    record InboundText(String text) implements SessionSignal {}

    record OperationUpdate(OperationEvent event) implements SessionSignal {}

    record Disconnected(String reason) implements SessionSignal {}
}
