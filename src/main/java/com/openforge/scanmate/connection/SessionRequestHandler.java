package com.openforge.scanmate.connection;

import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.chat.ChatService;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.connection.frame.InboundFrame;
import com.openforge.scanmate.connection.frame.OutboundFrame;
import com.openforge.scanmate.scan.ScanPipeline;
import com.openforge.scanmate.scan.ScanReport;
import com.openforge.scanmate.scan.ScanTargets;
import com.openforge.scanmate.store.UserIds;
import com.openforge.scanmate.task.OperationBusyException;
import com.openforge.scanmate.task.OperationEvent;
import com.openforge.scanmate.task.OperationKind;
import com.openforge.scanmate.task.OperationOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Maps domain frames onto orchestrated operations and operation events back
 * onto frames.
 *
 *   ChatRequest → {typing:true}                       → CHAT op → {response} | {error}
 *   ScanRequest → {processing:true, status:"Starting"} → SCAN op → {status}* → {response, url} | {error}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRequestHandler {

    static final List<String> SCAN_STAGES = List.of("Processing content...", "Analyzing security aspects...");

    private final ChatService       chatService;
    private final ScanPipeline      scanPipeline;
    private final ActivityLog       activityLog;
    private final GatewayProperties properties;

    /**
     * Validates {@code frame}, sends its acknowledgement through {@code out},
     * then starts the operation.  Events of the operation come back through
     * the session's mailbox.
     *
     * @throws com.openforge.scanmate.task.ValidationException on a bad user or URL
     * @throws OperationBusyException if an operation of the same kind is in flight
     */
    void start(ClientSession session, InboundFrame frame, Consumer<OutboundFrame> out) {
        if (frame instanceof InboundFrame.ChatRequest chat) {
            startChat(session, chat, out);
        } else if (frame instanceof InboundFrame.ScanRequest scan) {
            startScan(session, scan, out);
        } else {
            throw new IllegalArgumentException("Not a domain frame: " + frame);
        }
    }

    private void startChat(ClientSession session, InboundFrame.ChatRequest request, Consumer<OutboundFrame> out) {
        String user = UserIds.validate(request.user());
        ensureIdle(session, OperationKind.CHAT);
        bind(session, user);

        out.accept(OutboundFrame.Typing.INSTANCE);
        session.operations().start(OperationKind.CHAT,
                ctx -> chatService.reply(user, request.message(), ctx),
                properties.chat().deadline(),
                List.of(),
                listenerFor(session));
        log.debug("[Conn:{}] Chat started for {}", session.id(), user);
    }

    private void startScan(ClientSession session, InboundFrame.ScanRequest request, Consumer<OutboundFrame> out) {
        String user = UserIds.validate(request.user());
        URI target = ScanTargets.lenient(request.url());
        ensureIdle(session, OperationKind.SCAN);
        bind(session, user);

        out.accept(OutboundFrame.Processing.started());
        session.operations().start(OperationKind.SCAN,
                ctx -> scanPipeline.run(user, target, ctx),
                properties.scan().deadline(),
                SCAN_STAGES,
                listenerFor(session));
        log.debug("[Conn:{}] Scan of {} started for {}", session.id(), target, user);
    }

    /** Frame for an operation event; empty when the client should not hear about it. */
    Optional<OutboundFrame> render(OperationEvent event) {
        if (event instanceof OperationEvent.Progress progress) {
            return Optional.of(new OutboundFrame.Progress(progress.stage()));
        }
        OperationOutcome<?> outcome = ((OperationEvent.Completed) event).outcome();
        if (outcome.isOk()) {
            return Optional.of(switch (event.kind()) {
                case CHAT -> new OutboundFrame.ChatReply((String) outcome.payload());
                case SCAN -> {
                    ScanReport report = (ScanReport) outcome.payload();
                    yield new OutboundFrame.ScanReply(report.response(), report.url());
                }
            });
        }
        if (outcome.status() == OperationOutcome.Status.CANCELLED) {
            return Optional.empty();
        }
        return Optional.of(new OutboundFrame.ErrorFrame(outcome.message()));
    }

    private void ensureIdle(ClientSession session, OperationKind kind) {
        if (session.operations().outstanding(kind).isPresent()) {
            throw new OperationBusyException(kind);
        }
    }

    private void bind(ClientSession session, String user) {
        if (session.userId().isEmpty()) {
            activityLog.record(user, "WebSocket connected");
        }
        session.bindUser(user);
    }

    private static Consumer<OperationEvent> listenerFor(ClientSession session) {
        return event -> session.deliver(new SessionSignal.OperationUpdate(event));
    }
}
