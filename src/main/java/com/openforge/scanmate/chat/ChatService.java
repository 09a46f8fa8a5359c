package com.openforge.scanmate.chat;

import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.history.HistoryWindowManager;
import com.openforge.scanmate.llm.GenerationOptions;
import com.openforge.scanmate.llm.ModelClient;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.store.ConversationTurn;
import com.openforge.scanmate.store.SessionStore;
import com.openforge.scanmate.support.ModelReplies;
import com.openforge.scanmate.support.TextLimits;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.OperationContext;
import com.openforge.scanmate.task.OperationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * One chat turn: window the stored conversation, ask the model, persist the
 * exchange.
 *
 * Only a successful reply is persisted, always as a user/assistant pair.
 * Chat never degrades: a timeout, cancellation or upstream failure is
 * returned as-is with a user-facing message.
 */
@Slf4j
@Service
public class ChatService {

    private final SessionStore         store;
    private final HistoryWindowManager windows;
    private final ModelClient          modelClient;
    private final ActivityLog          activityLog;
    private final Duration             modelTimeout;
    private final int                  replyLimit;

    public ChatService(SessionStore store,
                       HistoryWindowManager windows,
                       ModelClient modelClient,
                       ActivityLog activityLog,
                       GatewayProperties properties) {
        this.store        = store;
        this.windows      = windows;
        this.modelClient  = modelClient;
        this.activityLog  = activityLog;
        this.modelTimeout = properties.chat().modelTimeout();
        this.replyLimit   = properties.chat().replyLimit();
    }

    /** Runs inside an orchestrated operation; {@code user} is already validated. */
    public OperationOutcome<String> reply(String user, String message, OperationContext ctx) {
        List<Message> prompt = windows.buildPrompt(
                store.loadConversation(user), store.loadScans(user), message);
        activityLog.record(user, "User: " + message);
        log.debug("[Chat] {} → model with {} messages", user, prompt.size());

        OperationOutcome<String> generated = ctx.await("Model call",
                () -> modelClient.generate(prompt, GenerationOptions.CHAT), modelTimeout);
        if (!generated.isOk()) {
            OperationOutcome<String> failure = generated.withMessage(userFacingError(generated));
            activityLog.record(user, failure.message());
            log.warn("[Chat] {} reply {}: {}", user, generated.status(), generated.message());
            return failure;
        }
        if (ctx.isCancelled()) {
            return ctx.interruption();
        }

        String reply = normalise(generated.payload());
        store.appendExchange(user, ConversationTurn.user(message), ConversationTurn.assistant(reply));
        activityLog.record(user, "Response: " + reply);
        log.info("[Chat] {} replied ({} chars)", user, reply.length());
        return OperationOutcome.ok(reply);
    }

    String normalise(String raw) {
        String joined = String.join("\n\n", ModelReplies.cleanLines(raw));
        return TextLimits.capAtSentence(joined, replyLimit);
    }

    private String userFacingError(OperationOutcome<?> outcome) {
        return switch (outcome.status()) {
            case TIMED_OUT -> "Request timed out after %d seconds".formatted(modelTimeout.toSeconds());
            case CANCELLED -> outcome.message();
            default -> outcome.errorKind() == ErrorKind.UPSTREAM_UNAVAILABLE
                    ? "Sorry, the security assistant is unavailable right now. Please try again later."
                    : "Error processing request: " + outcome.message();
        };
    }
}
