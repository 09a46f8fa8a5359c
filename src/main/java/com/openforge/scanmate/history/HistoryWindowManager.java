package com.openforge.scanmate.history;

import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.store.ConversationTurn;
import com.openforge.scanmate.store.ScanRecord;
import com.openforge.scanmate.support.TextLimits;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Builds the bounded message sequence sent to the model for one chat turn.
 *
 * Output shape:
 *
 *   [ system  ] preamble (+ digest of the most recent scan report, if any)
 *   [ history ] the most recent stored turns, holding at most N-1 user entries
 *   [ user    ] the pending message
 *
 * N is max-memory-turns; the pending message counts toward it.  Every method
 * is side-effect free: the same stored history always yields the same output.
 */
@Component
public class HistoryWindowManager {

    static final String PREAMBLE =
            "You are Mr. White, a security assistant specializing in detecting phishing, scams, "
            + "and cybersecurity threats. You are knowledgeable, concise, and focused on security. "
            + "You should respond to user questions by providing clear, actionable security advice. "
            + "Keep answers brief but helpful. If you don't know something, admit it rather than speculating.";

    private final int maxMemoryTurns;
    private final int scanDigestChars;

    @Autowired
    public HistoryWindowManager(GatewayProperties properties) {
        this(properties.memory().maxMemoryTurns(), properties.memory().scanDigestChars());
    }

    HistoryWindowManager(int maxMemoryTurns, int scanDigestChars) {
        this.maxMemoryTurns  = maxMemoryTurns;
        this.scanDigestChars = scanDigestChars;
    }

    /** Full model input for a chat turn: preamble, windowed history, pending message. */
    public List<Message> buildPrompt(List<ConversationTurn> history,
                                     List<ScanRecord> scans,
                                     String pendingUserMessage) {
        List<Message> messages = new ArrayList<>();
        messages.add(Message.system(systemPreamble(scans)));
        for (ConversationTurn turn : recentWindow(history, maxMemoryTurns - 1)) {
            messages.add(turn.toMessage());
        }
        messages.add(Message.user(pendingUserMessage));
        return messages;
    }

    /**
     * Walks {@code history} from the newest entry backwards until {@code userTurns}
     * user entries are collected; assistant entries ride along without counting.
     * The result is in chronological order.
     */
    public static List<ConversationTurn> recentWindow(List<ConversationTurn> history, int userTurns) {
        LinkedList<ConversationTurn> window = new LinkedList<>();
        if (history == null || userTurns <= 0) {
            return window;
        }
        int count = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationTurn turn = history.get(i);
            window.addFirst(turn);
            if (turn.isUser()) {
                count++;
            }
            if (count >= userTurns) {
                break;
            }
        }
        return window;
    }

    String systemPreamble(List<ScanRecord> scans) {
        if (scans == null || scans.isEmpty()) {
            return PREAMBLE;
        }
        ScanRecord latest = scans.get(scans.size() - 1);
        if (latest.result() == null || latest.result().isBlank()) {
            return PREAMBLE;
        }
        return PREAMBLE
                + "\n\nRecent scan results:\n"
                + TextLimits.truncate(latest.result(), scanDigestChars, "...")
                + "\n\nRefer to this information if the user asks about recent scans.";
    }
}
