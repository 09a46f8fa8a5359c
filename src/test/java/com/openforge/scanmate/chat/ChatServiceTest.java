package com.openforge.scanmate.chat;

import com.openforge.scanmate.FakeModelClient;
import com.openforge.scanmate.PropertiesFixture;
import com.openforge.scanmate.RuntimeFixture;
import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.config.JacksonConfig;
import com.openforge.scanmate.history.HistoryWindowManager;
import com.openforge.scanmate.llm.model.Message;
import com.openforge.scanmate.store.ConversationTurn;
import com.openforge.scanmate.store.JsonFileSessionStore;
import com.openforge.scanmate.store.ScanRecord;
import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;
import com.openforge.scanmate.task.OperationKind;
import com.openforge.scanmate.task.OperationOutcome;
import com.openforge.scanmate.task.OperationScope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatServiceTest {

    private static final String USER = "bob";

    @TempDir
    Path dataDir;

    private final FakeModelClient model = new FakeModelClient();

    private RuntimeFixture       runtime;
    private OperationScope       scope;
    private JsonFileSessionStore store;
    private ChatService          chat;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = PropertiesFixture.builder()
                .dataDir(dataDir)
                .maxMemoryTurns(3)
                .modelTimeout(Duration.ofSeconds(1))
                .chatDeadline(Duration.ofSeconds(3))
                .build();
        runtime = new RuntimeFixture(properties);
        scope   = runtime.orchestrator().openScope("chat:test");
        store   = new JsonFileSessionStore(new JacksonConfig().objectMapper(), properties);
        chat    = new ChatService(store, new HistoryWindowManager(properties), model,
                new ActivityLog(properties, Clock.systemUTC()), properties);
    }

    @AfterEach
    void tearDown() {
        scope.close();
        runtime.close();
    }

    @Test
    @DisplayName("A reply is persisted as a user/assistant pair and logged")
    void reply_persistsExchange() throws Exception {
        model.replying("Use a password manager.</s>");

        OperationOutcome<String> outcome = ask("How do I store passwords?");

        assertTrue(outcome.isOk());
        assertEquals("Use a password manager.", outcome.payload());
        assertEquals(List.of(ConversationTurn.user("How do I store passwords?"),
                        ConversationTurn.assistant("Use a password manager.")),
                store.loadConversation(USER));

        String activity = Files.readString(dataDir.resolve(USER + ".txt"));
        assertTrue(activity.contains("User: How do I store passwords?"));
        assertTrue(activity.contains("Response: Use a password manager."));
    }

    @Test
    @DisplayName("The prompt carries the scan digest, the stored history and the pending message")
    void reply_buildsPromptFromHistoryAndScans() {
        store.appendExchange(USER, ConversationTurn.user("hi"), ConversationTurn.assistant("hello"));
        store.appendScan(USER, new ScanRecord("http://example.com", "No", 200,
                "Threat Level: Safe", Instant.now()));

        ask("Was that site safe?");

        List<Message> prompt = model.lastPrompt();
        assertEquals(4, prompt.size());
        assertEquals(Message.SYSTEM, prompt.get(0).role());
        assertTrue(prompt.get(0).content().contains("Recent scan results:\nThreat Level: Safe"));
        assertEquals(Message.user("hi"), prompt.get(1));
        assertEquals(Message.assistant("hello"), prompt.get(2));
        assertEquals(Message.user("Was that site safe?"), prompt.get(3));
    }

    @Test
    void reply_dropsBlankLinesAndSeparatesParagraphs() {
        model.replying("  First point.  \n\n\n   Second point.\n");

        assertEquals("First point.\n\nSecond point.", ask("tips?").payload());
    }

    @Test
    void reply_timeoutIsReportedAndNothingPersisted() {
        model.delayedBy(Duration.ofSeconds(3));

        OperationOutcome<String> outcome = ask("slow question");

        assertEquals(OperationOutcome.Status.TIMED_OUT, outcome.status());
        assertEquals("Request timed out after 1 seconds", outcome.message());
        assertTrue(store.loadConversation(USER).isEmpty());
    }

    @Test
    void reply_upstreamFailureUsesApology() {
        model.failing(new GatewayException(ErrorKind.UPSTREAM_UNAVAILABLE, "503 from provider"));

        OperationOutcome<String> outcome = ask("anyone there?");

        assertEquals(ErrorKind.UPSTREAM_UNAVAILABLE, outcome.errorKind());
        assertEquals("Sorry, the security assistant is unavailable right now. Please try again later.",
                outcome.message());
        assertTrue(store.loadConversation(USER).isEmpty());
    }

    @Test
    void reply_unexpectedFailureIsDescribed() {
        model.failing(new IllegalStateException("unparseable body"));

        OperationOutcome<String> outcome = ask("hello?");

        assertEquals(ErrorKind.INTERNAL, outcome.errorKind());
        assertEquals("Error processing request: Model call failed: unparseable body", outcome.message());
    }

    private OperationOutcome<String> ask(String message) {
        return scope.awaitResult(scope.start(OperationKind.CHAT,
                ctx -> chat.reply(USER, message, ctx), Duration.ofSeconds(3)));
    }
}
