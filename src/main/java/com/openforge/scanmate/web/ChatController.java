package com.openforge.scanmate.web;

import com.openforge.scanmate.activity.ActivityLog;
import com.openforge.scanmate.chat.ChatService;
import com.openforge.scanmate.config.GatewayProperties;
import com.openforge.scanmate.store.UserIds;
import com.openforge.scanmate.task.OperationKind;
import com.openforge.scanmate.task.OperationOutcome;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Request/response chat and the free-form activity log.
 *
 * Endpoints:
 *   POST /api/chatbot  {user, message} → {status, data:{response}}
 *   POST /log          {user, message} → {status, data:{message}}
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController {

    public record ChatBody(
            @NotBlank(message = "Missing 'user' or 'message'") String user,
            @NotBlank(message = "Missing 'user' or 'message'") String message
    ) {}

    private final ChatService       chatService;
    private final OperationRunner   runner;
    private final ActivityLog       activityLog;
    private final GatewayProperties properties;

    @PostMapping("/api/chatbot")
    public ResponseEntity<ApiResponse> chat(@Valid @RequestBody ChatBody body) {
        String user    = UserIds.validate(body.user());
        String message = body.message().strip();

        OperationOutcome<String> outcome = runner.run(user, OperationKind.CHAT,
                ctx -> chatService.reply(user, message, ctx), properties.chat().deadline());
        log.info("[HTTP] Chat for {} → {}", user, outcome.status());
        return OperationRunner.respond(outcome, reply -> Map.of("response", reply));
    }

    @PostMapping("/log")
    public ApiResponse appendLog(@Valid @RequestBody ChatBody body) {
        String user = UserIds.validate(body.user());
        activityLog.record(user, body.message().strip());
        return ApiResponse.success(Map.of("message", "Logged"));
    }
}
