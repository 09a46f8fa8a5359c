package com.openforge.scanmate.web;

import com.openforge.scanmate.store.ConversationTurn;
import com.openforge.scanmate.store.SessionStore;
import com.openforge.scanmate.store.UserIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Endpoints:
 *   GET    /history/{user}          → {history:[{role, content}, ...]}
 *   DELETE /history/{user}          → clears the conversation
 *   DELETE /history/{user}/{index}  → deletes one entry (with its paired reply)
 */
@Slf4j
@RestController
@RequestMapping("/history/{user}")
@RequiredArgsConstructor
public class HistoryController {

    public record HistoryResponse(List<ConversationTurn> history) {}

    private final SessionStore store;

    @GetMapping
    public HistoryResponse history(@PathVariable String user) {
        return new HistoryResponse(store.loadConversation(UserIds.validate(user)));
    }

    @DeleteMapping
    public ApiResponse clear(@PathVariable String user) {
        store.clearConversation(UserIds.validate(user));
        return ApiResponse.success(Map.of("message", "History cleared"));
    }

    @DeleteMapping("/{index}")
    public ApiResponse deleteTurn(@PathVariable String user, @PathVariable int index) {
        List<ConversationTurn> remaining = store.deleteTurn(UserIds.validate(user), index);
        log.info("[HTTP] Deleted entry {} for {}, {} left", index, user, remaining.size());
        return ApiResponse.success(Map.of("message", "Message deleted", "history", remaining));
    }
}
