package com.openforge.scanmate.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A single role-tagged entry in a generation request.
 *
 * role variants:
 *   "system"    - persona / instructions
 *   "user"      - human turn
 *   "assistant" - model reply
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(String role, String content) {

    public static final String SYSTEM    = "system";
    public static final String USER      = "user";
    public static final String ASSISTANT = "assistant";

    public static Message system(String content) {
        return Message.builder().role(SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ASSISTANT).content(content).build();
    }
}
