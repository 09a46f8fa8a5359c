package com.openforge.scanmate.store;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.openforge.scanmate.llm.model.Message;

/**
 * One role-tagged entry of a persisted conversation.  Creation order is the
 * position in the owning list.
 */
public record ConversationTurn(String role, String content) {

    public static ConversationTurn user(String content) {
        return new ConversationTurn(Message.USER, content);
    }

    public static ConversationTurn assistant(String content) {
        return new ConversationTurn(Message.ASSISTANT, content);
    }

    @JsonIgnore
    public boolean isUser() {
        return Message.USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistant() {
        return Message.ASSISTANT.equals(role);
    }

    public Message toMessage() {
        return new Message(role, content);
    }
}
