package com.rozet.orchestration.model;

import org.springframework.ai.chat.messages.MessageType;

/**
 * One entry of the orchestrator's conversation context.
 */
public record ContextMessage(MessageType type, String content) {

    public String render() {
        return type.getValue() + ": " + content;
    }
}
