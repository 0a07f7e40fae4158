package com.rozet.orchestration.api;

/**
 * Text-completion capability used by the planner and the workers.
 */
public interface CompletionService {

    /**
     * Sends one system and one user message and returns the model's text answer.
     * Implementations bound the call with a timeout and may throw on network or auth failure.
     */
    String complete(String systemPrompt, String userPrompt);

    /**
     * Identifier of the model answering requests, used to label workers in notifications.
     */
    default String modelName() {
        return "unknown";
    }
}
