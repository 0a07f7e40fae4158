package com.rozet.orchestration.model;

import java.util.List;

public record ContextSnapshot(String summary, List<ContextMessage> recentMessages) {

    public ContextSnapshot {
        summary = summary == null ? "" : summary;
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
    }
}
