package com.rozet.orchestration.service;

import static com.rozet.orchestration.OrchestrationConstants.CHARS_PER_TOKEN;
import static com.rozet.orchestration.OrchestrationConstants.CONTEXT_SUMMARY_SYSTEM_PROMPT;
import static com.rozet.orchestration.OrchestrationConstants.PURPOSE_CONTEXT_SUMMARY;
import com.rozet.config.RozetProperties;
import com.rozet.orchestration.api.CompletionService;
import com.rozet.orchestration.model.ContextMessage;
import com.rozet.orchestration.model.ContextSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Rolling conversation memory for the orchestrator. Recent messages are kept verbatim until
 * they exceed the token budget; older ones are folded into a running summary by the model.
 * When the model cannot summarize, the evicted lines are appended to the summary as they are.
 * The summary never exceeds the budget either and keeps its most recent end.
 */
@Service
@Slf4j
public class ConversationContextService {

    private final CompletionService completionService;
    private final OrchestrationMetricsService metricsService;
    private final boolean enabled;

    private final Deque<ContextMessage> messages = new ArrayDeque<>();
    private String summary = "";
    private int maxTokens;

    public ConversationContextService(CompletionService completionService,
                                      OrchestrationMetricsService metricsService,
                                      RozetProperties properties) {
        this.completionService = completionService;
        this.metricsService = metricsService;
        this.enabled = properties.getContext().isEnabled();
        this.maxTokens = Math.max(1, properties.getContext().getMaxTokens());
    }

    public void recordUser(String content) {
        record(MessageType.USER, content);
    }

    public void recordAssistant(String content) {
        record(MessageType.ASSISTANT, content);
    }

    public void recordSystem(String content) {
        record(MessageType.SYSTEM, content);
    }

    public synchronized String summary() {
        return summary;
    }

    public synchronized List<ContextMessage> recentMessages() {
        return List.copyOf(messages);
    }

    public synchronized ContextSnapshot snapshot() {
        return new ContextSnapshot(summary, List.copyOf(messages));
    }

    /**
     * Text handed to the planner: the running summary followed by the recent messages.
     * Empty when nothing has been recorded.
     */
    public synchronized String contextSummary() {
        StringBuilder text = new StringBuilder();
        if (StringUtils.hasText(summary)) {
            text.append("Summary of earlier conversation:\n").append(summary);
        }
        if (!messages.isEmpty()) {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append("Recent conversation:\n")
                    .append(messages.stream().map(ContextMessage::render).collect(Collectors.joining("\n")));
        }
        return text.toString();
    }

    public synchronized void prune() {
        pruneTo(maxTokens);
    }

    /**
     * Changes the token budget and folds whatever no longer fits into the summary.
     */
    public synchronized void prune(int newMaxTokens) {
        this.maxTokens = Math.max(1, newMaxTokens);
        pruneTo(maxTokens);
        log.info("Pruned context | summary_length={} recent_messages={}", summary.length(), messages.size());
    }

    public synchronized void clear() {
        messages.clear();
        summary = "";
    }

    private synchronized void record(MessageType type, String content) {
        if (!enabled || !StringUtils.hasText(content)) {
            return;
        }
        messages.addLast(new ContextMessage(type, content.trim()));
        log.debug("Recorded {} message ({} chars)", type.getValue(), content.length());
        pruneTo(maxTokens);
    }

    // Caller must hold the monitor. The newest message is always kept.
    private void pruneTo(int budget) {
        List<ContextMessage> evicted = new ArrayList<>();
        while (messages.size() > 1 && estimateTokens(messages) > budget) {
            evicted.add(messages.removeFirst());
        }
        if (!evicted.isEmpty()) {
            summary = keepTail(summarize(summary, evicted), budget * CHARS_PER_TOKEN);
        }
    }

    private String summarize(String existing, List<ContextMessage> evicted) {
        String lines = evicted.stream().map(ContextMessage::render).collect(Collectors.joining("\n"));
        try {
            metricsService.recordLlmRequest(PURPOSE_CONTEXT_SUMMARY);
            String updated = completionService.complete(CONTEXT_SUMMARY_SYSTEM_PROMPT,
                    "Current summary:\n" + (existing.isEmpty() ? "(none)" : existing) + "\n\nNew lines:\n" + lines);
            if (StringUtils.hasText(updated)) {
                return updated.trim();
            }
            log.warn("Context summarization returned an empty answer, keeping condensed transcript");
        } catch (RuntimeException ex) {
            log.warn("Context summarization failed, keeping condensed transcript: {}", ex.getMessage());
        }
        return existing.isEmpty() ? lines : existing + "\n" + lines;
    }

    private static int estimateTokens(Deque<ContextMessage> entries) {
        int tokens = 0;
        for (ContextMessage entry : entries) {
            tokens += (entry.render().length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
        }
        return tokens;
    }

    private static String keepTail(String text, int maxChars) {
        return text.length() <= maxChars ? text : text.substring(text.length() - maxChars);
    }
}
