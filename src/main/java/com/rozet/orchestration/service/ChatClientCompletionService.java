package com.rozet.orchestration.service;

import com.rozet.config.RozetProperties;
import com.rozet.orchestration.api.CompletionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

/**
 * {@link CompletionService} backed by Spring AI. The active provider comes from
 * {@code rozet.ai-provider}; the OpenAI client also serves OpenAI-compatible local servers.
 */
@Service
@Slf4j
public class ChatClientCompletionService implements CompletionService {

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final RozetProperties properties;

    public ChatClientCompletionService(ChatClient chatClient,
                                       @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
                                       RozetProperties properties) {
        this.chatClient = chatClient;
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        log.debug("Sending completion request to {}", properties.getAiProvider());
        String content = requestSpec()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        return content == null ? "" : content;
    }

    @Override
    public String modelName() {
        if (properties.getAiProvider() == RozetProperties.AiProvider.OPENAI
                && StringUtils.hasText(properties.getOpenai().getModel())) {
            return properties.getOpenai().getModel();
        }
        return properties.getAiProvider().name().toLowerCase(Locale.ROOT);
    }

    private ChatClient.ChatClientRequestSpec requestSpec() {
        if (properties.getAiProvider() == RozetProperties.AiProvider.OPENAI) {
            if (openAiChatClient == null) {
                throw new IllegalStateException("OpenAI provider is not properly configured. " +
                        "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            String model = properties.getOpenai().getModel();
            if (StringUtils.hasText(model)) {
                spec = spec.options(OpenAiChatOptions.builder().model(model).build());
            }
            return spec;
        }
        return chatClient.prompt();
    }
}
