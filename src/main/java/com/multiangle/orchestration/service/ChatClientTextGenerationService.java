package com.multiangle.orchestration.service;

import com.multiangle.config.MultiAngleProperties;
import com.multiangle.exception.TextGenerationException;
import com.multiangle.orchestration.api.TextGenerationService;
import com.multiangle.orchestration.model.GenerationOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Locale;

@Service
@Slf4j
public class ChatClientTextGenerationService implements TextGenerationService {

    private static final String PROVIDER_OPENAI = "OPENAI";

    private final ChatClient chatClient;
    private final ChatClient openAiChatClient;
    private final MultiAngleProperties properties;
    private final OrchestrationMetricsService metricsService;

    public ChatClientTextGenerationService(
            @Qualifier("chatClient") ObjectProvider<ChatClient> chatClientProvider,
            @Qualifier("openAiChatClient") ObjectProvider<ChatClient> openAiChatClientProvider,
            MultiAngleProperties properties,
            OrchestrationMetricsService metricsService) {
        this.chatClient = chatClientProvider.getIfAvailable();
        this.openAiChatClient = openAiChatClientProvider.getIfAvailable();
        this.properties = properties;
        this.metricsService = metricsService;
    }

    @Override
    public String complete(String prompt, GenerationOptions options) {
        String purpose = options.purpose();
        metricsService.recordLlmRequest(purpose);
        String content;
        try {
            content = getChatRequestSpec(options.provider(), options.model())
                    .user(prompt)
                    .call()
                    .content();
        } catch (TextGenerationException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new TextGenerationException(purpose, "Text generation failed for " + purpose + ": " + ex.getMessage(), ex);
        }
        if (!StringUtils.hasText(content)) {
            throw new TextGenerationException(purpose, "Text generation returned no content for " + purpose);
        }
        return content;
    }

    private ChatClient.ChatClientRequestSpec getChatRequestSpec(String provider, String model) {
        String activeProvider = StringUtils.hasText(provider)
                ? provider.trim().toUpperCase(Locale.ROOT)
                : properties.getAiProvider().name();
        String activeModel = StringUtils.hasText(model) ? model : properties.getOpenai().getModel();

        if (PROVIDER_OPENAI.equals(activeProvider)) {
            if (openAiChatClient == null) {
                throw new TextGenerationException(activeProvider, "OpenAI provider is not properly configured. " +
                        "Check that you have a valid API key or a custom Base URL in your configuration.");
            }
            var spec = openAiChatClient.prompt();
            if (StringUtils.hasText(activeModel)) {
                spec = spec.options(OpenAiChatOptions.builder().model(activeModel).build());
            }
            return spec;
        }
        if (chatClient == null) {
            throw new TextGenerationException(activeProvider, "Google GenAI provider is not configured. " +
                    "Set spring.ai.model.chat=google-genai and provide an API key.");
        }
        return chatClient.prompt();
    }
}
