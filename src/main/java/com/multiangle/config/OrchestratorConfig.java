package com.multiangle.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.google.genai.GoogleGenAiChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    @Primary
    public ChatClient chatClient(ObjectProvider<GoogleGenAiChatModel> googleGenAiChatModelProvider) {
        return googleGenAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(googleGenAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    @Bean
    public ChatClient openAiChatClient(ObjectProvider<OpenAiChatModel> openAiChatModelProvider) {
        return openAiChatModelProvider.getIfAvailable() != null
                ? ChatClient.builder(openAiChatModelProvider.getIfAvailable()).build()
                : null;
    }

    // One branch per angle with no upper bound; waiting branches hold no thread between polls.
    @Bean(destroyMethod = "shutdown")
    public ExecutorService angleExecutor() {
        return Executors.newCachedThreadPool();
    }
}
