package com.example.mailagent.config;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * LLM client wiring. Retries are disabled here because the engine retries every port call itself.
 */
@Configuration
public class IntegrationConfig {

    @Bean
    public OpenAiChatModel classificationChatModel(MailAgentProperties properties) {
        MailAgentProperties.Llm llm = properties.getLlm();
        return OpenAiChatModel.builder()
                .openAiApi(OpenAiApi.builder()
                        .baseUrl(llm.getBaseUrl())
                        .apiKey(llm.getApiKey())
                        .build())
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(llm.getModel())
                        .temperature(0.0)
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }

    @Bean
    public ChatClient classificationChatClient(OpenAiChatModel classificationChatModel) {
        return ChatClient.builder(classificationChatModel).build();
    }
}
