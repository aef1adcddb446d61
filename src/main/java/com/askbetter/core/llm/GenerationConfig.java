package com.askbetter.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

/**
 * Builds the OpenAI chat model from {@link LlmProperties}.
 * <p>
 * Credentials are checked before anything is created, so a missing key fails the
 * application context at startup instead of the first request. Spring AI's own retry
 * is disabled: the review orchestrator owns retries and feeds corrections back.
 */
@Configuration
public class GenerationConfig {

    private static final Logger log = LoggerFactory.getLogger(GenerationConfig.class);

    @Bean
    public ChatModel openAiChatModel(LlmProperties properties) {
        properties.requireValid();

        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getTimeout());
        requestFactory.setReadTimeout(properties.getTimeout());

        var openAiApi = OpenAiApi.builder()
                .baseUrl(properties.getBaseUrl())
                .apiKey(properties.getApiKey())
                .restClientBuilder(RestClient.builder().requestFactory(requestFactory))
                .build();

        log.info("Generation model configured: {} at {} (timeout {}s)",
                properties.getModel(), properties.getBaseUrl(), properties.getTimeout().toSeconds());

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(OpenAiChatOptions.builder()
                        .model(properties.getModel())
                        .temperature(properties.getTemperature())
                        .build())
                .retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
                .build();
    }

    @Bean
    public ChatClient.Builder chatClientBuilder(ChatModel chatModel) {
        return ChatClient.builder(chatModel);
    }
}
