package com.example.paperdigest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * ChatClients for the two model tiers and the worker pools of the pipeline.
 * <p>
 * - fastChatClient (OpenAI): stage-1 relevance classification
 * - smartChatClient (Anthropic): review, extraction, trend and spotlight narratives
 */
@Configuration
public class AiConfig {

    @Bean("fastChatClient")
    public ChatClient fastChatClient(OpenAiChatModel openAiChatModel) {
        return ChatClient.builder(openAiChatModel).build();
    }

    @Bean("smartChatClient")
    public ChatClient smartChatClient(AnthropicChatModel anthropicChatModel) {
        return ChatClient.builder(anthropicChatModel).build();
    }

    /**
     * Pool for relevance classification calls.
     */
    @Bean(name = "filterExecutor", destroyMethod = "shutdownNow")
    public ExecutorService filterExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.filter().concurrency()));
    }

    /**
     * Worker pool of the extraction stage.
     */
    @Bean(name = "extractionExecutor", destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.extraction().workers()));
    }

    /**
     * Pool for attention-signal fetches.
     */
    @Bean(name = "signalExecutor", destroyMethod = "shutdownNow")
    public ExecutorService signalExecutor(DigestProperties properties) {
        return Executors.newFixedThreadPool(Math.max(1, properties.spotlight().concurrency()));
    }

    /**
     * Runs the trend and spotlight stages side by side.
     */
    @Bean(name = "stageExecutor", destroyMethod = "shutdownNow")
    public ExecutorService stageExecutor() {
        return Executors.newFixedThreadPool(2);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared ObjectMapper for JSON serialization.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
