package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.RetryPolicy;
import com.example.paperdigest.model.StructuredOutput;
import com.example.paperdigest.port.InferencePort;
import com.example.paperdigest.port.InferenceRequest;
import com.example.paperdigest.port.InferenceResult;
import com.example.paperdigest.port.InferenceTransportException;
import com.example.paperdigest.port.ModelTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Random;

/**
 * {@link InferencePort} over Spring AI ChatClients.
 * <p>
 * Format instructions from a {@link BeanOutputConverter} are appended to the user turn and the
 * reply is parsed by {@link StructuredOutputParser}. Transport errors are retried here with
 * the configured backoff; every attempt is charged to the {@link CallBudget}.
 */
@Service
public class ChatClientInferenceAdapter implements InferencePort {

    private static final Logger log = LoggerFactory.getLogger(ChatClientInferenceAdapter.class);

    private final ChatClient fastChatClient;
    private final ChatClient smartChatClient;
    private final CallBudget budget;
    private final RetryPolicy transportRetry;
    private final Random jitter = new Random();

    public ChatClientInferenceAdapter(@Qualifier("fastChatClient") ChatClient fastChatClient,
                                      @Qualifier("smartChatClient") ChatClient smartChatClient,
                                      CallBudget budget,
                                      DigestProperties properties) {
        this.fastChatClient = fastChatClient;
        this.smartChatClient = smartChatClient;
        this.budget = budget;
        this.transportRetry = properties.run().inferenceRetry().toPolicy();
    }

    @Override
    public <T extends StructuredOutput> InferenceResult<T> infer(InferenceRequest<T> request) {
        BeanOutputConverter<T> converter = StructuredOutputParser.converterFor(request.schema());
        String fullUserPrompt = request.payload() + "\n\n" + converter.getFormat();
        ChatClient client = request.tier() == ModelTier.FAST ? fastChatClient : smartChatClient;

        int maxAttempts = request.transportAttempts() > 0 ? request.transportAttempts() : transportRetry.maxAttempts();
        Exception lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            budget.acquireCall(request.task());
            try {
                ChatClient.ChatClientRequestSpec spec = client.prompt()
                        .system(request.systemPrompt())
                        .user(fullUserPrompt);
                if (request.deterministic()) {
                    spec = spec.options(ChatOptions.builder().temperature(0.0).build());
                }
                ChatResponse chatResponse = spec.call().chatResponse();

                captureTokenUsage(chatResponse, request);

                String content = (chatResponse != null && chatResponse.getResult() != null)
                        ? chatResponse.getResult().getOutput().getText()
                        : null;
                InferenceResult<T> result = StructuredOutputParser.parse(content, converter);
                if (!result.isSuccess()) {
                    log.debug("{}: reply rejected ({})", request.task(), result.describeViolations());
                }
                return result;
            } catch (RuntimeException e) {
                lastError = e;
                if (attempt < maxAttempts) {
                    Duration delay = transportRetry.delayAfter(attempt, jitter);
                    log.warn("{}: attempt {}/{} failed ({}), retrying in {}ms...",
                            request.task(), attempt, maxAttempts,
                            Backoff.rootCauseMessage(e), delay.toMillis());
                    if (!Backoff.pause(delay)) {
                        break;
                    }
                }
            }
        }
        throw new InferenceTransportException("Error in " + request.task() + " after "
                + maxAttempts + " attempts: "
                + (lastError != null ? Backoff.rootCauseMessage(lastError) : "interrupted"), lastError);
    }

    private void captureTokenUsage(ChatResponse chatResponse, InferenceRequest<?> request) {
        if (chatResponse == null || chatResponse.getMetadata() == null) return;
        var usage = chatResponse.getMetadata().getUsage();
        if (usage == null || usage.getTotalTokens() == null) return;
        long total = usage.getTotalTokens().longValue();
        budget.recordTokens(request.tier(), total);
        log.debug("{}: +{} {} tokens (model={})", request.task(), total, request.tier(),
                chatResponse.getMetadata().getModel());
    }
}
