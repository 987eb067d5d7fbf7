package com.example.paperdigest.agent;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.NarrativeResponse;
import com.example.paperdigest.model.PaperRecord;
import com.example.paperdigest.model.SpotlightItem;
import com.example.paperdigest.port.InferencePort;
import com.example.paperdigest.port.InferenceRequest;
import com.example.paperdigest.port.InferenceResult;
import com.example.paperdigest.port.ModelTier;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Short introduction of a spotlighted paper. The attention score is computed elsewhere and is
 * only shown to the model as context.
 */
@Service
public class SpotlightIntroAgent {

    private static final String SYSTEM_PROMPT = """
            You introduce ONE recent paper that is drawing unusual attention to readers of a
            research digest.

            TASK:
            Write 2-3 sentences (max 70 words): what the paper does and why readers might care.
            Mention the attention signals only in general terms (e.g. "already widely cited").

            RULES:
            - Use ONLY the information given. Do NOT speculate about authors or venues.
            - Do NOT restate the numeric score.
            - Return a JSON object with a single field "text".
            """;

    private final InferencePort inference;
    private final DigestProperties.Run run;

    public SpotlightIntroAgent(InferencePort inference, DigestProperties properties) {
        this.inference = inference;
        this.run = properties.run();
    }

    /**
     * @return the introduction, or empty when the model output was invalid.
     *         Transport and budget exceptions propagate.
     */
    public Optional<String> introduce(PaperRecord record, SpotlightItem item) {
        String signals = item.signals().stream()
                .map(s -> "%s %s=%.0f".formatted(s.source(), s.metric(), s.value()))
                .collect(Collectors.joining(", "));
        String payload = """
                LANGUAGE: %s
                TITLE: %s
                PROBLEM: %s
                METHOD: %s
                ATTENTION SIGNALS: %s
                """.formatted(
                run.language() != null ? run.language() : "English",
                record.title(), record.problem(), record.method(), signals);

        InferenceResult<NarrativeResponse> result = inference.infer(new InferenceRequest<>(
                ModelTier.SMART, "SpotlightIntro " + record.id(), SYSTEM_PROMPT, payload,
                NarrativeResponse.class, run.deterministic()));
        return result.isSuccess() ? Optional.of(result.payload().text().trim()) : Optional.empty();
    }
}
