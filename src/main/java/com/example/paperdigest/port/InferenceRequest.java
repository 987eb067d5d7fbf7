package com.example.paperdigest.port;

import com.example.paperdigest.model.StructuredOutput;

/**
 * One structured-output request.
 *
 * @param tier              Target model
 * @param task              Task name, used for logging and usage accounting
 * @param systemPrompt      Role and task instructions
 * @param payload           Input payload (the user turn)
 * @param schema            Expected response type
 * @param deterministic     Request deterministic sampling (temperature 0)
 * @param transportAttempts Transport attempts inside the adapter; 0 uses the configured policy
 * @param <T>               response type
 */
public record InferenceRequest<T extends StructuredOutput>(
        ModelTier tier,
        String task,
        String systemPrompt,
        String payload,
        Class<T> schema,
        boolean deterministic,
        int transportAttempts
) {
    public InferenceRequest(ModelTier tier, String task, String systemPrompt, String payload,
                            Class<T> schema, boolean deterministic) {
        this(tier, task, systemPrompt, payload, schema, deterministic, 0);
    }

    /**
     * Same request with a single transport attempt, for callers that run and audit their own
     * retry loop.
     */
    public InferenceRequest<T> withSingleTransportAttempt() {
        return new InferenceRequest<>(tier, task, systemPrompt, payload, schema, deterministic, 1);
    }

    /** Same request with a stricter instruction appended, used after a schema-invalid reply. */
    public InferenceRequest<T> withRepairHint(String violations) {
        String repaired = payload + """


                YOUR PREVIOUS ANSWER WAS REJECTED: %s
                Answer again with ONLY a JSON object that satisfies every field constraint.
                No markdown, no commentary.
                """.formatted(violations);
        return new InferenceRequest<>(tier, task, systemPrompt, repaired, schema, deterministic, transportAttempts);
    }
}
