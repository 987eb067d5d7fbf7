package com.example.paperdigest.port;

import com.example.paperdigest.model.StructuredOutput;

/**
 * Structured-output access to the language models.
 * <p>
 * Implementations retry transport errors themselves; schema-invalid replies are returned as
 * {@link InferenceResult#invalid} and retrying them is up to the caller.
 */
public interface InferencePort {

    /**
     * @throws InferenceTransportException when the service stays unreachable after retries
     * @throws BudgetExhaustedException    when the run budget refuses the call
     */
    <T extends StructuredOutput> InferenceResult<T> infer(InferenceRequest<T> request);
}
