package com.example.paperdigest.port;

import java.util.List;

/**
 * Tagged inference outcome: either a schema-valid payload or the reasons it was rejected.
 * Transport failures are not represented here; they surface as
 * {@link InferenceTransportException}.
 */
public record InferenceResult<T>(
        T payload,
        List<String> violations
) {
    public static <T> InferenceResult<T> success(T payload) {
        return new InferenceResult<>(payload, List.of());
    }

    public static <T> InferenceResult<T> invalid(List<String> violations) {
        return new InferenceResult<>(null, List.copyOf(violations));
    }

    public boolean isSuccess() {
        return payload != null;
    }

    public String describeViolations() {
        return String.join("; ", violations);
    }
}
