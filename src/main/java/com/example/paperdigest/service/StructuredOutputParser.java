package com.example.paperdigest.service;

import com.example.paperdigest.model.StructuredOutput;
import com.example.paperdigest.port.InferenceResult;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.ai.converter.BeanOutputConverter;

import java.util.List;

/**
 * Lenient parsing and validation of model replies.
 * <p>
 * Tolerates the usual deviations of model JSON:
 * <ul>
 *   <li>Trailing commas and Java-style comments</li>
 *   <li>Single quotes and unquoted field names</li>
 *   <li>Markdown fences or prose around the object</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * A reply that parses but breaks a field constraint is reported as invalid, never patched.
 */
public final class StructuredOutputParser {

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    private static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private StructuredOutputParser() {
        // utility class
    }

    public static <T extends StructuredOutput> BeanOutputConverter<T> converterFor(Class<T> type) {
        return new BeanOutputConverter<>(type, LENIENT_MAPPER);
    }

    public static <T extends StructuredOutput> InferenceResult<T> parse(String content,
                                                                        BeanOutputConverter<T> converter) {
        if (content == null || content.isBlank()) {
            return InferenceResult.invalid(List.of("empty response"));
        }
        T parsed;
        try {
            parsed = converter.convert(extractObject(content));
        } catch (RuntimeException e) {
            return InferenceResult.invalid(List.of("unparseable JSON: " + Backoff.rootCauseMessage(e)));
        }
        if (parsed == null) {
            return InferenceResult.invalid(List.of("null payload"));
        }
        List<String> violations = parsed.violations();
        return violations.isEmpty() ? InferenceResult.success(parsed) : InferenceResult.invalid(violations);
    }

    /** Cuts the first {...} block out of the reply, dropping fences and surrounding prose. */
    static String extractObject(String content) {
        String s = content.trim();
        int start = s.indexOf('{');
        int end = s.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return s.substring(start, end + 1);
        }
        return s;
    }
}
