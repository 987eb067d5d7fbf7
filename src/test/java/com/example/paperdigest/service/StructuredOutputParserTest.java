package com.example.paperdigest.service;

import com.example.paperdigest.model.RelevanceResponse;
import com.example.paperdigest.port.InferenceResult;
import org.junit.jupiter.api.Test;
import org.springframework.ai.converter.BeanOutputConverter;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredOutputParserTest {

    private final BeanOutputConverter<RelevanceResponse> converter =
            StructuredOutputParser.converterFor(RelevanceResponse.class);

    @Test
    void acceptsFencedJsonWithTrailingCommaAndUnknownFields() {
        String reply = """
                Sure, here is the classification:
                ```json
                {"isRelevant": true, "relevanceScore": 82, "matchedTerms": ["agents",],
                 "reason": "Tool-using agents", "confidence": "high",}
                ```
                """;

        InferenceResult<RelevanceResponse> result = StructuredOutputParser.parse(reply, converter);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.payload().relevanceScore()).isEqualTo(82);
        assertThat(result.payload().matchedTerms()).containsExactly("agents");
    }

    @Test
    void outOfRangeScoreIsInvalidNotClamped() {
        InferenceResult<RelevanceResponse> result = StructuredOutputParser.parse(
                "{\"isRelevant\": true, \"relevanceScore\": 140, \"reason\": \"x\"}", converter);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.describeViolations()).contains("between 0 and 100");
    }

    @Test
    void missingFieldsAreAllReported() {
        InferenceResult<RelevanceResponse> result = StructuredOutputParser.parse("{}", converter);

        assertThat(result.violations())
                .contains("isRelevant is missing", "relevanceScore is missing", "reason is missing");
    }

    @Test
    void blankAndNonJsonRepliesAreInvalid() {
        assertThat(StructuredOutputParser.parse("   ", converter).violations()).containsExactly("empty response");
        assertThat(StructuredOutputParser.parse("I cannot help with that.", converter).isSuccess()).isFalse();
    }

    @Test
    void extractObjectDropsSurroundingProse() {
        assertThat(StructuredOutputParser.extractObject("prefix {\"a\": {\"b\": 1}} suffix"))
                .isEqualTo("{\"a\": {\"b\": 1}}");
        assertThat(StructuredOutputParser.extractObject("no braces")).isEqualTo("no braces");
    }
}
