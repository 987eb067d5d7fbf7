package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.AttentionSignal;
import com.example.paperdigest.port.SignalFetch;
import com.example.paperdigest.port.SignalSourcePort;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Citation counts from the Semantic Scholar Graph API.
 */
@Service
public class SemanticScholarSignalSource implements SignalSourcePort {

    public static final String SOURCE_ID = "semantic_scholar";

    private static final Logger log = LoggerFactory.getLogger(SemanticScholarSignalSource.class);

    private final RestClient restClient;
    private final Clock clock;

    public SemanticScholarSignalSource(DigestProperties properties, Clock clock) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.spotlight().fetchTimeout());
        factory.setReadTimeout(properties.spotlight().fetchTimeout());
        this.restClient = RestClient.builder()
                .baseUrl(properties.spotlight().semanticScholarUrl())
                .requestFactory(factory)
                .build();
        this.clock = clock;
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public SignalFetch fetch(String arxivId) {
        try {
            JsonNode body = restClient.get()
                    .uri("/graph/v1/paper/arXiv:{id}?fields=citationCount,influentialCitationCount", arxivId)
                    .retrieve()
                    .body(JsonNode.class);
            if (body == null) {
                return SignalFetch.noData(SOURCE_ID);
            }
            Instant now = clock.instant();
            List<AttentionSignal> signals = new ArrayList<>();
            addIfNumber(signals, body, "citationCount", "citation_count", now);
            addIfNumber(signals, body, "influentialCitationCount", "influential_citation_count", now);
            return SignalFetch.available(SOURCE_ID, signals);

        } catch (HttpClientErrorException.NotFound e) {
            return SignalFetch.noData(SOURCE_ID);
        } catch (RestClientException e) {
            log.warn("Semantic Scholar unavailable for {}: {}", arxivId, e.getMessage());
            return SignalFetch.unavailable(SOURCE_ID, e.getMessage());
        }
    }

    private static void addIfNumber(List<AttentionSignal> out, JsonNode body, String field, String metric,
                                    Instant fetchedAt) {
        JsonNode value = body.get(field);
        if (value != null && value.isNumber()) {
            out.add(new AttentionSignal(SOURCE_ID, metric, value.asDouble(), fetchedAt));
        }
    }
}
