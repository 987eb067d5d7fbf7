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
import java.util.List;

/**
 * Citation counts from OpenAlex, looked up through the arXiv DOI (10.48550/arXiv.ID).
 */
@Service
public class OpenAlexSignalSource implements SignalSourcePort {

    public static final String SOURCE_ID = "openalex";

    private static final Logger log = LoggerFactory.getLogger(OpenAlexSignalSource.class);

    private final RestClient restClient;
    private final Clock clock;

    public OpenAlexSignalSource(DigestProperties properties, Clock clock) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(properties.spotlight().fetchTimeout());
        factory.setReadTimeout(properties.spotlight().fetchTimeout());
        this.restClient = RestClient.builder()
                .baseUrl(properties.spotlight().openAlexUrl())
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
                    .uri("/works/doi:10.48550/arXiv.{id}?select=id,cited_by_count", arxivId)
                    .retrieve()
                    .body(JsonNode.class);
            JsonNode cited = body != null ? body.get("cited_by_count") : null;
            if (cited == null || !cited.isNumber()) {
                return SignalFetch.noData(SOURCE_ID);
            }
            return SignalFetch.available(SOURCE_ID, List.of(
                    new AttentionSignal(SOURCE_ID, "cited_by_count", cited.asDouble(), clock.instant())));

        } catch (HttpClientErrorException.NotFound e) {
            return SignalFetch.noData(SOURCE_ID);
        } catch (RestClientException e) {
            log.warn("OpenAlex unavailable for {}: {}", arxivId, e.getMessage());
            return SignalFetch.unavailable(SOURCE_ID, e.getMessage());
        }
    }
}
