package com.example.paperdigest.service;

import com.example.paperdigest.config.DigestProperties;
import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.port.CandidateQuery;
import com.example.paperdigest.port.CandidateSourceException;
import com.example.paperdigest.port.CandidateSourcePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * HTTP client for the arXiv export API (Atom feed).
 * One request at a time: the API asks clients not to run parallel queries.
 */
@Service
public class ArxivCandidateSource implements CandidateSourcePort {

    private static final Logger log = LoggerFactory.getLogger(ArxivCandidateSource.class);

    /** arXiv date-range syntax, always in GMT, minute precision. */
    private static final DateTimeFormatter RANGE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMddHHmm").withZone(ZoneOffset.UTC);

    private final RestClient restClient;
    private final Duration requestTimeout;
    private final Semaphore permit = new Semaphore(1);

    public ArxivCandidateSource(DigestProperties properties) {
        DigestProperties.Search search = properties.search();
        this.requestTimeout = search.requestTimeout() != null ? search.requestTimeout() : Duration.ofSeconds(60);

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(Duration.ofSeconds(15));
        factory.setReadTimeout(requestTimeout);

        this.restClient = RestClient.builder()
                .baseUrl(search.baseUrl())
                .requestFactory(factory)
                .build();
    }

    @Override
    public List<Candidate> search(CandidateQuery query) {
        String searchQuery = buildSearchQuery(query);
        log.debug("arXiv query: {} (max {})", searchQuery, query.maxResults());

        acquire();
        try {
            String xml = restClient.get()
                    .uri(uri -> uri.path("/api/query")
                            .queryParam("search_query", searchQuery)
                            .queryParam("sortBy", "lastUpdatedDate")
                            .queryParam("sortOrder", "descending")
                            .queryParam("start", 0)
                            .queryParam("max_results", query.maxResults())
                            .build())
                    .retrieve()
                    .body(String.class);

            List<Candidate> parsed = xml != null ? ArxivAtomParser.parse(xml) : List.of();
            // the range filter is minute-grained upstream; enforce [start, end) here
            List<Candidate> inWindow = parsed.stream()
                    .filter(c -> c.timestamp() != null
                            && !c.timestamp().isBefore(query.start())
                            && c.timestamp().isBefore(query.end()))
                    .toList();
            log.info("arXiv returned {} entries, {} inside [{}, {})",
                    parsed.size(), inWindow.size(), query.start(), query.end());
            return inWindow;

        } catch (RestClientException e) {
            throw new CandidateSourceException("arXiv export API unreachable: " + e.getMessage(), e);
        } finally {
            permit.release();
        }
    }

    static String buildSearchQuery(CandidateQuery query) {
        String range = "lastUpdatedDate:[%s TO %s]".formatted(
                RANGE_FORMAT.format(query.start()),
                RANGE_FORMAT.format(query.end().minusSeconds(60)));
        if (query.categories().isEmpty()) {
            return range;
        }
        String cats = query.categories().stream()
                .map(c -> "cat:" + c)
                .collect(Collectors.joining(" OR "));
        return "(" + cats + ") AND " + range;
    }

    private void acquire() {
        try {
            if (!permit.tryAcquire(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new CandidateSourceException("Timed out waiting for the arXiv request slot");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CandidateSourceException("Interrupted waiting for the arXiv request slot", e);
        }
    }
}
