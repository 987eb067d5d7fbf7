package com.example.paperdigest.service;

import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.port.CandidateSourceException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArxivAtomParserTest {

    private static String fixture(String name) throws IOException {
        try (InputStream in = ArxivAtomParserTest.class.getResourceAsStream("/arxiv/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void parsesEntriesWithVersionedIdsAndCollapsedText() throws IOException {
        List<Candidate> out = ArxivAtomParser.parse(fixture("sample-feed.xml"));

        assertThat(out).hasSize(2);
        Candidate first = out.get(0);
        assertThat(first.id()).isEqualTo("2502.01234v2");
        assertThat(first.baseId()).isEqualTo("2502.01234");
        assertThat(first.version()).isEqualTo(2);
        assertThat(first.title()).isEqualTo("Tool-Using Agents for Long-Horizon Planning");
        assertThat(first.abstractText()).isEqualTo("We present an agent that plans over long horizons with tools.");
        assertThat(first.authors()).containsExactly("Ada Lovelace", "Alan Turing");
        assertThat(first.categories()).containsExactly("cs.CL", "cs.AI");
        assertThat(first.primaryCategory()).isEqualTo("cs.CL");
        assertThat(first.published()).isEqualTo(Instant.parse("2025-02-01T09:00:00Z"));
        assertThat(first.timestamp()).isEqualTo(Instant.parse("2025-02-04T17:30:00Z"));
        assertThat(first.url()).isEqualTo("http://arxiv.org/abs/2502.01234v2");
    }

    @Test
    void primaryCategoryFallsBackToFirstCategory() throws IOException {
        Candidate second = ArxivAtomParser.parse(fixture("sample-feed.xml")).get(1);

        assertThat(second.primaryCategory()).isEqualTo("cs.IR");
        assertThat(second.version()).isEqualTo(1);
    }

    @Test
    void errorEntryIsReportedAsSourceFailure() throws IOException {
        String xml = fixture("error-feed.xml");

        assertThatThrownBy(() -> ArxivAtomParser.parse(xml))
                .isInstanceOf(CandidateSourceException.class)
                .hasMessageContaining("incorrect id format");
    }

    @Test
    void malformedXmlIsReportedAsSourceFailure() {
        assertThatThrownBy(() -> ArxivAtomParser.parse("<feed><entry>"))
                .isInstanceOf(CandidateSourceException.class);
    }

    @Test
    void emptyFeedGivesNoCandidates() {
        assertThat(ArxivAtomParser.parse("<feed xmlns=\"http://www.w3.org/2005/Atom\"></feed>")).isEmpty();
    }
}
