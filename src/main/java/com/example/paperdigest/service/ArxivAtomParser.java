package com.example.paperdigest.service;

import com.example.paperdigest.model.Candidate;
import com.example.paperdigest.port.CandidateSourceException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the Atom feed returned by the arXiv export API into {@link Candidate}s.
 */
public final class ArxivAtomParser {

    private static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    private static final String ARXIV_NS = "http://arxiv.org/schemas/atom";

    private ArxivAtomParser() {
    }

    public static List<Candidate> parse(String xml) {
        Document doc = read(xml);
        NodeList entries = doc.getElementsByTagNameNS(ATOM_NS, "entry");
        List<Candidate> out = new ArrayList<>(entries.getLength());
        for (int i = 0; i < entries.getLength(); i++) {
            Element entry = (Element) entries.item(i);
            String entryId = text(entry, ATOM_NS, "id");
            if (entryId.contains("/api/errors")) {
                throw new CandidateSourceException("arXiv rejected the query: " + text(entry, ATOM_NS, "summary"));
            }
            out.add(toCandidate(entry, entryId));
        }
        return out;
    }

    private static Candidate toCandidate(Element entry, String entryId) {
        String id = entryId.contains("/abs/") ? entryId.substring(entryId.indexOf("/abs/") + 5) : entryId;

        List<String> authors = new ArrayList<>();
        NodeList authorNodes = entry.getElementsByTagNameNS(ATOM_NS, "author");
        for (int i = 0; i < authorNodes.getLength(); i++) {
            String name = text((Element) authorNodes.item(i), ATOM_NS, "name");
            if (!name.isEmpty()) authors.add(name);
        }

        List<String> categories = new ArrayList<>();
        NodeList catNodes = entry.getElementsByTagNameNS(ATOM_NS, "category");
        for (int i = 0; i < catNodes.getLength(); i++) {
            String term = ((Element) catNodes.item(i)).getAttribute("term");
            if (!term.isBlank() && !categories.contains(term)) categories.add(term);
        }

        String primary = "";
        NodeList primaryNodes = entry.getElementsByTagNameNS(ARXIV_NS, "primary_category");
        if (primaryNodes.getLength() > 0) {
            primary = ((Element) primaryNodes.item(0)).getAttribute("term");
        }
        if (primary.isBlank() && !categories.isEmpty()) {
            primary = categories.get(0);
        }

        Instant published = instant(text(entry, ATOM_NS, "published"));
        Instant updated = instant(text(entry, ATOM_NS, "updated"));

        return new Candidate(
                id,
                collapse(text(entry, ATOM_NS, "title")),
                authors,
                published,
                updated != null ? updated : published,
                categories,
                primary,
                collapse(text(entry, ATOM_NS, "summary")),
                entryId
        );
    }

    private static Document read(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            DocumentBuilder builder = factory.newDocumentBuilder();
            return builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new CandidateSourceException("Unreadable arXiv feed: " + e.getMessage(), e);
        }
    }

    private static String text(Element parent, String ns, String localName) {
        NodeList nodes = parent.getElementsByTagNameNS(ns, localName);
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            // direct children only: <author><name> must not leak into entry-level lookups
            if (n.getParentNode() == parent) {
                return n.getTextContent() != null ? n.getTextContent().trim() : "";
            }
        }
        return "";
    }

    private static Instant instant(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String collapse(String s) {
        return s.replaceAll("\\s+", " ").trim();
    }
}
