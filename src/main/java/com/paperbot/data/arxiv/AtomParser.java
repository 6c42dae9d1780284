package com.paperbot.data.arxiv;

import com.paperbot.core.CollaboratorException;
import com.paperbot.model.PaperItem;
import com.paperbot.utils.TextFormatter;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses an arXiv API Atom document into {@link PaperItem}s.
 */
public final class AtomParser {
    static final String ATOM_NS = "http://www.w3.org/2005/Atom";
    static final String ARXIV_NS = "http://arxiv.org/schemas/atom";

    private static final Pattern ARXIV_ID = Pattern.compile("(?:https?://)?arxiv\\.org/abs/(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern VERSION = Pattern.compile("v\\d+$", Pattern.CASE_INSENSITIVE);

    private AtomParser() {
    }

    public static List<PaperItem> parse(String xml) {
        Document doc = readDocument(xml);
        List<PaperItem> out = new ArrayList<>();
        NodeList entries = doc.getElementsByTagNameNS(ATOM_NS, "entry");
        for (int i = 0; i < entries.getLength(); i++) {
            PaperItem item = toItem((Element) entries.item(i));
            if (item != null) {
                out.add(item);
            }
        }
        return out;
    }

    private static PaperItem toItem(Element entry) {
        String id = extractArxivId(childText(entry, ATOM_NS, "id"));
        if (id.isEmpty()) {
            return null;
        }
        if (!VERSION.matcher(id).find()) {
            id = id + "v1";
        }

        List<String> authors = new ArrayList<>();
        for (Element author : children(entry, ATOM_NS, "author")) {
            String name = TextFormatter.compactWhitespace(childText(author, ATOM_NS, "name"));
            if (!name.isEmpty()) {
                authors.add(name);
            }
        }

        return PaperItem.builder()
                .id(id)
                .title(TextFormatter.toPlainText(childText(entry, ATOM_NS, "title")))
                .summary(TextFormatter.toPlainText(childText(entry, ATOM_NS, "summary")))
                .authors(List.copyOf(authors))
                .category(primaryCategory(entry))
                .publishedAt(parseTimestamp(childText(entry, ATOM_NS, "published")))
                .updatedAt(parseTimestamp(childText(entry, ATOM_NS, "updated")))
                .url("https://arxiv.org/abs/" + id)
                .build();
    }

    static String extractArxivId(String rawId) {
        String raw = rawId == null ? "" : rawId.trim();
        Matcher m = ARXIV_ID.matcher(raw);
        if (m.find()) {
            return m.group(1);
        }
        try {
            URI uri = URI.create(raw);
            String host = uri.getHost();
            String path = uri.getPath();
            if (host != null && host.toLowerCase(Locale.ROOT).endsWith("arxiv.org") && path != null && path.startsWith("/abs/")) {
                return path.substring("/abs/".length()).replaceFirst("^/+", "");
            }
        } catch (IllegalArgumentException ignored) {
            // not a URI, keep the raw value
        }
        return raw;
    }

    private static String primaryCategory(Element entry) {
        for (Element primary : children(entry, ARXIV_NS, "primary_category")) {
            String term = primary.getAttribute("term");
            if (!term.isBlank()) {
                return term.trim();
            }
        }
        for (Element category : children(entry, ATOM_NS, "category")) {
            String term = category.getAttribute("term");
            if (!term.isBlank()) {
                return term.trim();
            }
        }
        return "unknown";
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw.trim(), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (Exception ignored) {
            return null;
        }
    }

    private static Document readDocument(String xml) {
        if (xml == null || xml.isBlank()) {
            throw new CollaboratorException("empty feed document");
        }
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            return factory.newDocumentBuilder()
                    .parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new CollaboratorException("feed document is not valid Atom XML: " + e.getMessage(), e);
        }
    }

    private static List<Element> children(Element parent, String ns, String localName) {
        List<Element> out = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE
                    && ns.equals(n.getNamespaceURI())
                    && localName.equals(n.getLocalName())) {
                out.add((Element) n);
            }
        }
        return out;
    }

    private static String childText(Element parent, String ns, String localName) {
        List<Element> found = children(parent, ns, localName);
        return found.isEmpty() ? null : found.get(0).getTextContent();
    }
}
