package com.releasewatch.watchers.feed;

import com.releasewatch.watchers.api.FetchException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Reads RSS 2.0 and Atom documents into {@link FeedEntry} values, in document order.
 */
public final class FeedParser {
    private static final List<Function<String, Instant>> DATE_PARSERS = List.of(
            Instant::parse,
            value -> OffsetDateTime.parse(value).toInstant(),
            value -> ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant()
    );

    private FeedParser() {
    }

    public static List<FeedEntry> parse(String xml) throws FetchException {
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                    // ignored, only errors abort parsing
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            document = builder.parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new FetchException("Invalid RSS/Atom XML: " + e.getMessage(), e);
        }

        Element root = document.getDocumentElement();
        if (root == null) {
            return List.of();
        }
        String rootName = localName(root.getTagName());
        if ("rss".equals(rootName)) {
            return parseRss(document);
        }
        if ("feed".equals(rootName)) {
            return parseAtom(document);
        }
        throw new FetchException("Unsupported feed root element: " + root.getTagName());
    }

    private static List<FeedEntry> parseRss(Document document) {
        NodeList items = document.getElementsByTagName("item");
        List<FeedEntry> entries = new ArrayList<>();
        for (int i = 0; i < items.getLength(); i++) {
            Node item = items.item(i);
            String link = childText(item, "link").orElse("");
            entries.add(new FeedEntry(
                    childText(item, "guid").orElse(link),
                    childText(item, "title").orElse(null),
                    link,
                    childText(item, "description").orElse(""),
                    parseDate(childText(item, "pubDate").orElse(null)),
                    childText(item, "source").orElse(""),
                    List.of(),
                    List.of()
            ));
        }
        return entries;
    }

    private static List<FeedEntry> parseAtom(Document document) {
        NodeList nodes = document.getElementsByTagName("entry");
        List<FeedEntry> entries = new ArrayList<>();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node entry = nodes.item(i);
            if (!(entry instanceof Element element)) {
                continue;
            }
            List<String> authors = new ArrayList<>();
            NodeList authorNodes = element.getElementsByTagName("author");
            for (int a = 0; a < authorNodes.getLength(); a++) {
                childText(authorNodes.item(a), "name").ifPresent(authors::add);
            }
            List<String> categories = new ArrayList<>();
            NodeList categoryNodes = element.getElementsByTagName("category");
            for (int c = 0; c < categoryNodes.getLength(); c++) {
                if (categoryNodes.item(c) instanceof Element category && !category.getAttribute("term").isBlank()) {
                    categories.add(category.getAttribute("term"));
                }
            }
            String published = childText(entry, "published").orElseGet(() -> childText(entry, "updated").orElse(null));
            entries.add(new FeedEntry(
                    childText(entry, "id").orElse(""),
                    childText(entry, "title").map(FeedParser::collapseWhitespace).orElse(null),
                    htmlLink(element),
                    childText(entry, "summary").map(FeedParser::collapseWhitespace).orElse(""),
                    parseDate(published),
                    "",
                    authors,
                    categories
            ));
        }
        return entries;
    }

    // Prefers the text/html alternate, falls back to the first link.
    private static String htmlLink(Element entry) {
        NodeList links = entry.getElementsByTagName("link");
        String first = "";
        for (int i = 0; i < links.getLength(); i++) {
            if (!(links.item(i) instanceof Element link)) {
                continue;
            }
            String href = link.getAttribute("href");
            if (href.isBlank()) {
                continue;
            }
            if ("text/html".equals(link.getAttribute("type"))) {
                return href;
            }
            if (first.isEmpty()) {
                first = href;
            }
        }
        return first;
    }

    private static Optional<String> childText(Node parent, String tagName) {
        if (!(parent instanceof Element element)) {
            return Optional.empty();
        }
        NodeList children = element.getElementsByTagName(tagName);
        if (children.getLength() == 0) {
            return Optional.empty();
        }
        String text = children.item(0).getTextContent();
        return text == null ? Optional.empty() : Optional.of(text.trim());
    }

    static Instant parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Instant.EPOCH;
        }
        return DATE_PARSERS.stream()
                .map(parser -> safelyParse(parser, value.trim()))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(Instant.EPOCH);
    }

    private static Optional<Instant> safelyParse(Function<String, Instant> parser, String value) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static String collapseWhitespace(String value) {
        return value.replaceAll("\\s+", " ").trim();
    }

    private static String localName(String tagName) {
        int colon = tagName.indexOf(':');
        return (colon >= 0 ? tagName.substring(colon + 1) : tagName).toLowerCase(Locale.ROOT);
    }
}
