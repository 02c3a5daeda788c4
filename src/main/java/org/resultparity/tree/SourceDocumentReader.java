package org.resultparity.tree;

import java.io.IOException;
import java.io.StringReader;
import java.util.Objects;
import java.util.Optional;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Parses test-results XML and locates the top-level result set.
 */
public final class SourceDocumentReader {
    private static final ErrorHandler STRICT_ERRORS = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) {
            // warnings do not affect the parsed tree
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private SourceDocumentReader() {
    }

    /**
     * Returns the top-level {@code ResultSet}, or empty when a {@code TestResults} wrapper holds none.
     *
     * @throws SourceShapeException when the content is not XML or its root is not a test-results element
     */
    public static Optional<Element> readRoot(String content) {
        Objects.requireNonNull(content, "content");
        Document document = parse(content);
        Element documentElement = document.getDocumentElement();
        String rootName = SourceElements.localName(documentElement);
        if (SourceElements.RESULT_SET.equals(rootName)) {
            return Optional.of(documentElement);
        }
        if (SourceElements.TEST_RESULTS.equals(rootName)) {
            return Optional.ofNullable(SourceElements.firstChild(documentElement, SourceElements.RESULT_SET));
        }
        throw new SourceShapeException(
            "expected a " + SourceElements.TEST_RESULTS + " or " + SourceElements.RESULT_SET
                + " root element but found <" + rootName + ">"
        );
    }

    private static Document parse(String content) {
        try {
            DocumentBuilder builder = newFactory().newDocumentBuilder();
            builder.setErrorHandler(STRICT_ERRORS);
            return builder.parse(new InputSource(new StringReader(content)));
        } catch (SAXException e) {
            throw new SourceShapeException("source is not well-formed XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException | IOException e) {
            throw new IllegalStateException("XML parser could not be initialized", e);
        }
    }

    private static DocumentBuilderFactory newFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }
}
