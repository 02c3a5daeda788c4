package org.resultparity.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Element vocabulary of test-results documents and namespace-agnostic DOM helpers.
 */
final class SourceElements {
    static final String TEST_RESULTS = "TestResults";
    static final String RESULT_SET = "ResultSet";
    static final String TEST_GROUP = "TestGroup";
    static final String TEST = "Test";
    static final String SESSION_ACTION = "SessionAction";

    static final Set<String> CONTAINERS = Set.of(RESULT_SET, TEST_GROUP);
    static final Set<String> LEAVES = Set.of(TEST, SESSION_ACTION);

    static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    private SourceElements() {
    }

    static String localName(Element element) {
        String local = element.getLocalName();
        if (local != null) {
            return local;
        }
        String tagName = element.getTagName();
        int colon = tagName.indexOf(':');
        return colon < 0 ? tagName : tagName.substring(colon + 1);
    }

    static boolean isRecognized(Element element) {
        String local = localName(element);
        return CONTAINERS.contains(local) || LEAVES.contains(local);
    }

    static List<Element> childElements(Element parent) {
        NodeList nodes = parent.getChildNodes();
        List<Element> elements = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                elements.add((Element) node);
            }
        }
        return elements;
    }

    static Element firstChild(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        for (Element child : childElements(parent)) {
            if (localName.equals(localName(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * Follows a chain of first-matching children, or returns {@code null} when a link is missing.
     */
    static Element descend(Element start, String... localNames) {
        Element current = start;
        for (String localName : localNames) {
            current = firstChild(current, localName);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * Attribute value, or {@code null} when the attribute is absent.
     */
    static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    static String xsiType(Element element) {
        if (element == null) {
            return null;
        }
        String type = element.getAttributeNS(XSI_NAMESPACE, "type");
        if (type == null || type.isEmpty()) {
            type = element.getAttribute("xsi:type");
        }
        if (type == null || type.isEmpty()) {
            return null;
        }
        int colon = type.indexOf(':');
        return colon < 0 ? type : type.substring(colon + 1);
    }
}
