package com.vidnyan.rulecov.adapter.out.pmd;

import com.vidnyan.rulecov.domain.oracle.ToolViolation;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the XML report format of {@code pmd check -f xml}.
 */
@Component
public class PmdReportParser {

    /**
     * @throws IllegalArgumentException when the text is not a well-formed report
     */
    public List<ToolViolation> parse(String xml) {
        Document document;
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            document = factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new IllegalArgumentException("Invalid PMD report: " + e.getMessage(), e);
        }

        List<ToolViolation> violations = new ArrayList<>();
        NodeList files = document.getElementsByTagNameNS("*", "file");
        for (int f = 0; f < files.getLength(); f++) {
            NodeList nodes = ((Element) files.item(f)).getElementsByTagNameNS("*", "violation");
            for (int v = 0; v < nodes.getLength(); v++) {
                violations.add(toViolation((Element) nodes.item(v)));
            }
        }
        return violations;
    }

    /**
     * Extract the XML report from engine output that may carry log lines around it.
     */
    static String reportPart(String output) {
        if (output == null) {
            return null;
        }
        int start = output.indexOf("<?xml");
        if (start < 0) {
            start = output.indexOf("<pmd");
        }
        int end = output.lastIndexOf("</pmd>");
        if (start < 0 || end < start) {
            return null;
        }
        return output.substring(start, end + "</pmd>".length());
    }

    private ToolViolation toViolation(Element element) {
        String message = element.getAttribute("message");
        if (message.isBlank()) {
            message = element.getTextContent().trim();
        }
        return new ToolViolation(
                intAttribute(element, "beginline", 0),
                intAttribute(element, "begincolumn", 0),
                element.getAttribute("rule"),
                message,
                intAttribute(element, "priority", ToolViolation.DEFAULT_PRIORITY));
    }

    private int intAttribute(Element element, String name, int defaultValue) {
        String value = element.getAttribute(name).trim();
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
