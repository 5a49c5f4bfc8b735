package com.vidnyan.rulecov.adapter.out.rule;

import com.vidnyan.rulecov.application.port.out.RuleFileReader;
import com.vidnyan.rulecov.domain.rule.RuleDocument;
import com.vidnyan.rulecov.domain.rule.RuleFileReadException;
import com.vidnyan.rulecov.domain.rule.RuleMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads PMD rule XML files, either a bare {@code <rule>} or a ruleset holding one.
 * The first rule of the file is used.
 */
@Slf4j
@Component
public class XmlRuleFileReader implements RuleFileReader {

    private static final String ANY_NAMESPACE = "*";
    private static final Set<String> QUERY_PROPERTIES = Set.of("query", "xpath");

    @Override
    public RuleDocument read(Path ruleFile) {
        if (!Files.isRegularFile(ruleFile)) {
            throw new RuleFileReadException("Rule file not found: " + ruleFile, null);
        }
        Document document;
        try {
            document = newBuilder().parse(ruleFile.toFile());
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new RuleFileReadException("Failed to parse " + ruleFile + ": " + e.getMessage(), e);
        }

        Element rule = firstElement(document.getDocumentElement(), "rule");
        if (rule == null) {
            throw new RuleFileReadException("No rule element in " + ruleFile, null);
        }
        RuleMetadata metadata = new RuleMetadata(
                blankToNull(rule.getAttribute("name")),
                blankToNull(rule.getAttribute("message")),
                textOf(firstElement(rule, "description")),
                findQuery(rule));

        List<RuleDocument.ExampleBlock> examples = new ArrayList<>();
        NodeList exampleNodes = rule.getElementsByTagNameNS(ANY_NAMESPACE, "example");
        for (int i = 0; i < exampleNodes.getLength(); i++) {
            String content = exampleNodes.item(i).getTextContent();
            if (content == null || content.isBlank()) {
                log.debug("Skipping blank example {} in {}", i + 1, ruleFile);
                continue;
            }
            examples.add(new RuleDocument.ExampleBlock(i + 1, content.trim()));
        }
        log.debug("Read rule {} with {} examples", metadata.ruleName(), examples.size());
        return new RuleDocument(ruleFile, metadata, examples);
    }

    private DocumentBuilder newBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setExpandEntityReferences(false);
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        return factory.newDocumentBuilder();
    }

    private String findQuery(Element rule) {
        NodeList properties = rule.getElementsByTagNameNS(ANY_NAMESPACE, "property");
        for (int i = 0; i < properties.getLength(); i++) {
            Element property = (Element) properties.item(i);
            if (!QUERY_PROPERTIES.contains(property.getAttribute("name"))) {
                continue;
            }
            if (property.hasAttribute("value")) {
                return blankToNull(property.getAttribute("value").trim());
            }
            return textOf(firstElement(property, "value"));
        }
        return null;
    }

    private Element firstElement(Element parent, String localName) {
        if (localName.equals(localNameOf(parent))) {
            return parent;
        }
        NodeList nodes = parent.getElementsByTagNameNS(ANY_NAMESPACE, localName);
        return nodes.getLength() == 0 ? null : (Element) nodes.item(0);
    }

    private String localNameOf(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private String textOf(Element element) {
        return element == null ? null : blankToNull(element.getTextContent().trim());
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
