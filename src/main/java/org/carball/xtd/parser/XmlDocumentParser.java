package org.carball.xtd.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.error.MalformedInputException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads an XML document into an {@link XmlNode} tree.
 */
@Slf4j
public class XmlDocumentParser {

    private final XMLInputFactory inputFactory;

    public XmlDocumentParser() {
        inputFactory = XMLInputFactory.newFactory();
        inputFactory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        inputFactory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        inputFactory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    public XmlNode parse(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in);
        }
    }

    /**
     * @throws MalformedInputException if the stream is not well-formed XML
     */
    public XmlNode parse(InputStream in) {
        try {
            return read(inputFactory.createXMLStreamReader(in));
        } catch (XMLStreamException e) {
            throw malformed(e);
        }
    }

    public XmlNode parseString(String xml) {
        try {
            return read(inputFactory.createXMLStreamReader(new StringReader(xml)));
        } catch (XMLStreamException e) {
            throw malformed(e);
        }
    }

    private XmlNode read(XMLStreamReader reader) throws XMLStreamException {
        try {
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                    XmlNode root = readElement(reader);
                    // let the reader reject anything after the root element
                    while (reader.hasNext()) {
                        reader.next();
                    }
                    return root;
                }
            }
            throw new XMLStreamException("Document has no root element");
        } finally {
            reader.close();
        }
    }

    /**
     * Reads the element the reader is positioned on, up to and including its end tag.
     */
    private XmlNode readElement(XMLStreamReader reader) throws XMLStreamException {
        String tag = reader.getLocalName();

        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            attributes.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }

        StringBuilder text = new StringBuilder();
        List<XmlNode> children = new ArrayList<>();

        while (reader.hasNext()) {
            int event = reader.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT:
                    children.add(readElement(reader));
                    break;
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                    // only the text before the first child belongs to this element
                    if (children.isEmpty()) {
                        text.append(reader.getText());
                    }
                    break;
                case XMLStreamConstants.END_ELEMENT:
                    return new XmlNode(
                            tag,
                            Collections.unmodifiableMap(attributes),
                            text.toString().isBlank() ? null : text.toString(),
                            Collections.unmodifiableList(children));
                default:
                    break;
            }
        }
        throw new XMLStreamException("Unexpected end of document inside <" + tag + ">");
    }

    private static MalformedInputException malformed(XMLStreamException e) {
        log.debug("XML parsing failed", e);
        return new MalformedInputException("Bad XML input: " + e.getMessage(), e);
    }
}
