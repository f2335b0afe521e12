package org.carball.xtd.parser;

import java.util.List;
import java.util.Map;

/**
 * One element of a parsed document. Attributes keep their document order and
 * {@code text} holds the non-blank character data preceding the first child, or null.
 */
public record XmlNode(
    String tag,
    Map<String, String> attributes,
    String text,
    List<XmlNode> children
) {}
