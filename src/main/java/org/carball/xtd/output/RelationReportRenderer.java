package org.carball.xtd.output;

import org.carball.xtd.model.schema.TableRelation;

import java.util.List;
import java.util.Map;

/**
 * Renders classified relations as a {@code <tables>} XML document.
 */
public class RelationReportRenderer {

    public String render(Map<String, List<TableRelation>> relationsByTable) {
        StringBuilder xml = new StringBuilder("<tables>\n");

        relationsByTable.forEach((table, relations) -> {
            xml.append("    <table name=\"").append(table).append("\">\n");
            for (TableRelation relation : relations) {
                xml.append("        <relation to=\"").append(relation.table())
                        .append("\" relation_type=\"").append(relation.type().getLabel())
                        .append("\" />\n");
            }
            xml.append("    </table>\n");
        });

        return xml.append("</tables>\n").toString();
    }
}
