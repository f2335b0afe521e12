package org.carball.xtd.inference;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.parser.XmlNode;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Walks a parsed document depth-first and records every element in a {@link Database}.
 * The root element itself is not a table; its children are.
 */
@Slf4j
public class SchemaInferrer {

    private SchemaInferrer() {
        // Utility class - prevent instantiation
    }

    public static Database infer(XmlNode root, boolean skipColumns) {
        Database database = new Database(skipColumns);
        observeDocument(root, database);
        return database;
    }

    public static void observeDocument(XmlNode root, Database database) {
        for (XmlNode item : root.children()) {
            observe(item, database);
        }
        log.debug("Observed {} tables below <{}>", database.getTables().size(), root.tag());
    }

    private static void observe(XmlNode node, Database database) {
        String tableName = normalize(node.tag());

        node.attributes().forEach((name, literal) ->
                database.updateAttribute(tableName, normalize(name), literal));

        if (node.text() != null && !node.text().isBlank()) {
            database.updateValue(tableName, node.text());
        }

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (XmlNode child : node.children()) {
            counts.merge(normalize(child.tag()), 1, Integer::sum);
            observe(child, database);
        }

        database.updateRelations(tableName, counts);
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
