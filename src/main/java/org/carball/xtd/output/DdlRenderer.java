package org.carball.xtd.output;

import org.carball.xtd.model.schema.DataType;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.model.schema.Table;

import java.util.Map;

/**
 * Renders a flushed database as {@code CREATE TABLE} statements: primary key, foreign
 * keys, attribute columns, then the value column.
 */
public class DdlRenderer {

    private static final String INDENT = "   ";

    public String render(Database database) {
        StringBuilder ddl = new StringBuilder();
        for (Table table : database.getTables().values()) {
            appendTable(ddl, table);
        }
        return ddl.toString();
    }

    private void appendTable(StringBuilder ddl, Table table) {
        ddl.append("CREATE TABLE ").append(table.getName()).append("(\n");
        ddl.append(INDENT).append(table.getPrimaryKeyName()).append(" INT PRIMARY KEY");

        for (String key : table.getForeignKeys()) {
            ddl.append(",\n").append(INDENT).append(key).append(" INT");
        }
        for (Map.Entry<String, DataType> column : table.getColumns().entrySet()) {
            ddl.append(",\n").append(INDENT).append(column.getKey()).append(' ').append(column.getValue());
        }
        if (table.getValue() != null) {
            ddl.append(",\n").append(INDENT).append(Table.VALUE_COLUMN).append(' ').append(table.getValue());
        }

        ddl.append("\n);\n\n");
    }
}
