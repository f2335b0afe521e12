package org.carball.xtd.model.schema;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.carball.xtd.error.NamingCollisionException;
import org.carball.xtd.inference.TypeLattice;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Everything observed about one element name: attribute columns, the type of its
 * text content, how often each child element occurs per instance, and the foreign
 * keys generated when the database is flushed.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class Table {

    /** Attribute name that is stored in the value column instead of a regular one. */
    public static final String VALUE_COLUMN = "value";

    private static final String FOREIGN_KEY_SUFFIX = "_id";

    private final String name;
    private final Map<String, DataType> columns = new LinkedHashMap<>();
    private final Map<String, Integer> childCounts = new LinkedHashMap<>();
    // key column -> referenced table
    private final Map<String, String> foreignKeys = new LinkedHashMap<>();
    private DataType value;

    public String getPrimaryKeyName() {
        return "prk_" + name + FOREIGN_KEY_SUFFIX;
    }

    public Map<String, DataType> getColumns() {
        return Collections.unmodifiableMap(columns);
    }

    public Map<String, Integer> getChildCounts() {
        return Collections.unmodifiableMap(childCounts);
    }

    public Set<String> getForeignKeys() {
        return Collections.unmodifiableSet(foreignKeys.keySet());
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(columnName);
    }

    public void observeAttribute(String columnName, String literal) {
        if (VALUE_COLUMN.equals(columnName)) {
            observeValue(literal);
            return;
        }
        if (getPrimaryKeyName().equals(columnName)) {
            throw new NamingCollisionException(name, columnName);
        }
        columns.put(columnName, TypeLattice.merge(columns.get(columnName), literal, false));
    }

    public void observeValue(String literal) {
        value = TypeLattice.merge(value, literal, true);
    }

    public void observeChildOccurrence(String childTag, int countThisInstance) {
        childCounts.merge(childTag, countThisInstance, Math::max);
    }

    public String addForeignKey(String referencedTable) {
        return addForeignKey(referencedTable, referencedTable);
    }

    /**
     * Adds the foreign key column {@code <keyBase>_id} referencing {@code referencedTable}.
     * Adding the same key for the same table again has no effect.
     *
     * @return the generated column name
     * @throws NamingCollisionException if the column clashes with an attribute column, the
     *                                  primary key or a key referencing another table
     */
    public String addForeignKey(String keyBase, String referencedTable) {
        String keyName = keyBase + FOREIGN_KEY_SUFFIX;
        if (columns.containsKey(keyName) || getPrimaryKeyName().equals(keyName)) {
            throw new NamingCollisionException(name, keyName);
        }
        String previous = foreignKeys.putIfAbsent(keyName, referencedTable);
        if (previous != null && !previous.equals(referencedTable)) {
            throw new NamingCollisionException(name, keyName);
        }
        return keyName;
    }

    void clearForeignKeys() {
        foreignKeys.clear();
    }
}
