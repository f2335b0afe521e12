package org.carball.xtd.model.schema;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.error.SchemaNotSubsetException;
import org.carball.xtd.inference.RelationFinalizer;
import org.carball.xtd.inference.TypeLattice;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * All tables inferred from one document, in discovery order, plus the table
 * reference graph computed by {@link #flush(RelationFinalizer)}.
 */
@Slf4j
public class Database {

    private final boolean skipColumns;
    private final Map<String, Table> tables = new LinkedHashMap<>();
    private final Map<String, Set<String>> relationGraph = new LinkedHashMap<>();

    public Database() {
        this(false);
    }

    public Database(boolean skipColumns) {
        this.skipColumns = skipColumns;
    }

    public void updateAttribute(String tableName, String columnName, String literal) {
        if (skipColumns) {
            return;
        }
        table(tableName).observeAttribute(columnName, literal);
    }

    public void updateValue(String tableName, String literal) {
        table(tableName).observeValue(literal);
    }

    /**
     * Records the child element counts of one instance of {@code tableName}. The
     * table is created even when no child was seen.
     */
    public void updateRelations(String tableName, Map<String, Integer> countsThisInstance) {
        Table table = table(tableName);
        countsThisInstance.forEach(table::observeChildOccurrence);
    }

    public Table table(String tableName) {
        return tables.computeIfAbsent(tableName, Table::new);
    }

    public Table findTable(String tableName) {
        return tables.get(tableName);
    }

    public Map<String, Table> getTables() {
        return Collections.unmodifiableMap(tables);
    }

    public List<String> getTableNames() {
        return List.copyOf(tables.keySet());
    }

    public Map<String, Set<String>> getRelationGraph() {
        return Collections.unmodifiableMap(relationGraph);
    }

    /**
     * Tables that {@code tableName} holds a foreign key to.
     */
    public Set<String> references(String tableName) {
        Set<String> referenced = relationGraph.get(tableName);
        return referenced == null ? Set.of() : Collections.unmodifiableSet(referenced);
    }

    public boolean referencesTable(String holder, String referenced) {
        return references(holder).contains(referenced);
    }

    /**
     * Records that {@code holder} carries a foreign key to {@code referenced}.
     */
    public void addRelation(String holder, String referenced) {
        relationGraph.computeIfAbsent(holder, k -> new LinkedHashSet<>()).add(referenced);
    }

    /**
     * Turns the accumulated child counts into foreign key columns and rebuilds the
     * relation graph. Must be called once the whole document has been observed.
     */
    public void flush(RelationFinalizer finalizer) {
        relationGraph.clear();
        for (Table table : tables.values()) {
            table.clearForeignKeys();
            relationGraph.put(table.getName(), new LinkedHashSet<>());
        }

        // the finalizer may create tables, so iterate over a snapshot
        for (Table table : new ArrayList<>(tables.values())) {
            for (Map.Entry<String, Integer> child : table.getChildCounts().entrySet()) {
                finalizer.apply(this, table, child.getKey(), child.getValue());
            }
        }

        log.debug("Flushed {} tables with {} references using {}",
                tables.size(),
                relationGraph.values().stream().mapToInt(Set::size).sum(),
                finalizer.getMode());
    }

    public boolean isSubset(Database candidate) {
        return findSubsetViolation(candidate).isEmpty();
    }

    /**
     * @throws SchemaNotSubsetException if {@code candidate} cannot be stored in this database
     */
    public void requireSubset(Database candidate) {
        Optional<String> violation = findSubsetViolation(candidate);
        if (violation.isPresent()) {
            log.debug("Subset validation failed: {}", violation.get());
            throw new SchemaNotSubsetException(violation.get());
        }
    }

    private Optional<String> findSubsetViolation(Database candidate) {
        for (Table other : candidate.tables.values()) {
            Table target = tables.get(other.getName());
            if (target == null) {
                return Optional.of("Table '" + other.getName() + "' does not exist");
            }

            for (Map.Entry<String, DataType> column : other.getColumns().entrySet()) {
                DataType targetType = target.getColumns().get(column.getKey());
                if (targetType == null) {
                    return Optional.of("Column '" + other.getName() + "." + column.getKey() + "' does not exist");
                }
                if (!TypeLattice.isStorable(targetType, column.getValue())) {
                    return Optional.of(String.format("Column '%s.%s' of type %s cannot hold %s",
                            other.getName(), column.getKey(), targetType, column.getValue()));
                }
            }

            if (other.getValue() != null
                    && (target.getValue() == null || !TypeLattice.isStorable(target.getValue(), other.getValue()))) {
                return Optional.of(String.format("Value of '%s' of type %s cannot hold %s",
                        other.getName(), target.getValue(), other.getValue()));
            }
        }
        return Optional.empty();
    }
}
