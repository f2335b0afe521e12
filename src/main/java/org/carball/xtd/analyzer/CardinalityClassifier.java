package org.carball.xtd.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.model.schema.RelationType;
import org.carball.xtd.model.schema.TableRelation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies the relations of every table of a flushed {@link Database} as 1:1, 1:N,
 * N:1 or N:M by walking the foreign key graph outwards from that table.
 *
 * <p>Starting from an origin, each table it references is N:1 and each table
 * referencing it is 1:N. Tables reached through such a table in the opposite
 * direction are N:M, and so is everything reached after that. A pair of tables
 * referencing each other is a single N:M relation. The first path that comes back
 * to the origin yields the origin's 1:1 relation to itself.</p>
 */
@Slf4j
public class CardinalityClassifier {

    private final Database database;
    private final List<String> tableNames;

    /**
     * @param database a database that has already been flushed
     */
    public CardinalityClassifier(Database database) {
        this.database = database;
        this.tableNames = database.getTableNames();
    }

    /**
     * Relations of every table, in discovery order.
     */
    public Map<String, List<TableRelation>> classifyAll() {
        Map<String, List<TableRelation>> result = new LinkedHashMap<>();
        for (String table : tableNames) {
            result.put(table, classify(table));
        }
        return result;
    }

    public List<TableRelation> classify(String origin) {
        TraversalContext context = new TraversalContext(origin);

        // tables the origin references
        for (String other : tableNames) {
            if (!other.equals(origin)) {
                follow(context, origin, other, TraversalMode.FORWARD);
            }
        }

        // tables referencing the origin
        for (String other : tableNames) {
            if (!database.referencesTable(other, origin)) {
                continue;
            }
            if (other.equals(origin) && !context.isOriginReached()) {
                context.reachOrigin();
            } else {
                follow(context, origin, other, TraversalMode.BACKWARD);
            }
        }

        log.debug("Classified {} relations for {}", context.getRelations().size(), origin);
        return context.getRelations();
    }

    private void follow(TraversalContext context, String from, String to, TraversalMode mode) {
        switch (mode) {
            case FORWARD:
                followForward(context, from, to);
                break;
            case BACKWARD:
                followBackward(context, from, to);
                break;
            case MANY:
            default:
                followAmbiguous(context, from, to);
                break;
        }
    }

    private void followForward(TraversalContext context, String from, String to) {
        if (!database.referencesTable(from, to) || context.visited(to)) {
            return;
        }

        context.emit(database.referencesTable(to, from)
                ? RelationType.MANY_TO_MANY
                : RelationType.MANY_TO_ONE, to);
        context.enter(to);

        expand(context, to, TraversalMode.FORWARD, TraversalMode.MANY);
    }

    private void followBackward(TraversalContext context, String from, String to) {
        if (!database.referencesTable(to, from) || context.visited(to)) {
            return;
        }

        if (database.referencesTable(from, to)) {
            // a pair referencing each other was already reported when the origin followed it forward
            if (!context.isOrigin(from)) {
                context.emit(RelationType.MANY_TO_MANY, to);
            }
        } else {
            context.emit(RelationType.ONE_TO_MANY, to);
        }
        context.enter(to);

        expand(context, to, TraversalMode.MANY, TraversalMode.BACKWARD);
    }

    private void followAmbiguous(TraversalContext context, String from, String to) {
        if (context.visited(to) || context.isOrigin(to)) {
            return;
        }

        context.emit(RelationType.MANY_TO_MANY, to);
        context.enter(to);

        expand(context, to, TraversalMode.MANY, TraversalMode.MANY);
    }

    /**
     * Continues from {@code table} into the tables it references and the tables
     * referencing it.
     */
    private void expand(TraversalContext context, String table,
                        TraversalMode referencedMode, TraversalMode referencingMode) {
        for (String referenced : database.references(table)) {
            if (context.isOrigin(referenced) && !context.isOriginReached()) {
                context.reachOrigin();
            } else if (!context.visited(referenced)) {
                follow(context, table, referenced, referencedMode);
            }
        }

        for (String holder : tableNames) {
            if (!database.referencesTable(holder, table)) {
                continue;
            }
            if (context.isOrigin(holder)) {
                if (!context.isOriginReached()) {
                    context.reachOrigin();
                }
            } else if (!context.visited(holder)) {
                follow(context, table, holder, referencingMode);
            }
        }
    }
}
