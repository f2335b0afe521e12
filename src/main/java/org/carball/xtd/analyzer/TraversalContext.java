package org.carball.xtd.analyzer;

import lombok.Getter;
import org.carball.xtd.model.schema.RelationType;
import org.carball.xtd.model.schema.TableRelation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State shared by every branch of the traversal started from one origin table.
 * Tables enter the route at most once and are never removed from it.
 */
public class TraversalContext {

    private final String origin;
    private final Set<String> route = new LinkedHashSet<>();
    private final List<TableRelation> relations = new ArrayList<>();
    @Getter
    private boolean originReached;

    public TraversalContext(String origin) {
        this.origin = origin;
    }

    public boolean isOrigin(String table) {
        return origin.equals(table);
    }

    public boolean visited(String table) {
        return route.contains(table);
    }

    public void enter(String table) {
        route.add(table);
    }

    /**
     * Emits the 1:1 relation of the origin to itself the first time any path comes back to it.
     */
    public void reachOrigin() {
        if (originReached) {
            return;
        }
        emit(RelationType.ONE_TO_ONE, origin);
        enter(origin);
        originReached = true;
    }

    public void emit(RelationType type, String table) {
        relations.add(new TableRelation(type, table));
    }

    public List<TableRelation> getRelations() {
        return Collections.unmodifiableList(relations);
    }
}
