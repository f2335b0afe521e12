package org.carball.xtd.inference;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.xtd.config.FinalizationMode;
import org.carball.xtd.config.XtdConfig;
import org.carball.xtd.error.NamingCollisionException;
import org.carball.xtd.model.schema.Database;
import org.carball.xtd.model.schema.Table;

/**
 * Applies the configured finalization mode to one parent/child pair.
 */
@Slf4j
@Getter
public class RelationFinalizer {

    private final FinalizationMode mode;
    private final Integer maxColumnsThreshold;

    public RelationFinalizer(FinalizationMode mode, Integer maxColumnsThreshold) {
        if (mode == FinalizationMode.MAX_COLUMNS && maxColumnsThreshold == null) {
            throw new IllegalArgumentException("Max-columns mode requires a threshold");
        }
        this.mode = mode;
        this.maxColumnsThreshold = maxColumnsThreshold;
    }

    public static RelationFinalizer defaults() {
        return new RelationFinalizer(FinalizationMode.DEFAULT, null);
    }

    public static RelationFinalizer from(XtdConfig config) {
        return new RelationFinalizer(config.getFinalizationMode(), config.getMaxColumnsThreshold());
    }

    public void apply(Database database, Table parent, String child, int count) {
        switch (mode) {
            case DUPLICATE_KEYS:
                referenceParent(database, parent, child);
                break;
            case MAX_COLUMNS:
                if (count > maxColumnsThreshold) {
                    log.debug("{} occurs {} times in {}, above threshold {}",
                            child, count, parent.getName(), maxColumnsThreshold);
                    referenceParent(database, parent, child);
                } else {
                    referenceChild(database, parent, child, count);
                }
                break;
            case DEFAULT:
            default:
                referenceChild(database, parent, child, count);
                break;
        }
    }

    private void referenceChild(Database database, Table parent, String child, int count) {
        if (count == 1) {
            requireFreeName(parent, child);
            parent.addForeignKey(child);
        } else {
            for (int i = 1; i <= count; i++) {
                requireFreeName(parent, child + i);
                parent.addForeignKey(child + i, child);
            }
        }
        database.addRelation(parent.getName(), child);
    }

    private void referenceParent(Database database, Table parent, String child) {
        Table childTable = database.table(child);
        requireFreeName(childTable, child);
        childTable.addForeignKey(parent.getName());
        database.addRelation(child, parent.getName());
    }

    private static void requireFreeName(Table holder, String name) {
        if (holder.hasColumn(name)) {
            throw new NamingCollisionException(holder.getName(), name);
        }
    }
}
