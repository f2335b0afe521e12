package org.carball.xtd.model.schema;

/**
 * A classified relation from the table being reported to {@code table}.
 */
public record TableRelation(
    RelationType type,
    String table
) {}
