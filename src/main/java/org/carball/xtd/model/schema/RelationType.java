package org.carball.xtd.model.schema;

public enum RelationType {
    ONE_TO_ONE("1:1"),
    ONE_TO_MANY("1:N"),
    MANY_TO_ONE("N:1"),
    MANY_TO_MANY("N:M");

    private final String label;

    RelationType(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
