package org.carball.xtd.model.schema;

/**
 * Column types ordered by representational width. Every type can hold all the
 * values of the types declared before it.
 */
public enum DataType {
    BIT,
    INT,
    FLOAT,
    NVARCHAR,
    NTEXT;

    public boolean isWiderThan(DataType other) {
        return compareTo(other) > 0;
    }

    public static DataType widest(DataType first, DataType second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return second.isWiderThan(first) ? second : first;
    }
}
