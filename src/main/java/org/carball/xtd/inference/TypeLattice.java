package org.carball.xtd.inference;

import org.carball.xtd.model.schema.DataType;

import java.util.regex.Pattern;

/**
 * Infers column types from literal values and widens them as more values are seen.
 */
public final class TypeLattice {

    private static final Pattern BIT_PATTERN = Pattern.compile("1|0|True|False");
    private static final Pattern INT_PATTERN = Pattern.compile("[0-9]+");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("[-+]?\\d*\\.?\\d+([eE][-+]?\\d+)?");

    private TypeLattice() {
        // Utility class - prevent instantiation
    }

    /**
     * Smallest type able to hold {@code literal}. Text that is not numeric becomes
     * NTEXT for element content and NVARCHAR for attributes.
     */
    public static DataType classify(String literal, boolean valueContext) {
        if (literal.isEmpty() || BIT_PATTERN.matcher(literal).matches()) {
            return DataType.BIT;
        }
        if (INT_PATTERN.matcher(literal).matches()) {
            return DataType.INT;
        }
        if (FLOAT_PATTERN.matcher(literal).matches()) {
            return DataType.FLOAT;
        }
        return valueContext ? DataType.NTEXT : DataType.NVARCHAR;
    }

    /**
     * Widens {@code previous} so that it can also hold {@code literal}. A null
     * {@code previous} means nothing was observed yet.
     */
    public static DataType merge(DataType previous, String literal, boolean valueContext) {
        return DataType.widest(previous, classify(literal, valueContext));
    }

    /**
     * Whether a column of type {@code candidate} can be stored in a column of type
     * {@code target}.
     */
    public static boolean isStorable(DataType target, DataType candidate) {
        return target == DataType.NTEXT || !candidate.isWiderThan(target);
    }
}
