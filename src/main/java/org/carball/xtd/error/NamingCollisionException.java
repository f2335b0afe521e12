package org.carball.xtd.error;

import lombok.Getter;

/**
 * A generated primary key, foreign key or attribute column clashes with another
 * column of the same table.
 */
@Getter
public class NamingCollisionException extends XtdException {

    public static final int EXIT_CODE = 90;

    private final String tableName;
    private final String columnName;

    public NamingCollisionException(String tableName, String columnName) {
        super("Name collision in table '" + tableName + "': column '" + columnName + "' already exists");
        this.tableName = tableName;
        this.columnName = columnName;
    }

    @Override
    public int getExitCode() {
        return EXIT_CODE;
    }
}
