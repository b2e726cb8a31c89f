package com.modelviewer.customization.table;

/**
 * Raised when a source table cannot be read or decoded. Fatal to catalog construction.
 */
public class TableLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final TableName table;

    public TableLoadException(TableName table, String message) {
        super(table + ": " + message);
        this.table = table;
    }

    public TableLoadException(TableName table, String message, Throwable cause) {
        super(table + ": " + message, cause);
        this.table = table;
    }

    public TableName getTable() {
        return table;
    }
}
