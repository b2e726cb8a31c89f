package com.modelviewer.customization.table;

import java.util.Map;

/**
 * Supplies typed rows for a client database table.
 *
 * Implementations own all decoding and I/O; the catalog builder only consumes rows.
 */
public interface TableLoader {

    /**
     * Load every row of the schema's table.
     *
     * @return rows keyed by row id, in source order
     * @throws TableLoadException if the table cannot be read or decoded
     */
    <R> Map<Integer, R> load(TableSchema<R> schema);

    /**
     * Whether the loaded data version ships the given table at all.
     */
    boolean hasTable(TableName table);
}
