package com.modelviewer.customization.table;

import java.util.List;

/**
 * Typed column access to a single source row. Implemented by each table-loader adapter.
 */
public interface RowReader {

    int getInt(String column);

    String getString(String column);

    /**
     * Read a fixed-size array column (e.g. TextureVariationFileDataID[0..3]).
     */
    List<Integer> getIntArray(String column, int length);
}
