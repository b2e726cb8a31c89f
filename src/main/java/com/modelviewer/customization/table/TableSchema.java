package com.modelviewer.customization.table;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Describes how rows of one table are decoded into typed row objects.
 *
 * @param <R> row type
 */
@Value
@Builder
public class TableSchema<R> {

    @NonNull
    TableName table;

    @NonNull
    Class<R> rowType;

    @NonNull
    RowDecoder<R> decoder;

    public R decode(int id, RowReader reader) {
        return decoder.decode(id, reader);
    }

    @FunctionalInterface
    public interface RowDecoder<R> {
        R decode(int id, RowReader reader);
    }
}
