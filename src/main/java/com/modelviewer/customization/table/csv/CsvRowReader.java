package com.modelviewer.customization.table.csv;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVRecord;

import com.modelviewer.customization.table.RowReader;
import com.modelviewer.customization.table.TableLoadException;
import com.modelviewer.customization.table.TableName;

/**
 * Reads typed columns from one CSV record. Array columns are stored as {@code Name[0]}, {@code Name[1]}, ...
 */
class CsvRowReader implements RowReader {

    private static final long MAX_UNSIGNED = 0xFFFFFFFFL;

    private final TableName table;
    private final CSVRecord record;

    CsvRowReader(TableName table, CSVRecord record) {
        this.table = table;
        this.record = record;
    }

    @Override
    public int getInt(String column) {
        String raw = getString(column).trim();
        if (raw.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            // Unsigned 32-bit values (masks, ids) are exported without sign.
            long unsigned;
            try {
                unsigned = Long.parseLong(raw);
            } catch (NumberFormatException notUnsigned) {
                throw malformed(column, raw, "is not numeric", e);
            }
            if (unsigned < 0 || unsigned > MAX_UNSIGNED) {
                throw malformed(column, raw, "is out of the 32-bit range", e);
            }
            return (int) unsigned;
        }
    }

    private TableLoadException malformed(String column, String raw, String problem, NumberFormatException cause) {
        return new TableLoadException(table,
                "Line " + record.getRecordNumber() + ": column " + column + " " + problem + ": '" + raw + "'", cause);
    }

    @Override
    public String getString(String column) {
        if (!record.isMapped(column)) {
            throw new TableLoadException(table, "Missing column " + column);
        }
        if (!record.isSet(column)) {
            return "";
        }
        return record.get(column);
    }

    @Override
    public List<Integer> getIntArray(String column, int length) {
        List<Integer> values = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            String indexed = column + "[" + i + "]";
            if (!record.isMapped(indexed)) {
                break;
            }
            values.add(getInt(indexed));
        }
        if (values.isEmpty() && record.isMapped(column)) {
            values.add(getInt(column));
        }
        return values;
    }
}
