package com.modelviewer.customization.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Table loader backed by rows registered in code. Records the order tables were requested in.
 */
public class InMemoryTableLoader implements TableLoader {

    private final Map<TableName, Map<Integer, Object>> tables = new EnumMap<>(TableName.class);
    private final Set<TableName> failing = EnumSet.noneOf(TableName.class);
    private final List<TableName> loadOrder = new ArrayList<>();

    public InMemoryTableLoader row(TableName table, int id, Object row) {
        tables.computeIfAbsent(table, k -> new LinkedHashMap<>()).put(id, row);
        return this;
    }

    /**
     * Register a table with no rows, so {@link #hasTable(TableName)} reports it.
     */
    public InMemoryTableLoader emptyTable(TableName table) {
        tables.computeIfAbsent(table, k -> new LinkedHashMap<>());
        return this;
    }

    public InMemoryTableLoader removeTable(TableName table) {
        tables.remove(table);
        return this;
    }

    public InMemoryTableLoader failOn(TableName table) {
        failing.add(table);
        return this;
    }

    public List<TableName> getLoadOrder() {
        return Collections.unmodifiableList(loadOrder);
    }

    @Override
    public <R> Map<Integer, R> load(TableSchema<R> schema) {
        TableName table = schema.getTable();
        loadOrder.add(table);
        if (failing.contains(table)) {
            throw new TableLoadException(table, "simulated decode failure");
        }
        Map<Integer, R> rows = new LinkedHashMap<>();
        tables.getOrDefault(table, Map.of())
                .forEach((id, row) -> rows.put(id, schema.getRowType().cast(row)));
        return rows;
    }

    @Override
    public boolean hasTable(TableName table) {
        return tables.containsKey(table);
    }
}
