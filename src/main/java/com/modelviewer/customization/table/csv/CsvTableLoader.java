package com.modelviewer.customization.table.csv;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.modelviewer.customization.table.TableLoadException;
import com.modelviewer.customization.table.TableLoader;
import com.modelviewer.customization.table.TableName;
import com.modelviewer.customization.table.TableSchema;

/**
 * Loads client database tables exported as CSV, one {@code <TableName>.csv} per table in a single directory.
 *
 * Every file must have a header row and an {@code ID} column. File names are matched case-insensitively.
 */
public class CsvTableLoader implements TableLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvTableLoader.class);

    private static final String ID_COLUMN = "ID";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .setTrim(false)
            .get();

    private final Path dataDir;

    public CsvTableLoader(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
    }

    @Override
    public <R> Map<Integer, R> load(TableSchema<R> schema) {
        TableName table = schema.getTable();
        Path file = findTableFile(table)
                .orElseThrow(() -> new TableLoadException(table, "No CSV export found in " + dataDir));

        Map<Integer, R> rows = new LinkedHashMap<>();
        try (CSVParser parser = CSVParser.parse(file, StandardCharsets.UTF_8, FORMAT)) {
            if (!parser.getHeaderMap().containsKey(ID_COLUMN)) {
                throw new TableLoadException(table, "Missing column " + ID_COLUMN + " in " + file);
            }
            for (CSVRecord record : parser) {
                CsvRowReader reader = new CsvRowReader(table, record);
                int id = reader.getInt(ID_COLUMN);
                rows.put(id, schema.decode(id, reader));
            }
        } catch (IOException | UncheckedIOException e) {
            throw new TableLoadException(table, "Failed to read " + file, e);
        }

        log.debug("Loaded {} rows from {}", rows.size(), file.getFileName());
        return Collections.unmodifiableMap(rows);
    }

    @Override
    public boolean hasTable(TableName table) {
        return findTableFile(table).isPresent();
    }

    private Optional<Path> findTableFile(TableName table) {
        String expected = (table.getTableName() + ".csv").toLowerCase(Locale.ROOT);
        if (!Files.isDirectory(dataDir)) {
            return Optional.empty();
        }
        try (Stream<Path> stream = Files.list(dataDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).equals(expected))
                    .findFirst();
        } catch (IOException e) {
            throw new TableLoadException(table, "Failed to list " + dataDir, e);
        }
    }
}
