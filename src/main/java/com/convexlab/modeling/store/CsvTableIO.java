package com.convexlab.modeling.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.convexlab.modeling.exception.ModelDefinitionException;
import com.convexlab.modeling.model.Coordinate;
import com.convexlab.modeling.model.DataTable;
import com.convexlab.modeling.model.IndexSet;
import com.convexlab.modeling.model.ModelDefinition;
import com.convexlab.util.FileWriteUtil;

/**
 * Loads and exports table values as {@code <table>.csv} files. The header holds
 * the table's set names followed by {@value #VALUE_COLUMN}; blank values are
 * treated as missing.
 */
public class CsvTableIO {
    private static final Logger log = LoggerFactory.getLogger(CsvTableIO.class);

    public static final String VALUE_COLUMN = "value";
    private static final String SEPARATOR = ",";

    private final ModelDefinition model;

    public CsvTableIO(ModelDefinition model) {
        this.model = model;
    }

    /**
     * Loads every table of the model that has a file in {@code directory}.
     *
     * @return number of values loaded
     */
    public int loadAll(Path directory, TableStore store) throws IOException {
        int total = 0;
        for (DataTable table : model.getTables().values()) {
            Path file = directory.resolve(table.getName() + ".csv");
            if (Files.exists(file)) {
                total += load(table, file, store);
            } else {
                log.debug("No data file for table '{}'", table.getName());
            }
        }
        log.info("Loaded {} value(s) from {}", total, directory);
        return total;
    }

    public int load(DataTable table, Path file, TableStore store) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.isEmpty()) {
            throw new ModelDefinitionException("Empty data file " + file);
        }
        List<String> header = split(lines.get(0));
        Set<String> expected = new HashSet<>(table.getCoordinates());
        expected.add(VALUE_COLUMN);
        if (header.size() != expected.size() || !expected.containsAll(header)) {
            throw new ModelDefinitionException("Data file " + file + " has header " + header + ", expected "
                    + table.getCoordinates() + " and '" + VALUE_COLUMN + "'");
        }

        Map<Coordinate, Double> values = new LinkedHashMap<>();
        for (int lineNo = 1; lineNo < lines.size(); lineNo++) {
            String line = lines.get(lineNo);
            if (line.isBlank()) {
                continue;
            }
            List<String> cells = split(line);
            if (cells.size() != header.size()) {
                throw new ModelDefinitionException(file + ":" + (lineNo + 1) + " has " + cells.size()
                        + " cells, expected " + header.size());
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                row.put(header.get(i), cells.get(i));
            }
            String rawValue = row.get(VALUE_COLUMN);
            if (rawValue.isEmpty()) {
                continue;
            }
            Map<String, String> coordinate = new LinkedHashMap<>();
            for (String setName : table.getCoordinates()) {
                String item = row.get(setName);
                IndexSet set = model.set(setName);
                if (!set.contains(item)) {
                    throw new ModelDefinitionException(file + ":" + (lineNo + 1) + " item '" + item
                            + "' is not a member of set '" + setName + "'");
                }
                coordinate.put(setName, item);
            }
            try {
                values.put(Coordinate.of(coordinate), Double.parseDouble(rawValue));
            } catch (NumberFormatException e) {
                throw new ModelDefinitionException(file + ":" + (lineNo + 1) + " value '" + rawValue
                        + "' is not numeric", e);
            }
        }
        store.write(table.getName(), values);
        log.debug("Loaded {} value(s) into table '{}'", values.size(), table.getName());
        return values.size();
    }

    /**
     * Writes the stored values of the given tables, one file per table.
     */
    public void exportAll(Collection<String> tableNames, TableView store, Path directory) throws IOException {
        for (String tableName : tableNames) {
            export(model.table(tableName), store, directory.resolve(tableName + ".csv"));
        }
        log.info("Exported {} table(s) to {}", tableNames.size(), directory);
    }

    public void export(DataTable table, TableView store, Path file) throws IOException {
        export(table, store.read(table.getName()), file);
    }

    /**
     * Writes the given values of one table; an empty map yields a header-only file.
     */
    public void export(DataTable table, Map<Coordinate, Double> values, Path file) throws IOException {
        List<String> header = new ArrayList<>(table.getCoordinates());
        header.add(VALUE_COLUMN);
        List<String> lines = new ArrayList<>();
        lines.add(String.join(SEPARATOR, header));
        values.forEach((coordinate, value) -> {
            List<String> cells = new ArrayList<>(header.size());
            for (String setName : table.getCoordinates()) {
                cells.add(coordinate.get(setName));
            }
            cells.add(String.valueOf(value));
            lines.add(String.join(SEPARATOR, cells));
        });
        FileWriteUtil.safeWriteLines(file, lines);
    }

    private static List<String> split(String line) {
        String[] parts = line.split(SEPARATOR, -1);
        List<String> cells = new ArrayList<>(parts.length);
        for (String part : parts) {
            cells.add(part.trim());
        }
        return cells;
    }
}
