package org.aipomoea.aggregation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Wide result table: image name to command name to result value.
 * Images keep insertion order; commands are reported sorted so exports get a stable header.
 */
public final class ResultTable {

    private final Map<String, Map<String, String>> rows = new LinkedHashMap<>();

    /**
     * Stores a value unless the cell is already set.
     *
     * @return the value already present for the cell, or empty when the value was stored
     */
    public Optional<String> putIfAbsent(String image, String command, String value) {
        final Map<String, String> row = rows.computeIfAbsent(image, k -> new LinkedHashMap<>());
        return Optional.ofNullable(row.putIfAbsent(command, value));
    }

    public Optional<String> get(String image, String command) {
        final Map<String, String> row = rows.get(image);
        return row == null ? Optional.empty() : Optional.ofNullable(row.get(command));
    }

    public List<String> images() {
        return new ArrayList<>(rows.keySet());
    }

    /**
     * Every command that has at least one value, sorted by name.
     */
    public List<String> commands() {
        final TreeSet<String> commands = new TreeSet<>();
        rows.values().forEach(row -> commands.addAll(row.keySet()));
        return new ArrayList<>(commands);
    }

    public Map<String, String> row(String image) {
        final Map<String, String> row = rows.get(image);
        return row == null ? Map.of() : Collections.unmodifiableMap(row);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Map<String, Map<String, String>> asMap() {
        final Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        rows.forEach((image, row) -> copy.put(image, Collections.unmodifiableMap(new LinkedHashMap<>(row))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * A new table with only the rows of {@code images}, in the given order.
     */
    public ResultTable subset(List<String> images) {
        final ResultTable subset = new ResultTable();
        for (String image : images) {
            final Map<String, String> row = rows.get(image);
            if (row != null)
                subset.rows.put(image, new LinkedHashMap<>(row));
        }
        return subset;
    }

    @Override
    public String toString() {
        return "ResultTable" + rows;
    }
}
