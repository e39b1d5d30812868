package org.aipomoea.aggregation;

import org.aipomoea.model.ExecutionRecord;
import org.aipomoea.model.ImageSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Folds execution records into a {@link ResultTable} and splits it into export groups.
 */
public class ResultAggregator {

    private static final Logger LOGGER = Logger.getLogger(ResultAggregator.class.getName());

    public static final String UNGROUPED = "results";

    public ResultTable aggregate(List<ExecutionRecord> records) {
        final ResultTable table = new ResultTable();
        for (ExecutionRecord record : records)
            put(table, record);
        return table;
    }

    /**
     * Like {@link #aggregate(List)} but drops records whose image is not part of {@code images}.
     */
    public ResultTable aggregate(List<ExecutionRecord> records, ImageSet images) {
        final ResultTable table = new ResultTable();
        int dropped = 0;
        for (ExecutionRecord record : records) {
            if (!images.containsStem(record.imageName())) {
                LOGGER.log(Level.WARNING, "Dropping result of {0} for unknown image {1}",
                        new Object[]{record.commandName(), record.imageName()});
                dropped++;
                continue;
            }
            put(table, record);
        }
        if (dropped > 0)
            LOGGER.log(Level.WARNING, "{0} records referenced images outside the image set.", dropped);
        return table;
    }

    private static void put(ResultTable table, ExecutionRecord record) {
        final Optional<String> existing = table.putIfAbsent(record.imageName(), record.commandName(), record.resultValue());
        if (existing.isPresent() && !existing.get().equals(record.resultValue())) {
            LOGGER.log(Level.WARNING, "Conflicting values for {0}/{1}: keeping {2}, ignoring {3}",
                    new Object[]{record.imageName(), record.commandName(), existing.get(), record.resultValue()});
        }
    }

    /**
     * Splits the table by the token at {@code position}. Without a position the whole table is the single
     * {@value #UNGROUPED} group. Images too short for the position are left out of every group. Keys are compared
     * ignoring case, so {@code G7} and {@code g7} form one group named after the first spelling seen.
     *
     * @return group key to table, sorted by key
     */
    public Map<String, ResultTable> group(ResultTable table, OptionalInt position) {
        if (position.isEmpty())
            return Map.of(UNGROUPED, table);

        final Map<String, List<String>> members = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String image : table.images()) {
            final Optional<String> key = GroupKeyResolver.groupKey(image, position.getAsInt());
            if (key.isEmpty()) {
                LOGGER.log(Level.WARNING, "Image {0} has no token at position {1}, left out of grouping.",
                        new Object[]{image, position.getAsInt() + 1});
                continue;
            }
            members.computeIfAbsent(key.get(), k -> new ArrayList<>()).add(image);
        }

        final Map<String, ResultTable> groups = new LinkedHashMap<>();
        members.forEach((key, images) -> groups.put(key, table.subset(images)));
        return groups;
    }
}
