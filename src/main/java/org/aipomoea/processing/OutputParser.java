package org.aipomoea.processing;

import org.aipomoea.model.ExecutionRecord;
import org.aipomoea.util.Utils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns the text printed by a model binary into records. The only recognized line shape is
 * {@code <anything>: <path> [-] Result: <value>}; any other line is incidental output and is skipped.
 */
public final class OutputParser {

    public static final String RESULT_SEPARATOR = " Result: ";
    static final String FIELD_SEPARATOR = ": ";

    private OutputParser() {
    }

    /**
     * Parses one line. The image name is the basename of the path field with {@code " -"} trimmed and the
     * extension removed; the value has {@code *} markers removed and is trimmed.
     *
     * @return the record, or empty when the line does not contain {@value #RESULT_SEPARATOR} exactly once
     * or has no path field
     */
    public static Optional<ExecutionRecord> parseLine(String line, String commandName) {
        if (line == null)
            return Optional.empty();
        final int sep = line.indexOf(RESULT_SEPARATOR);
        if (sep < 0 || line.indexOf(RESULT_SEPARATOR, sep + RESULT_SEPARATOR.length()) >= 0)
            return Optional.empty();

        final String left = line.substring(0, sep);
        final String right = line.substring(sep + RESULT_SEPARATOR.length());

        final int fieldStart = left.indexOf(FIELD_SEPARATOR);
        if (fieldStart < 0)
            return Optional.empty();
        final int fieldEnd = left.indexOf(FIELD_SEPARATOR, fieldStart + FIELD_SEPARATOR.length());
        final String pathField = fieldEnd < 0
                ? left.substring(fieldStart + FIELD_SEPARATOR.length())
                : left.substring(fieldStart + FIELD_SEPARATOR.length(), fieldEnd);

        final String imageName = Utils.removeExtension(Utils.strip(Utils.baseName(pathField), " -"));
        if (imageName.isEmpty())
            return Optional.empty();

        final String value = right.replace("*", "").strip();
        return Optional.of(new ExecutionRecord(imageName, commandName, value));
    }

    public static List<ExecutionRecord> parse(List<String> lines, String commandName) {
        final List<ExecutionRecord> records = new ArrayList<>();
        for (String line : lines)
            parseLine(line, commandName).ifPresent(records::add);
        return records;
    }
}
