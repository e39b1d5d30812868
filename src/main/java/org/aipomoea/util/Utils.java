package org.aipomoea.util;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * String helpers shared by parsing, grouping and export.
 */
public final class Utils {

    /** Delimiters of the filename naming convention. */
    public static final Pattern NAME_DELIMITERS = Pattern.compile("[_-]");

    private Utils() {
    }

    public static String escapeCsvField(String field) {
        if (field == null) {
            return "";
        } else {
            boolean mustQuote = field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r");
            String escaped = field.replace("\"", "\"\"");
            return mustQuote ? "\"" + escaped + "\"" : escaped;
        }
    }

    /**
     * Strips the last extension: {@code a.b.jpg -> a.b}. A leading dot is not an extension ({@code .hidden}).
     */
    public static String removeExtension(String fileName) {
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0)
            return fileName;
        final String head = fileName.substring(0, dot);
        return head.chars().allMatch(c -> c == '.') ? fileName : head;
    }

    /**
     * Last path component, accepting both {@code /} and {@code \} separators since binaries may print either.
     */
    public static String baseName(String path) {
        final int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut < 0 ? path : path.substring(cut + 1);
    }

    /**
     * Removes any of {@code chars} from both ends of {@code value}.
     */
    public static String strip(String value, String chars) {
        int start = 0;
        int end = value.length();
        while (start < end && chars.indexOf(value.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(value.charAt(end - 1)) >= 0) end--;
        return value.substring(start, end);
    }

    /**
     * Splits a filename or naming convention on {@code _} and {@code -}.
     */
    public static List<String> tokenize(String name) {
        return Arrays.asList(NAME_DELIMITERS.split(name, -1));
    }
}
