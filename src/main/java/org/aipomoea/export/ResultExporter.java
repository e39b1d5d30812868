package org.aipomoea.export;

import org.aipomoea.aggregation.ResultTable;

import java.util.Locale;

/**
 * Writes a result table to one output format.
 */
public interface ResultExporter {

    ExportFormat format();

    /**
     * @param tableName group key of the table, or {@code results} when the run is not grouped
     */
    void export(String tableName, ResultTable table) throws ExportException;

    static String fileBaseName(String tableName) {
        return tableName.toLowerCase(Locale.ROOT);
    }
}
