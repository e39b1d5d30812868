package org.aipomoea.export;

import org.aipomoea.aggregation.ResultTable;
import org.aipomoea.metrics.Status;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs every enabled exporter over the grouped tables. A failure is confined to its (format, group) pair; the
 * remaining pairs are still attempted. The database exporter receives the whole table once instead of per group.
 */
public class ExportCoordinator {

    private static final Logger LOGGER = Logger.getLogger(ExportCoordinator.class.getName());

    public static final String EXPORT_ERROR = "FERS2";

    private final List<ResultExporter> exporters;

    public ExportCoordinator(List<ResultExporter> exporters) {
        this.exporters = List.copyOf(exporters);
    }

    /**
     * @param fullTable the ungrouped table, used by the database exporter
     * @param groups    group key to table, used by the file exporters
     * @return per format: PASS when every write succeeded, PARTIAL when some did, FAIL when none did
     */
    public Map<ExportFormat, Status> exportAll(ResultTable fullTable, Map<String, ResultTable> groups) {
        final Map<ExportFormat, Status> outcome = new EnumMap<>(ExportFormat.class);
        for (ResultExporter exporter : exporters) {
            final Map<String, ResultTable> targets = exporter.format() == ExportFormat.CONNECTED_DATABASE
                    ? Map.of(exporter.format().key(), fullTable)
                    : groups;

            int failed = 0;
            for (Map.Entry<String, ResultTable> target : targets.entrySet()) {
                try {
                    exporter.export(target.getKey(), target.getValue());
                } catch (ExportException | RuntimeException e) {
                    failed++;
                    LOGGER.log(Level.SEVERE, EXPORT_ERROR + " - Error while exporting " + target.getKey() + " as "
                            + exporter.format().key() + ": " + e.getMessage(), e);
                }
            }

            final Status status;
            if (failed == 0)
                status = Status.PASS;
            else
                status = failed == targets.size() ? Status.FAIL : Status.PARTIAL;
            outcome.put(exporter.format(), status);
            System.out.printf("  Export %s: %s (%d/%d tables written)%n", exporter.format().key(), status,
                    targets.size() - failed, targets.size());
        }
        return outcome;
    }
}
