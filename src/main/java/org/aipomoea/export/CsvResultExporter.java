package org.aipomoea.export;

import org.aipomoea.aggregation.ResultTable;
import org.aipomoea.util.Utils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes {@code <table>.csv}: an {@code image} column followed by one column per command, rows sorted by image.
 * Missing values are empty cells.
 */
public class CsvResultExporter implements ResultExporter {

    private static final Logger LOGGER = Logger.getLogger(CsvResultExporter.class.getName());

    static final String IMAGE_COLUMN = "image";

    private final Path outputDir;

    public CsvResultExporter(Path outputDir) {
        this.outputDir = outputDir;
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.CSV;
    }

    @Override
    public void export(String tableName, ResultTable table) throws ExportException {
        if (table.isEmpty())
            throw new ExportException("No rows to export for " + tableName);

        final Path target = outputDir.resolve(ResultExporter.fileBaseName(tableName) + ".csv");
        final List<String> commands = table.commands();
        final List<String> images = new ArrayList<>(table.images());
        Collections.sort(images);

        try {
            Files.createDirectories(outputDir);
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
                final List<String> header = new ArrayList<>();
                header.add(IMAGE_COLUMN);
                header.addAll(commands);
                writeRow(writer, header);

                for (String image : images) {
                    final Map<String, String> row = table.row(image);
                    final List<String> cells = new ArrayList<>();
                    cells.add(image);
                    for (String command : commands)
                        cells.add(row.get(command));
                    writeRow(writer, cells);
                }
            }
        } catch (IOException e) {
            throw new ExportException("Failed writing " + target + ": " + e.getMessage(), e);
        }
        LOGGER.log(Level.INFO, "Wrote {0} rows to {1}", new Object[]{images.size(), target});
    }

    private static void writeRow(BufferedWriter writer, List<String> cells) throws IOException {
        final List<String> escaped = new ArrayList<>(cells.size());
        for (String cell : cells)
            escaped.add(Utils.escapeCsvField(cell));
        writer.write(String.join(",", escaped));
        writer.newLine();
    }
}
