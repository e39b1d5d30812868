package org.aipomoea.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.aipomoea.aggregation.ResultTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes {@code <table>.json}: an array with one object per image, holding {@code image} and one key per command.
 * Commands without a value for an image are written as {@code null}.
 */
public class JsonResultExporter implements ResultExporter {

    private static final Logger LOGGER = Logger.getLogger(JsonResultExporter.class.getName());

    private final Path outputDir;
    private final ObjectMapper mapper;

    public JsonResultExporter(Path outputDir) {
        this(outputDir, new ObjectMapper());
    }

    public JsonResultExporter(Path outputDir, ObjectMapper mapper) {
        this.outputDir = outputDir;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public ExportFormat format() {
        return ExportFormat.JSON;
    }

    @Override
    public void export(String tableName, ResultTable table) throws ExportException {
        if (table.isEmpty())
            throw new ExportException("No rows to export for " + tableName);

        final Path target = outputDir.resolve(ResultExporter.fileBaseName(tableName) + ".json");
        final List<String> commands = table.commands();
        final List<String> images = new ArrayList<>(table.images());
        Collections.sort(images);

        final ArrayNode array = mapper.createArrayNode();
        for (String image : images) {
            final Map<String, String> row = table.row(image);
            final ObjectNode node = array.addObject();
            node.put(CsvResultExporter.IMAGE_COLUMN, image);
            for (String command : commands)
                node.put(command, row.get(command));
        }

        try {
            Files.createDirectories(outputDir);
            mapper.writeValue(target.toFile(), array);
        } catch (IOException e) {
            throw new ExportException("Failed writing " + target + ": " + e.getMessage(), e);
        }
        LOGGER.log(Level.INFO, "Wrote {0} rows to {1}", new Object[]{images.size(), target});
    }
}
