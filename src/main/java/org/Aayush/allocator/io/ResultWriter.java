package org.Aayush.allocator.io;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializes a {@link ResultTable} as CSV or JSON.
 *
 * <p>CSV output carries metadata as leading {@code # key=value} comment lines, which
 * {@link PointCsvReader} skips. JSON output is {@code {"metadata": {...}, "records": [...]}}.</p>
 */
public final class ResultWriter {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeNulls()
            .create();

    private final OutputFormat format;

    public ResultWriter(OutputFormat format) {
        this.format = Objects.requireNonNull(format, "format");
    }

    public void write(ResultTable table, Path target) throws IOException {
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            write(table, writer);
        }
    }

    public void write(ResultTable table, Writer writer) throws IOException {
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(writer, "writer");
        switch (format) {
            case CSV -> writeCsv(table, writer);
            case JSON -> writeJson(table, writer);
        }
        writer.flush();
    }

    private static void writeCsv(ResultTable table, Writer writer) throws IOException {
        for (Map.Entry<String, Object> entry : table.metadata().entrySet()) {
            writer.write("# " + entry.getKey() + "=" + cellText(entry.getValue()).replace('\n', ' ') + "\n");
        }
        writeCsvRow(table.columns(), writer);
        for (List<Object> record : table.records()) {
            writeCsvRow(record, writer);
        }
    }

    private static void writeCsvRow(List<?> cells, Writer writer) throws IOException {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(CsvTable.escape(cellText(cells.get(i))));
        }
        line.append('\n');
        writer.write(line.toString());
    }

    private static void writeJson(ResultTable table, Writer writer) {
        JsonObject metadata = new JsonObject();
        for (Map.Entry<String, Object> entry : table.metadata().entrySet()) {
            metadata.add(entry.getKey(), toJson(entry.getValue()));
        }
        JsonArray records = new JsonArray();
        List<String> columns = table.columns();
        for (List<Object> record : table.records()) {
            JsonObject object = new JsonObject();
            for (int i = 0; i < columns.size(); i++) {
                object.add(columns.get(i), toJson(record.get(i)));
            }
            records.add(object);
        }
        JsonObject root = new JsonObject();
        root.add("metadata", metadata);
        root.add("records", records);
        GSON.toJson(root, writer);
    }

    private static JsonElement toJson(Object value) {
        if (value == null) {
            return JsonNull.INSTANCE;
        }
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        if (value instanceof Boolean bool) {
            return new JsonPrimitive(bool);
        }
        return new JsonPrimitive(value.toString());
    }

    private static String cellText(Object value) {
        return value == null ? "" : value.toString();
    }
}
