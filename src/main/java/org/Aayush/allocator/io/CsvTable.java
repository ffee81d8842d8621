package org.Aayush.allocator.io;

import org.Aayush.allocator.error.ValidationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Minimal RFC 4180 table: comma separated, double-quote escaping, header row first.
 *
 * <p>Lines starting with {@code #} before the header are skipped, so files written with a
 * metadata preamble can be read back.</p>
 */
final class CsvTable {
    static final String REASON_EMPTY_INPUT = "IO_EMPTY_INPUT";
    static final String REASON_ROW_WIDTH = "IO_ROW_WIDTH";
    static final String REASON_UNTERMINATED_QUOTE = "IO_UNTERMINATED_QUOTE";

    private final List<String> header;
    private final List<List<String>> rows;

    private CsvTable(List<String> header, List<List<String>> rows) {
        this.header = header;
        this.rows = rows;
    }

    static CsvTable read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (header == null && (line.isBlank() || line.startsWith("#"))) {
                continue;
            }
            if (header != null && line.isEmpty()) {
                continue;
            }
            StringBuilder record = new StringBuilder(line);
            while (openQuotes(record)) {
                String continuation = reader.readLine();
                if (continuation == null) {
                    throw new ValidationException(
                            REASON_UNTERMINATED_QUOTE,
                            Integer.toString(lineNumber),
                            "quoted field is never closed"
                    );
                }
                lineNumber++;
                record.append('\n').append(continuation);
            }
            List<String> fields = split(record.toString());
            if (header == null) {
                if (!fields.isEmpty() && fields.get(0).startsWith("\uFEFF")) {
                    fields.set(0, fields.get(0).substring(1));
                }
                header = fields;
                continue;
            }
            if (fields.size() != header.size()) {
                throw new ValidationException(
                        REASON_ROW_WIDTH,
                        Integer.toString(lineNumber),
                        "row has " + fields.size() + " fields but header has " + header.size()
                );
            }
            rows.add(fields);
        }
        if (header == null) {
            throw new ValidationException(REASON_EMPTY_INPUT, "input has no header row");
        }
        return new CsvTable(List.copyOf(header), rows);
    }

    List<String> header() {
        return header;
    }

    List<List<String>> rows() {
        return rows;
    }

    /**
     * Index of the first header column matching any name (case-insensitive), or -1.
     */
    int column(String... names) {
        for (String name : names) {
            for (int i = 0; i < header.size(); i++) {
                if (header.get(i).trim().equalsIgnoreCase(name)) {
                    return i;
                }
            }
        }
        return -1;
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean quote = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!quote) {
            return value;
        }
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static boolean openQuotes(CharSequence record) {
        boolean open = false;
        for (int i = 0; i < record.length(); i++) {
            if (record.charAt(i) == '"') {
                open = !open;
            }
        }
        return open;
    }

    private static List<String> split(String record) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < record.length(); i++) {
            char c = record.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < record.length() && record.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else if (c != '\r') {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }
}
