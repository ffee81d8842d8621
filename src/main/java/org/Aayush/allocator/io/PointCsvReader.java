package org.Aayush.allocator.io;

import org.Aayush.allocator.error.ValidationException;
import org.Aayush.allocator.model.Point;
import org.Aayush.allocator.model.Worker;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads points and workers from CSV with a header row.
 *
 * <p>Coordinates come from {@code longitude}/{@code latitude} or the legacy aliases
 * {@code start_long}, {@code long}, {@code lng}, {@code lon} and {@code start_lat},
 * {@code lat}. An {@code id} column is optional; without it the 0-based row ordinal is
 * the id. Every other column is preserved verbatim as an attribute.</p>
 */
public final class PointCsvReader {
    public static final String REASON_MISSING_COLUMN = "IO_MISSING_COLUMN";
    public static final String REASON_MALFORMED_NUMBER = "IO_MALFORMED_NUMBER";

    static final String[] LONGITUDE_COLUMNS = {"longitude", "start_long", "long", "lng", "lon"};
    static final String[] LATITUDE_COLUMNS = {"latitude", "start_lat", "lat"};
    static final String ID_COLUMN = "id";
    static final String CAPACITY_COLUMN = "capacity";

    public List<Point> readPoints(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readPoints(reader);
        }
    }

    public List<Point> readPoints(Reader reader) throws IOException {
        CsvTable table = CsvTable.read(reader);
        Layout layout = Layout.of(table, false);
        List<Point> points = new ArrayList<>(table.rows().size());
        for (int r = 0; r < table.rows().size(); r++) {
            List<String> row = table.rows().get(r);
            String id = layout.idOf(row, r);
            points.add(Point.builder()
                    .id(id)
                    .longitude(parseCoordinate(row.get(layout.longitude), id, table.header().get(layout.longitude)))
                    .latitude(parseCoordinate(row.get(layout.latitude), id, table.header().get(layout.latitude)))
                    .attributes(layout.attributesOf(table.header(), row))
                    .build());
        }
        return points;
    }

    /**
     * Reads workers; an optional {@code capacity} column bounds each worker, blank means unbounded.
     */
    public List<Worker> readWorkers(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return readWorkers(reader);
        }
    }

    public List<Worker> readWorkers(Reader reader) throws IOException {
        CsvTable table = CsvTable.read(reader);
        Layout layout = Layout.of(table, true);
        List<Worker> workers = new ArrayList<>(table.rows().size());
        for (int r = 0; r < table.rows().size(); r++) {
            List<String> row = table.rows().get(r);
            String id = layout.idOf(row, r);
            workers.add(Worker.builder()
                    .id(id)
                    .longitude(parseCoordinate(row.get(layout.longitude), id, table.header().get(layout.longitude)))
                    .latitude(parseCoordinate(row.get(layout.latitude), id, table.header().get(layout.latitude)))
                    .capacity(layout.capacity < 0 ? null : parseCapacity(row.get(layout.capacity), id))
                    .attributes(layout.attributesOf(table.header(), row))
                    .build());
        }
        return workers;
    }

    private static double parseCoordinate(String raw, String id, String column) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new ValidationException(
                    REASON_MALFORMED_NUMBER,
                    id,
                    "column " + column + " is not a number: '" + raw + "'"
            );
        }
    }

    private static Integer parseCapacity(String raw, String id) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException ex) {
            throw new ValidationException(REASON_MALFORMED_NUMBER, id, "capacity is not an integer: '" + raw + "'");
        }
    }

    /**
     * Column positions resolved once per table.
     */
    private static final class Layout {
        private final int longitude;
        private final int latitude;
        private final int id;
        private final int capacity;

        private Layout(int longitude, int latitude, int id, int capacity) {
            this.longitude = longitude;
            this.latitude = latitude;
            this.id = id;
            this.capacity = capacity;
        }

        static Layout of(CsvTable table, boolean withCapacity) {
            int longitude = table.column(LONGITUDE_COLUMNS);
            if (longitude < 0) {
                throw new ValidationException(
                        REASON_MISSING_COLUMN,
                        "longitude",
                        "input needs a longitude column (longitude, start_long, long, lng or lon)"
                );
            }
            int latitude = table.column(LATITUDE_COLUMNS);
            if (latitude < 0) {
                throw new ValidationException(
                        REASON_MISSING_COLUMN,
                        "latitude",
                        "input needs a latitude column (latitude, start_lat or lat)"
                );
            }
            return new Layout(
                    longitude,
                    latitude,
                    table.column(ID_COLUMN),
                    withCapacity ? table.column(CAPACITY_COLUMN) : -1
            );
        }

        String idOf(List<String> row, int ordinal) {
            if (id < 0) {
                return Integer.toString(ordinal);
            }
            return row.get(id).trim();
        }

        Map<String, String> attributesOf(List<String> header, List<String> row) {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                if (i == longitude || i == latitude || i == id || i == capacity) {
                    continue;
                }
                attributes.put(header.get(i), row.get(i));
            }
            return attributes;
        }
    }
}
