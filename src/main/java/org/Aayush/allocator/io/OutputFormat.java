package org.Aayush.allocator.io;

import org.Aayush.allocator.error.ValidationException;

import java.util.Locale;

/**
 * Result file formats.
 */
public enum OutputFormat {
    CSV,
    JSON;

    public static final String REASON_UNKNOWN_FORMAT = "IO_UNKNOWN_FORMAT";

    public static OutputFormat fromId(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (OutputFormat format : values()) {
                if (format.name().equals(normalized)) {
                    return format;
                }
            }
        }
        throw new ValidationException(REASON_UNKNOWN_FORMAT, value, "unknown output format; supported: csv, json");
    }
}
