package com.power.anomaly.engine.parser;

import com.power.anomaly.exception.UnsupportedFormatException;

import java.util.Locale;

/**
 * Supported raw input layouts, selected by file extension.
 */
public enum RecordFormat {

    /** The household power consumption text layout: semicolon separated, '?' for missing values. */
    SEMICOLON(';', ".txt"),
    CSV(',', ".csv");

    public static final String MISSING_VALUE = "?";

    private final char delimiter;
    private final String extension;

    RecordFormat(char delimiter, String extension) {
        this.delimiter = delimiter;
        this.extension = extension;
    }

    public char getDelimiter() { return delimiter; }

    public static RecordFormat fromFilename(String filename) {
        if (filename != null) {
            String lower = filename.toLowerCase(Locale.ROOT);
            for (RecordFormat format : values()) {
                if (lower.endsWith(format.extension)) {
                    return format;
                }
            }
        }
        throw new UnsupportedFormatException(
                "Unsupported file format for '" + filename + "'. Please upload a .csv or .txt file");
    }
}
