package com.power.anomaly.engine.parser;

import com.power.anomaly.exception.MissingFeaturesException;
import com.power.anomaly.model.Feature;
import com.power.anomaly.model.ParseResult;
import com.power.anomaly.model.PowerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses raw delimited power consumption text into {@link PowerRecord}s.
 *
 * The first non-blank line is a header; columns are located by name so extra or reordered
 * columns are tolerated. A row whose timestamp does not parse, or whose feature fields are
 * missing ('?'), blank, not a plain decimal number or non-finite, is dropped and counted.
 * Bad rows never abort the file; a header without the required columns does.
 */
@Component
public class PowerRecordParser {

    private static final Logger log = LoggerFactory.getLogger(PowerRecordParser.class);

    static final String DATE_COLUMN = "Date";
    static final String TIME_COLUMN = "Time";

    // day/month/year hour:minute:second, as recorded by the household meter
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter
            .ofPattern("d/M/uuuu H:mm:ss", Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    // plain decimal with optional exponent; rejects Java-only literals such as 1.5d, 2f or 0x1p3
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public ParseResult parse(Reader source, RecordFormat format) {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        try {
            String headerLine = nextNonBlankLine(reader);
            if (headerLine == null) {
                return new ParseResult(List.of(), 0, 0);
            }
            ColumnLayout layout = ColumnLayout.fromHeader(split(headerLine, format.getDelimiter()));

            List<PowerRecord> records = new ArrayList<>();
            int dropped = 0;
            int lineNumber = 1;
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) continue;
                try {
                    records.add(parseRow(split(line, format.getDelimiter()), layout));
                } catch (RowRejectedException e) {
                    dropped++;
                    log.debug("Dropping line {}: {}", lineNumber, e.getMessage());
                }
            }

            log.info("Parsed {} records ({} rows dropped)", records.size(), dropped);
            return new ParseResult(records, records.size(), dropped);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read power consumption data", e);
        }
    }

    private PowerRecord parseRow(String[] fields, ColumnLayout layout) {
        if (fields.length < layout.requiredWidth()) {
            throw new RowRejectedException("expected at least " + layout.requiredWidth()
                    + " fields but found " + fields.length);
        }
        Instant timestamp = parseTimestamp(fields[layout.dateIndex()], fields[layout.timeIndex()]);
        double[] values = new double[Feature.COUNT];
        for (Feature feature : Feature.values()) {
            values[feature.ordinal()] = parseValue(fields[layout.featureIndex(feature)], feature);
        }
        return PowerRecord.builder()
                .timestamp(timestamp)
                .globalActivePower(values[Feature.GLOBAL_ACTIVE_POWER.ordinal()])
                .globalReactivePower(values[Feature.GLOBAL_REACTIVE_POWER.ordinal()])
                .voltage(values[Feature.VOLTAGE.ordinal()])
                .globalIntensity(values[Feature.GLOBAL_INTENSITY.ordinal()])
                .subMetering1(values[Feature.SUB_METERING_1.ordinal()])
                .subMetering2(values[Feature.SUB_METERING_2.ordinal()])
                .subMetering3(values[Feature.SUB_METERING_3.ordinal()])
                .build();
    }

    private Instant parseTimestamp(String date, String time) {
        try {
            return LocalDateTime.parse(date + " " + time, TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new RowRejectedException("unparseable timestamp '" + date + " " + time + "'");
        }
    }

    private double parseValue(String raw, Feature feature) {
        if (raw.isEmpty() || RecordFormat.MISSING_VALUE.equals(raw)) {
            throw new RowRejectedException("missing " + feature.getColumnName());
        }
        if (!DECIMAL.matcher(raw).matches()) {
            throw new RowRejectedException("non-numeric " + feature.getColumnName() + " '" + raw + "'");
        }
        double value = Double.parseDouble(raw);
        if (!Double.isFinite(value)) {
            throw new RowRejectedException("non-finite " + feature.getColumnName() + " '" + raw + "'");
        }
        return value;
    }

    private static String nextNonBlankLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) return line;
        }
        return null;
    }

    static String[] split(String line, char delimiter) {
        List<String> fields = new ArrayList<>(9);
        int start = 0;
        for (int i = 0; i <= line.length(); i++) {
            if (i == line.length() || line.charAt(i) == delimiter) {
                fields.add(unquote(line.substring(start, i).trim()));
                start = i + 1;
            }
        }
        return fields.toArray(new String[0]);
    }

    private static String unquote(String field) {
        if (field.length() >= 2 && field.charAt(0) == '"' && field.charAt(field.length() - 1) == '"') {
            return field.substring(1, field.length() - 1).trim();
        }
        return field;
    }

    /**
     * Column positions resolved from the header row.
     */
    record ColumnLayout(int dateIndex, int timeIndex, int[] featureIndexes, int requiredWidth) {

        static ColumnLayout fromHeader(String[] header) {
            Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < header.length; i++) {
                positions.putIfAbsent(header[i].toLowerCase(Locale.ROOT), i);
            }

            List<String> missing = new ArrayList<>();
            int dateIndex = lookup(positions, DATE_COLUMN, missing);
            int timeIndex = lookup(positions, TIME_COLUMN, missing);
            int[] featureIndexes = new int[Feature.COUNT];
            for (Feature feature : Feature.values()) {
                featureIndexes[feature.ordinal()] = lookup(positions, feature.getColumnName(), missing);
            }
            if (!missing.isEmpty()) {
                throw new MissingFeaturesException(missing);
            }

            int width = Math.max(dateIndex, timeIndex);
            for (int index : featureIndexes) {
                width = Math.max(width, index);
            }
            return new ColumnLayout(dateIndex, timeIndex, featureIndexes, width + 1);
        }

        private static int lookup(Map<String, Integer> positions, String column, List<String> missing) {
            Integer index = positions.get(column.toLowerCase(Locale.ROOT));
            if (index == null) {
                missing.add(column);
                return -1;
            }
            return index;
        }

        int featureIndex(Feature feature) {
            return featureIndexes[feature.ordinal()];
        }
    }

    /** Row-level parse failure; always caught and counted. */
    private static final class RowRejectedException extends RuntimeException {
        RowRejectedException(String message) {
            super(message, null, false, false);
        }
    }
}
