package com.power.anomaly.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * The 7 measured features of a power consumption reading, in model order.
 * The ordinal is the column index in every feature vector.
 */
public enum Feature {

    GLOBAL_ACTIVE_POWER("Global_active_power", "global_active_power", PowerRecord::getGlobalActivePower),
    GLOBAL_REACTIVE_POWER("Global_reactive_power", "global_reactive_power", PowerRecord::getGlobalReactivePower),
    VOLTAGE("Voltage", "voltage", PowerRecord::getVoltage),
    GLOBAL_INTENSITY("Global_intensity", "global_intensity", PowerRecord::getGlobalIntensity),
    SUB_METERING_1("Sub_metering_1", "sub_metering_1", PowerRecord::getSubMetering1),
    SUB_METERING_2("Sub_metering_2", "sub_metering_2", PowerRecord::getSubMetering2),
    SUB_METERING_3("Sub_metering_3", "sub_metering_3", PowerRecord::getSubMetering3);

    public static final int COUNT = values().length;

    private final String columnName;
    private final String jsonName;
    private final ToDoubleFunction<PowerRecord> accessor;

    Feature(String columnName, String jsonName, ToDoubleFunction<PowerRecord> accessor) {
        this.columnName = columnName;
        this.jsonName = jsonName;
        this.accessor = accessor;
    }

    public String getColumnName() { return columnName; }

    public double valueOf(PowerRecord record) {
        return accessor.applyAsDouble(record);
    }

    /**
     * Resolve a feature from either its source column name or its JSON field name, ignoring case.
     */
    public static Optional<Feature> fromName(String name) {
        if (name == null) return Optional.empty();
        String trimmed = name.trim();
        return Arrays.stream(values())
                .filter(f -> f.columnName.equalsIgnoreCase(trimmed) || f.jsonName.equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static List<String> columnNames() {
        return Arrays.stream(values()).map(Feature::getColumnName).toList();
    }
}
