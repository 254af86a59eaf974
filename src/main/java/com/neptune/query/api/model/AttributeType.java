package com.neptune.query.api.model;

import java.util.Locale;

/**
 * Closed set of value kinds an attribute can hold, with the names used on the wire.
 */
public enum AttributeType {
    FLOAT("float", false),
    INT("int", false),
    STRING("string", false),
    BOOL("bool", false),
    DATETIME("datetime", false),
    STRING_SET("string_set", false),
    FILE("file", false),
    FLOAT_SERIES("float_series", true),
    STRING_SERIES("string_series", true),
    FILE_SERIES("file_series", true),
    HISTOGRAM_SERIES("histogram_series", true);

    private final String wireName;
    private final boolean series;

    AttributeType(String wireName, boolean series) {
        this.wireName = wireName;
        this.series = series;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isSeries() {
        return series;
    }

    public static AttributeType fromWireName(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (AttributeType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown attribute type: " + name);
    }
}
