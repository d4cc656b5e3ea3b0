package com.lidar.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How the published point cloud is colored
 */
public enum ColorMode {
    HEIGHT,
    NDVI,
    RGB,
    CLASSIFICATION;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ColorMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HEIGHT;
        }
        return ColorMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
