package com.project.imaging.pipeline.model;

import java.util.Arrays;

/** Closed domain of {@code movie.movie_class}. */
public enum MovieClass {
    MOUSECAM("mousecam"),
    OBJECT3D("object3d"),
    MADMAX("madmax");

    private final String value;

    MovieClass(String value) {
        this.value = value;
    }

    /** The value stored in the database. */
    public String value() {
        return value;
    }

    public static MovieClass fromValue(String value) {
        return Arrays.stream(values())
                .filter(c -> c.value.equals(value))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown movie class '" + value + "', expected one of " + Arrays.toString(values())));
    }

    @Override
    public String toString() {
        return value;
    }
}
