package com.project.imaging.pipeline.DTOs;

import com.project.imaging.pipeline.exceptions.ScanReadException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Frame-invariant ScanImage header, as {@code key = value} pairs.
 * Keys are stored without the {@code scanimage.} and {@code SI.} prefixes, so
 * {@code scanimage.SI.hFastZ.userZs} is looked up as {@code hFastZ.userZs}.
 */
public record ScanImageHeader(Map<String, String> fields) {

    public static final String SLICE_POSITIONS = "hFastZ.userZs";

    private static final Pattern VECTOR_SEPARATOR = Pattern.compile("[\\s,;]+");

    public ScanImageHeader {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static ScanImageHeader parse(String text) {
        Map<String, String> fields = new LinkedHashMap<>();
        if (text == null) return new ScanImageHeader(fields);
        for (String line : text.split("\\r?\\n")) {
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = normalizeKey(line.substring(0, eq).trim());
            String value = line.substring(eq + 1).trim();
            if (!key.isEmpty()) fields.put(key, value);
        }
        return new ScanImageHeader(fields);
    }

    /** Combines two headers; entries of {@code other} win on duplicate keys. */
    public ScanImageHeader merge(ScanImageHeader other) {
        Map<String, String> merged = new LinkedHashMap<>(fields);
        merged.putAll(other.fields);
        return new ScanImageHeader(merged);
    }

    public boolean contains(String key) {
        return fields.containsKey(key);
    }

    public String get(String key) {
        String value = fields.get(key);
        if (value == null) {
            throw new ScanReadException("ScanImage header has no entry '" + key + "'");
        }
        return value;
    }

    /**
     * Reads a MATLAB scalar or vector literal: {@code 5}, {@code [0 -10 -20]}, {@code [0;10]}.
     */
    public double[] getDoubles(String key) {
        String raw = get(key).trim();
        if (raw.startsWith("[") && raw.endsWith("]")) {
            raw = raw.substring(1, raw.length() - 1).trim();
        }
        if (raw.isEmpty()) return new double[0];
        String[] parts = VECTOR_SEPARATOR.split(raw);
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i]);
            } catch (NumberFormatException e) {
                throw new ScanReadException("Header entry '" + key + "' is not numeric: " + get(key), e);
            }
        }
        return values;
    }

    public double[] slicePositions() {
        return getDoubles(SLICE_POSITIONS);
    }

    private static String normalizeKey(String key) {
        if (key.startsWith("scanimage.")) key = key.substring("scanimage.".length());
        if (key.startsWith("SI.")) key = key.substring("SI.".length());
        return key;
    }
}
