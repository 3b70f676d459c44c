package com.project.imaging.pipeline.DTOs;

import java.util.List;

public record PopulateReport(
        String table,
        int populated,
        List<KeyFailure> failures
) {
    public record KeyFailure(String key, String message) {}

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
