package com.cadence.core.domain;

import java.util.List;

/**
 * A class as stored under its dataset.
 */
public record DatasetClass(
        long id,
        String name,
        String description,
        List<String> recordings
) {
    public DatasetClass {
        recordings = recordings == null ? List.of() : List.copyOf(recordings);
    }

    public ClassDocument toDocument() {
        return new ClassDocument(name, description, recordings);
    }
}
