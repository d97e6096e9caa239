package com.cadence.core.domain;

import java.util.List;
import java.util.Objects;

/**
 * One class of a {@link DatasetDocument}: a name and the recording MBIDs assigned to it.
 */
public record ClassDocument(
        String name,
        String description,
        List<String> recordings
) {
    public ClassDocument {
        Objects.requireNonNull(name, "Class name cannot be null");
        recordings = recordings == null ? List.of() : List.copyOf(recordings);
    }
}
