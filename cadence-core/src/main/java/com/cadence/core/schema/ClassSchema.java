package com.cadence.core.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rules for a single class entry of a dataset document.
 *
 * @param nameMinLength minimum class name length in code points
 * @param nameMaxLength maximum class name length in code points
 * @param minRecordings minimum number of recordings in the class
 * @param recordingPattern pattern every recording identifier must match in full
 */
public record ClassSchema(
        int nameMinLength,
        int nameMaxLength,
        int minRecordings,
        Pattern recordingPattern
) {
    public ClassSchema {
        Objects.requireNonNull(recordingPattern, "Recording pattern cannot be null");
        if (nameMinLength < 0 || nameMaxLength < nameMinLength) {
            throw new IllegalArgumentException("Invalid class name length bounds");
        }
        if (minRecordings < 0) {
            throw new IllegalArgumentException("Minimum recordings cannot be negative");
        }
    }

    public ClassSchema withMinRecordings(int minRecordings) {
        return new ClassSchema(nameMinLength, nameMaxLength, minRecordings, recordingPattern);
    }
}
