package com.cadence.core.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Structural schema for dataset documents.
 *
 * Two variants exist. {@link #BASE} is what storage accepts. {@link #COMPLETE}
 * adds the counts a dataset needs before it can be used for downstream processing:
 * at least two classes, each with at least two recordings.
 */
public record DatasetSchema(
        String variant,
        int nameMinLength,
        int nameMaxLength,
        int minClasses,
        ClassSchema classSchema
) {

    /**
     * MusicBrainz identifier: 8-4-4-4-12 hexadecimal groups, either case.
     */
    public static final Pattern MBID_PATTERN = Pattern.compile(
            "^[a-fA-F0-9]{8}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{4}-[a-fA-F0-9]{12}$");

    public static final int MAX_NAME_LENGTH = 100;

    public static final DatasetSchema BASE = new DatasetSchema(
            "base",
            1,
            MAX_NAME_LENGTH,
            0,
            new ClassSchema(1, MAX_NAME_LENGTH, 0, MBID_PATTERN));

    public static final DatasetSchema COMPLETE = BASE
            .withVariant("complete")
            .withMinClasses(2)
            .withClassSchema(BASE.classSchema().withMinRecordings(2));

    public DatasetSchema {
        Objects.requireNonNull(variant, "Schema variant cannot be null");
        Objects.requireNonNull(classSchema, "Class schema cannot be null");
        if (nameMinLength < 0 || nameMaxLength < nameMinLength) {
            throw new IllegalArgumentException("Invalid dataset name length bounds");
        }
        if (minClasses < 0) {
            throw new IllegalArgumentException("Minimum classes cannot be negative");
        }
    }

    public DatasetSchema withVariant(String variant) {
        return new DatasetSchema(variant, nameMinLength, nameMaxLength, minClasses, classSchema);
    }

    public DatasetSchema withMinClasses(int minClasses) {
        return new DatasetSchema(variant, nameMinLength, nameMaxLength, minClasses, classSchema);
    }

    public DatasetSchema withClassSchema(ClassSchema classSchema) {
        return new DatasetSchema(variant, nameMinLength, nameMaxLength, minClasses, classSchema);
    }
}
