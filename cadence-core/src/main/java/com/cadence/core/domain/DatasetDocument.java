package com.cadence.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A dataset definition that has passed structural validation.
 * Instances are produced by {@link com.cadence.core.schema.DatasetSchemaValidator};
 * an absent description is carried as {@code null}.
 */
public record DatasetDocument(
        String name,
        String description,
        @JsonProperty("public") boolean isPublic,
        List<ClassDocument> classes
) {
    public DatasetDocument {
        Objects.requireNonNull(name, "Dataset name cannot be null");
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    /**
     * Total number of recordings across all classes.
     */
    public int recordingCount() {
        return classes.stream().mapToInt(c -> c.recordings().size()).sum();
    }
}
