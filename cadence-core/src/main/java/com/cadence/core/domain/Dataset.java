package com.cadence.core.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Stored dataset with its classes and their members.
 *
 * Class ids are assigned on every write and do not survive an update,
 * so callers should not hold on to them.
 */
public record Dataset(
        UUID id,
        String name,
        String description,
        @JsonProperty("public") boolean isPublic,
        UUID author,
        Instant created,
        List<DatasetClass> classes
) {
    public Dataset {
        classes = classes == null ? List.of() : List.copyOf(classes);
    }

    /**
     * Renders this dataset in the shape accepted by create and update.
     */
    public DatasetDocument toDocument() {
        return new DatasetDocument(
                name,
                description,
                isPublic,
                classes.stream().map(DatasetClass::toDocument).toList());
    }

    public DatasetSummary toSummary() {
        return new DatasetSummary(id, name, description, author, created);
    }
}
