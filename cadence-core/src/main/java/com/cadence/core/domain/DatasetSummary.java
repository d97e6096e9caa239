package com.cadence.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Listing view of a dataset, without its classes.
 */
public record DatasetSummary(
        UUID id,
        String name,
        String description,
        UUID author,
        Instant created
) {}
