package com.cadence.api.dataset;

import java.util.UUID;

/**
 * Source of identifiers for new datasets.
 */
@FunctionalInterface
public interface DatasetIdGenerator {

    UUID nextId();
}
