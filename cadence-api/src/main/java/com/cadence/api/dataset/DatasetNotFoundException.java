package com.cadence.api.dataset;

import java.util.UUID;

/**
 * Exception thrown when an operation targets a dataset that does not exist.
 */
public class DatasetNotFoundException extends RuntimeException {

    private final UUID datasetId;

    public DatasetNotFoundException(UUID datasetId) {
        super("Dataset not found: " + datasetId);
        this.datasetId = datasetId;
    }

    public UUID getDatasetId() {
        return datasetId;
    }
}
