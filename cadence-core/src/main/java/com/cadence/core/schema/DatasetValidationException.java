package com.cadence.core.schema;

/**
 * Exception thrown when a dataset document does not have the shape a schema requires.
 * Raised before any storage access.
 */
public class DatasetValidationException extends RuntimeException {

    private final String path;
    private final Constraint constraint;

    public DatasetValidationException(String path, Constraint constraint, String message) {
        super(path + ": " + message);
        this.path = path;
        this.constraint = constraint;
    }

    /**
     * Location of the offending value, e.g. {@code /classes/1/recordings/0}.
     * The document root is {@code ""}.
     */
    public String getPath() {
        return path;
    }

    public Constraint getConstraint() {
        return constraint;
    }
}
