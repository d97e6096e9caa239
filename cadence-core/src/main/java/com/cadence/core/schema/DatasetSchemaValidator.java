package com.cadence.core.schema;

import com.cadence.core.domain.ClassDocument;
import com.cadence.core.domain.DatasetDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks dataset documents against a {@link DatasetSchema} and converts them
 * into {@link DatasetDocument}s.
 *
 * The validator holds no state and performs no I/O. It stops at the first
 * violation and reports it as a {@link DatasetValidationException}.
 * Properties the schema does not mention are ignored.
 */
public class DatasetSchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(DatasetSchemaValidator.class);

    private final ObjectMapper objectMapper;

    public DatasetSchemaValidator() {
        this(new ObjectMapper());
    }

    public DatasetSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Validates against {@link DatasetSchema#BASE}.
     */
    public DatasetDocument validate(JsonNode document) {
        return validate(document, DatasetSchema.BASE);
    }

    /**
     * Validates a plain map/list structure, e.g. a deserialized request body.
     */
    public DatasetDocument validate(Object document, DatasetSchema schema) {
        if (document instanceof JsonNode node) {
            return validate(node, schema);
        }
        return validate(objectMapper.valueToTree(document), schema);
    }

    /**
     * Validates a document against the given schema.
     *
     * @param document the document to check
     * @param schema the schema variant to check against
     * @return the validated document
     * @throws DatasetValidationException if the document does not conform
     */
    public DatasetDocument validate(JsonNode document, DatasetSchema schema) {
        if (schema == null) {
            throw new IllegalArgumentException("Schema cannot be null");
        }
        try {
            return readDataset(document, schema);
        } catch (DatasetValidationException e) {
            log.debug("Document rejected by {} schema: {}", schema.variant(), e.getMessage());
            throw e;
        }
    }

    /**
     * Whether the document passes {@link DatasetSchema#COMPLETE}.
     */
    public boolean isComplete(JsonNode document) {
        try {
            validate(document, DatasetSchema.COMPLETE);
            return true;
        } catch (DatasetValidationException e) {
            return false;
        }
    }

    private DatasetDocument readDataset(JsonNode document, DatasetSchema schema) {
        String path = "";
        requireType(document, JsonType.OBJECT, path);

        JsonNode name = requireField(document, "name", path);
        JsonNode classes = requireField(document, "classes", path);
        JsonNode isPublic = requireField(document, "public", path);

        String nameValue = readString(name, "/name", schema.nameMinLength(), schema.nameMaxLength());
        String description = readOptionalString(document, "description", path);
        requireType(isPublic, JsonType.BOOLEAN, "/public");

        requireType(classes, JsonType.ARRAY, "/classes");
        requireMinItems(classes, schema.minClasses(), "/classes");

        List<ClassDocument> classDocuments = new ArrayList<>(classes.size());
        for (int i = 0; i < classes.size(); i++) {
            classDocuments.add(readClass(classes.get(i), schema.classSchema(), "/classes/" + i));
        }

        return new DatasetDocument(nameValue, description, isPublic.booleanValue(), classDocuments);
    }

    private ClassDocument readClass(JsonNode cls, ClassSchema schema, String path) {
        requireType(cls, JsonType.OBJECT, path);

        JsonNode name = requireField(cls, "name", path);
        JsonNode recordings = requireField(cls, "recordings", path);

        String nameValue = readString(name, path + "/name", schema.nameMinLength(), schema.nameMaxLength());
        String description = readOptionalString(cls, "description", path);

        String recordingsPath = path + "/recordings";
        requireType(recordings, JsonType.ARRAY, recordingsPath);
        requireMinItems(recordings, schema.minRecordings(), recordingsPath);

        List<String> mbids = new ArrayList<>(recordings.size());
        for (int i = 0; i < recordings.size(); i++) {
            JsonNode recording = recordings.get(i);
            String recordingPath = recordingsPath + "/" + i;
            requireType(recording, JsonType.STRING, recordingPath);
            String mbid = recording.textValue();
            if (!schema.recordingPattern().matcher(mbid).matches()) {
                throw new DatasetValidationException(recordingPath, Constraint.PATTERN,
                        "'" + mbid + "' does not match " + schema.recordingPattern().pattern());
            }
            mbids.add(mbid);
        }

        return new ClassDocument(nameValue, description, mbids);
    }

    private static JsonNode requireField(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isMissingNode()) {
            throw new DatasetValidationException(path, Constraint.REQUIRED,
                    "'" + field + "' is a required property");
        }
        return value;
    }

    private static String readString(JsonNode node, String path, int minLength, int maxLength) {
        requireType(node, JsonType.STRING, path);
        String value = node.textValue();
        int length = value.codePointCount(0, value.length());
        if (length < minLength) {
            throw new DatasetValidationException(path, Constraint.MIN_LENGTH,
                    "must be at least " + minLength + " characters long");
        }
        if (length > maxLength) {
            throw new DatasetValidationException(path, Constraint.MAX_LENGTH,
                    "must be at most " + maxLength + " characters long");
        }
        return value;
    }

    // Optional and nullable: absent and null both read as null.
    private static String readOptionalString(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new DatasetValidationException(path + "/" + field, Constraint.TYPE,
                    "must be a string or null, got " + JsonType.of(value).label());
        }
        return value.textValue();
    }

    private static void requireType(JsonNode node, JsonType expected, String path) {
        JsonType actual = JsonType.of(node);
        if (actual != expected) {
            throw new DatasetValidationException(path, Constraint.TYPE,
                    "must be " + expected.label() + ", got " + actual.label());
        }
    }

    private static void requireMinItems(JsonNode array, int minItems, String path) {
        if (array.size() < minItems) {
            throw new DatasetValidationException(path, Constraint.MIN_ITEMS,
                    "must contain at least " + minItems + " items, got " + array.size());
        }
    }

    private enum JsonType {
        OBJECT("an object"),
        ARRAY("an array"),
        STRING("a string"),
        BOOLEAN("a boolean"),
        NUMBER("a number"),
        NULL("null"),
        OTHER("an unsupported value");

        private final String label;

        JsonType(String label) {
            this.label = label;
        }

        String label() {
            return label;
        }

        static JsonType of(JsonNode node) {
            if (node == null || node.isNull() || node.isMissingNode()) {
                return NULL;
            }
            if (node.isObject()) return OBJECT;
            if (node.isArray()) return ARRAY;
            if (node.isTextual()) return STRING;
            if (node.isBoolean()) return BOOLEAN;
            if (node.isNumber()) return NUMBER;
            return OTHER;
        }
    }
}
