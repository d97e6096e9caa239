package com.cadence.api.dataset;

import com.cadence.core.domain.ClassDocument;
import com.cadence.core.domain.Dataset;
import com.cadence.core.domain.DatasetClass;
import com.cadence.core.domain.DatasetDocument;
import com.cadence.core.domain.DatasetSummary;
import com.cadence.core.schema.DatasetSchema;
import com.cadence.core.schema.DatasetSchemaValidator;
import com.cadence.core.schema.DatasetValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Dataset Service - Stores classification datasets across the
 * dataset, dataset_class and dataset_class_member tables.
 *
 * Every document is checked against {@link DatasetSchema#BASE} before any SQL runs.
 * Writes run as a single transaction: a failure in any statement rolls back
 * everything the call wrote. Classes are never diffed; an update deletes all
 * classes of the dataset (members go with them through ON DELETE CASCADE)
 * and inserts the new ones.
 */
@Service
public class DatasetService {

    private static final Logger log = LoggerFactory.getLogger(DatasetService.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final DatasetSchemaValidator validator;
    private final DatasetIdGenerator idGenerator;

    public DatasetService(
            NamedParameterJdbcTemplate jdbcTemplate,
            DatasetSchemaValidator validator,
            DatasetIdGenerator idGenerator) {
        this.jdbcTemplate = jdbcTemplate;
        this.validator = validator;
        this.idGenerator = idGenerator;
    }

    // ==================== Write path ====================

    /**
     * Creates a new dataset from a document.
     *
     * @param document dataset definition, checked against the base schema
     * @param authorId owner of the new dataset
     * @return id of the new dataset
     * @throws DatasetValidationException if the document is malformed
     */
    @Transactional
    public UUID create(JsonNode document, UUID authorId) {
        if (authorId == null) {
            throw new IllegalArgumentException("Author ID cannot be null");
        }
        DatasetDocument dataset = validator.validate(document, DatasetSchema.BASE);

        UUID datasetId = idGenerator.nextId();
        String sql = """
                INSERT INTO dataset (id, name, description, public, author)
                VALUES (:id, :name, :description, :isPublic, :author)
                """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", datasetId)
                .addValue("name", dataset.name())
                .addValue("description", dataset.description())
                .addValue("isPublic", dataset.isPublic())
                .addValue("author", authorId));

        insertClasses(datasetId, dataset.classes());

        log.info("Created dataset {} with {} classes and {} recordings for author {}",
                datasetId, dataset.classes().size(), dataset.recordingCount(), authorId);
        return datasetId;
    }

    /**
     * Replaces a dataset's fields and its whole set of classes.
     * The dataset id and creation time are kept; class ids are not.
     *
     * @param datasetId dataset to update
     * @param document new definition, checked against the base schema
     * @param authorId new owner, or {@code null} to keep the current one
     * @throws DatasetValidationException if the document is malformed
     * @throws DatasetNotFoundException if no dataset has this id
     */
    @Transactional
    public void update(UUID datasetId, JsonNode document, UUID authorId) {
        if (datasetId == null) {
            throw new IllegalArgumentException("Dataset ID cannot be null");
        }
        DatasetDocument dataset = validator.validate(document, DatasetSchema.BASE);

        // Locks the dataset row until commit, so concurrent updates of the same dataset queue here.
        String sql = authorId != null
                ? """
                  UPDATE dataset
                  SET name = :name, description = :description, public = :isPublic, author = :author
                  WHERE id = :id
                  """
                : """
                  UPDATE dataset
                  SET name = :name, description = :description, public = :isPublic
                  WHERE id = :id
                  """;
        int updated = jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("id", datasetId)
                .addValue("name", dataset.name())
                .addValue("description", dataset.description())
                .addValue("isPublic", dataset.isPublic())
                .addValue("author", authorId));
        if (updated == 0) {
            log.warn("Update requested for missing dataset {}", datasetId);
            throw new DatasetNotFoundException(datasetId);
        }

        int removed = jdbcTemplate.update(
                "DELETE FROM dataset_class WHERE dataset_id = :datasetId",
                new MapSqlParameterSource("datasetId", datasetId));

        insertClasses(datasetId, dataset.classes());

        log.info("Updated dataset {}: replaced {} classes with {}",
                datasetId, removed, dataset.classes().size());
    }

    /**
     * Deletes a dataset together with its classes and members.
     * Deleting an id that does not exist is not an error.
     */
    @Transactional
    public void delete(UUID datasetId) {
        if (datasetId == null) {
            throw new IllegalArgumentException("Dataset ID cannot be null");
        }
        int deleted = jdbcTemplate.update(
                "DELETE FROM dataset WHERE id = :id",
                new MapSqlParameterSource("id", datasetId));
        if (deleted == 0) {
            log.debug("Delete of dataset {} affected no rows", datasetId);
        } else {
            log.info("Deleted dataset {}", datasetId);
        }
    }

    private void insertClasses(UUID datasetId, List<ClassDocument> classes) {
        String classSql = """
                INSERT INTO dataset_class (name, description, dataset_id)
                VALUES (:name, :description, :datasetId)
                """;
        String memberSql = "INSERT INTO dataset_class_member (class_id, mbid) VALUES (:classId, :mbid)";

        for (ClassDocument cls : classes) {
            KeyHolder keyHolder = new GeneratedKeyHolder();
            jdbcTemplate.update(classSql, new MapSqlParameterSource()
                    .addValue("name", cls.name())
                    .addValue("description", cls.description())
                    .addValue("datasetId", datasetId),
                    keyHolder, new String[] {"id"});
            Number key = keyHolder.getKey();
            if (key == null) {
                throw new IllegalStateException("No id returned for class '" + cls.name() + "' of dataset " + datasetId);
            }
            long classId = key.longValue();

            if (cls.recordings().isEmpty()) {
                continue;
            }
            SqlParameterSource[] members = cls.recordings().stream()
                    .map(mbid -> new MapSqlParameterSource()
                            .addValue("classId", classId)
                            .addValue("mbid", UUID.fromString(mbid)))
                    .toArray(SqlParameterSource[]::new);
            jdbcTemplate.batchUpdate(memberSql, members);
        }
    }

    // ==================== Read path ====================

    /**
     * Gets a dataset with all its classes and their recordings.
     *
     * The dataset, class and member queries share one snapshot, so an update
     * committing in between is either fully visible or not at all.
     *
     * @return the dataset, or empty if no dataset has this id
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Optional<Dataset> get(UUID datasetId) {
        if (datasetId == null) {
            throw new IllegalArgumentException("Dataset ID cannot be null");
        }
        String sql = """
                SELECT id, name, description, author, created, public
                FROM dataset WHERE id = :id
                """;

        List<Dataset> rows = jdbcTemplate.query(sql,
                new MapSqlParameterSource("id", datasetId),
                (rs, rowNum) -> new Dataset(
                        rs.getObject("id", UUID.class),
                        rs.getString("name"),
                        rs.getString("description"),
                        rs.getBoolean("public"),
                        rs.getObject("author", UUID.class),
                        rs.getTimestamp("created").toInstant(),
                        List.of()));
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        Dataset row = rows.get(0);
        return Optional.of(new Dataset(
                row.id(), row.name(), row.description(), row.isPublic(),
                row.author(), row.created(), getClasses(row.id())));
    }

    /**
     * Gets datasets owned by a user, without their classes.
     *
     * @param authorId owner to list
     * @param publicOnly whether to leave out private datasets
     */
    @Transactional(readOnly = true)
    public List<DatasetSummary> getByOwner(UUID authorId, boolean publicOnly) {
        if (authorId == null) {
            throw new IllegalArgumentException("Author ID cannot be null");
        }
        StringBuilder sql = new StringBuilder("""
                SELECT id, name, description, author, created
                FROM dataset
                WHERE author = :author
                """);
        if (publicOnly) {
            sql.append(" AND public = TRUE");
        }
        sql.append(" ORDER BY created, id");

        return jdbcTemplate.query(sql.toString(),
                new MapSqlParameterSource("author", authorId),
                (rs, rowNum) -> new DatasetSummary(
                        rs.getObject("id", UUID.class),
                        rs.getString("name"),
                        rs.getString("description"),
                        rs.getObject("author", UUID.class),
                        rs.getTimestamp("created").toInstant()));
    }

    /**
     * Checks whether a stored dataset is ready for downstream processing,
     * i.e. passes {@link DatasetSchema#COMPLETE}.
     *
     * @throws DatasetNotFoundException if no dataset has this id
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public boolean isComplete(UUID datasetId) {
        Dataset dataset = get(datasetId).orElseThrow(() -> new DatasetNotFoundException(datasetId));
        DatasetDocument document = dataset.toDocument();
        try {
            validator.validate(document, DatasetSchema.COMPLETE);
            return true;
        } catch (DatasetValidationException e) {
            log.debug("Dataset {} is not complete: {}", datasetId, e.getMessage());
            return false;
        }
    }

    private List<DatasetClass> getClasses(UUID datasetId) {
        String sql = """
                SELECT id, name, description
                FROM dataset_class
                WHERE dataset_id = :datasetId
                ORDER BY id
                """;
        List<DatasetClass> classes = jdbcTemplate.query(sql,
                new MapSqlParameterSource("datasetId", datasetId),
                (rs, rowNum) -> new DatasetClass(
                        rs.getLong("id"),
                        rs.getString("name"),
                        rs.getString("description"),
                        List.of()));

        return classes.stream()
                .map(c -> new DatasetClass(c.id(), c.name(), c.description(), getRecordings(c.id())))
                .toList();
    }

    private List<String> getRecordings(long classId) {
        return jdbcTemplate.query(
                "SELECT mbid FROM dataset_class_member WHERE class_id = :classId",
                new MapSqlParameterSource("classId", classId),
                (rs, rowNum) -> rs.getObject("mbid", UUID.class).toString());
    }
}
