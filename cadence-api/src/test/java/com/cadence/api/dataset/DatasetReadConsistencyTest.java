package com.cadence.api.dataset;

import com.cadence.api.CadenceApiApplication;
import com.cadence.core.domain.ClassDocument;
import com.cadence.core.domain.Dataset;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.test.context.ActiveProfiles;

import javax.sql.DataSource;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

/**
 * Reads of a dataset must see one committed state even when an update
 * commits between the class query and the member queries.
 *
 * The template below runs a hook right after the class query of a read,
 * which commits an update from another thread before the read continues.
 */
@SpringBootTest(classes = CadenceApiApplication.class)
@ActiveProfiles("test")
@Import(DatasetReadConsistencyTest.InterleavingConfig.class)
class DatasetReadConsistencyTest {

    @TestConfiguration
    static class InterleavingConfig {

        @Bean
        @Primary
        InterleavingJdbcTemplate interleavingJdbcTemplate(DataSource dataSource) {
            return new InterleavingJdbcTemplate(dataSource);
        }
    }

    static class InterleavingJdbcTemplate extends NamedParameterJdbcTemplate {

        private final AtomicReference<Runnable> afterClassQuery = new AtomicReference<>();

        InterleavingJdbcTemplate(DataSource dataSource) {
            super(dataSource);
        }

        void runAfterNextClassQuery(Runnable hook) {
            afterClassQuery.set(hook);
        }

        void reset() {
            afterClassQuery.set(null);
        }

        @Override
        public <T> List<T> query(String sql, SqlParameterSource paramSource, RowMapper<T> rowMapper) {
            List<T> rows = super.query(sql, paramSource, rowMapper);
            if (sql.contains("FROM dataset_class") && !sql.contains("dataset_class_member")) {
                Runnable hook = afterClassQuery.getAndSet(null);
                if (hook != null) {
                    hook.run();
                }
            }
            return rows;
        }
    }

    @Autowired
    private DatasetService datasetService;

    @Autowired
    private DatasetTestSupport support;

    @Autowired
    private InterleavingJdbcTemplate jdbcTemplate;

    private ExecutorService writer;

    @BeforeEach
    void setUp() {
        support.clear();
        jdbcTemplate.reset();
        writer = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        jdbcTemplate.reset();
        writer.shutdownNow();
    }

    @Test
    void get_withUpdateCommittedMidRead_returnsPreviousState() {
        UUID author = UUID.randomUUID();
        var original = support.dataset("Old", false,
                support.cls("oldA", support.mbid(), support.mbid()),
                support.cls("oldB", support.mbid()));
        var replacement = support.dataset("New", true,
                support.cls("newA", support.mbid()));
        UUID id = datasetService.create(original, author);

        jdbcTemplate.runAfterNextClassQuery(() -> updateFromOtherThread(id, replacement, author));
        Dataset seen = datasetService.get(id).orElseThrow();

        assertThat(seen.name()).isEqualTo("Old");
        assertThat(asSet(seen.toDocument().classes())).isEqualTo(asSet(support.classesOf(original)));

        Dataset after = datasetService.get(id).orElseThrow();
        assertThat(after.name()).isEqualTo("New");
        assertThat(asSet(after.toDocument().classes())).isEqualTo(asSet(support.classesOf(replacement)));
    }

    @Test
    void isComplete_withUpdateCommittedMidRead_judgesPreviousState() {
        UUID author = UUID.randomUUID();
        UUID id = datasetService.create(support.dataset("Complete", true,
                support.cls("a", support.mbid(), support.mbid()),
                support.cls("b", support.mbid(), support.mbid())), author);
        var thinned = support.dataset("Thinned", true, support.cls("a", support.mbid()));

        jdbcTemplate.runAfterNextClassQuery(() -> updateFromOtherThread(id, thinned, author));

        assertThat(datasetService.isComplete(id)).isTrue();
        assertThat(datasetService.isComplete(id)).isFalse();
    }

    private void updateFromOtherThread(UUID id, JsonNode document, UUID author) {
        try {
            writer.submit(() -> datasetService.update(id, document, author)).get(30, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException("Concurrent update failed", e);
        }
    }

    private static Set<ClassDocument> asSet(List<ClassDocument> classes) {
        Set<ClassDocument> set = new HashSet<>();
        for (ClassDocument cls : classes) {
            set.add(new ClassDocument(cls.name(), cls.description(),
                    cls.recordings().stream().sorted().toList()));
        }
        return set;
    }
}
