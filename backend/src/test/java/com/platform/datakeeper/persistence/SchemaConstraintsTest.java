package com.platform.datakeeper.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.TestPropertySource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Rows written around the JPA layer still have to carry well-formed JSON columns.
 */
@DataJpaTest
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=none",
    "spring.sql.init.mode=always",
    "spring.sql.init.schema-locations=classpath:schema.sql"
})
class SchemaConstraintsTest {

    private static final String INSERT_POLICY =
        "INSERT INTO policy (id, name, strategy, data_type, tags, paths, operations, triggers, actions, " +
        "created_at, updated_at) VALUES (?, ?, 'default', ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";

    private static final String INSERT_JOB =
        "INSERT INTO job (id, policy_id, name, operation, trigger_type, trigger_spec, trigger_key, action_spec, " +
        "status, created_at) VALUES (?, 'p-1', 'automatic-deletion', 'retention', 'schedule', ?, 'p-1#0', ?, " +
        "'added', CURRENT_TIMESTAMP)";

    private static final String TRIGGER = "{\"trigger\":{\"kind\":\"cron\",\"expression\":\"0 */2 * * * *\"}}";
    private static final String ACTION = "{\"kind\":\"retention\",\"retentionTime\":2}";

    @Autowired
    private JdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        insertPolicy("p-1", "[\"csv\"]", "[\"sensor-array\"]", "[]");
    }

    private int insertPolicy(String id, String dataType, String tags, String triggers) {
        return jdbc.update(INSERT_POLICY, id, id + "-name", dataType, tags, "[\"/data\"]", "[]", triggers, "[]");
    }

    private int insertJob(String id, String triggerSpec, String actionSpec) {
        return jdbc.update(INSERT_JOB, id, triggerSpec, actionSpec);
    }

    // ===== Policy =====

    @Test
    void shouldAcceptWellFormedPolicyRow() {
        assertEquals(1, insertPolicy("p-2", "[\"csv\",\"h5\"]", "[]", "[{\"kind\":\"on-demand\"}]"));
    }

    @Test
    void shouldRejectPolicyWithTagsThatAreNotJson() {
        assertThrows(DataIntegrityViolationException.class,
            () -> insertPolicy("p-2", "[\"csv\"]", "sensor-array", "[]"));
    }

    @Test
    void shouldRejectPolicyWithObjectWhereListExpected() {
        assertThrows(DataIntegrityViolationException.class,
            () -> insertPolicy("p-2", "[\"csv\"]", "[]", "{\"kind\":\"cron\"}"));
        assertThrows(DataIntegrityViolationException.class,
            () -> insertPolicy("p-3", "\"csv\"", "[]", "[]"));
    }

    // ===== Job =====

    @Test
    void shouldAcceptWellFormedJobRow() {
        assertEquals(1, insertJob("j-1", TRIGGER, ACTION));
    }

    @Test
    void shouldRejectJobWithMalformedTriggerSpec() {
        assertThrows(DataIntegrityViolationException.class, () -> insertJob("j-1", "{\"trigger\":", ACTION));
    }

    @Test
    void shouldRejectJobWithListActionSpec() {
        assertThrows(DataIntegrityViolationException.class, () -> insertJob("j-1", TRIGGER, "[" + ACTION + "]"));
    }
}
