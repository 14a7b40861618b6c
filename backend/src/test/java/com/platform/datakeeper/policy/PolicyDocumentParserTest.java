package com.platform.datakeeper.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.datakeeper.error.ErrorCode;
import com.platform.datakeeper.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class PolicyDocumentParserTest {

    private static final String SOURCE = "config/policy.yaml";

    private static final String DOCUMENT = """
        apiVersion: v1
        kind: PolicyManager
        metadata:
          name: sensor-data-policy-manager
          version: 1.0.0
        settings:
          log_level: info
          audit_retention: 90
          policy_evaluation_interval: 30
        policy_templates:
        - name: standard-retention
          type: retention
          spec: &standard_retention
            retention_time: 30
            warning_time: 7
            strategy: none
        policies:
        - name: automatic-deletion
          description: Automatically delete data after the retention period
          enabled: true
          selector:
            data_type: [ "CSV", "hdf5" ]
            tags: [ "sensor-array" ]
            paths: [ "/tmp/datakeeper-data" ]
          triggers:
          - type: on-demand
            spec:
              api: /collect/data
          - type: schedule
            spec:
              type: cron
              cron: "*/2 * * * *"
          actions:
          - type: retention
            spec:
              <<: *standard_retention
              operations: [ "data-reduction" ]
              time_unit: minute
              retention_time: 2
              warning_time: 10
              strategy: default
              exceptions:
              - condition: "metadata.priority == 'high'"
                retention_time: 365
              - condition: "metadata.tagged == 'preserve'"
                retention_time: -1
        - name: sampling-reduction
          enabled: false
          selector:
            data_type: [ "csv" ]
            paths: [ "/tmp/samplers" ]
          triggers:
          - type: schedule
            spec:
              type: date
              date: "2025-04-12T02:00:00Z"
          actions:
          - type: downsampler
            spec:
              preserve_original: false
              methods:
              - dimension: temporal
                algorithm: mean
                factor: 2
                apply_to_channels: "0..9"
        """;

    private PolicyDocumentParser parser;

    @BeforeEach
    void setUp() {
        parser = new PolicyDocumentParser(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    // ===== Document =====

    @Test
    void shouldParseDocumentHeaderAndSettings() {
        PolicyDocument document = parser.parse(DOCUMENT, SOURCE);

        assertEquals("v1", document.apiVersion());
        assertEquals("sensor-data-policy-manager", document.name());
        assertEquals(Duration.ofSeconds(30), document.settings().evaluationInterval());
        assertEquals(90, document.settings().auditRetentionDays());
        assertThat(document.policies()).extracting(Policy::getName)
            .containsExactly("automatic-deletion", "sampling-reduction");
    }

    @Test
    void shouldParseSelectorWithLowerCasedTypes() {
        Policy policy = parser.parse(DOCUMENT, SOURCE).policies().get(0);

        assertThat(policy.getSelector().dataTypes()).containsExactlyInAnyOrder("csv", "hdf5");
        assertThat(policy.getSelector().tags()).containsExactly("sensor-array");
        assertThat(policy.getSelector().paths()).containsExactly("/tmp/datakeeper-data");
        assertEquals(SOURCE, policy.getPolicyFile());
        assertTrue(policy.isEnabled());
    }

    // ===== Triggers =====

    @Test
    void shouldNormalizeFiveFieldCron() {
        Policy policy = parser.parse(DOCUMENT, SOURCE).policies().get(0);

        assertEquals(new TriggerSpec.OnDemand("/collect/data"), policy.getTriggers().get(0));
        assertEquals(new TriggerSpec.Cron("0 */2 * * * *"), policy.getTriggers().get(1));
    }

    @Test
    void shouldParseFixedDateTrigger() {
        Policy policy = parser.parse(DOCUMENT, SOURCE).policies().get(1);

        assertEquals(new TriggerSpec.FixedDate(Instant.parse("2025-04-12T02:00:00Z")), policy.getTriggers().get(0));
        assertFalse(policy.isEnabled());
    }

    @Test
    void shouldParseIntervalConditionAndEventTriggers() {
        String yaml = """
            policies:
            - name: p
              selector: { data_type: [ csv ], paths: [ /data ] }
              triggers:
              - type: schedule
                spec: { type: interval, value: 5, unit: minutes }
              - type: condition
                spec: { expression: "storage.utilization > 80" }
              - type: event
                spec: { source: ais, radius_km: 1.5, window_seconds: 300, condition: "event.type == 'vessel'" }
              actions:
              - type: retention
                spec: { retention_time: 1 }
            """;

        List<TriggerSpec> triggers = parser.parse(yaml, SOURCE).policies().get(0).getTriggers();

        assertEquals(new TriggerSpec.Interval(Duration.ofMinutes(5)), triggers.get(0));
        assertEquals(new TriggerSpec.Condition("storage.utilization > 80"), triggers.get(1));
        assertEquals(new TriggerSpec.Event("ais", 1.5, 300, "event.type == 'vessel'"), triggers.get(2));
    }

    // ===== Actions =====

    @Test
    void shouldMergeAnchoredTemplateAndOverrides() {
        Policy policy = parser.parse(DOCUMENT, SOURCE).policies().get(0);
        ActionSpec.Retention retention = (ActionSpec.Retention) policy.getActions().get(0);

        assertEquals("default", retention.strategy());
        assertEquals(TimeUnitSpec.MINUTE, retention.timeUnit());
        assertEquals(2, retention.retentionTime());
        assertEquals(10, retention.warningTime());
        assertThat(retention.exceptions()).extracting(RetentionRule::retentionTime).containsExactly(365L, -1L);
        assertThat(retention.exceptions()).allMatch(rule -> rule.timeUnit() == TimeUnitSpec.MINUTE);
        assertThat(policy.getOperations()).containsExactly("data-reduction", "retention");
    }

    @Test
    void shouldResolveNamedTemplateReference() {
        String yaml = """
            policy_templates:
            - name: keep-a-week
              type: retention
              spec: { retention_time: 7, time_unit: day, warning_time: 1 }
            policies:
            - name: p
              selector: { data_type: [ csv ], paths: [ /data ] }
              triggers: []
              actions:
              - template: keep-a-week
                spec: { warning_time: 2 }
            """;

        ActionSpec.Retention retention = (ActionSpec.Retention) parser.parse(yaml, SOURCE)
            .policies().get(0).getActions().get(0);

        assertEquals(7, retention.retentionTime());
        assertEquals(TimeUnitSpec.DAY, retention.timeUnit());
        assertEquals(2, retention.warningTime());
    }

    @Test
    void shouldParseDownsamplerAsTransform() {
        Policy policy = parser.parse(DOCUMENT, SOURCE).policies().get(1);
        ActionSpec.Transform transform = (ActionSpec.Transform) policy.getActions().get(0);

        assertFalse(transform.preserveOriginal());
        assertEquals(List.of(new DownsampleMethod(
                DownsampleMethod.Dimension.TEMPORAL, DownsampleMethod.Aggregation.MEAN, 2, "0..9")),
            transform.methods());
    }

    // ===== Validation =====

    @Test
    void shouldRejectInvalidCron() {
        String yaml = DOCUMENT.replace("\"*/2 * * * *\"", "\"every two minutes\"");

        assertThatThrownBy(() -> parser.parse(yaml, SOURCE))
            .isInstanceOf(ValidationException.class)
            .satisfies(e -> assertEquals(ErrorCode.INVALID_CRON, ((ValidationException) e).getErrorCode()));
    }

    @Test
    void shouldRejectDuplicatePolicyNames() {
        String yaml = DOCUMENT.replace("name: sampling-reduction", "name: automatic-deletion");

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
        assertEquals("policies[1].name", e.getField());
    }

    @Test
    void shouldRejectZeroDownsampleFactor() {
        String yaml = DOCUMENT.replace("factor: 2", "factor: 0");

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
        assertThat(e.getField()).endsWith("methods[0].factor");
    }

    @Test
    void shouldRejectMalformedExceptionCondition() {
        String yaml = DOCUMENT.replace("metadata.priority == 'high'", "priority is high");

        assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
    }

    @Test
    void shouldRejectUnknownActionType() {
        String yaml = DOCUMENT.replace("type: downsampler", "type: compress");

        assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
    }

    @Test
    void shouldRejectUnknownStrategy() {
        String yaml = DOCUMENT.replace("strategy: default", "strategy: shred");

        assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
    }

    @Test
    void shouldRejectRetentionTimeBeyondRepresentableDuration() {
        String yaml = DOCUMENT.replace("retention_time: 2\n", "retention_time: 9223372036854775807\n");

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
        assertThat(e.getField()).endsWith("retention_time");
    }

    @Test
    void shouldRejectExceptionRetentionBeyondRepresentableDuration() {
        String yaml = DOCUMENT.replace("retention_time: 365", "retention_time: 200000000000000\n        time_unit: day");

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
        assertThat(e.getField()).endsWith("exceptions[0].retention_time");
    }

    @Test
    void shouldRejectIntervalBeyondRepresentableDuration() {
        String yaml = """
            policies:
            - name: p
              selector: { data_type: [ csv ], paths: [ /data ] }
              triggers:
              - type: schedule
                spec: { type: interval, value: 200000000000000, unit: days }
              actions:
              - type: retention
                spec: { retention_time: 1 }
            """;

        ValidationException e = assertThrows(ValidationException.class, () -> parser.parse(yaml, SOURCE));
        assertThat(e.getField()).endsWith(".value");
    }

    @Test
    void shouldAcceptLargestRepresentableRetention() {
        String yaml = DOCUMENT.replace("retention_time: 2\n", "retention_time: " + TimeUnitSpec.MINUTE.maxAmount() + "\n");

        ActionSpec.Retention retention = (ActionSpec.Retention) parser.parse(yaml, SOURCE)
            .policies().get(0).getActions().get(0);

        assertEquals(TimeUnitSpec.MINUTE.maxAmount(), retention.retentionTime());
    }

    @Test
    void shouldRejectInvalidYaml() {
        assertThrows(ValidationException.class, () -> parser.parse("policies: [ unclosed", SOURCE));
    }
}
