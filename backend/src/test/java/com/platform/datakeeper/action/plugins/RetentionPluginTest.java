package com.platform.datakeeper.action.plugins;

import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.action.Outcome.Disposition;
import com.platform.datakeeper.data.DataStoreAdapter;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.RetentionRule;
import com.platform.datakeeper.policy.TimeUnitSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RetentionPluginTest {

    private static final Instant NOW = Instant.parse("2025-04-12T12:00:00Z");

    private static final ActionSpec.Retention TWO_MINUTES = new ActionSpec.Retention(
        "default", TimeUnitSpec.MINUTE, 2, 1, List.of(
            new RetentionRule("metadata.priority == 'high'", 365, TimeUnitSpec.MINUTE),
            new RetentionRule("metadata.tagged == 'preserve'", RetentionRule.NEVER_DELETE, TimeUnitSpec.MINUTE)));

    private DataStoreAdapter store;
    private RetentionPlugin plugin;

    @BeforeEach
    void setUp() throws Exception {
        store = mock(DataStoreAdapter.class);
        when(store.sizeOf(any())).thenReturn(1024L);
        plugin = new RetentionPlugin();
    }

    private static DataUnit unitAged(Duration age, Map<String, Object> attributes) {
        return new DataUnit("/data/das/a.csv", "csv", Set.of("sensor-array"), attributes, NOW.minus(age), 1024);
    }

    private ActionContext context() {
        return new ActionContext("job-1", store, NOW, null, null);
    }

    // ===== Decisions =====

    @Test
    void shouldDeleteUnitOlderThanRetention() throws Exception {
        DataUnit unit = unitAged(Duration.ofMinutes(3), Map.of());

        Outcome outcome = plugin.execute(unit, TWO_MINUTES, context());

        assertEquals(Disposition.DELETED, outcome.disposition());
        assertEquals(1024, outcome.bytesBefore());
        assertEquals(0, outcome.bytesAfter());
        verify(store).delete(unit);
    }

    @Test
    void shouldDeleteExactlyAtThreshold() {
        DataUnit unit = unitAged(Duration.ofMinutes(2), Map.of());

        assertEquals(Disposition.DELETED, RetentionPlugin.decide(unit, TWO_MINUTES, NOW).disposition());
    }

    @Test
    void shouldRetainUnderLargestRepresentableRetention() {
        ActionSpec.Retention forever = new ActionSpec.Retention(
            "default", TimeUnitSpec.DAY, TimeUnitSpec.DAY.maxAmount(), 0, List.of());
        DataUnit unit = unitAged(Duration.ofDays(3650), Map.of());

        assertEquals(Disposition.RETAINED, RetentionPlugin.decide(unit, forever, NOW).disposition());
    }

    @Test
    void shouldRetainHighPriorityUnitUnderException() throws Exception {
        DataUnit unit = unitAged(Duration.ofMinutes(3), Map.of("priority", "high"));

        Outcome outcome = plugin.execute(unit, TWO_MINUTES, context());

        assertEquals(Disposition.RETAINED, outcome.disposition());
        verify(store, never()).delete(any());
    }

    @Test
    void shouldNeverDeletePreservedUnit() {
        DataUnit unit = unitAged(Duration.ofDays(3650), Map.of("tagged", "preserve"));

        RetentionPlugin.Decision decision = RetentionPlugin.decide(unit, TWO_MINUTES, NOW);

        assertEquals(Disposition.RETAINED, decision.disposition());
        assertTrue(decision.reason().contains("never deleted"));
    }

    @Test
    void shouldApplyFirstMatchingException() {
        DataUnit unit = unitAged(Duration.ofMinutes(400), Map.of("priority", "high", "tagged", "preserve"));

        assertEquals(Disposition.DELETED, RetentionPlugin.decide(unit, TWO_MINUTES, NOW).disposition());
    }

    @Test
    void shouldWarnWithinWarningTime() throws Exception {
        DataUnit unit = unitAged(Duration.ofSeconds(90), Map.of());

        Outcome outcome = plugin.execute(unit, TWO_MINUTES, context());

        assertEquals(Disposition.WARNED, outcome.disposition());
        assertTrue(outcome.isWarning());
        verify(store, never()).delete(any());
    }

    @Test
    void shouldRetainYoungUnitBeforeWarningTime() {
        DataUnit unit = unitAged(Duration.ofSeconds(30), Map.of());

        assertEquals(Disposition.RETAINED, RetentionPlugin.decide(unit, TWO_MINUTES, NOW).disposition());
    }

    @Test
    void shouldTreatFutureTimestampAsAgeZero() {
        DataUnit unit = unitAged(Duration.ofMinutes(-5), Map.of());

        assertEquals(Disposition.RETAINED, RetentionPlugin.decide(unit, TWO_MINUTES, NOW).disposition());
    }

    // ===== Strategies =====

    @Test
    void shouldOnlyReportCandidateInDryRun() throws Exception {
        ActionSpec.Retention dryRun = new ActionSpec.Retention("dry-run", TimeUnitSpec.MINUTE, 2, 0, List.of());
        DataUnit unit = unitAged(Duration.ofMinutes(10), Map.of());

        Outcome outcome = plugin.execute(unit, dryRun, context());

        assertEquals(Disposition.WOULD_DELETE, outcome.disposition());
        assertEquals(outcome.bytesBefore(), outcome.bytesAfter());
        verify(store, never()).delete(any());
    }
}
