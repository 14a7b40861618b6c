package com.platform.datakeeper.action.plugins;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.datakeeper.action.ActionContext;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.data.FileSystemDataStore;
import com.platform.datakeeper.data.SampleMatrix;
import com.platform.datakeeper.error.ActionExecutionException;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.DownsampleMethod;
import com.platform.datakeeper.policy.DownsampleMethod.Aggregation;
import com.platform.datakeeper.policy.DownsampleMethod.Dimension;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DownsamplePluginTest {

    @TempDir
    Path root;

    private FileSystemDataStore store;
    private DownsamplePlugin plugin;
    private DataUnit unit;

    @BeforeEach
    void setUp() throws Exception {
        store = new FileSystemDataStore(new ObjectMapper());
        plugin = new DownsamplePlugin();

        StringBuilder csv = new StringBuilder();
        for (int t = 0; t < 8; t++) {
            csv.append(t).append(',').append(t * 10).append(',').append(t * 100).append(',').append(t * 1000).append('\n');
        }
        Path file = root.resolve("raw.csv");
        Files.writeString(file, csv);
        Files.writeString(root.resolve("raw.csv.meta.json"), """
            {"tags": ["high-frequency"], "timestamp": "2025-01-01T00:00:00Z",
             "attributes": {"sample_rate_hz": 1000, "channel_spacing_m": 2.0}}
            """);
        unit = store.describe(file);
    }

    private ActionContext context() {
        return new ActionContext("job-1", store, Instant.parse("2025-02-01T00:00:00Z"), null, null);
    }

    @Test
    void shouldReplaceSourceWithTemporalMean() throws Exception {
        ActionSpec.Transform spec = new ActionSpec.Transform(List.of("data-down-sampling"), false, List.of(
            new DownsampleMethod(Dimension.TEMPORAL, Aggregation.MEAN, 2, "all")));

        Outcome outcome = plugin.execute(unit, spec, context());

        assertEquals(Outcome.Disposition.TRANSFORMED, outcome.disposition());
        assertEquals(List.of("temporal-mean-x2"), outcome.appliedOps());
        DataUnit replaced = store.find(unit.path()).orElseThrow();
        SampleMatrix data = store.read(replaced);
        assertEquals(4, data.samples());
        assertEquals(4, data.channels());
        assertEquals(0.5, data.get(0, 0), 1e-9);
        assertEquals(50.0, data.get(0, 2), 1e-9);
        assertEquals(6500.0, data.get(3, 3), 1e-9);
        assertEquals(500.0, replaced.attributeAsDouble(DataUnit.SAMPLE_RATE_HZ, 0), 1e-9);
        assertFalse(Files.exists(root.resolve("raw_downsampled.csv")));
    }

    @Test
    void shouldKeepOriginalAndChainMethods() throws Exception {
        ActionSpec.Transform spec = new ActionSpec.Transform(List.of(), true, List.of(
            new DownsampleMethod(Dimension.TEMPORAL, Aggregation.SUM, 4, "all"),
            new DownsampleMethod(Dimension.SPATIAL, Aggregation.MEAN, 2, "0..3")));

        Outcome outcome = plugin.execute(unit, spec, context());

        DataUnit written = store.find(root.resolve("raw_downsampled.csv").toString()).orElseThrow();
        SampleMatrix data = store.read(written);
        assertEquals(2, data.samples());
        assertEquals(2, data.channels());
        assertEquals((0 + 1 + 2 + 3 + 0 + 10 + 20 + 30) / 2.0, data.get(0, 0), 1e-9);
        assertEquals(4.0, written.attributeAsDouble(DataUnit.CHANNEL_SPACING_M, 0), 1e-9);
        assertEquals(250.0, written.attributeAsDouble(DataUnit.SAMPLE_RATE_HZ, 0), 1e-9);
        assertTrue(Files.exists(Path.of(unit.path())));
        assertTrue(outcome.bytesAfter() > outcome.bytesBefore());
    }

    @Test
    void shouldNarrowChannelsBeforeReducing() throws Exception {
        ActionSpec.Transform spec = new ActionSpec.Transform(List.of(), true, List.of(
            new DownsampleMethod(Dimension.TEMPORAL, Aggregation.MEAN, 8, "1")));

        plugin.execute(unit, spec, context());

        SampleMatrix data = store.read(store.find(root.resolve("raw_downsampled.csv").toString()).orElseThrow());
        assertEquals(1, data.channels());
        assertEquals(35.0, data.get(0, 0), 1e-9);
    }

    @Test
    void shouldRejectChannelSelectionOutsideUnit() {
        ActionSpec.Transform spec = new ActionSpec.Transform(List.of(), true, List.of(
            new DownsampleMethod(Dimension.SPATIAL, Aggregation.MEAN, 2, "2..9")));

        ActionExecutionException e = assertThrows(ActionExecutionException.class,
            () -> plugin.execute(unit, spec, context()));
        assertEquals(ActionExecutionException.Kind.CONSTRAINT, e.getKind());
    }
}
