package com.platform.datakeeper.policy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.datakeeper.MutableClock;
import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.error.ResourceNotFoundException;
import com.platform.datakeeper.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PolicyRegistryTest {

    private static final Instant T0 = Instant.parse("2025-04-12T02:00:00Z");

    @TempDir
    Path dir;

    private PolicyRepository repository;
    private DataKeeperProperties properties;
    private MutableClock clock;
    private PolicyRegistry registry;

    @BeforeEach
    void setUp() {
        repository = mock(PolicyRepository.class);
        when(repository.findByName(anyString())).thenReturn(Optional.empty());
        when(repository.findAllIds()).thenReturn(List.of());
        properties = new DataKeeperProperties();
        properties.setPolicyPath(dir.resolve("policy.yaml").toString());
        clock = new MutableClock(T0);
        registry = new PolicyRegistry(
            new PolicyDocumentParser(new ObjectMapper().registerModule(new JavaTimeModule())),
            repository, properties, clock);
    }

    private static String document(String... names) {
        StringBuilder yaml = new StringBuilder("""
            apiVersion: v1
            kind: PolicyManager
            metadata:
              name: test
            policies:
            """);
        for (String name : names) {
            yaml.append("""
                - name: %s
                  enabled: true
                  selector:
                    data_type: [ "csv" ]
                    paths: [ "/data" ]
                  triggers:
                  - type: on-demand
                    spec:
                      api: /collect
                  actions:
                  - type: retention
                    spec:
                      time_unit: day
                      retention_time: 30
                """.formatted(name));
        }
        return yaml.toString();
    }

    // ===== Load =====

    @Test
    void shouldInstallLoadedPolicies() {
        List<Policy> loaded = registry.load(document("alpha", "beta"), "api");

        assertEquals(2, loaded.size());
        assertEquals("api", registry.snapshot().source());
        assertEquals(T0, registry.snapshot().loadedAt());
        assertThat(loaded).allMatch(p -> p.getId().startsWith(p.getName() + "-"));
        assertSame(loaded.get(0), registry.get(loaded.get(0).getId()));
    }

    @Test
    void shouldKeepIdsAcrossReloads() {
        String alphaId = registry.load(document("alpha"), "api").get(0).getId();
        clock.advance(Duration.ofMinutes(1));

        Policy reloaded = registry.load(document("alpha", "beta"), "api").get(0);

        assertEquals(alphaId, reloaded.getId());
        assertEquals(T0, reloaded.getCreatedAt());
        assertEquals(T0.plus(Duration.ofMinutes(1)), reloaded.getUpdatedAt());
    }

    @Test
    void shouldReuseStoredIdForKnownName() {
        Policy stored = Policy.builder().id("alpha-stored").name("alpha").createdAt(T0.minusSeconds(60)).build();
        when(repository.findByName("alpha")).thenReturn(Optional.of(stored));

        Policy loaded = registry.load(document("alpha"), "api").get(0);

        assertEquals("alpha-stored", loaded.getId());
        assertEquals(T0.minusSeconds(60), loaded.getCreatedAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRetireStoredPoliciesMissingFromDocument() {
        when(repository.findAllIds()).thenReturn(List.of("gone-1234"));

        registry.load(document("alpha"), "api");

        ArgumentCaptor<Collection<String>> retired = ArgumentCaptor.forClass(Collection.class);
        verify(repository).replaceAll(any(), retired.capture());
        assertThat(retired.getValue()).containsExactly("gone-1234");
    }

    @Test
    void shouldKeepPreviousSnapshotWhenDocumentInvalid() {
        registry.load(document("alpha"), "api");
        PolicyRegistry.Snapshot before = registry.snapshot();

        assertThrows(ValidationException.class, () -> registry.load("policies: [ {name: x} ]", "api"));

        assertSame(before, registry.snapshot());
    }

    // ===== Policy file =====

    @Test
    void shouldLoadConfiguredFile() throws Exception {
        Files.writeString(dir.resolve("policy.yaml"), document("alpha"));

        assertEquals(1, registry.loadConfigured().size());
        assertFalse(registry.reloadIfChanged());
    }

    @Test
    void shouldFailConfiguredLoadWhenFileMissing() {
        ValidationException e = assertThrows(ValidationException.class, () -> registry.loadConfigured());

        assertEquals("policy_path", e.getField());
    }

    @Test
    void shouldReloadChangedFile() throws Exception {
        Path file = dir.resolve("policy.yaml");
        Files.writeString(file, document("alpha"));
        registry.loadConfigured();

        Files.writeString(file, document("alpha", "beta"));
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(5)));

        assertTrue(registry.reloadIfChanged());
        assertEquals(2, registry.snapshot().policies().size());
    }

    @Test
    void shouldKeepPoliciesWhenChangedFileInvalid() throws Exception {
        Path file = dir.resolve("policy.yaml");
        Files.writeString(file, document("alpha"));
        registry.loadConfigured();

        Files.writeString(file, "policies: [");
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(5)));

        assertFalse(registry.reloadIfChanged());
        assertEquals(1, registry.snapshot().policies().size());
    }

    // ===== Delete =====

    @Test
    void shouldDeletePolicy() {
        String id = registry.load(document("alpha", "beta"), "api").get(0).getId();

        registry.delete(id);

        verify(repository).deleteById(id);
        assertEquals(1, registry.snapshot().policies().size());
        assertThrows(ResourceNotFoundException.class, () -> registry.get(id));
    }
}
