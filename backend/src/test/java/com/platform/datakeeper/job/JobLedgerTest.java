package com.platform.datakeeper.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.datakeeper.MutableClock;
import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.InvalidTransitionException;
import com.platform.datakeeper.error.ValidationException;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.persistence.EntityMappers;
import com.platform.datakeeper.persistence.repository.JobJpaRepository;
import com.platform.datakeeper.persistence.repository.PolicyJpaRepository;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.Selector;
import com.platform.datakeeper.policy.TimeUnitSpec;
import com.platform.datakeeper.policy.TriggerSpec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@Import({JobLedger.class, EntityMappers.class, JobUpdatePublisher.class, MetricsRegistry.class,
    JobLedgerTest.LedgerTestConfig.class})
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=none",
    "spring.sql.init.mode=always",
    "spring.sql.init.schema-locations=classpath:schema.sql"
})
class JobLedgerTest {

    private static final Instant START = Instant.parse("2025-04-12T02:00:00Z");
    private static final ActionSpec.Retention RETENTION =
        new ActionSpec.Retention("default", TimeUnitSpec.MINUTE, 2, 0, List.of());

    @TestConfiguration
    static class LedgerTestConfig {
        @Bean
        MutableClock clock() {
            return new MutableClock(START);
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        }
    }

    @Autowired
    private JobLedger ledger;

    @Autowired
    private JobJpaRepository jobRepository;

    @Autowired
    private PolicyJpaRepository policyRepository;

    @Autowired
    private EntityMappers mappers;

    @Autowired
    private JobUpdatePublisher publisher;

    @Autowired
    private MutableClock clock;

    private Policy policy;
    private DataUnit unit;
    private TriggerSnapshot snapshot;
    private final List<JobUpdate> updates = new ArrayList<>();
    private Runnable unsubscribe;

    @BeforeEach
    void setUp() {
        clock.set(START);
        policy = Policy.builder()
            .id("automatic-deletion-1a2b3c4d")
            .name("automatic-deletion")
            .policyFile("config/policy.yaml")
            .enabled(true)
            .selector(new Selector(Set.of("csv"), Set.of("sensor-array"), Set.of("/data")))
            .triggers(List.of(new TriggerSpec.Cron("0 */2 * * * *")))
            .actions(List.of(RETENTION))
            .build();
        policyRepository.saveAndFlush(mappers.toEntity(policy));

        unit = new DataUnit("/data/a.csv", "csv", Set.of("sensor-array"), Map.of(), START, 10);
        snapshot = TriggerSnapshot.of(policy.getTriggers().get(0), START);
        unsubscribe = publisher.subscribe(updates::add);
    }

    @AfterEach
    void tearDown() {
        unsubscribe.run();
    }

    private Job newJob() {
        return ledger.create(policy, policy.triggerKey(0), snapshot, RETENTION, unit);
    }

    // ===== Create =====

    @Test
    void shouldCreateJobInAddedWithSnapshot() {
        Job job = newJob();

        Job stored = ledger.get(job.getId());
        assertEquals(JobStatus.ADDED, stored.getStatus());
        assertEquals("retention", stored.getOperation());
        assertEquals("schedule", stored.getTriggerType());
        assertEquals("csv", stored.getFiletypes());
        assertEquals(snapshot, stored.getTriggerSpec());
        assertEquals(RETENTION, stored.getActionSpec());
        assertNull(stored.getLastRunTime());
        assertThat(updates).extracting(JobUpdate::status).containsExactly("added");
    }

    // ===== Transitions =====

    @Test
    void shouldWalkHappyPathAndStampRunTime() {
        Job job = newJob();

        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        clock.advance(Duration.ofSeconds(5));
        Job running = ledger.transition(job.getId(), JobStatus.RUNNING, null);
        Outcome outcome = new Outcome(List.of("delete"), 10, 0, Outcome.Disposition.DELETED, null);
        Job done = ledger.complete(job.getId(), outcome);

        assertEquals(START.plusSeconds(5), running.getLastRunTime());
        assertEquals(JobStatus.SUCCESS, done.getStatus());
        assertNull(done.getLastError());
        assertThat(updates).extracting(JobUpdate::status)
            .containsExactly("added", "scheduled", "running", "success");
        assertEquals(outcome, updates.get(3).outcome());
    }

    @Test
    void shouldRecordErrorOnFailure() {
        Job job = newJob();
        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);

        Job failed = ledger.transition(job.getId(), JobStatus.FAILED, "IO: disk full");

        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals("IO: disk full", ledger.get(job.getId()).getLastError());
    }

    @Test
    void shouldRequireErrorWhenFailing() {
        Job job = newJob();
        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);

        assertThrows(ValidationException.class, () -> ledger.transition(job.getId(), JobStatus.FAILED, " "));
        assertEquals(JobStatus.RUNNING, ledger.get(job.getId()).getStatus());
    }

    @Test
    void shouldRejectSkippedStage() {
        Job job = newJob();

        assertThrows(InvalidTransitionException.class, () -> ledger.transition(job.getId(), JobStatus.RUNNING, null));
        assertEquals(JobStatus.ADDED, ledger.get(job.getId()).getStatus());
    }

    @Test
    void shouldRejectSecondClaimOfSameJob() {
        Job job = newJob();
        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);

        assertThrows(InvalidTransitionException.class, () -> ledger.transition(job.getId(), JobStatus.RUNNING, null));
    }

    @Test
    void shouldRejectLeavingTerminalStatus() {
        Job job = newJob();
        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);
        ledger.complete(job.getId(), null);

        assertThrows(InvalidTransitionException.class, () -> ledger.transition(job.getId(), JobStatus.FAILED, "late"));
        assertEquals(JobStatus.SUCCESS, ledger.get(job.getId()).getStatus());
    }

    // ===== Queries =====

    @Test
    void shouldTrackInFlightPerTrigger() {
        Job job = newJob();
        assertTrue(ledger.hasInFlight(policy.triggerKey(0)));
        assertFalse(ledger.hasInFlight(policy.triggerKey(1)));

        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);
        assertTrue(ledger.hasInFlight(policy.triggerKey(0)));

        ledger.transition(job.getId(), JobStatus.FAILED, "boom");
        assertFalse(ledger.hasInFlight(policy.triggerKey(0)));
    }

    @Test
    void shouldRememberTriggersThatProducedJobsWhateverTheirStatus() {
        assertFalse(ledger.hasAnyJob(policy.triggerKey(0)));

        Job job = newJob();
        ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(job.getId(), JobStatus.RUNNING, null);
        ledger.complete(job.getId(), null);

        assertTrue(ledger.hasAnyJob(policy.triggerKey(0)));
        assertFalse(ledger.hasAnyJob(policy.triggerKey(1)));
    }

    @Test
    void shouldListByStatusOldestFirst() {
        Job first = newJob();
        clock.advance(Duration.ofMinutes(1));
        Job second = newJob();
        clock.advance(Duration.ofMinutes(1));
        Job added = newJob();
        ledger.transition(second.getId(), JobStatus.SCHEDULED, null);
        ledger.transition(first.getId(), JobStatus.SCHEDULED, null);

        assertThat(ledger.listByStatus(JobStatus.SCHEDULED)).extracting(Job::getId)
            .containsExactly(first.getId(), second.getId());
        assertThat(ledger.listByStatus(JobStatus.ADDED)).extracting(Job::getId)
            .containsExactly(added.getId());
    }

    @Test
    void shouldListNewestFirstWithFilters() {
        Job first = newJob();
        clock.advance(Duration.ofMinutes(1));
        Job second = newJob();
        ledger.transition(second.getId(), JobStatus.SCHEDULED, null);

        assertThat(ledger.list(new JobFilter(null, null, 10))).extracting(Job::getId)
            .containsExactly(second.getId(), first.getId());
        assertThat(ledger.list(new JobFilter(policy.getId(), JobStatus.ADDED, 10))).extracting(Job::getId)
            .containsExactly(first.getId());
        assertThat(ledger.list(new JobFilter("other", null, 10))).isEmpty();
        assertThat(ledger.list(new JobFilter(null, null, 1))).hasSize(1);
        assertEquals(1, ledger.countByStatus(JobStatus.SCHEDULED));
    }

    @Test
    void shouldCascadeJobsWhenPolicyDeleted() {
        newJob();
        newJob();
        assertEquals(2, jobRepository.countByPolicyId(policy.getId()));

        policyRepository.deletePolicy(policy.getId());

        assertEquals(0, jobRepository.countByPolicyId(policy.getId()));
    }
}
