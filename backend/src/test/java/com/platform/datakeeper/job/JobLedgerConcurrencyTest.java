package com.platform.datakeeper.job;

import com.platform.datakeeper.action.Outcome;
import com.platform.datakeeper.data.DataUnit;
import com.platform.datakeeper.error.InvalidTransitionException;
import com.platform.datakeeper.observability.MetricsRegistry;
import com.platform.datakeeper.persistence.EntityMappers;
import com.platform.datakeeper.persistence.repository.JobJpaRepository;
import com.platform.datakeeper.persistence.repository.PolicyJpaRepository;
import com.platform.datakeeper.policy.ActionSpec;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.Selector;
import com.platform.datakeeper.policy.TimeUnitSpec;
import com.platform.datakeeper.policy.TriggerSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Racing workers against the real database: every conditional update commits on its
 * own connection, so exactly one caller may win each transition.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({JobLedger.class, EntityMappers.class, JobUpdatePublisher.class, MetricsRegistry.class,
    JobLedgerTest.LedgerTestConfig.class})
@TestPropertySource(properties = {
    "spring.jpa.hibernate.ddl-auto=none",
    "spring.sql.init.mode=always",
    "spring.sql.init.schema-locations=classpath:schema.sql"
})
class JobLedgerConcurrencyTest {

    private static final int WORKERS = 8;
    private static final int ROUNDS = 10;
    private static final ActionSpec.Retention RETENTION =
        new ActionSpec.Retention("default", TimeUnitSpec.MINUTE, 2, 0, List.of());

    @Autowired
    private JobLedger ledger;

    @Autowired
    private JobJpaRepository jobRepository;

    @Autowired
    private PolicyJpaRepository policyRepository;

    @Autowired
    private EntityMappers mappers;

    private Policy policy;
    private DataUnit unit;
    private TriggerSnapshot snapshot;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        policy = Policy.builder()
            .id("race-policy-00000001")
            .name("race-policy")
            .enabled(true)
            .selector(new Selector(Set.of("csv"), Set.of("sensor-array"), Set.of("/data")))
            .triggers(List.of(new TriggerSpec.Cron("0 */2 * * * *")))
            .actions(List.of(RETENTION))
            .build();
        policyRepository.saveAndFlush(mappers.toEntity(policy));

        Instant now = Instant.parse("2025-04-12T02:00:00Z");
        unit = new DataUnit("/data/a.csv", "csv", Set.of("sensor-array"), Map.of(), now, 10);
        snapshot = TriggerSnapshot.of(policy.getTriggers().get(0), now);
        workers = Executors.newFixedThreadPool(WORKERS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
        jobRepository.deleteAllInBatch();
        policyRepository.deleteAllInBatch();
    }

    private Job scheduledJob() {
        Job job = ledger.create(policy, policy.triggerKey(0), snapshot, RETENTION, unit);
        return ledger.transition(job.getId(), JobStatus.SCHEDULED, null);
    }

    /**
     * Starts every task at once and returns how many returned normally. Each other task
     * must have failed with {@link InvalidTransitionException}.
     */
    private int race(List<Callable<Job>> tasks) throws Exception {
        CountDownLatch ready = new CountDownLatch(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Job>> futures = new ArrayList<>();
        for (Callable<Job> task : tasks) {
            futures.add(workers.submit(() -> {
                ready.countDown();
                start.await();
                return task.call();
            }));
        }
        assertTrue(ready.await(5, TimeUnit.SECONDS));
        start.countDown();

        int winners = 0;
        for (Future<Job> future : futures) {
            try {
                future.get(30, TimeUnit.SECONDS);
                winners++;
            } catch (ExecutionException e) {
                assertThat(e.getCause()).isInstanceOf(InvalidTransitionException.class);
            }
        }
        return winners;
    }

    // ===== Claims =====

    @Test
    void shouldLetExactlyOneWorkerClaimScheduledJob() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            Job job = scheduledJob();
            List<Callable<Job>> claims = new ArrayList<>();
            for (int i = 0; i < WORKERS; i++) {
                claims.add(() -> ledger.transition(job.getId(), JobStatus.RUNNING, null));
            }

            assertEquals(1, race(claims), "round " + round);
            Job stored = ledger.get(job.getId());
            assertEquals(JobStatus.RUNNING, stored.getStatus());
            assertNotNull(stored.getLastRunTime());
        }
    }

    // ===== Completion =====

    @Test
    void shouldRecordExactlyOneTerminalOutcome() throws Exception {
        for (int round = 0; round < ROUNDS; round++) {
            Job job = scheduledJob();
            ledger.transition(job.getId(), JobStatus.RUNNING, null);
            Outcome outcome = new Outcome(List.of("delete"), 10, 0, Outcome.Disposition.DELETED, null);

            List<Callable<Job>> finishers = new ArrayList<>();
            for (int i = 0; i < WORKERS; i++) {
                if (i % 2 == 0) {
                    finishers.add(() -> ledger.complete(job.getId(), outcome));
                } else {
                    finishers.add(() -> ledger.transition(job.getId(), JobStatus.FAILED, "worker lost"));
                }
            }

            assertEquals(1, race(finishers), "round " + round);
            Job stored = ledger.get(job.getId());
            assertTrue(stored.getStatus().isTerminal());
            assertEquals(stored.getStatus() == JobStatus.FAILED, stored.getLastError() != null);
        }
    }
}
