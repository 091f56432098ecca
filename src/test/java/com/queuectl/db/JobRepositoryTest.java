package com.queuectl.db;

import com.queuectl.core.DuplicateJobException;
import com.queuectl.core.Job;
import com.queuectl.core.JobState;
import com.queuectl.support.MutableClock;
import com.queuectl.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the H2 job store, in particular the atomic acquire.
 */
public class JobRepositoryTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    private Database database;
    private JobRepository repository;
    private MutableClock clock;

    @BeforeEach
    public void setUp() throws SQLException {
        database = TestDatabases.open();
        clock = new MutableClock(START);
        repository = new JobRepository(database, clock);
    }

    @AfterEach
    public void tearDown() {
        repository.close();
    }

    @Test
    public void testCreateAndFind() throws SQLException {
        Job created = repository.create(new Job("job1", "echo hi", 3));

        assertEquals("job1", created.getId());
        assertEquals(JobState.PENDING, created.getState());
        assertEquals(0, created.getAttempts());
        assertEquals(START, created.getCreatedAt());
        assertEquals(START, created.getUpdatedAt());
        assertNull(created.getWorkerId());
        assertNull(created.getNextRetryAt());

        assertNull(repository.findById("missing"));
    }

    /**
     * The primary key is the last line of defence against duplicate ids.
     */
    @Test
    public void testDuplicateIdRejectedByStore() throws SQLException {
        repository.create(new Job("job1", "echo hi", 3));

        DuplicateJobException e = assertThrows(DuplicateJobException.class,
                () -> repository.create(new Job("job1", "echo other", 3)));
        assertEquals("job1", e.getJobId());
        assertEquals("echo hi", repository.findById("job1").getCommand(), "original row must be untouched");
    }

    @Test
    public void testAcquireOldestFirst() throws SQLException {
        repository.create(new Job("b", "true", 3));
        clock.advance(Duration.ofSeconds(1));
        repository.create(new Job("a", "true", 3));

        Job first = repository.acquireNext("w1", clock.instant());
        assertEquals("b", first.getId(), "older job must be acquired first");
        assertEquals(JobState.PROCESSING, first.getState());
        assertEquals("w1", first.getWorkerId());

        assertEquals("a", repository.acquireNext("w1", clock.instant()).getId());
        assertNull(repository.acquireNext("w1", clock.instant()), "nothing left to acquire");
    }

    @Test
    public void testAcquireTieBrokenById() throws SQLException {
        repository.create(new Job("zeta", "true", 3));
        repository.create(new Job("alpha", "true", 3));

        assertEquals("alpha", repository.acquireNext("w1", clock.instant()).getId());
    }

    @Test
    public void testFailedJobEligibleOnlyAfterRetryTime() throws SQLException {
        repository.create(new Job("job1", "false", 3));
        repository.acquireNext("w1", clock.instant());
        repository.update("job1", JobUpdate.set()
                .state(JobState.FAILED)
                .attempts(1)
                .workerId(null)
                .nextRetryAt(START.plusSeconds(2)));

        assertNull(repository.acquireNext("w2", START.plusSeconds(1)), "retry time not reached");

        Job retried = repository.acquireNext("w2", START.plusSeconds(2));
        assertNotNull(retried, "retry time reached exactly");
        assertEquals("w2", retried.getWorkerId());
        assertEquals(1, retried.getAttempts(), "acquire never touches attempts");
        assertNull(retried.getNextRetryAt(), "a processing job carries no retry time");
        assertNull(repository.findById("job1").getNextRetryAt());
    }

    @Test
    public void testFailedJobWithoutRetryTimeIsEligible() throws SQLException {
        repository.create(new Job("job1", "false", 3));
        repository.update("job1", JobUpdate.set().state(JobState.FAILED).attempts(1));

        assertNotNull(repository.acquireNext("w1", clock.instant()));
    }

    @Test
    public void testTerminalJobsNeverAcquired() throws SQLException {
        repository.create(new Job("done", "true", 3));
        repository.create(new Job("dead", "false", 1));
        repository.update("done", JobUpdate.set().state(JobState.COMPLETED));
        repository.update("dead", JobUpdate.set().state(JobState.DEAD).attempts(1));

        assertNull(repository.acquireNext("w1", clock.instant().plus(Duration.ofDays(1000))));
    }

    /**
     * N threads racing for M jobs (N > M): every job is handed out exactly once.
     */
    @Test
    public void testConcurrentAcquireNeverDoubleAssigns() throws Exception {
        int jobCount = 20;
        int threadCount = 8;
        for (int i = 0; i < jobCount; i++) {
            repository.create(new Job(String.format("job-%02d", i), "true", 3));
        }

        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        CountDownLatch go = new CountDownLatch(1);
        List<String> acquired = Collections.synchronizedList(new ArrayList<>());
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threadCount; t++) {
            String workerId = "worker-" + t;
            futures.add(pool.submit(() -> {
                go.await();
                Job job;
                while ((job = repository.acquireNext(workerId, clock.instant())) != null) {
                    assertEquals(workerId, job.getWorkerId());
                    acquired.add(job.getId());
                }
                return null;
            }));
        }

        go.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        Set<String> unique = new HashSet<>(acquired);
        assertEquals(acquired.size(), unique.size(), "a job was acquired twice: " + acquired);
        assertEquals(jobCount, unique.size(), "every job must be acquired");
        assertEquals(jobCount, repository.countByState().get(JobState.PROCESSING));
    }

    @Test
    public void testGuardedUpdate() throws SQLException {
        repository.create(new Job("job1", "true", 3));
        clock.advance(Duration.ofSeconds(5));

        assertNull(repository.update("job1", JobUpdate.set().state(JobState.PENDING).whereState(JobState.PROCESSING)),
                "state guard must block the update");
        assertNull(repository.update("job1", JobUpdate.set().attempts(2).whereAttempts(1)),
                "attempts guard must block the update");
        assertNull(repository.update("missing", JobUpdate.set().attempts(1)));

        Job updated = repository.update("job1", JobUpdate.set().attempts(1).output("ok").whereAttempts(0));
        assertEquals(1, updated.getAttempts());
        assertEquals("ok", updated.getOutput());
        assertEquals(START.plusSeconds(5), updated.getUpdatedAt(), "updated_at refreshed on every write");
        assertEquals(START, updated.getCreatedAt(), "created_at never changes");
    }

    @Test
    public void testUpdateClearsNullableColumns() throws SQLException {
        repository.create(new Job("job1", "false", 3));
        repository.update("job1", JobUpdate.set().state(JobState.FAILED).error("boom").nextRetryAt(START));

        Job cleared = repository.update("job1", JobUpdate.set().error(null).nextRetryAt(null));
        assertNull(cleared.getError());
        assertNull(cleared.getNextRetryAt());
    }

    @Test
    public void testListOrdering() throws SQLException {
        repository.create(new Job("old", "true", 3));
        clock.advance(Duration.ofSeconds(1));
        repository.create(new Job("new", "true", 3));
        clock.advance(Duration.ofSeconds(1));
        repository.update("new", JobUpdate.set().state(JobState.DEAD));
        clock.advance(Duration.ofSeconds(1));
        repository.update("old", JobUpdate.set().state(JobState.DEAD));

        List<Job> all = repository.list(null);
        assertEquals(List.of("new", "old"), List.of(all.get(0).getId(), all.get(1).getId()), "newest created first");

        List<Job> dead = repository.listDead();
        assertEquals("old", dead.get(0).getId(), "most recently dead-lettered first");

        assertTrue(repository.list(JobState.PENDING).isEmpty());
        assertEquals(2, repository.list(JobState.DEAD).size());
    }

    @Test
    public void testCountByState() throws SQLException {
        repository.create(new Job("a", "true", 3));
        repository.create(new Job("b", "true", 3));
        repository.create(new Job("c", "true", 3));
        repository.acquireNext("w1", clock.instant());

        Map<JobState, Long> counts = repository.countByState();
        assertEquals(2L, counts.get(JobState.PENDING));
        assertEquals(1L, counts.get(JobState.PROCESSING));
        assertNull(counts.get(JobState.DEAD), "raw counts only contain states that occur");
    }

    @Test
    public void testCloseIsIdempotent() {
        repository.close();
        repository.close();
        assertTrue(database.isClosed());
    }
}
