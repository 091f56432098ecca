package com.queuectl.engine;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for starting and stopping worker fleets, with plain {@code sleep} processes
 * standing in for worker JVMs.
 */
@DisabledOnOs(OS.WINDOWS)
public class FleetSupervisorTest {

    @TempDir
    Path tempDir;

    private final List<Process> spawned = new ArrayList<>();

    @AfterEach
    public void tearDown() {
        spawned.forEach(Process::destroyForcibly);
    }

    private Path sidecar() {
        return tempDir.resolve(FleetSupervisor.DEFAULT_SIDECAR_FILE);
    }

    private WorkerLauncher launcher(String... command) {
        return workerId -> {
            Process process = new ProcessBuilder(command).start();
            spawned.add(process);
            return process;
        };
    }

    @Test
    public void testStartRecordsWorkers() throws IOException {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"));

        List<WorkerRecord> started = supervisor.start(3);

        assertEquals(3, started.size());
        assertEquals(3, started.stream().map(WorkerRecord::getWorkerId).distinct().count(), "ids must be distinct");
        assertTrue(started.get(0).getWorkerId().startsWith("worker-"));
        assertTrue(Files.exists(sidecar()));
        assertEquals(3, supervisor.readSidecar().size());
        assertEquals(3, supervisor.listWorkers().size());
    }

    @Test
    public void testStopSignalsWorkersGracefully() throws IOException {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"), Duration.ofSeconds(5));
        List<WorkerRecord> started = supervisor.start(2);

        FleetSupervisor.StopReport report = supervisor.stop();

        assertEquals(2, report.getSignalledWorkerIds().size());
        assertTrue(report.getForcedWorkerIds().isEmpty(), "sleep exits on SIGTERM");
        assertFalse(Files.exists(sidecar()), "sidecar must be removed");
        for (WorkerRecord record : started) {
            assertFalse(ProcessHandle.of(record.getPid()).map(ProcessHandle::isAlive).orElse(false));
        }
    }

    /**
     * A stop issued from another command line only has the sidecar to go on.
     */
    @Test
    public void testStopFromSeparateSupervisor() throws IOException {
        new FleetSupervisor(sidecar(), launcher("sleep", "30")).start(2);

        FleetSupervisor other = new FleetSupervisor(sidecar(), launcher("false"), Duration.ofSeconds(5));
        assertEquals(2, other.listWorkers().size());
        assertEquals(2, other.stop().allWorkerIds().size());
        assertTrue(other.listWorkers().isEmpty());
    }

    @Test
    public void testStopForceKillsWorkersIgnoringSignal() throws IOException {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(),
                launcher("sh", "-c", "trap '' TERM; while true; do sleep 1; done"), Duration.ofMillis(500));
        List<WorkerRecord> started = supervisor.start(1);
        sleepQuietly(300);

        FleetSupervisor.StopReport report = supervisor.stop();

        assertEquals(List.of(started.get(0).getWorkerId()), report.getForcedWorkerIds());
        assertFalse(Files.exists(sidecar()));
    }

    @Test
    public void testStopWithoutSidecar() {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"));

        FleetSupervisor.StopReport report = supervisor.stop();

        assertTrue(report.allWorkerIds().isEmpty());
        assertTrue(supervisor.listWorkers().isEmpty());
    }

    @Test
    public void testStopWithCorruptSidecar() throws IOException {
        Files.writeString(sidecar(), "[{\"pid\": oops", StandardCharsets.UTF_8);
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"));

        assertTrue(supervisor.listWorkers().isEmpty());
        assertTrue(supervisor.stop().allWorkerIds().isEmpty());
        assertFalse(Files.exists(sidecar()), "corrupt sidecar is removed");
    }

    @Test
    public void testStopIgnoresExitedWorkers() throws Exception {
        Process exited = new ProcessBuilder("true").start();
        exited.waitFor();
        Files.writeString(sidecar(), "[{\"pid\": " + exited.pid() + ", \"workerId\": \"worker-gone\"}]",
                StandardCharsets.UTF_8);
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"));

        assertTrue(supervisor.listWorkers().isEmpty());
        FleetSupervisor.StopReport report = supervisor.stop();
        assertTrue(report.getSignalledWorkerIds().isEmpty());
        assertFalse(Files.exists(sidecar()));
    }

    @Test
    public void testAwaitWorkers() throws Exception {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "0.2"));
        supervisor.start(2);

        supervisor.awaitWorkers();

        assertTrue(supervisor.listWorkers().isEmpty());
    }

    @Test
    public void testInvalidCount() {
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), launcher("sleep", "30"));
        assertThrows(IllegalArgumentException.class, () -> supervisor.start(0));
    }

    /**
     * If one launch fails the ones already started are killed and nothing is recorded.
     */
    @Test
    public void testLaunchFailureCleansUp() throws Exception {
        AtomicInteger launches = new AtomicInteger();
        WorkerLauncher flaky = workerId -> {
            if (launches.incrementAndGet() == 2) {
                throw new IOException("no more processes");
            }
            Process process = new ProcessBuilder("sleep", "30").start();
            spawned.add(process);
            return process;
        };
        FleetSupervisor supervisor = new FleetSupervisor(sidecar(), flaky);

        assertThrows(IOException.class, () -> supervisor.start(3));

        assertFalse(Files.exists(sidecar()));
        assertTrue(spawned.get(0).waitFor(5, java.util.concurrent.TimeUnit.SECONDS), "first worker must be killed");
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
