package com.queuectl.engine;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts, tracks and stops a fleet of worker processes.
 *
 * <p>Workers are opaque OS processes. The supervisor remembers them in a sidecar file
 * ({@code .queuectl-workers.pid}) holding {@code {pid, workerId}} pairs, so that a later
 * {@code worker stop} from another terminal can find them.</p>
 *
 * <p><b>Stop Sequence:</b></p>
 * <ol>
 *   <li>Read the sidecar (absent: nothing to stop; corrupt: reported, treated as empty)</li>
 *   <li>Send a graceful termination signal to every recorded process still alive</li>
 *   <li>Wait up to the grace period (2 seconds by default) for them to exit</li>
 *   <li>Force-kill the survivors</li>
 *   <li>Delete the sidecar</li>
 * </ol>
 *
 * <p>A worker that is force-killed mid-job leaves that job PROCESSING; the
 * {@link StopReport#getForcedWorkerIds() forced ids} can be handed to
 * {@link JobQueue#releaseJobsOwnedBy(java.util.Collection)} to reclaim it.</p>
 */
public class FleetSupervisor {
    private static final Logger logger = Logger.getLogger(FleetSupervisor.class.getName());
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private static final Type RECORD_LIST_TYPE = new TypeToken<List<WorkerRecord>>() {}.getType();

    public static final String DEFAULT_SIDECAR_FILE = ".queuectl-workers.pid";
    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(2);

    private final Path sidecarFile;
    private final WorkerLauncher launcher;
    private final Duration gracePeriod;
    private final List<Process> launched = Collections.synchronizedList(new ArrayList<>());

    public FleetSupervisor(Path sidecarFile, WorkerLauncher launcher) {
        this(sidecarFile, launcher, DEFAULT_GRACE_PERIOD);
    }

    public FleetSupervisor(Path sidecarFile, WorkerLauncher launcher, Duration gracePeriod) {
        this.sidecarFile = sidecarFile;
        this.launcher = launcher;
        this.gracePeriod = gracePeriod;
    }

    /**
     * Launch {@code count} workers with distinct ids and record them in the sidecar.
     *
     * @param count number of workers, at least 1
     * @return the recorded workers, in launch order
     * @throws IllegalArgumentException if count is below 1
     * @throws IOException if a worker cannot be launched or the sidecar cannot be written;
     *                     workers launched before the failure are terminated
     */
    public List<WorkerRecord> start(int count) throws IOException {
        if (count < 1) {
            throw new IllegalArgumentException("Count must be a positive number, got " + count);
        }

        List<WorkerRecord> records = new ArrayList<>();
        List<Process> started = new ArrayList<>();

        try {
            for (int i = 0; i < count; i++) {
                String workerId = "worker-" + UUID.randomUUID();
                Process process = launcher.launch(workerId);
                started.add(process);
                records.add(new WorkerRecord(process.pid(), workerId));

                logger.info("Started worker " + workerId + " (PID: " + process.pid() + ")");
                process.onExit().thenAccept(p ->
                        logger.info("Worker " + workerId + " exited with code " + p.exitValue()));
            }
            writeSidecar(records);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to start workers, terminating " + started.size() + " already started", e);
            started.forEach(Process::destroyForcibly);
            throw e;
        }

        launched.addAll(started);
        return records;
    }

    /**
     * Block until every worker launched by this supervisor has exited.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void awaitWorkers() throws InterruptedException {
        List<Process> snapshot;
        synchronized (launched) {
            snapshot = new ArrayList<>(launched);
        }
        for (Process process : snapshot) {
            process.waitFor();
        }
    }

    /**
     * Stop every worker recorded in the sidecar, gracefully first, then by force.
     *
     * @return which workers were signalled and which had to be killed
     */
    public StopReport stop() {
        if (!Files.exists(sidecarFile)) {
            logger.info("No workers found (" + sidecarFile + " does not exist)");
            return new StopReport(List.of(), List.of());
        }

        List<WorkerRecord> records = readSidecar();
        logger.info("Stopping " + records.size() + " worker(s)...");

        List<WorkerRecord> signalled = new ArrayList<>();
        List<CompletableFuture<ProcessHandle>> exits = new ArrayList<>();

        for (WorkerRecord record : records) {
            Optional<ProcessHandle> handle = ProcessHandle.of(record.getPid());
            if (handle.isEmpty() || !handle.get().isAlive()) {
                logger.fine("Worker " + record + " already exited");
                continue;
            }
            if (handle.get().destroy()) {
                logger.info("Sent termination signal to worker " + record);
            } else {
                logger.warning("Could not signal worker " + record + ", will force kill");
            }
            signalled.add(record);
            exits.add(handle.get().onExit());
        }

        awaitExits(exits);

        List<String> forced = new ArrayList<>();
        for (WorkerRecord record : signalled) {
            Optional<ProcessHandle> handle = ProcessHandle.of(record.getPid());
            if (handle.isPresent() && handle.get().isAlive()) {
                handle.get().destroyForcibly();
                forced.add(record.getWorkerId());
                logger.warning("Force killed worker " + record);
            }
        }

        deleteSidecar();
        logger.info("All workers stopped");

        List<String> signalledIds = new ArrayList<>();
        signalled.forEach(r -> signalledIds.add(r.getWorkerId()));
        return new StopReport(signalledIds, forced);
    }

    /**
     * @return recorded workers whose processes are still alive; empty when there is no sidecar
     */
    public List<WorkerRecord> listWorkers() {
        if (!Files.exists(sidecarFile)) {
            return List.of();
        }
        List<WorkerRecord> alive = new ArrayList<>();
        for (WorkerRecord record : readSidecar()) {
            if (ProcessHandle.of(record.getPid()).map(ProcessHandle::isAlive).orElse(false)) {
                alive.add(record);
            }
        }
        return alive;
    }

    // Waits for all exits together so the whole fleet shares one grace period
    private void awaitExits(List<CompletableFuture<ProcessHandle>> exits) {
        if (exits.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(exits.toArray(new CompletableFuture[0]))
                    .get(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.info("Grace period of " + gracePeriod.toMillis() + "ms elapsed with workers still running");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            logger.log(Level.WARNING, "Error waiting for workers to exit", e);
        }
    }

    List<WorkerRecord> readSidecar() {
        try (Reader reader = Files.newBufferedReader(sidecarFile, StandardCharsets.UTF_8)) {
            List<WorkerRecord> records = gson.fromJson(reader, RECORD_LIST_TYPE);
            if (records == null) {
                return List.of();
            }
            List<WorkerRecord> valid = new ArrayList<>();
            for (WorkerRecord record : records) {
                if (record != null && record.getPid() > 0) {
                    valid.add(record);
                }
            }
            return valid;
        } catch (IOException | JsonParseException e) {
            logger.log(Level.WARNING, "Worker file " + sidecarFile + " is unreadable, treating as empty", e);
            return List.of();
        }
    }

    private void writeSidecar(List<WorkerRecord> records) throws IOException {
        List<WorkerRecord> all = new ArrayList<>();
        if (Files.exists(sidecarFile)) {
            // Keep workers of an earlier start that are still running
            for (WorkerRecord existing : listWorkers()) {
                all.add(existing);
            }
        }
        all.addAll(records);

        Path tmp = sidecarFile.resolveSibling(sidecarFile.getFileName() + ".tmp");
        try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            gson.toJson(all, RECORD_LIST_TYPE, writer);
        }
        Files.move(tmp, sidecarFile, StandardCopyOption.REPLACE_EXISTING);
    }

    private void deleteSidecar() {
        try {
            Files.deleteIfExists(sidecarFile);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Could not delete worker file " + sidecarFile, e);
        }
    }

    public Path getSidecarFile() {
        return sidecarFile;
    }

    /**
     * Result of {@link #stop()}.
     */
    public static final class StopReport {
        private final List<String> signalledWorkerIds;
        private final List<String> forcedWorkerIds;

        StopReport(List<String> signalledWorkerIds, List<String> forcedWorkerIds) {
            this.signalledWorkerIds = List.copyOf(signalledWorkerIds);
            this.forcedWorkerIds = List.copyOf(forcedWorkerIds);
        }

        /** Workers that were alive and received a termination signal. */
        public List<String> getSignalledWorkerIds() {
            return signalledWorkerIds;
        }

        /** Workers still alive after the grace period, killed by force. */
        public List<String> getForcedWorkerIds() {
            return forcedWorkerIds;
        }

        public Set<String> allWorkerIds() {
            Set<String> all = new LinkedHashSet<>(signalledWorkerIds);
            all.addAll(forcedWorkerIds);
            return all;
        }
    }
}
