package com.queuectl.app;

import com.queuectl.config.QueueConfig;
import com.queuectl.core.DuplicateJobException;
import com.queuectl.core.InvalidJobException;
import com.queuectl.core.Job;
import com.queuectl.core.JobSpec;
import com.queuectl.core.JobState;
import com.queuectl.core.JobStats;
import com.queuectl.core.NotInDLQException;
import com.queuectl.db.Database;
import com.queuectl.db.JobRepository;
import com.queuectl.engine.FleetSupervisor;
import com.queuectl.engine.JobQueue;
import com.queuectl.engine.JvmWorkerLauncher;
import com.queuectl.engine.WorkerRecord;
import org.json.JSONArray;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: {@code queuectl <command> [args]}.
 *
 * <pre>
 *   enqueue '&lt;json&gt;'            add a job, e.g. {"id":"job1","command":"echo hi"}
 *   worker start [--count N]    start N worker processes and wait for them
 *   worker stop                 stop the running workers gracefully
 *   status                      job counts per state and live workers
 *   list [--state S]            list jobs, newest first
 *   dlq list                    list dead jobs
 *   dlq retry &lt;id&gt;              move a dead job back to pending
 *   release &lt;id&gt;               return a stuck processing job to pending
 *   config get|set|list         read or change .queuectl.json
 * </pre>
 *
 * Errors are printed as {@code Error: <message>} and exit with status 1.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    private static final int JSON_INDENT = 2;

    private final QueueConfig config;
    private final FleetSupervisor supervisor;
    private final PrintStream out;
    private final PrintStream err;

    Main(QueueConfig config, FleetSupervisor supervisor, PrintStream out, PrintStream err) {
        this.config = config;
        this.supervisor = supervisor;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        LoggingSetup.install();

        QueueConfig config = QueueConfig.load();
        FleetSupervisor supervisor = new FleetSupervisor(
                Paths.get(FleetSupervisor.DEFAULT_SIDECAR_FILE), new JvmWorkerLauncher());

        int status = new Main(config, supervisor, System.out, System.err).run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Run one command.
     *
     * @param args the command line
     * @return the process exit status
     */
    int run(String[] args) {
        if (args.length == 0) {
            printUsage(err);
            return 1;
        }

        String command = args[0];
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            switch (command) {
                case "enqueue" -> enqueue(rest);
                case "worker" -> worker(rest);
                case "status" -> status();
                case "list" -> list(rest);
                case "dlq" -> dlq(rest);
                case "release" -> release(rest);
                case "config" -> config(rest);
                case "help", "--help", "-h" -> printUsage(out);
                default -> throw new IllegalArgumentException("Unknown command: " + command);
            }
            return 0;
        } catch (InvalidJobException | DuplicateJobException | NotInDLQException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (SQLException | IOException e) {
            logger.log(Level.SEVERE, "Command '" + command + "' failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            err.println("Error: interrupted");
            return 1;
        }
    }

    private void enqueue(String[] args) throws SQLException {
        requireArgs(args, 1, "enqueue '<json>'");
        JobSpec spec = JobSpec.fromJson(args[0]);

        try (JobQueue queue = openQueue()) {
            Job job = queue.enqueue(spec);
            out.println("Job enqueued successfully:");
            out.println(job.toJson().toString(JSON_INDENT));
        }
    }

    private void worker(String[] args) throws SQLException, IOException, InterruptedException {
        requireArgs(args, 1, "worker start [--count N] | worker stop");
        switch (args[0]) {
            case "start" -> startWorkers(parseCount(Arrays.copyOfRange(args, 1, args.length)));
            case "stop" -> stopWorkers();
            default -> throw new IllegalArgumentException("Unknown worker command: " + args[0]);
        }
    }

    private void startWorkers(int count) throws IOException, InterruptedException {
        out.println("Starting " + count + " worker(s)...");
        List<WorkerRecord> started = supervisor.start(count);
        started.forEach(record -> out.println("  " + record));

        // Ctrl+C reaches the workers too; the hook makes sure none is left behind
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            FleetSupervisor.StopReport report = supervisor.stop();
            releaseForced(report);
        }, "fleet-shutdown"));

        supervisor.awaitWorkers();
    }

    private void stopWorkers() {
        FleetSupervisor.StopReport report = supervisor.stop();
        if (report.allWorkerIds().isEmpty()) {
            out.println("No running workers found");
            return;
        }
        int released = releaseForced(report);
        out.println("Workers stopped: " + report.getSignalledWorkerIds().size()
                + " signalled, " + report.getForcedWorkerIds().size() + " force killed"
                + (released > 0 ? ", " + released + " job(s) returned to pending" : ""));
    }

    // Jobs held by a killed worker would stay processing forever
    private int releaseForced(FleetSupervisor.StopReport report) {
        if (report.getForcedWorkerIds().isEmpty()) {
            return 0;
        }
        try (JobQueue queue = openQueue()) {
            return queue.releaseJobsOwnedBy(report.getForcedWorkerIds());
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Could not release jobs of force killed workers "
                    + report.getForcedWorkerIds(), e);
            return 0;
        }
    }

    private void status() throws SQLException {
        JobStats stats;
        try (JobQueue queue = openQueue()) {
            stats = queue.getStats();
        }

        out.println("=== Queue Status ===");
        out.printf("%-12s %d%n", "Pending:", stats.get(JobState.PENDING));
        out.printf("%-12s %d%n", "Processing:", stats.get(JobState.PROCESSING));
        out.printf("%-12s %d%n", "Completed:", stats.get(JobState.COMPLETED));
        out.printf("%-12s %d%n", "Failed:", stats.get(JobState.FAILED));
        out.printf("%-12s %d%n", "Dead (DLQ):", stats.get(JobState.DEAD));
        out.printf("%-12s %d%n", "Total:", stats.getTotal());

        List<WorkerRecord> workers = supervisor.listWorkers();
        out.println();
        out.println("Active workers: " + workers.size());
        workers.forEach(record -> out.println("  " + record));
    }

    private void list(String[] args) throws SQLException {
        JobState state = null;
        for (int i = 0; i < args.length; i++) {
            if ("--state".equals(args[i]) || "-s".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--state requires a value");
                }
                state = JobState.fromWireName(args[++i]);
            } else {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        try (JobQueue queue = openQueue()) {
            printJobs(queue.listJobs(state), "No jobs found");
        }
    }

    private void dlq(String[] args) throws SQLException {
        requireArgs(args, 1, "dlq list | dlq retry <id>");
        switch (args[0]) {
            case "list" -> {
                try (JobQueue queue = openQueue()) {
                    printJobs(queue.getDLQJobs(), "No jobs in DLQ");
                }
            }
            case "retry" -> {
                requireArgs(args, 2, "dlq retry <id>");
                try (JobQueue queue = openQueue()) {
                    Job job = queue.retryDLQJob(args[1]);
                    out.println("Job " + job.getId() + " moved back to queue");
                    out.println(job.toJson().toString(JSON_INDENT));
                }
            }
            default -> throw new IllegalArgumentException("Unknown dlq command: " + args[0]);
        }
    }

    private void release(String[] args) throws SQLException {
        requireArgs(args, 1, "release <id>");
        try (JobQueue queue = openQueue()) {
            Job job = queue.releaseJob(args[0]);
            if (job == null) {
                throw new IllegalArgumentException("Job " + args[0] + " not found");
            }
            out.println(job.toJson().toString(JSON_INDENT));
        }
    }

    private void config(String[] args) throws IOException {
        requireArgs(args, 1, "config get <key> | config set <key> <value> | config list");
        switch (args[0]) {
            case "get" -> {
                requireArgs(args, 2, "config get <key>");
                Object value = config.get(args[1]);
                if (value == null) {
                    throw new IllegalArgumentException("Unknown configuration key: " + args[1]);
                }
                out.println(args[1] + ": " + value);
            }
            case "set" -> {
                requireArgs(args, 3, "config set <key> <value>");
                config.set(args[1], args[2]);
                out.println("Configuration updated: " + args[1] + " = " + config.get(args[1]));
            }
            case "list" -> {
                out.println("=== Configuration ===");
                for (Map.Entry<String, Object> entry : config.getAll().entrySet()) {
                    out.println(entry.getKey().replace('_', '-') + ": " + entry.getValue());
                }
            }
            default -> throw new IllegalArgumentException("Unknown config command: " + args[0]);
        }
    }

    private void printJobs(List<Job> jobs, String emptyMessage) {
        if (jobs.isEmpty()) {
            out.println(emptyMessage);
            return;
        }
        JSONArray array = new JSONArray();
        jobs.forEach(job -> array.put(job.toJson()));
        out.println(array.toString(JSON_INDENT));
    }

    JobQueue openQueue() throws SQLException {
        Database database = new Database(config.getDatabaseUrl());
        database.initialize();
        return new JobQueue(new JobRepository(database), config);
    }

    private int parseCount(String[] args) {
        int count = config.getWorkerCount();
        for (int i = 0; i < args.length; i++) {
            if ("--count".equals(args[i]) || "-c".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--count requires a value");
                }
                String value = args[++i];
                try {
                    count = Integer.parseInt(value);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Count must be a positive number, got " + value, e);
                }
                if (count < 1) {
                    throw new IllegalArgumentException("Count must be a positive number, got " + value);
                }
            } else {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return count;
    }

    private static void requireArgs(String[] args, int needed, String usage) {
        if (args.length < needed) {
            throw new IllegalArgumentException("Usage: queuectl " + usage);
        }
    }

    private static void printUsage(PrintStream stream) {
        stream.println("Usage: queuectl <command> [args]");
        stream.println("  enqueue '<json>'          add a job, e.g. {\"id\":\"job1\",\"command\":\"echo hi\"}");
        stream.println("  worker start [--count N]  start N worker processes");
        stream.println("  worker stop               stop running workers gracefully");
        stream.println("  status                    job counts per state and active workers");
        stream.println("  list [--state S]          list jobs (pending, processing, completed, failed, dead)");
        stream.println("  dlq list                  list jobs in the dead letter queue");
        stream.println("  dlq retry <id>            move a dead job back to the queue");
        stream.println("  release <id>              return a processing job to pending");
        stream.println("  config get <key>          show a configuration value");
        stream.println("  config set <key> <value>  change a configuration value");
        stream.println("  config list               show all configuration values");
    }
}
