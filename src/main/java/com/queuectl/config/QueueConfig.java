package com.queuectl.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Queue settings persisted as JSON in {@code .queuectl.json} in the working directory.
 *
 * <p>Keys use the file's snake_case names ({@code max_retries}); the command line may
 * also spell them with dashes ({@code max-retries}). A missing file means defaults; a
 * file that cannot be read or parsed is reported and also falls back to defaults, so a
 * broken config never stops workers from starting.</p>
 */
public class QueueConfig {
    private static final Logger logger = Logger.getLogger(QueueConfig.class.getName());
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public static final String DEFAULT_FILE_NAME = ".queuectl.json";

    public static final String MAX_RETRIES = "max_retries";
    public static final String BACKOFF_BASE = "backoff_base";
    public static final String WORKER_COUNT = "worker_count";
    public static final String JOB_TIMEOUT_MS = "job_timeout_ms";
    public static final String POLL_INTERVAL_MS = "poll_interval_ms";
    public static final String DATABASE_PATH = "database_path";

    /** System property that replaces the whole JDBC URL, mostly for tests. */
    public static final String DB_URL_PROPERTY = "queuectl.db.url";

    private transient Path path;

    @SerializedName(MAX_RETRIES)
    private int maxRetries = 3;

    @SerializedName(BACKOFF_BASE)
    private double backoffBase = 2;

    @SerializedName(WORKER_COUNT)
    private int workerCount = 1;

    @SerializedName(JOB_TIMEOUT_MS)
    private long jobTimeoutMs = 300_000L;

    @SerializedName(POLL_INTERVAL_MS)
    private long pollIntervalMs = 1_000L;

    @SerializedName(DATABASE_PATH)
    private String databasePath = "./queuectl";

    public QueueConfig() {
        this.path = Paths.get(DEFAULT_FILE_NAME);
    }

    /**
     * Load the config from the default file in the working directory.
     */
    public static QueueConfig load() {
        return load(Paths.get(DEFAULT_FILE_NAME));
    }

    /**
     * Load the config from a file, falling back to defaults when it is absent or unreadable.
     *
     * @param path the JSON file
     * @return the loaded config, bound to {@code path} for later saves
     */
    public static QueueConfig load(Path path) {
        QueueConfig config = null;

        if (Files.exists(path)) {
            try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                config = gson.fromJson(reader, QueueConfig.class);
            } catch (IOException | JsonParseException e) {
                logger.log(Level.WARNING, "Error loading config from " + path + ", using defaults", e);
            }
        }

        if (config == null) {
            config = new QueueConfig();
        }
        config.path = path;
        config.sanitize();
        return config;
    }

    // Values edited by hand may be out of range; keep the defaults for those
    private void sanitize() {
        QueueConfig defaults = new QueueConfig();
        if (maxRetries < 1) {
            logger.warning("Ignoring invalid max_retries " + maxRetries);
            maxRetries = defaults.maxRetries;
        }
        if (Double.isNaN(backoffBase) || backoffBase < 1) {
            logger.warning("Ignoring invalid backoff_base " + backoffBase);
            backoffBase = defaults.backoffBase;
        }
        if (workerCount < 1) {
            workerCount = defaults.workerCount;
        }
        if (jobTimeoutMs < 1) {
            jobTimeoutMs = defaults.jobTimeoutMs;
        }
        if (pollIntervalMs < 1) {
            pollIntervalMs = defaults.pollIntervalMs;
        }
        if (databasePath == null || databasePath.isBlank()) {
            databasePath = defaults.databasePath;
        }
    }

    /**
     * Write the config back to the file it was loaded from.
     *
     * @throws IOException if the file cannot be written
     */
    public void save() throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            gson.toJson(this, writer);
        }
    }

    /**
     * Get a value by key.
     *
     * @param key the key, with underscores or dashes
     * @return the value, or null for an unknown key
     */
    public Object get(String key) {
        return getAll().get(normalizeKey(key));
    }

    /**
     * Validate and set a value by key, then save the file.
     *
     * @param key the key, with underscores or dashes
     * @param value the textual value from the command line
     * @throws IllegalArgumentException if the key is unknown or the value invalid
     * @throws IOException if the file cannot be written
     */
    public void set(String key, String value) throws IOException {
        String normalized = normalizeKey(key);
        switch (normalized) {
            case MAX_RETRIES -> setMaxRetries(parsePositiveInt(normalized, value));
            case BACKOFF_BASE -> setBackoffBase(parseDouble(normalized, value));
            case WORKER_COUNT -> setWorkerCount(parsePositiveInt(normalized, value));
            case JOB_TIMEOUT_MS -> setJobTimeoutMs(parsePositive(normalized, value));
            case POLL_INTERVAL_MS -> setPollIntervalMs(parsePositive(normalized, value));
            case DATABASE_PATH -> {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("database_path must not be empty");
                }
                this.databasePath = value.trim();
            }
            default -> throw new IllegalArgumentException("Unknown configuration key: " + key);
        }
        save();
    }

    /**
     * @return all settings keyed by their file names, in a stable order
     */
    public Map<String, Object> getAll() {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put(MAX_RETRIES, maxRetries);
        all.put(BACKOFF_BASE, backoffBase);
        all.put(WORKER_COUNT, workerCount);
        all.put(JOB_TIMEOUT_MS, jobTimeoutMs);
        all.put(POLL_INTERVAL_MS, pollIntervalMs);
        all.put(DATABASE_PATH, databasePath);
        return all;
    }

    /**
     * @return the JDBC URL workers and the command line open, honouring {@value #DB_URL_PROPERTY}
     */
    public String getDatabaseUrl() {
        String override = System.getProperty(DB_URL_PROPERTY);
        if (override != null && !override.isBlank()) {
            return override;
        }
        return "jdbc:h2:" + databasePath + ";AUTO_SERVER=TRUE";
    }

    static String normalizeKey(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private static int parsePositiveInt(String key, String value) {
        long parsed = parsePositive(key, value);
        if (parsed > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(key + " must be at most " + Integer.MAX_VALUE + ", got " + value);
        }
        return (int) parsed;
    }

    private static long parsePositive(String key, String value) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 1) {
                throw new IllegalArgumentException(key + " must be a positive number, got " + value);
            }
            return parsed;
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(key + " must be a positive number, got " + value, e);
        }
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException(key + " must be a number, got " + value, e);
        }
    }

    public int getMaxRetries() { return maxRetries; }

    public void setMaxRetries(int maxRetries) {
        if (maxRetries < 1) {
            throw new IllegalArgumentException("max_retries must be at least 1, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public double getBackoffBase() { return backoffBase; }

    public void setBackoffBase(double backoffBase) {
        if (Double.isNaN(backoffBase) || backoffBase < 1) {
            throw new IllegalArgumentException("backoff_base must be at least 1, got " + backoffBase);
        }
        this.backoffBase = backoffBase;
    }

    public int getWorkerCount() { return workerCount; }

    public void setWorkerCount(int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("worker_count must be at least 1, got " + workerCount);
        }
        this.workerCount = workerCount;
    }

    public long getJobTimeoutMs() { return jobTimeoutMs; }

    public void setJobTimeoutMs(long jobTimeoutMs) {
        if (jobTimeoutMs < 1) {
            throw new IllegalArgumentException("job_timeout_ms must be positive, got " + jobTimeoutMs);
        }
        this.jobTimeoutMs = jobTimeoutMs;
    }

    public long getPollIntervalMs() { return pollIntervalMs; }

    public void setPollIntervalMs(long pollIntervalMs) {
        if (pollIntervalMs < 1) {
            throw new IllegalArgumentException("poll_interval_ms must be positive, got " + pollIntervalMs);
        }
        this.pollIntervalMs = pollIntervalMs;
    }

    public String getDatabasePath() { return databasePath; }

    public Path getPath() { return path; }
}
