package com.queuectl.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for loading, validating and saving {@code .queuectl.json}.
 */
public class QueueConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    public void tearDown() {
        System.clearProperty(QueueConfig.DB_URL_PROPERTY);
    }

    @Test
    public void testDefaultsWhenFileMissing() {
        QueueConfig config = QueueConfig.load(tempDir.resolve("missing.json"));

        assertEquals(3, config.getMaxRetries());
        assertEquals(2.0, config.getBackoffBase());
        assertEquals(1, config.getWorkerCount());
        assertEquals(300_000L, config.getJobTimeoutMs());
        assertEquals(1_000L, config.getPollIntervalMs());
        assertEquals("./queuectl", config.getDatabasePath());
        assertFalse(Files.exists(tempDir.resolve("missing.json")), "loading must not create the file");
    }

    @Test
    public void testSetSavesAndReloads() throws IOException {
        Path file = tempDir.resolve("config.json");
        QueueConfig config = QueueConfig.load(file);

        config.set("max-retries", "5");
        config.set("backoff_base", "1.5");
        config.set("database_path", "/tmp/jobs");

        QueueConfig reloaded = QueueConfig.load(file);
        assertEquals(5, reloaded.getMaxRetries());
        assertEquals(1.5, reloaded.getBackoffBase());
        assertEquals("/tmp/jobs", reloaded.getDatabasePath());
        assertEquals(1, reloaded.getWorkerCount(), "untouched keys keep their defaults");
    }

    @Test
    public void testSetRejectsInvalidValues() {
        QueueConfig config = QueueConfig.load(tempDir.resolve("config.json"));

        assertThrows(IllegalArgumentException.class, () -> config.set("max_retries", "0"));
        assertThrows(IllegalArgumentException.class, () -> config.set("max_retries", "lots"));
        assertThrows(IllegalArgumentException.class, () -> config.set("backoff_base", "0.5"));
        assertThrows(IllegalArgumentException.class, () -> config.set("poll_interval_ms", "-1"));
        assertThrows(IllegalArgumentException.class, () -> config.set("database_path", " "));
        assertThrows(IllegalArgumentException.class, () -> config.set("colour", "blue"));

        assertEquals(3, config.getMaxRetries(), "rejected values leave the config unchanged");
        assertFalse(Files.exists(tempDir.resolve("config.json")));
    }

    /**
     * Integer keys must fit in an int rather than wrap around (2^32 + 1 would read as 1).
     */
    @Test
    public void testSetRejectsOutOfRangeIntegers() throws IOException {
        QueueConfig config = QueueConfig.load(tempDir.resolve("config.json"));

        assertThrows(IllegalArgumentException.class, () -> config.set("max_retries", "4294967297"));
        assertThrows(IllegalArgumentException.class, () -> config.set("worker_count", "2147483648"));
        assertThrows(IllegalArgumentException.class, () -> config.set("job_timeout_ms", "99999999999999999999"));

        assertEquals(3, config.getMaxRetries());
        assertEquals(1, config.getWorkerCount());
        assertFalse(Files.exists(tempDir.resolve("config.json")));

        config.set("worker_count", String.valueOf(Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, config.getWorkerCount());
    }

    @Test
    public void testMalformedFileFallsBackToDefaults() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{ this is not json", StandardCharsets.UTF_8);

        assertEquals(3, QueueConfig.load(file).getMaxRetries());
    }

    /**
     * Hand-edited values out of range are replaced by defaults instead of breaking workers.
     */
    @Test
    public void testOutOfRangeValuesSanitized() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, "{\"max_retries\": -2, \"backoff_base\": 0, \"worker_count\": 4}",
                StandardCharsets.UTF_8);

        QueueConfig config = QueueConfig.load(file);
        assertEquals(3, config.getMaxRetries());
        assertEquals(2.0, config.getBackoffBase());
        assertEquals(4, config.getWorkerCount());
    }

    @Test
    public void testGetAndGetAll() {
        QueueConfig config = QueueConfig.load(tempDir.resolve("config.json"));

        assertEquals(3, config.get("max-retries"));
        assertEquals(3, config.get("MAX_RETRIES"));
        assertNull(config.get("unknown"));
        assertEquals(List.of("max_retries", "backoff_base", "worker_count", "job_timeout_ms",
                "poll_interval_ms", "database_path"), List.copyOf(config.getAll().keySet()));
    }

    @Test
    public void testDatabaseUrl() throws IOException {
        QueueConfig config = QueueConfig.load(tempDir.resolve("config.json"));
        config.set("database_path", "./data/q");

        assertEquals("jdbc:h2:./data/q;AUTO_SERVER=TRUE", config.getDatabaseUrl());

        System.setProperty(QueueConfig.DB_URL_PROPERTY, "jdbc:h2:mem:override");
        assertEquals("jdbc:h2:mem:override", config.getDatabaseUrl());
    }

    @Test
    public void testNormalizeKey() {
        assertEquals("job_timeout_ms", QueueConfig.normalizeKey(" Job-Timeout-Ms "));
    }
}
