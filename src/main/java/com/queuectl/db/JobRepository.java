package com.queuectl.db;

import com.queuectl.core.DuplicateJobException;
import com.queuectl.core.Job;
import com.queuectl.core.JobState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * H2/JDBC implementation of {@link JobStore}.
 * All methods use PreparedStatement and try-with-resources for safe resource management.
 *
 * <p><b>Atomic acquisition:</b> {@link #acquireNext(String, Instant)} is one statement,</p>
 * <pre>
 * SELECT * FROM FINAL TABLE (
 *     UPDATE jobs SET state = 'processing', worker_id = ?, next_retry_at = NULL, updated_at = ?
 *     WHERE id = (SELECT id FROM jobs WHERE &lt;eligible&gt; ORDER BY created_at, id LIMIT 1)
 *       AND &lt;eligible&gt;)
 * </pre>
 * <p>The inner query finds the oldest eligible job and the outer predicate is checked
 * again by H2 once it holds the row lock. Two workers racing for the same row therefore
 * cannot both win: the loser's UPDATE matches zero rows and it simply tries again with
 * the next candidate.</p>
 */
public class JobRepository implements JobStore {
    private static final Logger logger = Logger.getLogger(JobRepository.class.getName());

    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final int MAX_ACQUIRE_ATTEMPTS = 5;

    private static final String ELIGIBLE =
            "(state = 'pending' OR (state = 'failed' AND (next_retry_at IS NULL OR next_retry_at <= ?)))";

    private static final String ACQUIRE_SQL =
            "SELECT * FROM FINAL TABLE ("
                    + "UPDATE jobs SET state = 'processing', worker_id = ?, next_retry_at = NULL, updated_at = ? "
                    + "WHERE id = (SELECT id FROM jobs WHERE " + ELIGIBLE
                    + " ORDER BY created_at ASC, id ASC LIMIT 1) "
                    + "AND " + ELIGIBLE + ")";

    private static final String ANY_ELIGIBLE_SQL =
            "SELECT COUNT(*) FROM jobs WHERE " + ELIGIBLE;

    private final Database database;
    private final Clock clock;

    public JobRepository(Database database) {
        this(database, Clock.systemUTC());
    }

    public JobRepository(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public Job create(Job job) throws SQLException {
        String sql = "INSERT INTO jobs (id, command, state, attempts, max_retries, created_at, updated_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?)";

        Instant now = clock.instant();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, job.getId());
            stmt.setString(2, job.getCommand());
            stmt.setString(3, (job.getState() != null ? job.getState() : JobState.PENDING).wireName());
            stmt.setInt(4, job.getAttempts());
            stmt.setInt(5, job.getMaxRetries());
            setInstant(stmt, 6, now);
            setInstant(stmt, 7, now);

            stmt.executeUpdate();
        } catch (SQLException e) {
            if (UNIQUE_VIOLATION_STATE.equals(e.getSQLState())) {
                throw new DuplicateJobException(job.getId(), e);
            }
            throw e;
        }

        logger.fine("Created job " + job.getId());
        return findById(job.getId());
    }

    @Override
    public Job findById(String id) throws SQLException {
        String sql = "SELECT * FROM jobs WHERE id = ?";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToJob(rs);
                }
            }
        }

        return null;
    }

    @Override
    public Job acquireNext(String workerId, Instant now) throws SQLException {
        try (Connection conn = database.getConnection()) {
            for (int attempt = 1; attempt <= MAX_ACQUIRE_ATTEMPTS; attempt++) {
                Job acquired = tryAcquire(conn, workerId, now);
                if (acquired != null) {
                    logger.fine("Worker " + workerId + " acquired job " + acquired.getId());
                    return acquired;
                }
                // Zero rows either means nothing is eligible or another worker won the row
                if (!anyEligible(conn, now)) {
                    return null;
                }
                logger.fine("Worker " + workerId + " lost an acquisition race, retrying (" + attempt + ")");
            }
        }
        return null;
    }

    private Job tryAcquire(Connection conn, String workerId, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(ACQUIRE_SQL)) {
            stmt.setString(1, workerId);
            setInstant(stmt, 2, clock.instant());
            setInstant(stmt, 3, now);
            setInstant(stmt, 4, now);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToJob(rs);
                }
            }
        }
        return null;
    }

    private boolean anyEligible(Connection conn, Instant now) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(ANY_ELIGIBLE_SQL)) {
            setInstant(stmt, 1, now);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() && rs.getLong(1) > 0;
            }
        }
    }

    @Override
    public Job update(String id, JobUpdate update) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT * FROM FINAL TABLE (UPDATE jobs SET ");
        List<Object> params = new ArrayList<>();

        for (Map.Entry<JobUpdate.Column, Object> entry : update.getValues().entrySet()) {
            sql.append(entry.getKey().columnName()).append(" = ?, ");
            params.add(entry.getValue());
        }
        sql.append("updated_at = ? WHERE id = ?");
        params.add(clock.instant());
        params.add(id);

        if (update.getExpectedState() != null) {
            sql.append(" AND state = ?");
            params.add(update.getExpectedState());
        }
        if (update.getExpectedAttempts() != null) {
            sql.append(" AND attempts = ?");
            params.add(update.getExpectedAttempts());
        }
        sql.append(')');

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                bind(stmt, i + 1, params.get(i));
            }

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return mapResultSetToJob(rs);
                }
            }
        }

        logger.fine("Update of job " + id + " matched no row: " + update);
        return null;
    }

    @Override
    public Map<JobState, Long> countByState() throws SQLException {
        String sql = "SELECT state, COUNT(*) AS count FROM jobs GROUP BY state";
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {

            while (rs.next()) {
                counts.put(JobState.fromWireName(rs.getString("state")), rs.getLong("count"));
            }
        }

        return counts;
    }

    @Override
    public List<Job> list(JobState state) throws SQLException {
        String sql = state == null
                ? "SELECT * FROM jobs ORDER BY created_at DESC, id DESC"
                : "SELECT * FROM jobs WHERE state = ? ORDER BY created_at DESC, id DESC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            if (state != null) {
                stmt.setString(1, state.wireName());
            }

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToJob(rs));
                }
            }
        }

        return jobs;
    }

    @Override
    public List<Job> listDead() throws SQLException {
        String sql = "SELECT * FROM jobs WHERE state = ? ORDER BY updated_at DESC, id DESC";
        List<Job> jobs = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, JobState.DEAD.wireName());

            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    jobs.add(mapResultSetToJob(rs));
                }
            }
        }

        return jobs;
    }

    @Override
    public void close() {
        database.close();
    }

    private Job mapResultSetToJob(ResultSet rs) throws SQLException {
        Job job = new Job();
        job.setId(rs.getString("id"));
        job.setCommand(rs.getString("command"));
        job.setState(JobState.fromWireName(rs.getString("state")));
        job.setAttempts(rs.getInt("attempts"));
        job.setMaxRetries(rs.getInt("max_retries"));
        job.setCreatedAt(getInstant(rs, "created_at"));
        job.setUpdatedAt(getInstant(rs, "updated_at"));
        job.setNextRetryAt(getInstant(rs, "next_retry_at"));
        job.setWorkerId(rs.getString("worker_id"));
        job.setOutput(rs.getString("output"));
        job.setError(rs.getString("error"));
        return job;
    }

    private static void bind(PreparedStatement stmt, int index, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.NULL);
        } else if (value instanceof Instant) {
            setInstant(stmt, index, (Instant) value);
        } else if (value instanceof JobState) {
            stmt.setString(index, ((JobState) value).wireName());
        } else if (value instanceof Integer) {
            stmt.setInt(index, (Integer) value);
        } else {
            stmt.setString(index, value.toString());
        }
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, OffsetDateTime.ofInstant(instant, ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value != null ? value.toInstant() : null;
    }
}
