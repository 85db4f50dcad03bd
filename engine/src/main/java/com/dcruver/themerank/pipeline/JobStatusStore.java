package com.dcruver.themerank.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import javax.sql.DataSource;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SQLite persistence for job statuses, one row per (owner, job).
 */
@Component
@Slf4j
public class JobStatusStore {

    private static final RowMapper<JobStatus> ROW_MAPPER = (rs, rowNum) -> JobStatus.builder()
        .owner(rs.getString("owner"))
        .job(rs.getString("job"))
        .state(JobState.valueOf(rs.getString("state")))
        .stage(PipelineStage.valueOf(rs.getString("stage")))
        .message(rs.getString("message"))
        .startedAt(Instant.ofEpochMilli(rs.getLong("started_at")))
        .updatedAt(Instant.ofEpochMilli(rs.getLong("updated_at")))
        .build();

    private final JdbcTemplate jdbcTemplate;

    public JobStatusStore(DataSource dataSource) {
        this.jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @PostConstruct
    public void init() {
        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS job_status (
                owner TEXT NOT NULL,
                job TEXT NOT NULL,
                state TEXT NOT NULL,
                stage TEXT NOT NULL,
                message TEXT,
                started_at INTEGER NOT NULL,
                updated_at INTEGER NOT NULL,
                PRIMARY KEY (owner, job)
            )
            """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_job_status_state ON job_status(state)");

        log.info("Initialized job status store");
    }

    public void save(JobStatus status) {
        jdbcTemplate.update("""
            INSERT OR REPLACE INTO job_status (owner, job, state, stage, message, started_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            """,
            status.getOwner(),
            status.getJob(),
            status.getState().name(),
            status.getStage().name(),
            status.getMessage(),
            status.getStartedAt().toEpochMilli(),
            status.getUpdatedAt().toEpochMilli()
        );
    }

    public Optional<JobStatus> find(String owner, String job) {
        List<JobStatus> rows = jdbcTemplate.query(
            "SELECT * FROM job_status WHERE owner = ? AND job = ?", ROW_MAPPER, owner, job);
        return rows.stream().findFirst();
    }

    public List<JobStatus> findByState(JobState state) {
        return jdbcTemplate.query(
            "SELECT * FROM job_status WHERE state = ? ORDER BY started_at", ROW_MAPPER, state.name());
    }

    public List<JobStatus> findAll() {
        return jdbcTemplate.query("SELECT * FROM job_status ORDER BY updated_at DESC", ROW_MAPPER);
    }
}
