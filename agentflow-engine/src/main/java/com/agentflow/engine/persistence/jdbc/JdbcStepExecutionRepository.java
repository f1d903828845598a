package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.model.StepExecution;
import com.agentflow.core.model.StepStatus;
import com.agentflow.core.repository.StepExecutionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of StepExecutionRepository.
 * The {@code seq} column preserves creation order of attempts.
 */
public class JdbcStepExecutionRepository extends JdbcSupport implements StepExecutionRepository {

    private static final String INSERT = """
        INSERT INTO step_executions (
            id, execution_id, step_id, step_name, iteration, attempt, status, result,
            error, error_code, dispatched_at, deadline, started_at, completed_at
        ) VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?, ?, ?)
        """;

    private final StepExecutionRowMapper rowMapper = new StepExecutionRowMapper();

    public JdbcStepExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(StepExecution stepExecution) {
        translateRun("save step execution", () -> jdbcTemplate.update(INSERT, insertArgs(stepExecution)));
    }

    @Override
    public void saveAll(List<StepExecution> stepExecutions) {
        List<Object[]> batch = new ArrayList<>(stepExecutions.size());
        for (StepExecution stepExecution : stepExecutions) {
            batch.add(insertArgs(stepExecution));
        }
        translateRun("save step executions", () -> jdbcTemplate.batchUpdate(INSERT, batch));
    }

    @Override
    public void update(StepExecution stepExecution) {
        String sql = """
            UPDATE step_executions SET
                status = ?,
                result = ?::jsonb,
                error = ?,
                error_code = ?,
                dispatched_at = ?,
                deadline = ?,
                started_at = ?,
                completed_at = ?
            WHERE id = ?
            """;
        int rows = translate("update step execution", () -> jdbcTemplate.update(sql,
            stepExecution.status().name(),
            toJson(stepExecution.result()),
            stepExecution.error(),
            stepExecution.errorCode(),
            toTimestamp(stepExecution.dispatchedAt()),
            toTimestamp(stepExecution.deadline()),
            toTimestamp(stepExecution.startedAt()),
            toTimestamp(stepExecution.completedAt()),
            stepExecution.id()
        ));
        if (rows == 0) {
            throw new IllegalStateException("Unknown step execution: " + stepExecution.id());
        }
    }

    @Override
    public List<StepExecution> findByExecution(UUID executionId) {
        return translate("find step executions", () -> jdbcTemplate.query(
            "SELECT * FROM step_executions WHERE execution_id = ? ORDER BY seq", rowMapper, executionId));
    }

    private Object[] insertArgs(StepExecution stepExecution) {
        return new Object[]{
            stepExecution.id(),
            stepExecution.executionId(),
            stepExecution.stepId(),
            stepExecution.stepName(),
            stepExecution.iteration(),
            stepExecution.attempt(),
            stepExecution.status().name(),
            toJson(stepExecution.result()),
            stepExecution.error(),
            stepExecution.errorCode(),
            toTimestamp(stepExecution.dispatchedAt()),
            toTimestamp(stepExecution.deadline()),
            toTimestamp(stepExecution.startedAt()),
            toTimestamp(stepExecution.completedAt())
        };
    }

    private class StepExecutionRowMapper implements RowMapper<StepExecution> {
        @Override
        public StepExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new StepExecution(
                    UUID.fromString(rs.getString("id")),
                    UUID.fromString(rs.getString("execution_id")),
                    rs.getString("step_id"),
                    rs.getString("step_name"),
                    rs.getInt("iteration"),
                    rs.getInt("attempt"),
                    StepStatus.valueOf(rs.getString("status")),
                    parseNode(rs.getString("result")),
                    rs.getString("error"),
                    rs.getString("error_code"),
                    toInstant(rs.getTimestamp("dispatched_at")),
                    toInstant(rs.getTimestamp("deadline")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at"))
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map step execution row", e);
            }
        }
    }
}
