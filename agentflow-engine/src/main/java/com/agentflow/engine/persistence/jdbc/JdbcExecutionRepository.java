package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.exception.OptimisticLockException;
import com.agentflow.core.model.ExecutionStatistics;
import com.agentflow.core.model.ExecutionStatus;
import com.agentflow.core.model.StepResult;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowExecution;
import com.agentflow.core.repository.ExecutionQuery;
import com.agentflow.core.repository.ExecutionRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed implementation of ExecutionRepository.
 * Optimistic locking on the {@code version} column; step results and events are stored as
 * {@code json} so their insertion order survives.
 */
public class JdbcExecutionRepository extends JdbcSupport implements ExecutionRepository {

    private static final TypeReference<LinkedHashMap<String, StepResult>> STEP_RESULTS = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, JsonNode>> EVENTS = new TypeReference<>() {
    };

    private static final String STATISTICS_COLUMNS = """
        SELECT COUNT(*) AS execution_count,
               COUNT(*) FILTER (WHERE status = 'SUCCEEDED') AS success_count,
               COUNT(*) FILTER (WHERE status = 'FAILED') AS failure_count,
               COUNT(*) FILTER (WHERE status = 'CANCELLED') AS cancelled_count,
               COUNT(*) FILTER (WHERE status = 'RUNNING') AS running_count,
               COALESCE(AVG(duration_seconds), 0) AS average_duration
        FROM workflow_executions
        """;

    private final ExecutionRowMapper rowMapper = new ExecutionRowMapper();

    public JdbcExecutionRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
    }

    @Override
    public void save(WorkflowExecution execution) {
        String sql = """
            INSERT INTO workflow_executions (
                id, workflow_id, workflow_version, status, input_data, output_data,
                step_results, received_events, error, error_code,
                created_at, started_at, completed_at, duration_seconds, version, definition_snapshot
            ) VALUES (?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::json, ?::json, ?, ?, ?, ?, ?, ?, ?, ?::jsonb)
            """;
        translateRun("save execution", () -> jdbcTemplate.update(sql,
            execution.id(),
            execution.workflowId(),
            execution.workflowVersion(),
            execution.status().name(),
            toJson(execution.inputData()),
            toJson(execution.outputData()),
            toJson(execution.stepResults()),
            toJson(execution.receivedEvents()),
            execution.error(),
            execution.errorCode(),
            toTimestamp(execution.createdAt()),
            toTimestamp(execution.startedAt()),
            toTimestamp(execution.completedAt()),
            execution.durationSeconds(),
            execution.version(),
            toJson(execution.definition())
        ));
    }

    @Override
    public void update(WorkflowExecution execution) {
        String sql = """
            UPDATE workflow_executions SET
                status = ?,
                output_data = ?::jsonb,
                step_results = ?::json,
                received_events = ?::json,
                error = ?,
                error_code = ?,
                started_at = ?,
                completed_at = ?,
                duration_seconds = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;
        int rows = translate("update execution", () -> jdbcTemplate.update(sql,
            execution.status().name(),
            toJson(execution.outputData()),
            toJson(execution.stepResults()),
            toJson(execution.receivedEvents()),
            execution.error(),
            execution.errorCode(),
            toTimestamp(execution.startedAt()),
            toTimestamp(execution.completedAt()),
            execution.durationSeconds(),
            execution.version(),
            execution.id(),
            execution.version() - 1
        ));
        if (rows == 0) {
            throw new OptimisticLockException("WorkflowExecution", execution.id(), execution.version() - 1);
        }
    }

    @Override
    public Optional<WorkflowExecution> findById(UUID executionId) {
        return translate("find execution", () -> {
            List<WorkflowExecution> results = jdbcTemplate.query(
                "SELECT * FROM workflow_executions WHERE id = ?", rowMapper, executionId);
            return results.isEmpty() ? Optional.<WorkflowExecution>empty() : Optional.of(results.get(0));
        });
    }

    @Override
    public List<WorkflowExecution> find(ExecutionQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM workflow_executions WHERE 1 = 1");
        List<Object> args = new ArrayList<>();
        if (query.workflowId() != null) {
            sql.append(" AND workflow_id = ?");
            args.add(query.workflowId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            args.add(query.status().name());
        }
        sql.append(" ORDER BY started_at DESC NULLS LAST, created_at DESC LIMIT ? OFFSET ?");
        args.add(query.limit());
        args.add(query.offset());
        return translate("find executions", () -> jdbcTemplate.query(sql.toString(), rowMapper, args.toArray()));
    }

    @Override
    public List<WorkflowExecution> findNonTerminal() {
        String sql = """
            SELECT * FROM workflow_executions
            WHERE status IN ('PENDING', 'RUNNING')
            ORDER BY created_at
            """;
        return translate("find non-terminal executions", () -> jdbcTemplate.query(sql, rowMapper));
    }

    @Override
    public long countActive(String workflowId) {
        String sql = """
            SELECT COUNT(*) FROM workflow_executions
            WHERE workflow_id = ? AND status IN ('PENDING', 'RUNNING')
            """;
        return translate("count active executions", () -> {
            Long count = jdbcTemplate.queryForObject(sql, Long.class, workflowId);
            return count != null ? count : 0L;
        });
    }

    @Override
    public ExecutionStatistics statistics(String workflowId) {
        return translate("execution statistics", () -> {
            RowMapper<ExecutionStatistics> mapper = (rs, rowNum) -> new ExecutionStatistics(
                workflowId,
                rs.getLong("execution_count"),
                rs.getLong("success_count"),
                rs.getLong("failure_count"),
                rs.getLong("cancelled_count"),
                rs.getLong("running_count"),
                rs.getDouble("average_duration")
            );
            if (workflowId == null) {
                return jdbcTemplate.queryForObject(STATISTICS_COLUMNS, mapper);
            }
            return jdbcTemplate.queryForObject(STATISTICS_COLUMNS + " WHERE workflow_id = ?", mapper, workflowId);
        });
    }

    private class ExecutionRowMapper implements RowMapper<WorkflowExecution> {
        @Override
        public WorkflowExecution mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                double duration = rs.getDouble("duration_seconds");
                Double durationSeconds = rs.wasNull() ? null : duration;
                return new WorkflowExecution(
                    UUID.fromString(rs.getString("id")),
                    rs.getString("workflow_id"),
                    rs.getInt("workflow_version"),
                    ExecutionStatus.valueOf(rs.getString("status")),
                    parseNode(rs.getString("input_data")),
                    parseNode(rs.getString("output_data")),
                    parse(rs.getString("step_results"), STEP_RESULTS),
                    parse(rs.getString("received_events"), EVENTS),
                    rs.getString("error"),
                    rs.getString("error_code"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("started_at")),
                    toInstant(rs.getTimestamp("completed_at")),
                    durationSeconds,
                    rs.getLong("version"),
                    parse(rs.getString("definition_snapshot"), Workflow.class)
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map execution row", e);
            }
        }
    }
}
