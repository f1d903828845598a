package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.OptimisticLockException;
import com.agentflow.core.model.Workflow;
import com.agentflow.core.model.WorkflowStatus;
import com.agentflow.core.model.WorkflowStep;
import com.agentflow.core.model.WorkflowType;
import com.agentflow.core.repository.WorkflowQuery;
import com.agentflow.core.repository.WorkflowRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL-backed implementation of WorkflowRepository.
 * A workflow and its steps are written in one transaction; steps keep their definition order
 * through the {@code position} column.
 */
public class JdbcWorkflowRepository extends JdbcSupport implements WorkflowRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final TransactionTemplate transactionTemplate;
    private final WorkflowRowMapper rowMapper = new WorkflowRowMapper();
    private final StepRowMapper stepRowMapper = new StepRowMapper();

    public JdbcWorkflowRepository(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                  ObjectMapper objectMapper) {
        super(jdbcTemplate, objectMapper);
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public void save(Workflow workflow) {
        translateRun("save workflow", () -> {
            try {
                transactionTemplate.executeWithoutResult(status -> {
                    String sql = """
                        INSERT INTO workflows (
                            id, name, description, workflow_type, status, config, metadata, tags,
                            version, created_at, updated_at
                        ) VALUES (?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?::jsonb, ?, ?, ?)
                        """;
                    jdbcTemplate.update(sql,
                        workflow.id(),
                        workflow.name(),
                        workflow.description(),
                        workflow.workflowType().name(),
                        workflow.status().name(),
                        toJson(workflow.config()),
                        toJson(workflow.metadata()),
                        toJson(workflow.tags()),
                        workflow.version(),
                        toTimestamp(workflow.createdAt()),
                        toTimestamp(workflow.updatedAt())
                    );
                    insertSteps(workflow);
                });
            } catch (DuplicateKeyException e) {
                throw new ConflictException("Workflow already exists: " + workflow.id());
            }
        });
    }

    @Override
    public void update(Workflow workflow) {
        translateRun("update workflow", () -> transactionTemplate.executeWithoutResult(status -> {
            String sql = """
                UPDATE workflows SET
                    name = ?,
                    description = ?,
                    workflow_type = ?,
                    status = ?,
                    config = ?::jsonb,
                    metadata = ?::jsonb,
                    tags = ?::jsonb,
                    version = ?,
                    updated_at = ?
                WHERE id = ? AND version = ?
                """;
            int rows = jdbcTemplate.update(sql,
                workflow.name(),
                workflow.description(),
                workflow.workflowType().name(),
                workflow.status().name(),
                toJson(workflow.config()),
                toJson(workflow.metadata()),
                toJson(workflow.tags()),
                workflow.version(),
                toTimestamp(workflow.updatedAt()),
                workflow.id(),
                workflow.version() - 1
            );
            if (rows == 0) {
                throw new OptimisticLockException("Workflow", workflow.id(), workflow.version() - 1);
            }
            jdbcTemplate.update("DELETE FROM workflow_steps WHERE workflow_id = ?", workflow.id());
            insertSteps(workflow);
        }));
    }

    @Override
    public Optional<Workflow> findById(String workflowId) {
        return translate("find workflow", () -> {
            List<Workflow> results = jdbcTemplate.query("SELECT * FROM workflows WHERE id = ?", rowMapper, workflowId);
            return results.isEmpty() ? Optional.<Workflow>empty() : Optional.of(withSteps(results.get(0)));
        });
    }

    @Override
    public List<Workflow> find(WorkflowQuery query) {
        return translate("find workflows", () -> {
            StringBuilder sql = new StringBuilder("SELECT * FROM workflows WHERE 1 = 1");
            List<Object> args = new ArrayList<>();
            if (query.workflowType() != null) {
                sql.append(" AND workflow_type = ?");
                args.add(query.workflowType().name());
            }
            if (query.status() != null) {
                sql.append(" AND status = ?");
                args.add(query.status().name());
            }
            if (query.tags() != null) {
                List<String> matches = new ArrayList<>();
                for (String tag : query.tags()) {
                    matches.add("tags @> ?::jsonb");
                    args.add(toJson(List.of(tag)));
                }
                sql.append(" AND (").append(String.join(" OR ", matches)).append(")");
            }
            sql.append(" ORDER BY updated_at DESC, id LIMIT ? OFFSET ?");
            args.add(query.limit());
            args.add(query.offset());
            List<Workflow> workflows = jdbcTemplate.query(sql.toString(), rowMapper, args.toArray());
            List<Workflow> complete = new ArrayList<>(workflows.size());
            for (Workflow workflow : workflows) {
                complete.add(withSteps(workflow));
            }
            return complete;
        });
    }

    @Override
    public boolean delete(String workflowId) {
        // executions and steps go with it through ON DELETE CASCADE
        return translate("delete workflow",
            () -> jdbcTemplate.update("DELETE FROM workflows WHERE id = ?", workflowId) > 0);
    }

    @Override
    public long count() {
        return translate("count workflows", () -> {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM workflows", Long.class);
            return count != null ? count : 0L;
        });
    }

    @Override
    public Map<WorkflowType, Long> countByType() {
        return translate("count workflows by type", () -> {
            Map<WorkflowType, Long> counts = new EnumMap<>(WorkflowType.class);
            jdbcTemplate.query("SELECT workflow_type, COUNT(*) AS count FROM workflows GROUP BY workflow_type",
                rs -> {
                    counts.put(WorkflowType.valueOf(rs.getString("workflow_type")), rs.getLong("count"));
                });
            return counts;
        });
    }

    @Override
    public Map<WorkflowStatus, Long> countByStatus() {
        return translate("count workflows by status", () -> {
            Map<WorkflowStatus, Long> counts = new EnumMap<>(WorkflowStatus.class);
            jdbcTemplate.query("SELECT status, COUNT(*) AS count FROM workflows GROUP BY status",
                rs -> {
                    counts.put(WorkflowStatus.valueOf(rs.getString("status")), rs.getLong("count"));
                });
            return counts;
        });
    }

    // ========== Helper Methods ==========

    private void insertSteps(Workflow workflow) {
        String sql = """
            INSERT INTO workflow_steps (
                workflow_id, id, position, name, step_type, agent_ref, config, dependencies,
                timeout_seconds, retry_count
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?)
            """;
        List<Object[]> batch = new ArrayList<>();
        for (int i = 0; i < workflow.steps().size(); i++) {
            WorkflowStep step = workflow.steps().get(i);
            batch.add(new Object[]{
                workflow.id(),
                step.id(),
                i,
                step.name(),
                step.stepType(),
                step.agentRef(),
                toJson(step.config()),
                toJson(step.dependencies()),
                step.timeoutSeconds(),
                step.retryCount()
            });
        }
        jdbcTemplate.batchUpdate(sql, batch);
    }

    private Workflow withSteps(Workflow workflow) {
        List<WorkflowStep> steps = jdbcTemplate.query(
            "SELECT * FROM workflow_steps WHERE workflow_id = ? ORDER BY position", stepRowMapper, workflow.id());
        return new Workflow(
            workflow.id(), workflow.name(), workflow.description(), workflow.workflowType(), workflow.status(),
            workflow.config(), workflow.metadata(), workflow.tags(), steps, workflow.version(),
            workflow.createdAt(), workflow.updatedAt()
        );
    }

    private class WorkflowRowMapper implements RowMapper<Workflow> {
        @Override
        public Workflow mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                List<String> tags = parse(rs.getString("tags"), STRING_LIST);
                return new Workflow(
                    rs.getString("id"),
                    rs.getString("name"),
                    rs.getString("description"),
                    WorkflowType.valueOf(rs.getString("workflow_type")),
                    WorkflowStatus.valueOf(rs.getString("status")),
                    parseNode(rs.getString("config")),
                    parseNode(rs.getString("metadata")),
                    tags != null ? new LinkedHashSet<>(tags) : null,
                    List.of(),
                    rs.getInt("version"),
                    toInstant(rs.getTimestamp("created_at")),
                    toInstant(rs.getTimestamp("updated_at"))
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map workflow row", e);
            }
        }
    }

    private class StepRowMapper implements RowMapper<WorkflowStep> {
        @Override
        public WorkflowStep mapRow(ResultSet rs, int rowNum) throws SQLException {
            try {
                return new WorkflowStep(
                    rs.getString("id"),
                    rs.getString("workflow_id"),
                    rs.getString("name"),
                    rs.getString("step_type"),
                    rs.getString("agent_ref"),
                    parseNode(rs.getString("config")),
                    parse(rs.getString("dependencies"), STRING_LIST),
                    rs.getInt("timeout_seconds"),
                    rs.getInt("retry_count")
                );
            } catch (Exception e) {
                throw new SQLException("Failed to map workflow step row", e);
            }
        }
    }
}
