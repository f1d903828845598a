package com.agentflow.engine.persistence.jdbc;

import com.agentflow.core.exception.TransientStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Shared plumbing of the JDBC repositories: JSON columns, timestamps and translation of
 * retryable database failures into {@link TransientStoreException}.
 */
abstract class JdbcSupport {

    protected final JdbcTemplate jdbcTemplate;
    protected final ObjectMapper objectMapper;

    protected JdbcSupport(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    protected <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException e) {
            throw new TransientStoreException(operation + " failed: " + e.getMessage(), e);
        }
    }

    protected void translateRun(String operation, Runnable action) {
        translate(operation, () -> {
            action.run();
            return null;
        });
    }

    protected String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize to JSON", e);
        }
    }

    protected JsonNode parseNode(String json) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return objectMapper.readTree(json);
    }

    protected <T> T parse(String json, TypeReference<T> type) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return objectMapper.readValue(json, type);
    }

    protected <T> T parse(String json, Class<T> type) throws JsonProcessingException {
        if (json == null || json.isEmpty()) {
            return null;
        }
        return objectMapper.readValue(json, type);
    }

    protected static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    protected static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
