package com.agentflow.engine.persistence.jdbc;

import com.agentflow.engine.health.StoreProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Checks database reachability with a trivial query.
 */
public class JdbcStoreProbe implements StoreProbe {

    private static final Logger log = LoggerFactory.getLogger(JdbcStoreProbe.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcStoreProbe(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public boolean isAvailable() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (DataAccessException e) {
            log.warn("Database probe failed: {}", e.getMessage());
            return false;
        }
    }
}
