package com.williamcallahan.omnibus_engine.repository;

import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/**
 * Postgres backed lookup of omnibus container records.
 */
@Repository
public class JdbcOmnibusBookRepository implements OmnibusBookRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcOmnibusBookRepository.class);

    static final RowMapper<OmnibusBook> OMNIBUS_ROW_MAPPER = (rs, rowNum) -> new OmnibusBook(
            rs.getString("id"),
            rs.getString("name"),
            rs.getString("url"),
            rs.getString("media_type"),
            toInstant(rs.getTimestamp("file_last_modified")),
            rs.getLong("file_size")
    );

    private final JdbcTemplate jdbcTemplate;

    public JdbcOmnibusBookRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<OmnibusBook> findById(String id) {
        String sql = "SELECT id, name, url, media_type, file_last_modified, file_size FROM omnibus_books WHERE id = ?";
        try {
            return jdbcTemplate.query(sql, OMNIBUS_ROW_MAPPER, id).stream().findFirst();
        } catch (DataAccessException ex) {
            log.error("Failed to load omnibus {}: {}", id, ex.getMessage(), ex);
            throw ex;
        }
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : Instant.EPOCH;
    }
}
