package com.williamcallahan.omnibus_engine.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.omnibus_engine.model.BookMetadata;
import com.williamcallahan.omnibus_engine.model.OmnibusBook;
import com.williamcallahan.omnibus_engine.model.VirtualBook;
import com.williamcallahan.omnibus_engine.model.VirtualBookWithOmnibus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Postgres backed storage of virtual books. Descriptive metadata lives in a JSONB column.
 */
@Repository
public class JdbcVirtualBookRepository implements VirtualBookRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcVirtualBookRepository.class);

    private static final String VIRTUAL_BOOK_COLUMNS =
            "vb.id, vb.omnibus_id, vb.title, vb.sort_title, vb.number, vb.number_sort, " +
            "vb.file_last_modified, vb.file_size, vb.metadata, vb.url";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<VirtualBook> virtualBookRowMapper;

    public JdbcVirtualBookRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.virtualBookRowMapper = (rs, rowNum) -> mapVirtualBook(rs);
    }

    @Override
    public Optional<VirtualBook> findById(String id) {
        String sql = "SELECT " + VIRTUAL_BOOK_COLUMNS + " FROM virtual_books vb WHERE vb.id = ?";
        return jdbcTemplate.query(sql, virtualBookRowMapper, id).stream().findFirst();
    }

    @Override
    public Optional<VirtualBookWithOmnibus> findWithOmnibus(String id) {
        String sql = "SELECT " + VIRTUAL_BOOK_COLUMNS + ", " +
                     "ob.id AS ob_id, ob.name AS ob_name, ob.url AS ob_url, ob.media_type AS ob_media_type, " +
                     "ob.file_last_modified AS ob_file_last_modified, ob.file_size AS ob_file_size " +
                     "FROM virtual_books vb JOIN omnibus_books ob ON ob.id = vb.omnibus_id WHERE vb.id = ?";
        RowMapper<VirtualBookWithOmnibus> mapper = (rs, rowNum) -> new VirtualBookWithOmnibus(
                mapVirtualBook(rs),
                new OmnibusBook(
                        rs.getString("ob_id"),
                        rs.getString("ob_name"),
                        rs.getString("ob_url"),
                        rs.getString("ob_media_type"),
                        JdbcOmnibusBookRepository.toInstant(rs.getTimestamp("ob_file_last_modified")),
                        rs.getLong("ob_file_size")));
        return jdbcTemplate.query(sql, mapper, id).stream().findFirst();
    }

    @Override
    public List<VirtualBook> findByOmnibusId(String omnibusId) {
        String sql = "SELECT " + VIRTUAL_BOOK_COLUMNS + " FROM virtual_books vb WHERE vb.omnibus_id = ? " +
                     "ORDER BY vb.number_sort, vb.id";
        return jdbcTemplate.query(sql, virtualBookRowMapper, omnibusId);
    }

    @Override
    @Transactional
    public void replaceForOmnibus(String omnibusId, List<VirtualBook> virtualBooks) {
        int removed = jdbcTemplate.update("DELETE FROM virtual_books WHERE omnibus_id = ?", omnibusId);
        String sql = "INSERT INTO virtual_books (id, omnibus_id, title, sort_title, number, number_sort, " +
                     "file_last_modified, file_size, metadata, url) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?)";
        List<Object[]> rows = virtualBooks.stream()
                .map(vb -> new Object[] {
                        vb.id(),
                        omnibusId,
                        vb.title(),
                        vb.sortTitle(),
                        vb.number(),
                        vb.numberSort(),
                        vb.fileLastModified() != null ? Timestamp.from(vb.fileLastModified()) : null,
                        vb.fileSize(),
                        writeMetadata(vb.metadata()),
                        vb.url()
                })
                .toList();
        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(sql, rows);
        }
        log.debug("Replaced {} virtual books of omnibus {} with {}", removed, omnibusId, rows.size());
    }

    @Override
    public int deleteByOmnibusId(String omnibusId) {
        return jdbcTemplate.update("DELETE FROM virtual_books WHERE omnibus_id = ?", omnibusId);
    }

    @Override
    public boolean existsByOmnibusId(String omnibusId) {
        Boolean exists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM virtual_books WHERE omnibus_id = ?)", Boolean.class, omnibusId);
        return Objects.requireNonNullElse(exists, false);
    }

    VirtualBook mapVirtualBook(ResultSet rs) throws SQLException {
        return new VirtualBook(
                rs.getString("id"),
                rs.getString("omnibus_id"),
                rs.getString("title"),
                rs.getString("sort_title"),
                rs.getFloat("number"),
                rs.getFloat("number_sort"),
                JdbcOmnibusBookRepository.toInstant(rs.getTimestamp("file_last_modified")),
                rs.getLong("file_size"),
                readMetadata(rs.getString("metadata")),
                rs.getString("url"));
    }

    private BookMetadata readMetadata(String json) {
        if (json == null || json.isBlank() || json.equals("{}")) {
            return BookMetadata.empty();
        }
        try {
            return objectMapper.readValue(json, BookMetadata.class);
        } catch (JsonProcessingException ex) {
            log.warn("Failed to parse virtual book metadata JSON: {}", ex.getMessage());
            return BookMetadata.empty();
        }
    }

    private String writeMetadata(BookMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata == null ? BookMetadata.empty() : metadata);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize virtual book metadata", ex);
        }
    }
}
