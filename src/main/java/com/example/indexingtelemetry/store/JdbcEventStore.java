package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.exception.StoreUnavailableException;
import com.example.indexingtelemetry.exception.WriteFailedException;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.SessionOverview;
import com.example.indexingtelemetry.model.SessionRecord;
import com.example.indexingtelemetry.model.Stage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.*;

/**
 * Relational event log: one row per event, payload kept as JSON text.
 * A batch is inserted in a single transaction, so it is either stored whole or not at all.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);

    static final String SCHEMA = "db/indexing-telemetry-schema.sql";

    private static final int ITEM_TYPE_MAX = 64;
    private static final int MESSAGE_MAX = 1024;

    private static final String INSERT_SQL =
            "INSERT INTO indexing_events(session_id, item_id, item_type, stage, event_level, ts_epoch_ms, seq, message, payload) "
                    + "VALUES (?,?,?,?,?,?,?,?,?)";

    private static final String SELECT_COLUMNS =
            "SELECT id, session_id, item_id, item_type, stage, event_level, ts_epoch_ms, seq, message, payload FROM indexing_events ";

    private static final String SELECT_SESSION_SQL =
            SELECT_COLUMNS + "WHERE session_id = ? ORDER BY ts_epoch_ms ASC, seq ASC, id ASC";

    private static final String SELECT_SESSION_ITEM_SQL =
            SELECT_COLUMNS + "WHERE session_id = ? AND item_id = ? ORDER BY ts_epoch_ms ASC, seq ASC, id ASC";

    private static final String SELECT_RECENT_SESSIONS_SQL =
            "SELECT session_id, MIN(ts_epoch_ms) AS start_ms, MAX(ts_epoch_ms) AS end_ms, COUNT(*) AS event_count, "
                    + "SUM(CASE WHEN event_level = 'ERROR' THEN 1 ELSE 0 END) AS error_count "
                    + "FROM indexing_events GROUP BY session_id ORDER BY start_ms DESC LIMIT ?";

    private static final String DELETE_SESSION_RECORD_SQL = "DELETE FROM indexing_sessions WHERE session_id = ?";

    private static final String INSERT_SESSION_RECORD_SQL =
            "INSERT INTO indexing_sessions(session_id, index_id, ts_epoch_ms, duration_seconds, memory_peak_bytes, "
                    + "total_items, error_count, status_breakdown) VALUES (?,?,?,?,?,?,?,?)";

    private static final String SELECT_SESSION_RECORD_SQL =
            "SELECT session_id, index_id, ts_epoch_ms, duration_seconds, memory_peak_bytes, total_items, error_count, "
                    + "status_breakdown FROM indexing_sessions WHERE session_id = ?";

    private static final String DELETE_EVENTS_OLDER_THAN_SQL = "DELETE FROM indexing_events WHERE ts_epoch_ms < ?";
    private static final String DELETE_SESSIONS_OLDER_THAN_SQL = "DELETE FROM indexing_sessions WHERE ts_epoch_ms < ?";

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Long>> BREAKDOWN_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate batchTx;
    private final RowMapper<IndexingEvent> eventMapper;

    public JdbcEventStore(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
        this.batchTx = new TransactionTemplate(
                new DataSourceTransactionManager(Objects.requireNonNull(jdbc.getDataSource())));
        this.eventMapper = (rs, rowNum) -> IndexingEvent.builder()
                .id(String.valueOf(rs.getLong("id")))
                .sessionId(rs.getString("session_id"))
                .itemId(rs.getLong("item_id"))
                .itemType(rs.getString("item_type"))
                .stage(Stage.valueOf(rs.getString("stage")))
                .level(EventLevel.valueOf(rs.getString("event_level")))
                .timestamp(Instant.ofEpochMilli(rs.getLong("ts_epoch_ms")))
                .sequence(rs.getLong("seq"))
                .message(rs.getString("message"))
                .payload(readJson(rs.getString("payload"), PAYLOAD_TYPE))
                .build();
    }

    @Override
    public String backend() {
        return "jdbc";
    }

    @Override
    public void verify() {
        try {
            ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA));
            DatabasePopulatorUtils.execute(populator, Objects.requireNonNull(jdbc.getDataSource()));
            logger.info("Relational telemetry schema ready");
        } catch (Exception e) {
            throw new StoreUnavailableException("Relational telemetry store unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void appendBatch(List<IndexingEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        try {
            batchTx.executeWithoutResult(status -> jdbc.batchUpdate(INSERT_SQL, new BatchPreparedStatementSetter() {
                @Override
                public void setValues(PreparedStatement ps, int i) throws SQLException {
                    IndexingEvent e = events.get(i);
                    ps.setString(1, e.getSessionId());
                    ps.setLong(2, e.getItemId());
                    ps.setString(3, truncate(e.getItemType(), ITEM_TYPE_MAX));
                    ps.setString(4, e.getStage().name());
                    ps.setString(5, e.getLevel().name());
                    ps.setLong(6, e.getTimestamp().toEpochMilli());
                    ps.setLong(7, e.getSequence());
                    ps.setString(8, truncate(e.getMessage(), MESSAGE_MAX));
                    ps.setString(9, writeJson(e.getPayload()));
                }

                @Override
                public int getBatchSize() {
                    return events.size();
                }
            }));
        } catch (DataAccessException | TransactionException e) {
            throw new WriteFailedException("Relational batch insert failed", events.size(), e);
        }
    }

    @Override
    public boolean isReadable() {
        return true;
    }

    @Override
    public List<IndexingEvent> findBySession(String sessionId) {
        return jdbc.query(SELECT_SESSION_SQL, eventMapper, sessionId);
    }

    @Override
    public List<IndexingEvent> findBySessionAndItem(String sessionId, long itemId) {
        return jdbc.query(SELECT_SESSION_ITEM_SQL, eventMapper, sessionId, itemId);
    }

    @Override
    public List<SessionOverview> recentSessions(int limit) {
        return jdbc.query(SELECT_RECENT_SESSIONS_SQL, (rs, rowNum) -> SessionOverview.builder()
                .sessionId(rs.getString("session_id"))
                .startTime(Instant.ofEpochMilli(rs.getLong("start_ms")))
                .endTime(Instant.ofEpochMilli(rs.getLong("end_ms")))
                .eventCount(rs.getLong("event_count"))
                .errorCount(rs.getLong("error_count"))
                .build(), limit);
    }

    @Override
    public void saveSessionRecord(SessionRecord record) {
        jdbc.update(DELETE_SESSION_RECORD_SQL, record.getSessionId());
        jdbc.update(INSERT_SESSION_RECORD_SQL,
                record.getSessionId(),
                record.getIndexId(),
                record.getTimestamp().toEpochMilli(),
                record.getDurationSeconds(),
                record.getMemoryPeakBytes(),
                record.getTotalItems(),
                record.getErrorCount(),
                writeJson(record.getStatusBreakdown()));
    }

    @Override
    public Optional<SessionRecord> findSessionRecord(String sessionId) {
        List<SessionRecord> rows = jdbc.query(SELECT_SESSION_RECORD_SQL, (rs, rowNum) -> SessionRecord.builder()
                .sessionId(rs.getString("session_id"))
                .indexId(rs.getString("index_id"))
                .timestamp(Instant.ofEpochMilli(rs.getLong("ts_epoch_ms")))
                .durationSeconds(rs.getLong("duration_seconds"))
                .memoryPeakBytes(rs.getLong("memory_peak_bytes"))
                .totalItems(rs.getInt("total_items"))
                .errorCount(rs.getLong("error_count"))
                .statusBreakdown(readJson(rs.getString("status_breakdown"), BREAKDOWN_TYPE))
                .build(), sessionId);
        return rows.stream().findFirst();
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        long ms = cutoff.toEpochMilli();
        return (long) jdbc.update(DELETE_EVENTS_OLDER_THAN_SQL, ms) + jdbc.update(DELETE_SESSIONS_OLDER_THAN_SQL, ms);
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            logger.debug("Payload not serializable, storing without it: {}", e.getMessage());
            return null;
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            // hand-edited rows read as having no payload
            logger.debug("Unreadable JSON column ignored: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.length() <= max) {
            return s;
        }
        return s.substring(0, max);
    }
}
