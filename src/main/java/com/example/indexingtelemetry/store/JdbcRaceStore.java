package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.Stage;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

public class JdbcRaceStore implements RaceStore {

    private static final String INSERT_SQL =
            "INSERT INTO race_observations(item_id, stage, session_id, ts_epoch_ms, obs_type, concurrent_sessions, stages, "
                    + "first_seen_ms, last_seen_ms, operation_count, spread_ms) VALUES (?,?,?,?,?,?,?,?,?,?,?)";

    private static final String SELECT_COLUMNS =
            "SELECT id, item_id, stage, session_id, ts_epoch_ms, obs_type, concurrent_sessions, stages, first_seen_ms, "
                    + "last_seen_ms, operation_count, spread_ms FROM race_observations ";

    private static final String SELECT_RECENT_SQL =
            SELECT_COLUMNS + "WHERE item_id = ? AND obs_type = ? AND ts_epoch_ms >= ? ORDER BY ts_epoch_ms DESC, id DESC LIMIT ?";

    private static final String SELECT_BY_TYPE_SQL =
            SELECT_COLUMNS + "WHERE obs_type = ? ORDER BY ts_epoch_ms ASC, id ASC";

    private static final String DELETE_OLDER_THAN_SQL = "DELETE FROM race_observations WHERE ts_epoch_ms < ?";

    private static final RowMapper<RaceObservation> ROW_MAPPER = (rs, rowNum) -> {
        long firstSeen = rs.getLong("first_seen_ms");
        boolean hasFirstSeen = !rs.wasNull();
        long lastSeen = rs.getLong("last_seen_ms");
        boolean hasLastSeen = !rs.wasNull();
        return RaceObservation.builder()
                .id(String.valueOf(rs.getLong("id")))
                .itemId(rs.getLong("item_id"))
                .stage(Stage.valueOf(rs.getString("stage")))
                .sessionId(rs.getString("session_id"))
                .timestamp(Instant.ofEpochMilli(rs.getLong("ts_epoch_ms")))
                .type(rs.getString("obs_type"))
                .concurrentSessions(splitSessions(rs.getString("concurrent_sessions")))
                .stages(splitStages(rs.getString("stages")))
                .firstSeen(hasFirstSeen ? Instant.ofEpochMilli(firstSeen) : null)
                .lastSeen(hasLastSeen ? Instant.ofEpochMilli(lastSeen) : null)
                .operationCount(rs.getInt("operation_count"))
                .spreadMillis(rs.getLong("spread_ms"))
                .build();
    };

    private final JdbcTemplate jdbc;

    public JdbcRaceStore(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<RaceObservation> recentOperations(long itemId, Instant since, int limit) {
        return jdbc.query(SELECT_RECENT_SQL, ROW_MAPPER, itemId, RaceObservation.OPERATION, since.toEpochMilli(), limit);
    }

    @Override
    public void record(RaceObservation o) {
        jdbc.update(INSERT_SQL,
                o.getItemId(),
                o.getStage().name(),
                o.getSessionId(),
                o.getTimestamp().toEpochMilli(),
                o.getType(),
                o.getConcurrentSessions() == null ? null : String.join(",", o.getConcurrentSessions()),
                o.getStages() == null ? null : o.getStages().stream().map(Stage::name).collect(Collectors.joining(",")),
                o.getFirstSeen() == null ? null : o.getFirstSeen().toEpochMilli(),
                o.getLastSeen() == null ? null : o.getLastSeen().toEpochMilli(),
                o.getOperationCount(),
                o.getSpreadMillis());
    }

    @Override
    public List<RaceObservation> findCorrelations() {
        return jdbc.query(SELECT_BY_TYPE_SQL, ROW_MAPPER, RaceObservation.CONCURRENT_ACCESS);
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        return jdbc.update(DELETE_OLDER_THAN_SQL, cutoff.toEpochMilli());
    }

    private static Set<String> splitSessions(String joined) {
        if (joined == null || joined.isEmpty()) {
            return null;
        }
        return new TreeSet<>(Arrays.asList(joined.split(",")));
    }

    private static Set<Stage> splitStages(String joined) {
        if (joined == null || joined.isEmpty()) {
            return null;
        }
        EnumSet<Stage> stages = EnumSet.noneOf(Stage.class);
        for (String s : joined.split(",")) {
            stages.add(Stage.valueOf(s));
        }
        return stages;
    }
}
