package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.defined.ChangeKind;
import com.ddm.mnemosyne.defined.HistoryRecord;
import com.ddm.mnemosyne.store.HistoryLedger;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于关系型数据库的 {@link HistoryLedger} 实现，数据保存在 {@code config_history} 表。
 * <p>
 * 只有 INSERT 与 SELECT，不提供 UPDATE / DELETE。
 *
 * @author liyifei
 * @since 1.0
 */
public class JdbcHistoryLedger extends AbstractJdbcRepository implements HistoryLedger {

    private static final String COLUMNS = """
            id, cfg_key, cfg_version, previous_value, new_value, restorable_value,
            changed_at, changed_by, change_reason, change_kind, rollback_source_id
            """;

    private static final RowMapper<HistoryRecord> ROW_MAPPER = (rs, rowNum) -> new HistoryRecord(
            rs.getString("id"),
            rs.getString("cfg_key"),
            rs.getLong("cfg_version"),
            rs.getString("previous_value"),
            rs.getString("new_value"),
            rs.getString("restorable_value"),
            toInstant(rs.getTimestamp("changed_at")),
            rs.getString("changed_by"),
            rs.getString("change_reason"),
            ChangeKind.valueOf(rs.getString("change_kind")),
            rs.getString("rollback_source_id"));

    public JdbcHistoryLedger(DataSource dataSource) {
        this(dataSource, null);
    }

    public JdbcHistoryLedger(DataSource dataSource, Duration queryTimeout) {
        super(dataSource, queryTimeout);
    }

    @Override
    public void append(HistoryRecord record) {
        String sql = """
                INSERT INTO config_history (%s)
                VALUES (:id, :key, :version, :previousValue, :newValue, :restorableValue,
                        :changedAt, :changedBy, :changeReason, :kind, :rollbackSourceId)
                """.formatted(COLUMNS);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("id", record.id())
                .addValue("key", record.configKey())
                .addValue("version", record.version())
                .addValue("previousValue", record.previousValue())
                .addValue("newValue", record.newValue())
                .addValue("restorableValue", record.restorableValue())
                .addValue("changedAt", toTimestamp(record.changedAt()))
                .addValue("changedBy", record.changedBy())
                .addValue("changeReason", record.changeReason())
                .addValue("kind", record.kind().name())
                .addValue("rollbackSourceId", record.rollbackSourceId());
        write("appending history for " + record.configKey(), () -> jdbc.update(sql, params));
    }

    @Override
    public List<HistoryRecord> listForKey(String key, int limit, int offset) {
        String sql = "SELECT " + COLUMNS + """
                FROM config_history
                WHERE cfg_key = :key
                ORDER BY changed_at DESC, cfg_version DESC
                LIMIT :limit OFFSET :offset
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", key)
                .addValue("limit", Math.max(limit, 0))
                .addValue("offset", Math.max(offset, 0));
        return read("listing history for " + key, () -> jdbc.query(sql, params, ROW_MAPPER));
    }

    @Override
    public List<HistoryRecord> listAllForKey(String key) {
        String sql = "SELECT " + COLUMNS + """
                FROM config_history
                WHERE cfg_key = :key
                ORDER BY changed_at ASC, cfg_version ASC
                """;
        return read("listing history for " + key, () -> jdbc.query(sql, Map.of("key", key), ROW_MAPPER));
    }

    @Override
    public long countForKey(String key) {
        String sql = "SELECT COUNT(*) FROM config_history WHERE cfg_key = :key";
        Long count = read("counting history for " + key,
                () -> jdbc.queryForObject(sql, Map.of("key", key), Long.class));
        return count == null ? 0 : count;
    }

    @Override
    public Optional<HistoryRecord> getById(String historyId) {
        String sql = "SELECT " + COLUMNS + " FROM config_history WHERE id = :id";
        return read("loading history " + historyId, () -> jdbc.query(sql, Map.of("id", historyId), ROW_MAPPER)
                .stream()
                .findFirst());
    }
}
