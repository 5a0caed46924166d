package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.exception.StorageException;
import com.ddm.mnemosyne.store.ConfigStore;
import com.ddm.mnemosyne.utils.Json;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于关系型数据库的 {@link ConfigStore} 实现，数据保存在 {@code config_entry} 表。
 *
 * <p><strong>并发控制：</strong>
 * {@link #updateValue} 使用 {@code WHERE cfg_key = :key AND cfg_version = :expected}
 * 做比较并交换，影响行数为 0 即表示版本已被他人推进。
 *
 * <p>表结构见 {@link JdbcSchema}。
 *
 * @author liyifei
 * @since 1.0
 */
public class JdbcConfigStore extends AbstractJdbcRepository implements ConfigStore {

    private static final String COLUMNS = """
            cfg_key, name, description, category, value_type, effect_type, cfg_value, default_value,
            validation, impact_note, sort_order, encrypted, read_only, cfg_version, updated_at, updated_by
            """;

    private static final RowMapper<ConfigEntry> ROW_MAPPER = (rs, rowNum) -> new ConfigEntry(
            rs.getString("cfg_key"),
            rs.getString("name"),
            rs.getString("description"),
            ConfigCategory.valueOf(rs.getString("category")),
            ValueType.valueOf(rs.getString("value_type")),
            EffectType.valueOf(rs.getString("effect_type")),
            rs.getString("cfg_value"),
            rs.getString("default_value"),
            readRules(rs.getString("validation")),
            rs.getString("impact_note"),
            rs.getInt("sort_order"),
            rs.getBoolean("encrypted"),
            rs.getBoolean("read_only"),
            rs.getLong("cfg_version"),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getString("updated_by"));

    public JdbcConfigStore(DataSource dataSource) {
        this(dataSource, null);
    }

    public JdbcConfigStore(DataSource dataSource, Duration queryTimeout) {
        super(dataSource, queryTimeout);
    }

    @Override
    public Optional<ConfigEntry> find(String key) {
        String sql = "SELECT " + COLUMNS + " FROM config_entry WHERE cfg_key = :key";
        return read("finding config " + key, () -> jdbc.query(sql, Map.of("key", key), ROW_MAPPER)
                .stream()
                .findFirst());
    }

    @Override
    public List<ConfigEntry> findAll() {
        String sql = "SELECT " + COLUMNS + " FROM config_entry";
        return read("listing configs", () -> jdbc.query(sql, ROW_MAPPER));
    }

    @Override
    public void insert(ConfigEntry entry) {
        String sql = """
                INSERT INTO config_entry (%s)
                VALUES (:key, :name, :description, :category, :valueType, :effectType, :value, :defaultValue,
                        :validation, :impactNote, :sortOrder, :encrypted, :readOnly, :version, :updatedAt, :updatedBy)
                """.formatted(COLUMNS);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("key", entry.key())
                .addValue("name", entry.name())
                .addValue("description", entry.description())
                .addValue("category", entry.category().name())
                .addValue("valueType", entry.valueType().name())
                .addValue("effectType", entry.effectType().name())
                .addValue("value", entry.value())
                .addValue("defaultValue", entry.defaultValue())
                .addValue("validation", entry.validation().unconstrained() ? null : Json.write(entry.validation()))
                .addValue("impactNote", entry.impactNote())
                .addValue("sortOrder", entry.sortOrder())
                .addValue("encrypted", entry.encrypted())
                .addValue("readOnly", entry.readOnly())
                .addValue("version", entry.version())
                .addValue("updatedAt", toTimestamp(entry.updatedAt()))
                .addValue("updatedBy", entry.updatedBy());
        try {
            write("inserting config " + entry.key(), () -> jdbc.update(sql, params));
        } catch (StorageException e) {
            if (e.getCause() instanceof DuplicateKeyException) {
                throw new ConfigAlreadyExistsException(entry.key());
            }
            throw e;
        }
    }

    @Override
    public boolean updateValue(String key, long expectedVersion, String newValue, String actor, Instant at) {
        String sql = """
                UPDATE config_entry
                SET cfg_value = :value, cfg_version = cfg_version + 1, updated_at = :at, updated_by = :actor
                WHERE cfg_key = :key AND cfg_version = :expected
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("value", newValue)
                .addValue("at", toTimestamp(at))
                .addValue("actor", actor)
                .addValue("key", key)
                .addValue("expected", expectedVersion);
        return write("updating config " + key, () -> jdbc.update(sql, params)) == 1;
    }

    private static ValidationRules readRules(String json) {
        if (json == null || json.isBlank()) {
            return ValidationRules.none();
        }
        return Json.read(json, ValidationRules.class);
    }
}
