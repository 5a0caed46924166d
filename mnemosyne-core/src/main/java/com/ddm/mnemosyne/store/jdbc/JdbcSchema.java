package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

/**
 * 配置存储的表结构。
 *
 * <h3>config_entry 表（配置项当前状态）</h3>
 * <pre>{@code
 * CREATE TABLE config_entry (
 *   id            BIGINT AUTO_INCREMENT PRIMARY KEY,
 *   cfg_key       VARCHAR(255) NOT NULL UNIQUE,  -- 配置键
 *   name          VARCHAR(255),
 *   description   VARCHAR(1024),
 *   category      VARCHAR(32)  NOT NULL,
 *   value_type    VARCHAR(16)  NOT NULL,
 *   effect_type   VARCHAR(32)  NOT NULL,
 *   cfg_value     TEXT         NOT NULL,         -- 当前值；加密配置为密文信封
 *   default_value TEXT         NOT NULL,         -- 默认值明文，预置后不可变
 *   validation    TEXT,                         -- 约束 JSON
 *   impact_note   VARCHAR(1024),
 *   sort_order    INT          NOT NULL DEFAULT 0,
 *   encrypted     BOOLEAN      NOT NULL DEFAULT FALSE,
 *   read_only     BOOLEAN      NOT NULL DEFAULT FALSE,
 *   cfg_version   BIGINT       NOT NULL DEFAULT 1, -- 乐观锁版本号
 *   updated_at    TIMESTAMP,
 *   updated_by    VARCHAR(128),
 *   created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP
 * );
 * }</pre>
 *
 * <h3>config_history 表（只追加的变更历史）</h3>
 * <pre>{@code
 * CREATE TABLE config_history (
 *   id                 VARCHAR(64)  PRIMARY KEY,
 *   cfg_key            VARCHAR(255) NOT NULL,
 *   cfg_version        BIGINT       NOT NULL,
 *   previous_value     TEXT,
 *   new_value          TEXT,
 *   restorable_value   TEXT,        -- 变更前的存储形态，仅供回滚
 *   changed_at         TIMESTAMP    NOT NULL,
 *   changed_by         VARCHAR(128),
 *   change_reason      VARCHAR(512),
 *   change_kind        VARCHAR(16)  NOT NULL,
 *   rollback_source_id VARCHAR(64)
 * );
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public final class JdbcSchema {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchema.class);

    /**
     * 各数据库的建表语句，Key 为数据库类型（h2、mysql）。
     */
    private static final Map<String, List<String>> SQL_TEMPLATES = Map.of(
            "h2", List.of("""
                            CREATE TABLE IF NOT EXISTS config_entry (
                                id            BIGINT AUTO_INCREMENT PRIMARY KEY,
                                cfg_key       VARCHAR(255)  NOT NULL,
                                name          VARCHAR(255),
                                description   VARCHAR(1024),
                                category      VARCHAR(32)   NOT NULL,
                                value_type    VARCHAR(16)   NOT NULL,
                                effect_type   VARCHAR(32)   NOT NULL,
                                cfg_value     VARCHAR(8192) NOT NULL,
                                default_value VARCHAR(8192) NOT NULL,
                                validation    VARCHAR(2048),
                                impact_note   VARCHAR(1024),
                                sort_order    INT           NOT NULL DEFAULT 0,
                                encrypted     BOOLEAN       NOT NULL DEFAULT FALSE,
                                read_only     BOOLEAN       NOT NULL DEFAULT FALSE,
                                cfg_version   BIGINT        NOT NULL DEFAULT 1,
                                updated_at    TIMESTAMP,
                                updated_by    VARCHAR(128),
                                created_at    TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                                CONSTRAINT uk_cfg_key UNIQUE (cfg_key)
                            )
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS config_history (
                                id                 VARCHAR(64)   PRIMARY KEY,
                                cfg_key            VARCHAR(255)  NOT NULL,
                                cfg_version        BIGINT        NOT NULL,
                                previous_value     VARCHAR(8192),
                                new_value          VARCHAR(8192),
                                restorable_value   VARCHAR(8192),
                                changed_at         TIMESTAMP     NOT NULL,
                                changed_by         VARCHAR(128),
                                change_reason      VARCHAR(512),
                                change_kind        VARCHAR(16)   NOT NULL,
                                rollback_source_id VARCHAR(64)
                            )
                            """,
                    "CREATE INDEX IF NOT EXISTS idx_history_key_time ON config_history (cfg_key, changed_at)"),
            "mysql", List.of("""
                            CREATE TABLE IF NOT EXISTS `config_entry` (
                                `id` BIGINT NOT NULL AUTO_INCREMENT,
                                `cfg_key` VARCHAR(255) NOT NULL,
                                `name` VARCHAR(255) DEFAULT NULL,
                                `description` VARCHAR(1024) DEFAULT NULL,
                                `category` VARCHAR(32) NOT NULL,
                                `value_type` VARCHAR(16) NOT NULL,
                                `effect_type` VARCHAR(32) NOT NULL,
                                `cfg_value` TEXT NOT NULL,
                                `default_value` TEXT NOT NULL,
                                `validation` TEXT DEFAULT NULL,
                                `impact_note` VARCHAR(1024) DEFAULT NULL,
                                `sort_order` INT NOT NULL DEFAULT '0',
                                `encrypted` TINYINT(1) NOT NULL DEFAULT '0',
                                `read_only` TINYINT(1) NOT NULL DEFAULT '0',
                                `cfg_version` BIGINT NOT NULL DEFAULT '1',
                                `updated_at` TIMESTAMP(3) NULL DEFAULT NULL,
                                `updated_by` VARCHAR(128) DEFAULT NULL,
                                `created_at` TIMESTAMP NULL DEFAULT CURRENT_TIMESTAMP,
                                PRIMARY KEY (`id`),
                                UNIQUE KEY `uk_cfg_key` (`cfg_key`)
                            ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4;
                            """,
                    """
                            CREATE TABLE IF NOT EXISTS `config_history` (
                                `id` VARCHAR(64) NOT NULL,
                                `cfg_key` VARCHAR(255) NOT NULL,
                                `cfg_version` BIGINT NOT NULL,
                                `previous_value` TEXT,
                                `new_value` TEXT,
                                `restorable_value` TEXT,
                                `changed_at` TIMESTAMP(3) NOT NULL,
                                `changed_by` VARCHAR(128) DEFAULT NULL,
                                `change_reason` VARCHAR(512) DEFAULT NULL,
                                `change_kind` VARCHAR(16) NOT NULL,
                                `rollback_source_id` VARCHAR(64) DEFAULT NULL,
                                PRIMARY KEY (`id`),
                                KEY `idx_history_key_time` (`cfg_key`, `changed_at`)
                            ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4;
                            """)
    );

    private JdbcSchema() {
    }

    /**
     * 确保表结构存在（幂等执行）。
     * <p>
     * 不支持的数据库类型只记录警告，不抛出异常；建表语句执行失败会抛出，
     * 避免在缺表的情况下继续启动。
     *
     * @param dataSource 数据源
     * @throws StorageException 无法获取连接
     */
    public static void ensureTables(DataSource dataSource) {
        String url;
        try (Connection connection = dataSource.getConnection()) {
            url = connection.getMetaData().getURL();
        } catch (SQLException e) {
            throw new StorageException("Unable to detect database provider", e);
        }
        String dbType = detectDatabaseType(url);
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);

        List<String> statements = SQL_TEMPLATES.get(dbType);
        if (statements == null) {
            log.warn("Unsupported database provider: {}, table creation skipped", dbType);
            return;
        }
        for (String sql : statements) {
            jdbc.execute(sql);
        }
        log.info("Config store tables ensured ({})", dbType);
    }

    /**
     * 根据数据库 URL 检测数据库类型。
     *
     * @return h2、mysql；无法识别时返回 mysql
     */
    static String detectDatabaseType(String url) {
        String lowerUrl = url == null ? "" : url.toLowerCase();
        if (lowerUrl.contains(":h2:")) {
            return "h2";
        } else if (lowerUrl.contains(":mysql:") || lowerUrl.contains(":mariadb:")) {
            return "mysql";
        }
        return "mysql";
    }
}
