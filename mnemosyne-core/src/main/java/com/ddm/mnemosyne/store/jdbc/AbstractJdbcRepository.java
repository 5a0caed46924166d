package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.exception.StorageException;
import com.ddm.mnemosyne.utils.Retry;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JDBC 仓储的公共部分：模板构造、查询超时、异常转换与只读重试。
 *
 * @author liyifei
 * @since 1.0
 */
abstract class AbstractJdbcRepository {

    private static final int READ_ATTEMPTS = 3;
    private static final long READ_BACKOFF_MS = 50;

    protected final NamedParameterJdbcTemplate jdbc;

    protected AbstractJdbcRepository(DataSource dataSource, Duration queryTimeout) {
        Objects.requireNonNull(dataSource, "dataSource");
        JdbcTemplate template = new JdbcTemplate(dataSource);
        if (queryTimeout != null && !queryTimeout.isZero() && !queryTimeout.isNegative()) {
            template.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
        }
        this.jdbc = new NamedParameterJdbcTemplate(template);
    }

    /**
     * 执行只读查询，瞬时故障最多重试 3 次。
     */
    protected <T> T read(String what, Supplier<T> query) {
        return Retry.read(() -> translate(what, query), READ_ATTEMPTS, READ_BACKOFF_MS);
    }

    /**
     * 执行写操作，不重试。
     */
    protected <T> T write(String what, Supplier<T> statement) {
        return translate(what, statement);
    }

    private static <T> T translate(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure while " + what, e);
        }
    }

    protected static Timestamp toTimestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    protected static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
