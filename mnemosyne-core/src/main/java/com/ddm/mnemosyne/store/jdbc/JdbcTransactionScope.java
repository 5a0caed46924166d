package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.exception.StorageException;
import com.ddm.mnemosyne.store.TransactionScope;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * 基于 Spring {@link PlatformTransactionManager} 的事务边界。
 * <p>
 * 总是开启新事务（REQUIRES_NEW），保证 {@link Transaction#commit()} 返回时写入已真正提交，
 * 调用方可以在此之后安全地失效缓存。传入的事务管理器必须与
 * {@link JdbcConfigStore}、{@link JdbcHistoryLedger} 使用同一个 DataSource。
 *
 * @author liyifei
 * @since 1.0
 */
public class JdbcTransactionScope implements TransactionScope {

    private final PlatformTransactionManager transactionManager;
    private final TransactionDefinition definition;

    public JdbcTransactionScope(DataSource dataSource) {
        this(new DataSourceTransactionManager(dataSource));
    }

    public JdbcTransactionScope(PlatformTransactionManager transactionManager) {
        this.transactionManager = Objects.requireNonNull(transactionManager, "transactionManager");
        DefaultTransactionDefinition def = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        def.setName("mnemosyne-config-write");
        this.definition = def;
    }

    @Override
    public Transaction begin() {
        TransactionStatus status;
        try {
            status = transactionManager.getTransaction(definition);
        } catch (TransactionException e) {
            throw new StorageException("Unable to begin transaction", e);
        }
        return new Transaction() {
            @Override
            public void commit() {
                try {
                    transactionManager.commit(status);
                } catch (TransactionException e) {
                    throw new StorageException("Unable to commit transaction", e);
                }
            }

            @Override
            public void rollback() {
                try {
                    transactionManager.rollback(status);
                } catch (TransactionException e) {
                    throw new StorageException("Unable to roll back transaction", e);
                }
            }

            @Override
            public void close() {
                if (!status.isCompleted()) {
                    rollback();
                }
            }
        };
    }
}
