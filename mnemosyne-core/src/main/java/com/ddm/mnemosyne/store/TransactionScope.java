package com.ddm.mnemosyne.store;

/**
 * 显式事务边界。
 *
 * <p>典型用法：
 * <pre>{@code
 * try (TransactionScope.Transaction tx = scope.begin()) {
 *     store.updateValue(...);
 *     ledger.append(...);
 *     tx.commit();
 * }
 * }</pre>
 * 未提交就关闭的事务会被回滚，{@link ConfigStore} 与 {@link HistoryLedger}
 * 的写入要么一起生效，要么都不生效。
 *
 * @author liyifei
 * @since 1.0
 */
public interface TransactionScope {

    Transaction begin();

    interface Transaction extends AutoCloseable {

        void commit();

        void rollback();

        /**
         * 未提交时回滚；已提交或已回滚时无操作。
         */
        @Override
        void close();
    }
}
