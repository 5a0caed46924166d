package com.ddm.mnemosyne.store.memory;

import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.HistoryRecord;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.store.ConfigStore;
import com.ddm.mnemosyne.store.HistoryLedger;
import com.ddm.mnemosyne.store.TransactionScope;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存实现：同一个对象同时充当 {@link ConfigStore}、{@link HistoryLedger} 与 {@link TransactionScope}。
 *
 * <p><strong>事务语义：</strong>
 * 事务绑定在当前线程上。事务内的每次写入都会登记一个撤销动作，
 * 回滚时按相反顺序执行；提交时丢弃撤销记录。事务外的写入立即生效。
 * 不支持嵌套事务。
 *
 * <p>适用于测试与单进程嵌入场景，不做持久化。
 *
 * @author liyifei
 * @since 1.0
 */
public class InMemoryConfigRepository implements ConfigStore, HistoryLedger, TransactionScope {

    private static final Comparator<HistoryRecord> CHRONOLOGICAL =
            Comparator.comparing(HistoryRecord::changedAt).thenComparingLong(HistoryRecord::version);

    private final Map<String, ConfigEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, List<HistoryRecord>> historyByKey = new ConcurrentHashMap<>();
    private final Map<String, HistoryRecord> historyById = new ConcurrentHashMap<>();

    /**
     * 当前线程事务的撤销日志；为 null 表示不在事务中。
     */
    private final ThreadLocal<Deque<Runnable>> journal = new ThreadLocal<>();

    /* ===================== ConfigStore ===================== */

    @Override
    public Optional<ConfigEntry> find(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public List<ConfigEntry> findAll() {
        return List.copyOf(entries.values());
    }

    @Override
    public void insert(ConfigEntry entry) {
        if (entries.putIfAbsent(entry.key(), entry) != null) {
            throw new ConfigAlreadyExistsException(entry.key());
        }
        recordUndo(() -> entries.remove(entry.key()));
    }

    @Override
    public boolean updateValue(String key, long expectedVersion, String newValue, String actor, Instant at) {
        ConfigEntry current = entries.get(key);
        if (current == null || current.version() != expectedVersion) {
            return false;
        }
        ConfigEntry next = current.withValue(newValue, actor, at);
        if (!entries.replace(key, current, next)) {
            return false;
        }
        recordUndo(() -> entries.replace(key, next, current));
        return true;
    }

    /* ===================== HistoryLedger ===================== */

    @Override
    public void append(HistoryRecord record) {
        if (historyById.putIfAbsent(record.id(), record) != null) {
            throw new IllegalStateException("Duplicate history id: " + record.id());
        }
        List<HistoryRecord> list = historyByKey.computeIfAbsent(record.configKey(), k -> new CopyOnWriteArrayList<>());
        list.add(record);
        recordUndo(() -> {
            list.remove(record);
            historyById.remove(record.id());
        });
    }

    @Override
    public List<HistoryRecord> listForKey(String key, int limit, int offset) {
        List<HistoryRecord> all = new ArrayList<>(historyByKey.getOrDefault(key, List.of()));
        all.sort(CHRONOLOGICAL.reversed());
        return all.stream().skip(Math.max(offset, 0)).limit(Math.max(limit, 0)).toList();
    }

    @Override
    public List<HistoryRecord> listAllForKey(String key) {
        List<HistoryRecord> all = new ArrayList<>(historyByKey.getOrDefault(key, List.of()));
        all.sort(CHRONOLOGICAL);
        return all;
    }

    @Override
    public long countForKey(String key) {
        return historyByKey.getOrDefault(key, List.of()).size();
    }

    @Override
    public Optional<HistoryRecord> getById(String historyId) {
        return Optional.ofNullable(historyById.get(historyId));
    }

    /* ===================== TransactionScope ===================== */

    @Override
    public Transaction begin() {
        if (journal.get() != null) {
            throw new IllegalStateException("Nested transactions are not supported");
        }
        Deque<Runnable> undo = new ArrayDeque<>();
        journal.set(undo);
        return new Transaction() {
            private boolean completed;

            @Override
            public void commit() {
                ensureActive();
                completed = true;
                journal.remove();
            }

            @Override
            public void rollback() {
                ensureActive();
                completed = true;
                try {
                    while (!undo.isEmpty()) {
                        undo.pop().run();
                    }
                } finally {
                    journal.remove();
                }
            }

            @Override
            public void close() {
                if (!completed) {
                    rollback();
                }
            }

            private void ensureActive() {
                if (completed) {
                    throw new IllegalStateException("Transaction already completed");
                }
            }
        };
    }

    private void recordUndo(Runnable action) {
        Deque<Runnable> undo = journal.get();
        if (undo != null) {
            undo.push(action);
        }
    }
}
