package com.ddm.mnemosyne.store.memory;

import com.ddm.mnemosyne.defined.ChangeKind;
import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.HistoryRecord;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.store.TransactionScope;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link InMemoryConfigRepository} 的单元测试。
 */
class InMemoryConfigRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private final InMemoryConfigRepository repo = new InMemoryConfigRepository();

    private static ConfigEntry entry(String key, String value) {
        return new ConfigEntry(key, key, null, ConfigCategory.SYSTEM, ValueType.STRING, EffectType.IMMEDIATE,
                value, value, null, null, 0, false, false, 1, T0, "system");
    }

    private static HistoryRecord record(String id, String key, long version, String prev, String next, Instant at) {
        return new HistoryRecord(id, key, version, prev, next, prev, at, "admin", null, ChangeKind.UPDATE, null);
    }

    @Test
    void testInsertAndFind() {
        repo.insert(entry("a", "1"));

        assertEquals("1", repo.find("a").orElseThrow().value());
        assertTrue(repo.find("b").isEmpty());
        assertThrows(ConfigAlreadyExistsException.class, () -> repo.insert(entry("a", "2")));
    }

    @Test
    void testUpdateValue_CompareAndSwap() {
        repo.insert(entry("a", "1"));

        assertTrue(repo.updateValue("a", 1, "2", "admin", T0.plusSeconds(1)));
        assertFalse(repo.updateValue("a", 1, "3", "admin", T0.plusSeconds(2)), "stale version");
        assertFalse(repo.updateValue("missing", 1, "3", "admin", T0));

        ConfigEntry current = repo.find("a").orElseThrow();
        assertEquals("2", current.value());
        assertEquals(2, current.version());
        assertEquals("admin", current.updatedBy());
    }

    @Test
    void testHistoryOrderingAndPaging() {
        repo.append(record("h1", "a", 2, "1", "2", T0.plusSeconds(1)));
        repo.append(record("h2", "a", 3, "2", "3", T0.plusSeconds(2)));
        repo.append(record("h3", "a", 4, "3", "4", T0.plusSeconds(2)));
        repo.append(record("x1", "b", 2, "x", "y", T0));

        List<HistoryRecord> page = repo.listForKey("a", 2, 0);
        assertEquals(List.of("h3", "h2"), page.stream().map(HistoryRecord::id).toList());
        assertEquals(List.of("h1"), repo.listForKey("a", 2, 2).stream().map(HistoryRecord::id).toList());
        assertEquals(List.of("h1", "h2", "h3"), repo.listAllForKey("a").stream().map(HistoryRecord::id).toList());
        assertEquals(3, repo.countForKey("a"));
        assertEquals(0, repo.countForKey("none"));
        assertEquals("b", repo.getById("x1").orElseThrow().configKey());
    }

    @Test
    void testTransactionRollbackUndoesAllWrites() {
        repo.insert(entry("a", "1"));

        try (TransactionScope.Transaction tx = repo.begin()) {
            assertTrue(repo.updateValue("a", 1, "2", "admin", T0));
            repo.append(record("h1", "a", 2, "1", "2", T0));
            repo.insert(entry("b", "x"));
            tx.rollback();
        }

        assertEquals("1", repo.find("a").orElseThrow().value());
        assertEquals(1, repo.find("a").orElseThrow().version());
        assertTrue(repo.find("b").isEmpty());
        assertEquals(0, repo.countForKey("a"));
        assertTrue(repo.getById("h1").isEmpty());
    }

    @Test
    void testCloseWithoutCommitRollsBack() {
        repo.insert(entry("a", "1"));

        try (TransactionScope.Transaction tx = repo.begin()) {
            repo.updateValue("a", 1, "2", "admin", T0);
        }

        assertEquals("1", repo.find("a").orElseThrow().value());
    }

    @Test
    void testCommitKeepsWrites() {
        repo.insert(entry("a", "1"));

        try (TransactionScope.Transaction tx = repo.begin()) {
            repo.updateValue("a", 1, "2", "admin", T0);
            repo.append(record("h1", "a", 2, "1", "2", T0));
            tx.commit();
        }

        assertEquals("2", repo.find("a").orElseThrow().value());
        assertEquals(1, repo.countForKey("a"));
    }

    @Test
    void testNestedTransactionRejected() {
        try (TransactionScope.Transaction ignored = repo.begin()) {
            assertThrows(IllegalStateException.class, repo::begin);
        }
    }

    @Test
    void testDuplicateHistoryIdRejected() {
        repo.append(record("h1", "a", 2, "1", "2", T0));
        assertThrows(IllegalStateException.class, () -> repo.append(record("h1", "a", 3, "2", "3", T0)));
    }
}
