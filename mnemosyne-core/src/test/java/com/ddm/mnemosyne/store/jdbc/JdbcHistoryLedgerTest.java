package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.defined.ChangeKind;
import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.HistoryRecord;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.store.TransactionScope;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link JdbcHistoryLedger} 与 {@link JdbcTransactionScope} 的单元测试，使用 H2 内存数据库。
 */
class JdbcHistoryLedgerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00Z");

    private JdbcConfigStore store;
    private JdbcHistoryLedger ledger;
    private JdbcTransactionScope transactions;

    @BeforeEach
    void setUp() {
        String uniqueDbName = "ledger_" + System.nanoTime();
        DriverManagerDataSource dataSource =
                new DriverManagerDataSource("jdbc:h2:mem:" + uniqueDbName + ";DB_CLOSE_DELAY=-1", "sa", "");
        JdbcSchema.ensureTables(dataSource);
        store = new JdbcConfigStore(dataSource);
        ledger = new JdbcHistoryLedger(dataSource);
        transactions = new JdbcTransactionScope(dataSource);

        store.insert(new ConfigEntry("batch.size", null, null, ConfigCategory.PROCESSING, ValueType.NUMBER,
                EffectType.IMMEDIATE, "10", "10", null, null, 0, false, false, 1, T0, "system"));
    }

    private static HistoryRecord record(String id, long version, String prev, String next, Instant at) {
        return new HistoryRecord(id, "batch.size", version, prev, next, prev, at, "admin", "tuning",
                ChangeKind.UPDATE, null);
    }

    @Test
    void testAppendAndRead() {
        HistoryRecord rollback = new HistoryRecord("h9", "batch.size", 5, "30", "10", "30",
                T0.plusSeconds(9), "admin", null, ChangeKind.ROLLBACK, "h1");
        ledger.append(rollback);

        HistoryRecord loaded = ledger.getById("h9").orElseThrow();
        assertEquals(rollback, loaded);
        assertTrue(loaded.isRollback());
        assertTrue(ledger.getById("nope").isEmpty());
    }

    @Test
    void testOrderingAndPaging() {
        ledger.append(record("h1", 2, "10", "20", T0.plusSeconds(1)));
        ledger.append(record("h2", 3, "20", "30", T0.plusSeconds(2)));
        ledger.append(record("h3", 4, "30", "40", T0.plusSeconds(2)));

        assertEquals(List.of("h3", "h2"), ids(ledger.listForKey("batch.size", 2, 0)));
        assertEquals(List.of("h1"), ids(ledger.listForKey("batch.size", 2, 2)));
        assertEquals(List.of("h1", "h2", "h3"), ids(ledger.listAllForKey("batch.size")));
        assertEquals(3, ledger.countForKey("batch.size"));
        assertEquals(0, ledger.countForKey("other"));
    }

    @Test
    void testTransactionRollback() {
        try (TransactionScope.Transaction tx = transactions.begin()) {
            assertTrue(store.updateValue("batch.size", 1, "20", "admin", T0.plusSeconds(1)));
            ledger.append(record("h1", 2, "10", "20", T0.plusSeconds(1)));
            tx.rollback();
        }

        assertEquals("10", store.find("batch.size").orElseThrow().value());
        assertEquals(0, ledger.countForKey("batch.size"));
    }

    @Test
    void testTransactionCloseWithoutCommit() {
        try (TransactionScope.Transaction tx = transactions.begin()) {
            store.updateValue("batch.size", 1, "20", "admin", T0.plusSeconds(1));
            ledger.append(record("h1", 2, "10", "20", T0.plusSeconds(1)));
        }

        assertEquals(1, store.find("batch.size").orElseThrow().version());
        assertTrue(ledger.getById("h1").isEmpty());
    }

    @Test
    void testTransactionCommit() {
        try (TransactionScope.Transaction tx = transactions.begin()) {
            store.updateValue("batch.size", 1, "20", "admin", T0.plusSeconds(1));
            ledger.append(record("h1", 2, "10", "20", T0.plusSeconds(1)));
            tx.commit();
        }

        assertEquals("20", store.find("batch.size").orElseThrow().value());
        assertEquals(1, ledger.countForKey("batch.size"));
    }

    private static List<String> ids(List<HistoryRecord> records) {
        return records.stream().map(HistoryRecord::id).toList();
    }
}
