package com.ddm.mnemosyne.store.jdbc;

import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link JdbcConfigStore} 的单元测试，使用 H2 内存数据库。
 */
class JdbcConfigStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T08:00:00.123Z");

    private DriverManagerDataSource dataSource;
    private JdbcConfigStore store;

    @BeforeEach
    void setUp() {
        // 每个测试使用独立的数据库实例，避免数据冲突
        String uniqueDbName = "store_" + System.nanoTime();
        dataSource = new DriverManagerDataSource("jdbc:h2:mem:" + uniqueDbName + ";DB_CLOSE_DELAY=-1", "sa", "");
        JdbcSchema.ensureTables(dataSource);
        store = new JdbcConfigStore(dataSource, Duration.ofSeconds(5));
    }

    private static ConfigEntry threshold() {
        return new ConfigEntry("threshold", "Confidence threshold", "Auto-approve above this value",
                ConfigCategory.THRESHOLD, ValueType.NUMBER, EffectType.IMMEDIATE, "0.8", "0.8",
                ValidationRules.range(new BigDecimal("0"), new BigDecimal("1")).asRequired(),
                "Affects every document", 3, false, false, 1, T0, "system");
    }

    @Test
    void testEnsureTables_Idempotent() {
        assertDoesNotThrow(() -> JdbcSchema.ensureTables(dataSource));
    }

    @Test
    void testInsertAndFind_AllColumns() {
        store.insert(threshold());

        ConfigEntry loaded = store.find("threshold").orElseThrow();
        assertEquals(threshold(), loaded);
        assertEquals(0, BigDecimal.ONE.compareTo(loaded.validation().max()));
        assertTrue(loaded.validation().requiresValue());
    }

    @Test
    void testUnconstrainedRulesStoredAsNull() {
        ConfigEntry plain = new ConfigEntry("plain", null, null, ConfigCategory.DISPLAY, ValueType.STRING,
                EffectType.IMMEDIATE, "x", "x", null, null, 0, false, true, 1, T0, "system");
        store.insert(plain);

        String rules = new JdbcTemplate(dataSource)
                .queryForObject("SELECT validation FROM config_entry WHERE cfg_key = 'plain'", String.class);
        assertNull(rules);
        assertTrue(store.find("plain").orElseThrow().validation().unconstrained());
        assertTrue(store.find("plain").orElseThrow().readOnly());
    }

    @Test
    void testInsertDuplicate() {
        store.insert(threshold());
        assertThrows(ConfigAlreadyExistsException.class, () -> store.insert(threshold()));
    }

    @Test
    void testUpdateValue_CompareAndSwap() {
        store.insert(threshold());
        Instant at = T0.plusSeconds(60);

        assertTrue(store.updateValue("threshold", 1, "0.95", "admin", at));
        assertFalse(store.updateValue("threshold", 1, "0.5", "other", at), "stale version must lose");

        ConfigEntry current = store.find("threshold").orElseThrow();
        assertEquals("0.95", current.value());
        assertEquals(2, current.version());
        assertEquals("admin", current.updatedBy());
        assertEquals(at, current.updatedAt());
        assertEquals("0.8", current.defaultValue());
    }

    @Test
    void testFindAllAndMissing() {
        store.insert(threshold());

        List<ConfigEntry> all = store.findAll();
        assertEquals(1, all.size());
        assertTrue(store.find("missing").isEmpty());
    }

    @Test
    void testStorageFailure() {
        new JdbcTemplate(dataSource).execute("DROP TABLE config_entry");

        StorageException e = assertThrows(StorageException.class, () -> store.find("threshold"));
        assertTrue(e.code().isRetryable());
    }
}
