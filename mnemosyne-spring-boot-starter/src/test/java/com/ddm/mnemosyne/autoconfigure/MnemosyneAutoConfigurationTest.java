package com.ddm.mnemosyne.autoconfigure;

import com.ddm.mnemosyne.SpringTestApplication;
import com.ddm.mnemosyne.cache.CaffeineConfigCache;
import com.ddm.mnemosyne.cache.ConfigCache;
import com.ddm.mnemosyne.defined.ConfigCategory;
import com.ddm.mnemosyne.defined.ConfigDefinition;
import com.ddm.mnemosyne.defined.ConfigView;
import com.ddm.mnemosyne.defined.EffectType;
import com.ddm.mnemosyne.defined.HistoryPage;
import com.ddm.mnemosyne.defined.UpdateResult;
import com.ddm.mnemosyne.defined.ValidationRules;
import com.ddm.mnemosyne.defined.ValueType;
import com.ddm.mnemosyne.event.ConfigChangeEvent;
import com.ddm.mnemosyne.event.ConfigChangeListener;
import com.ddm.mnemosyne.event.LoggingChangeListener;
import com.ddm.mnemosyne.exception.ReadOnlyViolationException;
import com.ddm.mnemosyne.service.ConfigService;
import com.ddm.mnemosyne.service.DefaultConfigService;
import com.ddm.mnemosyne.store.ConfigStore;
import com.ddm.mnemosyne.store.jdbc.JdbcConfigStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置存储自动配置的 Spring Boot 集成测试。
 *
 * <p>该测试验证：
 * <ul>
 *   <li>存在 DataSource 时所有组件自动装配，JDBC 表自动创建</li>
 *   <li>{@code mnemosyne.config-store.entries} 中的配置在启动时预置</li>
 *   <li>容器中的 {@link ConfigChangeListener} 能收到变更事件</li>
 * </ul>
 */
@SpringBootTest(classes = SpringTestApplication.class)
@Import(MnemosyneAutoConfigurationTest.ListenerConfig.class)
class MnemosyneAutoConfigurationTest {

    @TestConfiguration
    static class ListenerConfig {

        @Bean
        RecordingListener recordingListener() {
            return new RecordingListener();
        }
    }

    static class RecordingListener implements ConfigChangeListener {
        final List<ConfigChangeEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void onChange(ConfigChangeEvent event) {
            events.add(event);
        }
    }

    @Autowired
    private ConfigService configService;

    @Autowired
    private ConfigStore configStore;

    @Autowired
    private ConfigCache configCache;

    @Autowired
    private LoggingChangeListener loggingChangeListener;

    @Autowired
    private RecordingListener recordingListener;

    @Autowired
    private ConfigProvisioner provisioner;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    void testComponentsWired() {
        assertInstanceOf(DefaultConfigService.class, configService);
        assertInstanceOf(JdbcConfigStore.class, configStore);
        assertInstanceOf(CaffeineConfigCache.class, configCache);
        assertNotNull(loggingChangeListener);
    }

    @Test
    void testDeclaredEntriesProvisioned() {
        ConfigView threshold = configService.get("threshold");
        assertEquals(ValueType.NUMBER, threshold.valueType());
        assertEquals(ConfigCategory.THRESHOLD, threshold.category());
        assertEquals(0, new BigDecimal("0.8").compareTo((BigDecimal) threshold.defaultValue()));
        assertEquals(0, BigDecimal.ONE.compareTo(threshold.validation().max()));

        ConfigView apiKey = configService.get("apiKey");
        assertTrue(apiKey.encrypted());

        ConfigView region = configService.get("system.region");
        assertTrue(region.readOnly());
        assertEquals(EffectType.RESTART_REQUIRED, region.effectType());
        assertEquals("eu-west-1", region.value());
    }

    @Test
    void testProvisioningIsIdempotent() {
        assertEquals(0, provisioner.provisionAll());
    }

    @Test
    void testReadOnlyEntryRejected() {
        assertThrows(ReadOnlyViolationException.class,
                () -> configService.update("system.region", "us-east-1", "admin", null));
        assertEquals("eu-west-1", configService.getValue("system.region", String.class));
    }

    @Test
    void testUpdatePersistsAndNotifies() {
        configService.provision(ConfigDefinition.of("starter.batchSize", ValueType.NUMBER, "10")
                .withValidation(ValidationRules.range(1, 500))
                .withCategory(ConfigCategory.PROCESSING));

        UpdateResult result = configService.update("starter.batchSize", 50, "admin", "load test");

        assertTrue(result.changed());
        assertEquals(Integer.valueOf(50), configService.getValue("starter.batchSize", Integer.class));
        assertEquals("50", jdbcTemplate.queryForObject(
                "SELECT cfg_value FROM config_entry WHERE cfg_key = ?", String.class, "starter.batchSize"));

        HistoryPage history = configService.history("starter.batchSize");
        assertEquals(1, history.total());
        assertEquals("10", history.records().get(0).previousValue());

        assertTrue(recordingListener.events.stream()
                .anyMatch(e -> e.key().equals("starter.batchSize") && e.historyId().equals(result.historyId())));
    }

    @Test
    void testSecretStoredEncrypted() {
        configService.provision(ConfigDefinition.of("starter.token", ValueType.SECRET, ""));
        configService.update("starter.token", "tok-0123456789", "admin", null);

        String stored = jdbcTemplate.queryForObject(
                "SELECT cfg_value FROM config_entry WHERE cfg_key = ?", String.class, "starter.token");
        assertNotEquals("tok-0123456789", stored);
        assertEquals("tok-0123456789", configService.getValue("starter.token", String.class));
        assertEquals("••••••••6789", configService.get("starter.token").value());
    }

    @Test
    void testNotActivatedWithoutDataSource() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(MnemosyneAutoConfiguration.class))
                .withPropertyValues("mnemosyne.config-store.master-secret=unused")
                .run(context -> assertFalse(context.containsBean("configService")));
    }
}
