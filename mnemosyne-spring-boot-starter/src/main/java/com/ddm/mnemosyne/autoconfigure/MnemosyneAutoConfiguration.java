package com.ddm.mnemosyne.autoconfigure;

import com.ddm.mnemosyne.cache.CaffeineConfigCache;
import com.ddm.mnemosyne.cache.ConfigCache;
import com.ddm.mnemosyne.crypto.AesGcmEncryptor;
import com.ddm.mnemosyne.crypto.Encryptor;
import com.ddm.mnemosyne.event.ConfigChangeListener;
import com.ddm.mnemosyne.event.LoggingChangeListener;
import com.ddm.mnemosyne.service.ConfigService;
import com.ddm.mnemosyne.service.DefaultConfigService;
import com.ddm.mnemosyne.store.ConfigStore;
import com.ddm.mnemosyne.store.HistoryLedger;
import com.ddm.mnemosyne.store.TransactionScope;
import com.ddm.mnemosyne.store.jdbc.JdbcConfigStore;
import com.ddm.mnemosyne.store.jdbc.JdbcHistoryLedger;
import com.ddm.mnemosyne.store.jdbc.JdbcSchema;
import com.ddm.mnemosyne.store.jdbc.JdbcTransactionScope;
import com.ddm.mnemosyne.validation.DefaultValidator;
import com.ddm.mnemosyne.validation.Validator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.DependsOn;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * 配置存储的自动配置类，容器中存在 {@link DataSource} 时生效。
 * <p>自动配置以下组件（均可被同类型的自定义 Bean 覆盖）：
 * <ul>
 *   <li>{@link Encryptor}：基于 {@code master-secret} 的 AES-GCM 加密器</li>
 *   <li>{@link ConfigStore} / {@link HistoryLedger} / {@link TransactionScope}：JDBC 实现</li>
 *   <li>{@link ConfigCache}：Caffeine 读缓存</li>
 *   <li>{@link ConfigService}：收集容器中全部 {@link ConfigChangeListener}</li>
 *   <li>{@link ConfigProvisioner}：启动时预置配置项</li>
 * </ul>
 *
 * @author liyifei
 * @see MnemosyneProperties
 * @since 1.0
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MnemosyneProperties.class)
public class MnemosyneAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(MnemosyneAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public Encryptor configEncryptor(MnemosyneProperties props) {
        return new AesGcmEncryptor(props.masterSecret(), props.salt());
    }

    @Bean
    @ConditionalOnMissingBean
    public Validator configValidator() {
        return new DefaultValidator();
    }

    /**
     * 按需建表，在 JDBC 仓储之前执行。
     */
    @Bean
    public InitializingBean mnemosyneSchemaInitializer(DataSource dataSource, MnemosyneProperties props) {
        return () -> {
            if (props.initSchema()) {
                JdbcSchema.ensureTables(dataSource);
            } else {
                log.info("Config store schema initialization disabled");
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    @DependsOn("mnemosyneSchemaInitializer")
    public ConfigStore configStore(DataSource dataSource, MnemosyneProperties props) {
        return new JdbcConfigStore(dataSource, props.queryTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    @DependsOn("mnemosyneSchemaInitializer")
    public HistoryLedger configHistoryLedger(DataSource dataSource, MnemosyneProperties props) {
        return new JdbcHistoryLedger(dataSource, props.queryTimeout());
    }

    /**
     * 优先复用容器中唯一的事务管理器，否则基于 DataSource 新建。
     */
    @Bean
    @ConditionalOnMissingBean
    public TransactionScope configTransactionScope(DataSource dataSource,
                                                   ObjectProvider<PlatformTransactionManager> transactionManager) {
        PlatformTransactionManager tm = transactionManager.getIfUnique();
        return tm != null ? new JdbcTransactionScope(tm) : new JdbcTransactionScope(dataSource);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigCache configCache(ConfigStore store, Encryptor encryptor, MnemosyneProperties props) {
        return new CaffeineConfigCache(store, encryptor, props.cacheTtl());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoggingChangeListener loggingChangeListener() {
        return new LoggingChangeListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigService configService(ConfigStore store,
                                       HistoryLedger ledger,
                                       TransactionScope transactions,
                                       ConfigCache cache,
                                       Encryptor encryptor,
                                       Validator validator,
                                       ObjectProvider<ConfigChangeListener> listeners,
                                       MnemosyneProperties props) {
        return new DefaultConfigService(store, ledger, transactions, cache, encryptor, validator,
                listeners.orderedStream().toList(), props.lockTimeout(), Clock.systemUTC());
    }

    @Bean
    public ConfigProvisioner configProvisioner(ConfigService configService, MnemosyneProperties props) {
        return new ConfigProvisioner(configService, props.entries());
    }
}
