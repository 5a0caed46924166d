package com.ddm.mnemosyne.autoconfigure;

import com.ddm.mnemosyne.defined.ConfigDefinition;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.List;

/**
 * 启动时按 {@code mnemosyne.config-store.entries} 预置缺失的配置项。
 * <p>
 * 已存在的键（包括其他实例并发预置的）保持原值不变；默认值不满足自身约束时启动失败。
 *
 * @author liyifei
 * @since 1.0
 */
public class ConfigProvisioner implements SmartInitializingSingleton {

    private static final Logger log = LoggerFactory.getLogger(ConfigProvisioner.class);

    private final ConfigService configService;
    private final List<ConfigDefinition> definitions;

    public ConfigProvisioner(ConfigService configService, List<ConfigDefinition> definitions) {
        this.configService = configService;
        this.definitions = definitions;
    }

    @Override
    public void afterSingletonsInstantiated() {
        provisionAll();
    }

    /**
     * @return 本次新建的配置数
     */
    public int provisionAll() {
        int created = 0;
        for (ConfigDefinition definition : definitions) {
            try {
                configService.provision(definition);
                created++;
            } catch (ConfigAlreadyExistsException e) {
                log.debug("Config {} already exists, provisioning skipped", definition.key());
            }
        }
        if (!definitions.isEmpty()) {
            log.info("Config provisioning finished: {} declared, {} created", definitions.size(), created);
        }
        return created;
    }
}
