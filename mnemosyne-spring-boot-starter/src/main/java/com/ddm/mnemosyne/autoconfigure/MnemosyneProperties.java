package com.ddm.mnemosyne.autoconfigure;

import com.ddm.mnemosyne.defined.ConfigDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * 配置存储主配置绑定类，对应属性前缀：{@code mnemosyne.config-store.*}
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * mnemosyne:
 *   config-store:
 *     master-secret: ${CONFIG_ENCRYPTION_KEY}
 *     cache-ttl: 60
 *     entries:
 *       - key: threshold
 *         value-type: NUMBER
 *         category: THRESHOLD
 *         default-value: "0.8"
 *         validation:
 *           min: 0
 *           max: 1
 * }</pre>
 *
 * @author liyifei
 * @see MnemosyneAutoConfiguration
 * @since 1.0
 */
@ConfigurationProperties(prefix = "mnemosyne.config-store")
public record MnemosyneProperties(

        /**
         * 主密钥，用于派生加密配置的 AES 密钥。
         * <p>
         * 不能为空，通常来自环境变量；长度不足 32 个字符时启动日志会给出警告。
         */
        String masterSecret,

        /**
         * 密钥派生使用的全局盐值。更改后已有密文全部无法解密。
         */
        @DefaultValue("config-salt")
        String salt,

        /**
         * 读缓存 TTL，单位秒。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        @DefaultValue("60")
        Duration cacheTtl,

        /**
         * 写操作等待 Key 锁的最长时间，单位秒。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        @DefaultValue("5")
        Duration lockTimeout,

        /**
         * JDBC 语句超时，单位秒。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        @DefaultValue("10")
        Duration queryTimeout,

        /**
         * 启动时是否自动建表（幂等）。
         */
        @DefaultValue("true")
        boolean initSchema,

        /**
         * 启动时预置的配置项；已存在的键保持不变。
         */
        List<ConfigDefinition> entries) {

    public MnemosyneProperties {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
