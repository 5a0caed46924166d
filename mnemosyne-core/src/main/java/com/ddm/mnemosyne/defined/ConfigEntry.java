package com.ddm.mnemosyne.defined;

import java.time.Instant;
import java.util.Objects;

/**
 * 配置项的存储形态，每个配置键一行。
 * <p>
 * {@code value} 为序列化后的当前值；当 {@code encrypted} 为 true 时，
 * 它是加密信封而非明文。{@code defaultValue} 始终为明文，预置后不可变。
 * {@code version} 从 1 开始，每次被接受的变更加 1，用于乐观并发控制。
 *
 * @author liyifei
 * @since 1.0
 */
public record ConfigEntry(String key,
                          String name,
                          String description,
                          ConfigCategory category,
                          ValueType valueType,
                          EffectType effectType,
                          String value,
                          String defaultValue,
                          ValidationRules validation,
                          String impactNote,
                          int sortOrder,
                          boolean encrypted,
                          boolean readOnly,
                          long version,
                          Instant updatedAt,
                          String updatedBy) {

    public ConfigEntry {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(valueType, "valueType");
        Objects.requireNonNull(effectType, "effectType");
        validation = validation == null ? ValidationRules.none() : validation;
        value = value == null ? "" : value;
        defaultValue = defaultValue == null ? "" : defaultValue;
        name = name == null ? key : name;
    }

    /**
     * 生成写入新值后的副本，版本号加 1。
     */
    public ConfigEntry withValue(String newValue, String actor, Instant at) {
        return new ConfigEntry(key, name, description, category, valueType, effectType,
                newValue, defaultValue, validation, impactNote, sortOrder, encrypted, readOnly,
                version + 1, at, actor);
    }
}
