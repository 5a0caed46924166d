package com.ddm.mnemosyne.defined;

import java.util.Objects;

/**
 * 配置预置定义：描述一个配置项的元数据和默认值。
 * <p>
 * {@code encrypted} 为 null 时按类型推断（仅 {@link ValueType#SECRET} 加密）；
 * SECRET 类型必须加密。
 *
 * @author liyifei
 * @since 1.0
 */
public record ConfigDefinition(String key,
                               String name,
                               String description,
                               ConfigCategory category,
                               ValueType valueType,
                               EffectType effectType,
                               String defaultValue,
                               ValidationRules validation,
                               String impactNote,
                               Integer sortOrder,
                               Boolean encrypted,
                               Boolean readOnly) {

    public ConfigDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        Objects.requireNonNull(valueType, "valueType");
        category = category == null ? ConfigCategory.SYSTEM : category;
        effectType = effectType == null ? EffectType.IMMEDIATE : effectType;
        if (valueType == ValueType.SECRET && Boolean.FALSE.equals(encrypted)) {
            throw new IllegalArgumentException("SECRET config must be encrypted: " + key);
        }
    }

    public static ConfigDefinition of(String key, ValueType valueType, String defaultValue) {
        return new ConfigDefinition(key, null, null, null, valueType, null, defaultValue,
                null, null, null, null, null);
    }

    public boolean isEncrypted() {
        return encrypted != null ? encrypted : valueType == ValueType.SECRET;
    }

    public boolean isReadOnly() {
        return Boolean.TRUE.equals(readOnly);
    }

    public ConfigDefinition withValidation(ValidationRules rules) {
        return new ConfigDefinition(key, name, description, category, valueType, effectType, defaultValue,
                rules, impactNote, sortOrder, encrypted, readOnly);
    }

    public ConfigDefinition withCategory(ConfigCategory c) {
        return new ConfigDefinition(key, name, description, c, valueType, effectType, defaultValue,
                validation, impactNote, sortOrder, encrypted, readOnly);
    }

    public ConfigDefinition withEffectType(EffectType e) {
        return new ConfigDefinition(key, name, description, category, valueType, e, defaultValue,
                validation, impactNote, sortOrder, encrypted, readOnly);
    }

    public ConfigDefinition withName(String n, String desc) {
        return new ConfigDefinition(key, n, desc, category, valueType, effectType, defaultValue,
                validation, impactNote, sortOrder, encrypted, readOnly);
    }

    public ConfigDefinition asReadOnly() {
        return new ConfigDefinition(key, name, description, category, valueType, effectType, defaultValue,
                validation, impactNote, sortOrder, encrypted, Boolean.TRUE);
    }
}
