package com.ddm.mnemosyne.defined;

import java.time.Instant;

/**
 * 面向展示的配置视图。
 * <p>
 * {@code value} / {@code defaultValue} 为解析后的类型化值；加密配置一律为遮蔽字符串。
 * {@code modified} 表示当前值与默认值不同（加密配置按解密后的明文比较）。
 *
 * @author liyifei
 * @since 1.0
 */
public record ConfigView(String key,
                         String name,
                         String description,
                         ConfigCategory category,
                         ValueType valueType,
                         EffectType effectType,
                         Object value,
                         Object defaultValue,
                         ValidationRules validation,
                         String impactNote,
                         boolean encrypted,
                         boolean readOnly,
                         boolean modified,
                         long version,
                         Instant updatedAt,
                         String updatedBy) {
}
