package com.ddm.mnemosyne.cache;

import com.ddm.mnemosyne.defined.ConfigEntry;

/**
 * 缓存中的一项：存储形态 + 解密后的明文 + 按类型解析后的值。
 * <p>
 * 明文只在进程内存中存在，不得写入日志或对外展示。
 *
 * @param entry     读取时的存储形态
 * @param plaintext 解密后的序列化文本（非加密配置即 {@code entry.value()}）
 * @param value     解析后的运行时值，空值为 null
 * @author liyifei
 * @since 1.0
 */
public record CachedValue(ConfigEntry entry, String plaintext, Object value) {

    /**
     * 当前值是否与默认值不同；加密配置按明文比较。
     */
    public boolean isModified() {
        return !plaintext.equals(entry.defaultValue());
    }

    @Override
    public String toString() {
        return entry == null ? "CachedValue[missing]" : "CachedValue[key=" + entry.key() + ", version=" + entry.version() + "]";
    }
}
