package com.ddm.mnemosyne.cache;

import java.util.Optional;

/**
 * 配置读缓存，保存解密并解析后的值。
 *
 * <p><strong>一致性约定：</strong>
 * <ul>
 *   <li>两次刷新之间的读取最多落后 TTL</li>
 *   <li>写入方在提交后同步调用 {@link #invalidate(String)}，同进程内读写一致</li>
 *   <li>跨进程变更需要显式调用 {@link #invalidateAll()}</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigCache {

    /**
     * 读取配置；不存在时返回 empty。
     *
     * @throws com.ddm.mnemosyne.exception.DecryptionFailureException 存储的密文无法解密
     * @throws com.ddm.mnemosyne.exception.StorageException           存储不可用
     */
    Optional<CachedValue> get(String key);

    void invalidate(String key);

    void invalidateAll();

    /**
     * 当前快照中可用的配置数，未加载时为 0。
     */
    long size();
}
