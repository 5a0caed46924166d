package com.ddm.mnemosyne.store;

import com.ddm.mnemosyne.defined.ConfigEntry;
import com.ddm.mnemosyne.exception.ConfigAlreadyExistsException;
import com.ddm.mnemosyne.exception.StorageException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 配置项的持久化存储，当前值的唯一可信来源。
 *
 * <p><strong>职责：</strong>
 * <ul>
 *   <li>按键读取与全量读取配置项</li>
 *   <li>预置新配置项（仅在预置时写入 value = defaultValue）</li>
 *   <li>以版本号做比较并交换（CAS）写入新值</li>
 * </ul>
 *
 * <p>除预置外，只有 ConfigService 的写路径会调用写方法，且总在
 * {@link TransactionScope} 打开的事务中与 {@link HistoryLedger#append} 一起执行。
 * 存储故障抛出 {@link StorageException}。
 *
 * @author liyifei
 * @since 1.0
 */
public interface ConfigStore {

    Optional<ConfigEntry> find(String key);

    /**
     * 读取全部配置项，顺序不作保证。
     */
    List<ConfigEntry> findAll();

    /**
     * 预置配置项。
     *
     * @throws ConfigAlreadyExistsException 键已存在
     */
    void insert(ConfigEntry entry);

    /**
     * 比较版本号后写入新值，并将版本号加 1。
     *
     * @param key             配置键
     * @param expectedVersion 调用方读到的版本号
     * @param newValue        新的存储形态（加密配置为密文信封）
     * @param actor           操作者
     * @param at              写入时间
     * @return 版本号匹配且写入成功时返回 true；版本号已变化返回 false
     */
    boolean updateValue(String key, long expectedVersion, String newValue, String actor, Instant at);
}
