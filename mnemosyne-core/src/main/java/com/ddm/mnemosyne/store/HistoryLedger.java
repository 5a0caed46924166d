package com.ddm.mnemosyne.store;

import com.ddm.mnemosyne.defined.HistoryRecord;

import java.util.List;
import java.util.Optional;

/**
 * 只追加的配置变更历史。
 * <p>
 * 不提供修改与删除操作。{@link #append} 必须与对应的
 * {@link ConfigStore#updateValue} 处于同一事务中。
 *
 * @author liyifei
 * @since 1.0
 */
public interface HistoryLedger {

    void append(HistoryRecord record);

    /**
     * 分页读取某个配置的历史，按时间倒序（同一时间按版本号倒序）。
     */
    List<HistoryRecord> listForKey(String key, int limit, int offset);

    /**
     * 读取某个配置的全部历史，按时间正序，用于历史链校验。
     */
    List<HistoryRecord> listAllForKey(String key);

    long countForKey(String key);

    Optional<HistoryRecord> getById(String historyId);
}
