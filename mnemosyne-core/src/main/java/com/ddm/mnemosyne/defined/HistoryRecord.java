package com.ddm.mnemosyne.defined;

import java.time.Instant;
import java.util.Objects;

/**
 * 配置变更历史，每次被接受的变更追加一条，追加后不可修改或删除。
 * <p>
 * 对加密配置，{@code previousValue} / {@code newValue} 为遮蔽后的显示值；
 * {@code restorableValue} 保存变更前的存储形态（加密配置即旧的密文信封），
 * 仅供回滚使用，不对外展示。
 *
 * @param id               记录 ID
 * @param configKey        配置键
 * @param version          本次变更产生的配置版本号
 * @param previousValue    变更前的值（显示形态）
 * @param newValue         变更后的值（显示形态）
 * @param restorableValue  变更前的存储形态
 * @param changedAt        变更时间
 * @param changedBy        操作者
 * @param changeReason     变更原因，可以为 null
 * @param kind             变更来源
 * @param rollbackSourceId 回滚时指向被恢复的历史记录，否则为 null
 * @author liyifei
 * @since 1.0
 */
public record HistoryRecord(String id,
                            String configKey,
                            long version,
                            String previousValue,
                            String newValue,
                            String restorableValue,
                            Instant changedAt,
                            String changedBy,
                            String changeReason,
                            ChangeKind kind,
                            String rollbackSourceId) {

    public HistoryRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(configKey, "configKey");
        Objects.requireNonNull(changedAt, "changedAt");
        Objects.requireNonNull(kind, "kind");
    }

    public boolean isRollback() {
        return kind == ChangeKind.ROLLBACK;
    }

    /**
     * 带外写入的记录不要求与前一条衔接。
     */
    public boolean isChainReset() {
        return kind == ChangeKind.SEED;
    }
}
