package com.ddm.mnemosyne.defined;

/**
 * 历史记录的变更来源。
 *
 * @author liyifei
 * @since 1.0
 */
public enum ChangeKind {
    UPDATE,
    ROLLBACK,
    RESET,
    IMPORT,
    /**
     * 带外写入（初始化脚本、数据迁移）。校验历史链时视为链的重新起点。
     */
    SEED
}
