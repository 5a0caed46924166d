package com.ddm.mnemosyne.exception;

/**
 * 回滚目标历史记录不存在，或不属于指定的配置键。
 */
public class HistoryMismatchException extends ConfigException {

    public HistoryMismatchException(String key, String historyId) {
        super(ErrorCode.HISTORY_MISMATCH,
                "History record " + historyId + " does not belong to config " + key);
    }
}
