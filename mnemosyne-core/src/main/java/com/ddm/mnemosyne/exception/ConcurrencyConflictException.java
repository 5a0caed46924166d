package com.ddm.mnemosyne.exception;

/**
 * 并发写入冲突：版本号比较失败，或等待键锁超时。
 * <p>
 * 调用方可退避后重试；引擎内部不会重试写操作，以免重复追加历史。
 */
public class ConcurrencyConflictException extends ConfigException {

    public ConcurrencyConflictException(String message) {
        super(ErrorCode.CONCURRENCY_CONFLICT, message);
    }
}
