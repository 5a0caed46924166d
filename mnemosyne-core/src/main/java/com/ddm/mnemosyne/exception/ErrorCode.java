package com.ddm.mnemosyne.exception;

/**
 * 配置操作的错误分类。
 * <p>
 * 上层（HTTP、CLI 等）依据错误码决定响应方式：
 * <ul>
 *   <li>{@link #isClientError()} 为 true：调用方输入问题，映射为 4xx 或表单提示</li>
 *   <li>{@link #isRetryable()} 为 true：调用方可退避后重试</li>
 *   <li>其余：服务端故障，对外只给出通用提示</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public enum ErrorCode {

    NOT_FOUND(true, false),
    READ_ONLY(true, false),
    VALIDATION(true, false),
    HISTORY_MISMATCH(true, false),
    ALREADY_EXISTS(true, false),
    CONCURRENCY_CONFLICT(false, true),
    DECRYPTION_FAILURE(false, false),
    STORAGE(false, true);

    private final boolean clientError;
    private final boolean retryable;

    ErrorCode(boolean clientError, boolean retryable) {
        this.clientError = clientError;
        this.retryable = retryable;
    }

    public boolean isClientError() {
        return clientError;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
