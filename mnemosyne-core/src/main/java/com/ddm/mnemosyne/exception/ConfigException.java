package com.ddm.mnemosyne.exception;

import java.util.Objects;

/**
 * 配置存储引擎所有异常的基类。
 *
 * @author liyifei
 * @since 1.0
 */
public class ConfigException extends RuntimeException {

    private final ErrorCode code;

    public ConfigException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ConfigException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
