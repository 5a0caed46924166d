package com.ddm.mnemosyne.exception;

/**
 * 候选值未通过类型或约束校验。
 * <p>
 * {@link #reason()} 可直接展示给操作者。
 */
public class ValidationException extends ConfigException {

    private final String key;
    private final String reason;

    public ValidationException(String key, String reason) {
        super(ErrorCode.VALIDATION, "Invalid value for config " + key + ": " + reason);
        this.key = key;
        this.reason = reason;
    }

    public String key() {
        return key;
    }

    public String reason() {
        return reason;
    }
}
