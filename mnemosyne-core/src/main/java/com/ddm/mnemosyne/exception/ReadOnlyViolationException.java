package com.ddm.mnemosyne.exception;

/**
 * 尝试修改只读配置。
 */
public class ReadOnlyViolationException extends ConfigException {

    private final String key;

    public ReadOnlyViolationException(String key) {
        super(ErrorCode.READ_ONLY, "Config is read-only: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
