package com.ddm.mnemosyne.exception;

/**
 * 配置键不存在。
 */
public class NotFoundException extends ConfigException {

    private final String key;

    public NotFoundException(String key) {
        super(ErrorCode.NOT_FOUND, "Config not found: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
