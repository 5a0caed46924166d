package com.ddm.mnemosyne.exception;

/**
 * 预置配置时键已存在。
 */
public class ConfigAlreadyExistsException extends ConfigException {

    public ConfigAlreadyExistsException(String key) {
        super(ErrorCode.ALREADY_EXISTS, "Config already exists: " + key);
    }
}
