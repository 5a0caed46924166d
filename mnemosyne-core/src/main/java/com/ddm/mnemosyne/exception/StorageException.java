package com.ddm.mnemosyne.exception;

/**
 * 底层存储不可用或执行失败。
 */
public class StorageException extends ConfigException {

    public StorageException(String message, Throwable cause) {
        super(ErrorCode.STORAGE, message, cause);
    }
}
