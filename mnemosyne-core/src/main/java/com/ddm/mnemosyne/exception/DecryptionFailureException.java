package com.ddm.mnemosyne.exception;

/**
 * 密文信封无法解密。
 * <p>
 * 信封格式错误与认证标签不匹配使用同一条消息且不携带 cause，
 * 调用方无法区分两者。
 */
public class DecryptionFailureException extends ConfigException {

    public DecryptionFailureException() {
        super(ErrorCode.DECRYPTION_FAILURE, "Unable to decrypt config value");
    }
}
