package com.ddm.mnemosyne.crypto;

import com.ddm.mnemosyne.exception.DecryptionFailureException;

/**
 * 敏感配置值的认证对称加密。
 *
 * <p><strong>约定：</strong>
 * <ul>
 *   <li>同一明文两次加密得到不同的信封（每次使用新的随机 IV），但都能解密回原文</li>
 *   <li>解密先校验认证标签；失败时抛出 {@link DecryptionFailureException}，不返回部分明文</li>
 *   <li>实现必须无可变状态，可被多线程共享</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public interface Encryptor {

    /**
     * 加密明文。
     *
     * @param plaintext 明文，不能为 null
     * @return 自描述的密文信封
     */
    String encrypt(String plaintext);

    /**
     * 解密信封。
     *
     * @param envelope 由 {@link #encrypt(String)} 生成的信封
     * @return 明文
     * @throws DecryptionFailureException 信封格式错误或认证失败
     */
    String decrypt(String envelope);

    /**
     * 快速判断字符串是否具备信封格式（不做解密）。
     */
    boolean isEnvelope(String value);
}
