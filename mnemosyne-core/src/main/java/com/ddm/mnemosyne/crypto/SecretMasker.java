package com.ddm.mnemosyne.crypto;

/**
 * 敏感值遮蔽：固定 8 个遮蔽符 + 末尾 4 个字符。
 * <p>
 * 长度不超过 4 的值完全遮蔽，遮蔽符数量固定，不泄露原值长度。
 */
public final class SecretMasker {

    public static final String MASK = "••••••••";

    private static final int VISIBLE_CHARS = 4;

    private SecretMasker() {
    }

    public static String mask(String plaintext) {
        if (plaintext == null || plaintext.length() <= VISIBLE_CHARS) {
            return MASK;
        }
        return MASK + plaintext.substring(plaintext.length() - VISIBLE_CHARS);
    }
}
