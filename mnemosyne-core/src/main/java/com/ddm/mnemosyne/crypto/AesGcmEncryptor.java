package com.ddm.mnemosyne.crypto;

import com.ddm.mnemosyne.exception.DecryptionFailureException;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * AES-256-GCM 加密实现。
 *
 * <p><strong>密钥派生：</strong>
 * 使用 scrypt（N=16384, r=8, p=1）从主密钥派生 32 字节密钥。盐值为全局静态常量，
 * 只用于区分用途，不需要保密。密钥在构造时派生一次，实例生命周期内复用。
 *
 * <p><strong>信封格式：</strong>
 * <pre>{@code
 * hex(iv[12]) ":" hex(tag[16]) ":" hex(ciphertext)
 * }</pre>
 *
 * <p>主密钥通常来自环境变量或密钥管理服务，不应写入配置文件。
 *
 * @author liyifei
 * @since 1.0
 */
public final class AesGcmEncryptor implements Encryptor {

    private static final Logger log = LoggerFactory.getLogger(AesGcmEncryptor.class);

    /**
     * 默认盐值。
     */
    public static final String DEFAULT_SALT = "config-salt";

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH = 16;
    private static final int KEY_LENGTH = 32;
    private static final int RECOMMENDED_SECRET_LENGTH = 32;

    private static final int SCRYPT_N = 16384;
    private static final int SCRYPT_R = 8;
    private static final int SCRYPT_P = 1;

    private static final Pattern ENVELOPE = Pattern.compile("^[0-9a-f]{24}:[0-9a-f]{32}:[0-9a-f]*$");

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public AesGcmEncryptor(String masterSecret) {
        this(masterSecret, DEFAULT_SALT);
    }

    /**
     * @param masterSecret 主密钥，不能为空白
     * @param salt         全局盐值，不能为空
     * @throws IllegalArgumentException 主密钥或盐值为空
     */
    public AesGcmEncryptor(String masterSecret, String salt) {
        if (masterSecret == null || masterSecret.isBlank()) {
            throw new IllegalArgumentException("Master secret must not be blank");
        }
        if (salt == null || salt.isEmpty()) {
            throw new IllegalArgumentException("Salt must not be empty");
        }
        if (masterSecret.length() < RECOMMENDED_SECRET_LENGTH) {
            log.warn("Master secret is shorter than {} characters; use a longer secret in production",
                    RECOMMENDED_SECRET_LENGTH);
        }
        this.key = deriveKey(masterSecret, salt);
    }

    private static SecretKeySpec deriveKey(String masterSecret, String salt) {
        byte[] derived = SCrypt.generate(
                masterSecret.getBytes(StandardCharsets.UTF_8),
                salt.getBytes(StandardCharsets.UTF_8),
                SCRYPT_N, SCRYPT_R, SCRYPT_P, KEY_LENGTH);
        return new SecretKeySpec(derived, "AES");
    }

    @Override
    public String encrypt(String plaintext) {
        Objects.requireNonNull(plaintext, "plaintext");
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            // JCA 输出为 ciphertext || tag
            byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int ctLength = out.length - TAG_LENGTH;
            byte[] ciphertext = new byte[ctLength];
            byte[] tag = new byte[TAG_LENGTH];
            System.arraycopy(out, 0, ciphertext, 0, ctLength);
            System.arraycopy(out, ctLength, tag, 0, TAG_LENGTH);
            return Hex.toHexString(iv) + ":" + Hex.toHexString(tag) + ":" + Hex.toHexString(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    @Override
    public String decrypt(String envelope) {
        try {
            if (envelope == null) {
                throw new IllegalArgumentException("null envelope");
            }
            String[] parts = envelope.split(":", -1);
            if (parts.length != 3) {
                throw new IllegalArgumentException("expected 3 segments, got " + parts.length);
            }
            byte[] iv = Hex.decode(parts[0]);
            byte[] tag = Hex.decode(parts[1]);
            byte[] ciphertext = Hex.decode(parts[2]);
            if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
                throw new IllegalArgumentException("bad iv/tag length");
            }

            byte[] combined = new byte[ciphertext.length + TAG_LENGTH];
            System.arraycopy(ciphertext, 0, combined, 0, ciphertext.length);
            System.arraycopy(tag, 0, combined, ciphertext.length, TAG_LENGTH);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(combined), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | RuntimeException e) {
            // 细节只进日志，调用方拿到的异常不区分格式错误与认证失败
            log.error("Config value decryption failed ({}: {})", e.getClass().getSimpleName(), e.getMessage());
            throw new DecryptionFailureException();
        }
    }

    @Override
    public boolean isEnvelope(String value) {
        return value != null && ENVELOPE.matcher(value).matches();
    }
}
