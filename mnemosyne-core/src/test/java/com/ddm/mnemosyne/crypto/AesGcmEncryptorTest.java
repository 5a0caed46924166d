package com.ddm.mnemosyne.crypto;

import com.ddm.mnemosyne.exception.DecryptionFailureException;
import com.ddm.mnemosyne.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link AesGcmEncryptor} 的单元测试。
 */
class AesGcmEncryptorTest {

    private static final String SECRET = "unit-test-master-secret-0123456789abcdef";

    private final AesGcmEncryptor encryptor = new AesGcmEncryptor(SECRET);

    @Test
    void testRoundTrip() {
        String envelope = encryptor.encrypt("sk-abc123");

        assertNotEquals("sk-abc123", envelope);
        assertTrue(encryptor.isEnvelope(envelope));
        assertEquals("sk-abc123", encryptor.decrypt(envelope));
    }

    @Test
    void testRoundTrip_UnicodeAndEmpty() {
        assertEquals("密码-ü-🔑", encryptor.decrypt(encryptor.encrypt("密码-ü-🔑")));
        assertEquals("", encryptor.decrypt(encryptor.encrypt("")));
    }

    @Test
    void testEnvelopeFormat() {
        String[] parts = encryptor.encrypt("value").split(":");

        assertEquals(3, parts.length);
        assertEquals(24, parts[0].length(), "12-byte IV");
        assertEquals(32, parts[1].length(), "16-byte tag");
        assertEquals(10, parts[2].length(), "ciphertext has plaintext length");
    }

    @Test
    void testFreshNoncePerCall() {
        String a = encryptor.encrypt("same");
        String b = encryptor.encrypt("same");

        assertNotEquals(a, b);
        assertNotEquals(a.split(":")[0], b.split(":")[0]);
        assertEquals(encryptor.decrypt(a), encryptor.decrypt(b));
    }

    @Test
    void testSameSecretDerivesSameKey() {
        AesGcmEncryptor other = new AesGcmEncryptor(SECRET, AesGcmEncryptor.DEFAULT_SALT);
        assertEquals("shared", other.decrypt(encryptor.encrypt("shared")));
    }

    @Test
    void testTamperedCiphertext() {
        String envelope = encryptor.encrypt("sk-abc123");
        String[] parts = envelope.split(":");
        char flipped = parts[2].charAt(0) == '0' ? '1' : '0';
        String tampered = parts[0] + ":" + parts[1] + ":" + flipped + parts[2].substring(1);

        DecryptionFailureException e = assertThrows(DecryptionFailureException.class,
                () -> encryptor.decrypt(tampered));
        assertEquals(ErrorCode.DECRYPTION_FAILURE, e.code());
        assertFalse(e.getMessage().contains("sk-abc123"));
    }

    @Test
    void testTamperedTag() {
        String[] parts = encryptor.encrypt("value").split(":");
        String tag = parts[1].charAt(0) == 'a' ? "b" + parts[1].substring(1) : "a" + parts[1].substring(1);

        assertThrows(DecryptionFailureException.class,
                () -> encryptor.decrypt(parts[0] + ":" + tag + ":" + parts[2]));
    }

    @Test
    void testWrongKey() {
        AesGcmEncryptor other = new AesGcmEncryptor("another-master-secret-0123456789abcdef");
        String envelope = encryptor.encrypt("value");

        assertThrows(DecryptionFailureException.class, () -> other.decrypt(envelope));
    }

    @Test
    void testMalformedEnvelope_SameOpaqueMessage() {
        String expected = assertThrows(DecryptionFailureException.class,
                () -> encryptor.decrypt("not-an-envelope")).getMessage();

        for (String malformed : new String[]{"", "a:b", "zz:zz:zz", "00:00:00", "a:b:c:d"}) {
            DecryptionFailureException e = assertThrows(DecryptionFailureException.class,
                    () -> encryptor.decrypt(malformed), malformed);
            assertEquals(expected, e.getMessage());
            assertNull(e.getCause());
        }
        assertFalse(encryptor.isEnvelope("a:b"));
        assertFalse(encryptor.isEnvelope(null));
    }

    @Test
    void testBlankMasterSecretRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AesGcmEncryptor(" "));
        assertThrows(IllegalArgumentException.class, () -> new AesGcmEncryptor(null));
    }

    @Test
    void testShortMasterSecretAccepted() {
        AesGcmEncryptor shortKey = new AesGcmEncryptor("short");
        assertEquals("ok", shortKey.decrypt(shortKey.encrypt("ok")));
    }

    @Test
    void testMask() {
        assertEquals("••••••••c123", SecretMasker.mask("sk-abc123"));
        assertEquals("••••••••", SecretMasker.mask("abcd"));
        assertEquals("••••••••", SecretMasker.mask(null));
    }
}
