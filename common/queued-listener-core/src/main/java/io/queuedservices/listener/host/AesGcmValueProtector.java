package io.queuedservices.listener.host;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES/GCM value protector. Protected values are base64 of a 12 byte IV followed by the ciphertext
 * and authentication tag.
 */
public final class AesGcmValueProtector implements ValueProtector {

    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random;

    public AesGcmValueProtector(byte[] key) {
        this(key, new SecureRandom());
    }

    AesGcmValueProtector(byte[] key, SecureRandom random) {
        Objects.requireNonNull(key, "key");
        if (key.length != 16 && key.length != 24 && key.length != 32) {
            throw new IllegalArgumentException("AES key must be 128, 192 or 256 bits, got " + key.length * 8);
        }
        this.key = new SecretKeySpec(key.clone(), ALGORITHM);
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a protector from a base64 encoded key.
     */
    public static AesGcmValueProtector fromBase64Key(String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            throw new IllegalArgumentException("base64Key must not be null or blank");
        }
        return new AesGcmValueProtector(Base64.getDecoder().decode(base64Key.trim()));
    }

    /**
     * Encrypts {@code plainText} into the format accepted by {@link #decrypt(String)}.
     */
    public String protect(String plainText) {
        Objects.requireNonNull(plainText, "plainText");
        byte[] iv = new byte[IV_LENGTH];
        random.nextBytes(iv);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            byte[] sealed = cipher.doFinal(plainText.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + sealed.length);
            buffer.put(iv).put(sealed);
            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to protect value", ex);
        }
    }

    @Override
    public String decrypt(String cipherText) {
        if (cipherText == null || cipherText.isBlank()) {
            throw new IllegalStateException("Encrypted value must not be null or blank");
        }
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(cipherText.trim());
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Encrypted value is not valid base64", ex);
        }
        if (payload.length <= IV_LENGTH) {
            throw new IllegalStateException("Encrypted value is too short");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, payload, 0, IV_LENGTH));
            byte[] plain = cipher.doFinal(payload, IV_LENGTH, payload.length - IV_LENGTH);
            return new String(plain, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Failed to decrypt value", ex);
        }
    }
}
