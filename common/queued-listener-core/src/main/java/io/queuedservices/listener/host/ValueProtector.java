package io.queuedservices.listener.host;

/**
 * Host protection mechanism for encrypted configuration values.
 */
public interface ValueProtector {

    /**
     * Rejects every decryption request. Used by hosts that have no key configured.
     */
    ValueProtector UNAVAILABLE = cipherText -> {
        throw new IllegalStateException("No value protector is configured for this host");
    };

    /**
     * Returns the plaintext for the supplied ciphertext.
     *
     * @throws IllegalStateException when the value cannot be decrypted
     */
    String decrypt(String cipherText);
}
