package lab.reconciler.security;

import lab.reconciler.config.ReconcilerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.function.Function;

/**
 * AES-256-GCM envelope for private keys. Stored form is {@code base64(nonce ‖ ciphertext ‖ tag)};
 * the AES key itself comes from configuration and is never written next to the ciphertext.
 */
@Component
@Slf4j
public class KeyVault {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int NONCE_LENGTH = 12;
    private static final int TAG_BITS = 128;

    private final SecretKeySpec key;
    private final SecureRandom random = new SecureRandom();

    public KeyVault(ReconcilerProperties properties) {
        String encoded = properties.getSecurity().getEncryptionKey();
        if (encoded == null || encoded.isBlank()) {
            throw new IllegalStateException("reconciler.security.encryption-key must be configured");
        }
        byte[] raw = Base64.getDecoder().decode(encoded.trim());
        if (raw.length != 32) {
            throw new IllegalStateException("reconciler.security.encryption-key must decode to 32 bytes, got " + raw.length);
        }
        this.key = new SecretKeySpec(raw, "AES");
        Arrays.fill(raw, (byte) 0);
    }

    public String encrypt(byte[] plaintext) {
        try {
            byte[] nonce = new byte[NONCE_LENGTH];
            random.nextBytes(nonce);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            byte[] sealed = cipher.doFinal(plaintext);
            return Base64.getEncoder().encodeToString(ByteBuffer.allocate(nonce.length + sealed.length)
                    .put(nonce)
                    .put(sealed)
                    .array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("failed to encrypt key material", e);
        }
    }

    /**
     * Decrypts the key into a scratch buffer, hands it to {@code action} and wipes it before
     * returning, whatever the outcome.
     */
    public <T> T withPrivateKey(String encrypted, Function<byte[], T> action) {
        byte[] plaintext = decrypt(encrypted);
        try {
            return action.apply(plaintext);
        } finally {
            Arrays.fill(plaintext, (byte) 0);
        }
    }

    private byte[] decrypt(String encrypted) {
        if (encrypted == null || encrypted.isBlank()) {
            throw new IllegalStateException("no encrypted key available");
        }
        byte[] blob = Base64.getDecoder().decode(encrypted.trim());
        if (blob.length <= NONCE_LENGTH) {
            throw new IllegalStateException("encrypted key is truncated");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, blob, 0, NONCE_LENGTH));
            return cipher.doFinal(blob, NONCE_LENGTH, blob.length - NONCE_LENGTH);
        } catch (GeneralSecurityException e) {
            log.warn("event=key_vault.decrypt.failed reason={}", e.getClass().getSimpleName());
            throw new IllegalStateException("failed to decrypt key material", e);
        }
    }
}
