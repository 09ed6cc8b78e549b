package lab.reconciler.security;

import lab.reconciler.config.ReconcilerProperties;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeyVaultTest {

    private static final String KEY_A = Base64.getEncoder().encodeToString(
            "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII));
    private static final String KEY_B = Base64.getEncoder().encodeToString(
            "fedcba9876543210fedcba9876543210".getBytes(StandardCharsets.US_ASCII));

    @Test
    void encryptedKey_isUsableAndWipedAfterUse() {
        KeyVault vault = vault(KEY_A);
        byte[] secret = "private-key-material".getBytes(StandardCharsets.US_ASCII);
        String sealed = vault.encrypt(secret);
        AtomicReference<byte[]> seen = new AtomicReference<>();

        String recovered = vault.withPrivateKey(sealed, key -> {
            seen.set(key);
            return new String(key, StandardCharsets.US_ASCII);
        });

        assertThat(recovered).isEqualTo("private-key-material");
        assertThat(seen.get()).containsOnly((byte) 0);
        assertThat(sealed).doesNotContain("private");
    }

    @Test
    void sameKey_encryptsToDifferentCiphertexts() {
        KeyVault vault = vault(KEY_A);
        byte[] secret = {1, 2, 3, 4};

        assertThat(vault.encrypt(secret)).isNotEqualTo(vault.encrypt(secret));
    }

    @Test
    void tamperedOrForeignCiphertext_isRejected() {
        KeyVault vault = vault(KEY_A);
        byte[] blob = Base64.getDecoder().decode(vault.encrypt(new byte[] {9, 9, 9}));
        blob[blob.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(blob);

        assertThatThrownBy(() -> vault.withPrivateKey(tampered, key -> key.length))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> vault(KEY_B).withPrivateKey(vault.encrypt(new byte[] {1}), key -> key.length))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> vault.withPrivateKey(" ", key -> key.length))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void keyOfWrongLength_failsAtStartup() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> vault(shortKey))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> vault(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("encryption-key");
    }

    private static KeyVault vault(String key) {
        ReconcilerProperties properties = new ReconcilerProperties();
        properties.getSecurity().setEncryptionKey(key);
        return new KeyVault(properties);
    }
}
