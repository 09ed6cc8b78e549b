package lab.reconciler.security;

import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base32;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Locale;

/**
 * RFC 6238 second factor for privileged operator actions: HMAC-SHA1, 30 second step,
 * six digits, one step of drift either way.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TotpVerifier {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int TIME_STEP_SECONDS = 30;
    private static final int WINDOW = 1;

    private final ReconcilerProperties properties;
    private final Clock clock;

    public boolean verify(String code) {
        String secret = properties.getSecurity().getAdminTotpSecret();
        if (secret == null || secret.isBlank()) {
            log.warn("event=totp.verify.rejected reason=no_secret_configured");
            return false;
        }
        if (code == null || !code.matches("\\d{6}")) {
            return false;
        }
        long counter = clock.instant().getEpochSecond() / TIME_STEP_SECONDS;
        for (int i = -WINDOW; i <= WINDOW; i++) {
            if (MessageDigest.isEqual(
                    codeAt(secret, counter + i).getBytes(StandardCharsets.US_ASCII),
                    code.getBytes(StandardCharsets.US_ASCII))) {
                return true;
            }
        }
        return false;
    }

    static String codeAt(String base32Secret, long counter) {
        byte[] key = new Base32().decode(base32Secret.trim().toUpperCase(Locale.ROOT));
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            byte[] hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(counter).array());
            int offset = hash[hash.length - 1] & 0x0F;
            int binary = ((hash[offset] & 0x7F) << 24)
                    | ((hash[offset + 1] & 0xFF) << 16)
                    | ((hash[offset + 2] & 0xFF) << 8)
                    | (hash[offset + 3] & 0xFF);
            return "%06d".formatted(binary % 1_000_000);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TOTP computation failed", e);
        }
    }

    /** Current code, for operator tooling and tests. */
    public String currentCode() {
        return codeAt(properties.getSecurity().getAdminTotpSecret(), clock.instant().getEpochSecond() / TIME_STEP_SECONDS);
    }
}
