package lab.reconciler.webhook;

import org.apache.commons.codec.binary.Hex;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HMAC-SHA256 signatures shared by outbound callbacks and inbound API requests.
 * Callbacks sign {@code merchant_no + order_no + status + amount}. API requests sign the
 * plain concatenation of their fields in the fixed order of the operation's {@link RequestLayout};
 * an absent field contributes nothing.
 */
@Component
public class CallbackSigner {

    private static final String ALGORITHM = "HmacSHA256";

    public String signCallback(String secret, String merchantNo, String orderNo, String status, String amount) {
        return hmacHex(secret, merchantNo + orderNo + status + amount);
    }

    public boolean verifyCallback(String secret, String signature, String merchantNo, String orderNo, String status, String amount) {
        return constantTimeEquals(signCallback(secret, merchantNo, orderNo, status, amount), signature);
    }

    public enum RequestLayout {
        DEPOSIT(List.of("merchant_no", "timestamp", "nonce", "out_trade_no", "token", "chain", "amount", "callback_url")),
        WITHDRAWAL(List.of("merchant_no", "timestamp", "nonce", "out_trade_no", "token", "chain", "amount", "to_address", "callback_url")),
        QUERY_BY_ORDER_NO(List.of("merchant_no", "timestamp", "nonce", "order_no")),
        QUERY_BY_OUT_TRADE_NO(List.of("merchant_no", "timestamp", "nonce", "out_trade_no", "order_type"));

        private final List<String> fields;

        RequestLayout(List<String> fields) {
            this.fields = fields;
        }

        public List<String> fields() {
            return fields;
        }
    }

    public String signRequest(String secret, RequestLayout layout, Map<String, String> params) {
        return hmacHex(secret, requestMessage(layout, params));
    }

    public boolean verifyRequest(String secret, String signature, RequestLayout layout, Map<String, String> params) {
        return constantTimeEquals(signRequest(secret, layout, params), signature);
    }

    static String requestMessage(RequestLayout layout, Map<String, String> params) {
        StringBuilder message = new StringBuilder();
        for (String field : layout.fields()) {
            String value = params.get(field);
            if (value != null) {
                message.append(value);
            }
        }
        return message.toString();
    }

    private String hmacHex(String secret, String message) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return Hex.encodeHexString(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (actual == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), actual.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8));
    }
}
