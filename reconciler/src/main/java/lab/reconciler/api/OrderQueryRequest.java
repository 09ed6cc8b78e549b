package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.HashMap;
import java.util.Map;

/**
 * Either {@code order_no}, or {@code out_trade_no} together with {@code order_type}
 * ({@code deposit} or {@code withdrawal}).
 */
public record OrderQueryRequest(
        @JsonProperty("merchant_no") String merchantNo,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("sign") String sign,
        @JsonProperty("order_no") String orderNo,
        @JsonProperty("out_trade_no") String outTradeNo,
        @JsonProperty("order_type") String orderType
) {

    Map<String, String> signedFields() {
        Map<String, String> fields = new HashMap<>();
        fields.put("merchant_no", merchantNo);
        fields.put("timestamp", timestamp == null ? null : timestamp.toString());
        fields.put("nonce", nonce);
        fields.put("order_no", orderNo);
        fields.put("out_trade_no", outTradeNo);
        fields.put("order_type", orderType);
        return fields;
    }
}
