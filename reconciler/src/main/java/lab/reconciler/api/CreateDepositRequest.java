package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

public record CreateDepositRequest(
        @JsonProperty("merchant_no") String merchantNo,
        @JsonProperty("timestamp") Long timestamp,
        @JsonProperty("nonce") String nonce,
        @JsonProperty("sign") String sign,
        @JsonProperty("out_trade_no") String outTradeNo,
        @JsonProperty("chain") String chain,
        @JsonProperty("token") String token,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("currency") String currency,
        @JsonProperty("callback_url") String callbackUrl,
        @JsonProperty("extra_data") String extraData
) {

    Map<String, String> signedFields() {
        Map<String, String> fields = new HashMap<>();
        fields.put("merchant_no", merchantNo);
        fields.put("timestamp", timestamp == null ? null : timestamp.toString());
        fields.put("nonce", nonce);
        fields.put("out_trade_no", outTradeNo);
        fields.put("chain", chain);
        fields.put("token", token);
        fields.put("amount", amount == null ? null : amount.toPlainString());
        fields.put("callback_url", callbackUrl);
        return fields;
    }
}
