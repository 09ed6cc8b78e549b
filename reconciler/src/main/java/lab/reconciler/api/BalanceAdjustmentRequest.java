package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/** A negative amount debits the merchant. */
public record BalanceAdjustmentRequest(
        @JsonProperty("token") String token,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("operator") String operator,
        @JsonProperty("reason") String reason,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("totp_code") String totpCode
) {}
