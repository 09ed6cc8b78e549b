package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record RegisterMerchantRequest(
        @JsonProperty("merchant_no") String merchantNo,
        @JsonProperty("name") String name,
        @JsonProperty("deposit_fee_percent") BigDecimal depositFeePercent,
        @JsonProperty("withdrawal_fee_percent") BigDecimal withdrawalFeePercent,
        @JsonProperty("withdrawal_fixed_fee") BigDecimal withdrawalFixedFee
) {}
