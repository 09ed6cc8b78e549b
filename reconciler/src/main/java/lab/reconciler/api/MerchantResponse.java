package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lab.reconciler.domain.merchant.Merchant;

/**
 * Returned once at registration; the keys are not readable through any other call.
 */
public record MerchantResponse(
        @JsonProperty("merchant_no") String merchantNo,
        @JsonProperty("name") String name,
        @JsonProperty("deposit_key") String depositKey,
        @JsonProperty("withdraw_key") String withdrawKey
) {

    static MerchantResponse from(Merchant merchant) {
        return new MerchantResponse(merchant.getMerchantNo(), merchant.getName(), merchant.getDepositKey(), merchant.getWithdrawKey());
    }
}
