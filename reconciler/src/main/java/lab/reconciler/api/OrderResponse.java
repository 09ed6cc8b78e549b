package lab.reconciler.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lab.reconciler.common.Amounts;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.PaymentOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderResponse(
        @JsonProperty("order_no") String orderNo,
        @JsonProperty("out_trade_no") String outTradeNo,
        @JsonProperty("order_type") String orderType,
        @JsonProperty("chain") String chain,
        @JsonProperty("token") String token,
        @JsonProperty("requested_amount") String requestedAmount,
        @JsonProperty("currency") String currency,
        @JsonProperty("exchange_rate") String exchangeRate,
        @JsonProperty("amount") String amount,
        @JsonProperty("settled_amount") String settledAmount,
        @JsonProperty("fee") String fee,
        @JsonProperty("net_amount") String netAmount,
        @JsonProperty("wallet_address") String walletAddress,
        @JsonProperty("to_address") String toAddress,
        @JsonProperty("tx_hash") String txHash,
        @JsonProperty("confirmations") long confirmations,
        @JsonProperty("required_confirmations") int requiredConfirmations,
        @JsonProperty("status") String status,
        @JsonProperty("failure_reason") String failureReason,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("completed_at") Instant completedAt
) {

    static OrderResponse from(PaymentOrder order) {
        boolean deposit = order.getKind() == OrderKind.DEPOSIT;
        return new OrderResponse(
                order.getOrderNo(),
                order.getMerchantRef(),
                lower(order.getKind()),
                order.getChain(),
                order.getToken(),
                nullableAmount(order.getRequestedAmount()),
                order.getRequestedCurrency(),
                nullableAmount(order.getExchangeRate()),
                Amounts.format(order.getAmount()),
                nullableAmount(order.getSettledAmount()),
                Amounts.format(order.getFee()),
                Amounts.format(order.getNetAmount()),
                deposit ? order.getWalletAddress() : null,
                order.getToAddress(),
                order.getTxHash(),
                order.getConfirmations(),
                order.getRequiredConfirmations(),
                lower(order.getStatus()),
                order.getFailureReason() == null ? null : lower(order.getFailureReason()),
                order.getExpiresAt(),
                order.getCreatedAt(),
                order.getCompletedAt()
        );
    }

    private static String nullableAmount(BigDecimal value) {
        return value == null ? null : Amounts.format(value);
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
