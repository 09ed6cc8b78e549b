package lab.reconciler.api;

import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.orchestration.CreateDepositCommand;
import lab.reconciler.orchestration.CreateWithdrawalCommand;
import lab.reconciler.orchestration.DepositOrderService;
import lab.reconciler.orchestration.OrderQueryService;
import lab.reconciler.orchestration.WithdrawalOrderService;
import lab.reconciler.webhook.CallbackSigner.RequestLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Slf4j
public class PaymentController {

    private final RequestSignatureVerifier signatureVerifier;
    private final DepositOrderService depositService;
    private final WithdrawalOrderService withdrawalService;
    private final OrderQueryService queryService;

    // Replaying the same out_trade_no with the same body returns the original order.
    @PostMapping("/deposits")
    public ResponseEntity<OrderResponse> createDeposit(@RequestBody CreateDepositRequest req) {
        log.info("event=deposit.create.request merchantNo={} outTradeNo={} chain={} token={} amount={} currency={}",
                req.merchantNo(), req.outTradeNo(), req.chain(), req.token(), req.amount(), req.currency());
        signatureVerifier.verify(req.merchantNo(), req.timestamp(), req.sign(), OrderKind.DEPOSIT,
                RequestLayout.DEPOSIT, req.signedFields());
        PaymentOrder order = depositService.createDeposit(new CreateDepositCommand(
                req.merchantNo(), req.outTradeNo(), req.chain(), req.token(), req.amount(), req.currency(),
                req.callbackUrl(), req.extraData()));
        log.info("event=deposit.create.response orderNo={} status={} walletAddress={}",
                order.getOrderNo(), order.getStatus(), order.getWalletAddress());
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @PostMapping("/withdrawals")
    public ResponseEntity<OrderResponse> createWithdrawal(@RequestBody CreateWithdrawalRequest req) {
        log.info("event=withdrawal.create.request merchantNo={} outTradeNo={} chain={} token={} amount={} toAddress={}",
                req.merchantNo(), req.outTradeNo(), req.chain(), req.token(), req.amount(), req.toAddress());
        signatureVerifier.verify(req.merchantNo(), req.timestamp(), req.sign(), OrderKind.WITHDRAWAL,
                RequestLayout.WITHDRAWAL, req.signedFields());
        PaymentOrder order = withdrawalService.createWithdrawal(new CreateWithdrawalCommand(
                req.merchantNo(), req.outTradeNo(), req.chain(), req.token(), req.amount(), req.toAddress(),
                req.callbackUrl(), req.extraData()));
        log.info("event=withdrawal.create.response orderNo={} status={} fee={}",
                order.getOrderNo(), order.getStatus(), order.getFee().toPlainString());
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @PostMapping("/orders/query")
    public ResponseEntity<OrderResponse> query(@RequestBody OrderQueryRequest req) {
        OrderKind kind = resolveKind(req);
        log.info("event=order.query.request merchantNo={} orderNo={} outTradeNo={} kind={}",
                req.merchantNo(), req.orderNo(), req.outTradeNo(), kind);
        RequestLayout layout = req.orderNo() != null && !req.orderNo().isBlank()
                ? RequestLayout.QUERY_BY_ORDER_NO
                : RequestLayout.QUERY_BY_OUT_TRADE_NO;
        Merchant merchant = signatureVerifier.verify(req.merchantNo(), req.timestamp(), req.sign(), kind, layout, req.signedFields());
        PaymentOrder order = queryService.find(merchant, req.orderNo(), req.outTradeNo(), kind);
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    // The signing key depends on the kind, so it has to be known before the order is loaded.
    private static OrderKind resolveKind(OrderQueryRequest req) {
        if (req.orderType() != null && !req.orderType().isBlank()) {
            try {
                return OrderKind.valueOf(req.orderType().trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidRequestException("order_type must be deposit or withdrawal");
            }
        }
        if (req.orderNo() != null) {
            for (OrderKind kind : OrderKind.values()) {
                if (req.orderNo().startsWith(kind.orderNoPrefix())) {
                    return kind;
                }
            }
        }
        throw new InvalidRequestException("order_type is required");
    }
}
