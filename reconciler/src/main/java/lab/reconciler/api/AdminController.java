package lab.reconciler.api;

import lab.reconciler.domain.collect.CollectTask;
import lab.reconciler.domain.ledger.LedgerEntry;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.webhook.WebhookDelivery;
import lab.reconciler.ledger.LedgerService;
import lab.reconciler.ledger.LedgerVerification;
import lab.reconciler.orchestration.BalanceAdjustmentService;
import lab.reconciler.orchestration.MerchantService;
import lab.reconciler.orchestration.OrderQueryService;
import lab.reconciler.orchestration.WithdrawalOrderService;
import lab.reconciler.scanner.ChainScanWorker;
import lab.reconciler.scanner.ScanResult;
import lab.reconciler.sweep.SweepService;
import lab.reconciler.webhook.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Operator endpoints. Authentication of operators is handled in front of this service;
 * force-completion and balance adjustments additionally demand a TOTP code.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/admin")
@Slf4j
public class AdminController {

    private final MerchantService merchantService;
    private final WithdrawalOrderService withdrawalService;
    private final OrderQueryService queryService;
    private final NotificationDispatcher notificationDispatcher;
    private final LedgerService ledgerService;
    private final ChainScanWorker scanWorker;
    private final SweepService sweepService;
    private final BalanceAdjustmentService adjustmentService;

    @PostMapping("/merchants")
    public ResponseEntity<MerchantResponse> registerMerchant(@RequestBody RegisterMerchantRequest req) {
        log.info("event=admin.merchant.register.request merchantNo={}", req.merchantNo());
        Merchant merchant = merchantService.register(req.merchantNo(), req.name(),
                req.depositFeePercent(), req.withdrawalFeePercent(), req.withdrawalFixedFee());
        return ResponseEntity.ok(MerchantResponse.from(merchant));
    }

    @PostMapping("/withdrawals/{orderNo}/force-complete")
    public ResponseEntity<OrderResponse> forceComplete(@PathVariable String orderNo, @RequestBody ForceCompleteRequest req) {
        log.info("event=admin.withdrawal.force_complete.request orderNo={} operator={}", orderNo, req.operator());
        PaymentOrder order = withdrawalService.forceComplete(orderNo, req.operator(), req.totpCode());
        return ResponseEntity.ok(OrderResponse.from(order));
    }

    @PostMapping("/webhooks/{deliveryId}/resend")
    public ResponseEntity<WebhookDeliveryResponse> resend(@PathVariable UUID deliveryId) {
        log.info("event=admin.webhook.resend.request deliveryId={}", deliveryId);
        WebhookDelivery delivery = notificationDispatcher.resend(deliveryId);
        return ResponseEntity.ok(WebhookDeliveryResponse.from(delivery));
    }

    @PostMapping("/merchants/{merchantNo}/balance-adjustments")
    public ResponseEntity<LedgerEntryResponse> adjustBalance(@PathVariable String merchantNo, @RequestBody BalanceAdjustmentRequest req) {
        log.info("event=admin.ledger.adjust.request merchantNo={} token={} operator={} requestId={}",
                merchantNo, req.token(), req.operator(), req.requestId());
        LedgerEntry entry = adjustmentService.adjust(merchantNo, req.token(), req.amount(), req.operator(),
                req.reason(), req.requestId(), req.totpCode());
        return ResponseEntity.ok(LedgerEntryResponse.from(entry));
    }

    @GetMapping("/ledger/{accountId}/verify")
    public ResponseEntity<LedgerVerification> verifyLedger(@PathVariable UUID accountId) {
        LedgerVerification verification = ledgerService.verify(accountId);
        log.info("event=admin.ledger.verify.response accountId={} entries={} consistent={}",
                accountId, verification.entryCount(), verification.consistent());
        return ResponseEntity.ok(verification);
    }

    @GetMapping("/orders/{orderNo}/audit")
    public ResponseEntity<List<OrderAuditLog>> auditTrail(@PathVariable String orderNo) {
        PaymentOrder order = queryService.findByOrderNo(orderNo);
        return ResponseEntity.ok(queryService.history(order.getId()));
    }

    @PostMapping("/chains/{chain}/scan")
    public ResponseEntity<ScanResult> scan(@PathVariable String chain) {
        log.info("event=admin.scan.request chain={}", chain);
        return ResponseEntity.ok(scanWorker.tick(chain));
    }

    @PostMapping("/chains/{chain}/sweep")
    public ResponseEntity<SweepService.SweepResult> sweep(@PathVariable String chain) {
        log.info("event=admin.sweep.request chain={}", chain);
        return ResponseEntity.ok(sweepService.runOnce(chain));
    }

    @PostMapping("/chains/{chain}/sweep/addresses/{address}/retry")
    public ResponseEntity<List<CollectTask>> retrySkippedSweep(@PathVariable String chain, @PathVariable String address) {
        log.info("event=admin.sweep.retry.request chain={} address={}", chain, address);
        return ResponseEntity.ok(sweepService.retrySkipped(chain, address));
    }
}
