package lab.reconciler.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lab.reconciler.common.Amounts;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.merchant.MerchantRepository;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.webhook.DeliveryOutcome;
import lab.reconciler.domain.webhook.WebhookDelivery;
import lab.reconciler.domain.webhook.WebhookDeliveryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Signed merchant callbacks with at-least-once delivery. One {@link WebhookDelivery} per
 * (order, status); failed attempts are rescheduled along the configured backoff and the
 * delivery is parked as FAILED once the schedule runs out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final WebhookDeliveryRepository deliveryRepository;
    private final MerchantRepository merchantRepository;
    private final CallbackSigner signer;
    private final WebhookTransport transport;
    private final ObjectMapper objectMapper;
    private final ReconcilerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Snapshots the order into a signed payload. Runs inside the caller's transaction so the
     * delivery exists if and only if the state change that caused it was committed.
     */
    public Optional<WebhookDelivery> enqueue(PaymentOrder order) {
        if (order.getCallbackUrl() == null || order.getCallbackUrl().isBlank()) {
            log.info("event=webhook.enqueue.skipped orderNo={} status={} reason=no_callback_url", order.getOrderNo(), order.getStatus());
            return Optional.empty();
        }
        Optional<WebhookDelivery> existing = deliveryRepository.findByOrderIdAndEventStatus(order.getId(), order.getStatus());
        if (existing.isPresent()) {
            return existing;
        }

        Merchant merchant = merchantRepository.findById(order.getMerchantId())
                .orElseThrow(() -> new NotFoundException("merchant not found: " + order.getMerchantId()));
        Instant now = clock.instant();
        String status = order.getStatus().name().toLowerCase(Locale.ROOT);
        String amount = Amounts.format(payloadAmount(order));
        String secret = order.getKind() == OrderKind.DEPOSIT ? merchant.getDepositKey() : merchant.getWithdrawKey();
        String signature = signer.signCallback(secret, merchant.getMerchantNo(), order.getOrderNo(), status, amount);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("merchant_no", merchant.getMerchantNo());
        payload.put("order_no", order.getOrderNo());
        payload.put("out_trade_no", order.getMerchantRef());
        payload.put("order_type", order.getKind().name().toLowerCase(Locale.ROOT));
        payload.put("token", order.getToken());
        payload.put("chain", order.getChain());
        payload.put("amount", amount);
        payload.put("fee", Amounts.format(order.getFee()));
        payload.put("net_amount", Amounts.format(order.getNetAmount()));
        payload.put("status", status);
        payload.put("wallet_address", order.getKind() == OrderKind.DEPOSIT ? order.getWalletAddress() : order.getToAddress());
        payload.put("tx_hash", order.getTxHash());
        payload.put("confirmations", order.getConfirmations());
        payload.put("completed_at", order.getCompletedAt() == null ? null : order.getCompletedAt().toString());
        payload.put("extra_data", order.getExtraData());
        payload.put("failure_reason", order.getFailureReason() == null ? null : order.getFailureReason().name().toLowerCase(Locale.ROOT));
        payload.put("timestamp", now.toEpochMilli());
        payload.put("sign", signature);

        WebhookDelivery delivery = deliveryRepository.save(WebhookDelivery.scheduled(
                order.getId(), order.getStatus(), order.getCallbackUrl(), toJson(payload), signature, now));
        log.info("event=webhook.enqueue.done deliveryId={} orderNo={} status={}", delivery.getId(), order.getOrderNo(), status);
        return Optional.of(delivery);
    }

    /**
     * Attempts every delivery whose next attempt time has come. Returns how many were tried.
     */
    public int dispatchDue() {
        List<UUID> due = deliveryRepository.findDueIds(clock.instant(), PageRequest.of(0, properties.getWebhook().getBatchSize()));
        for (UUID id : due) {
            try {
                attempt(id);
            } catch (RuntimeException e) {
                log.error("event=webhook.attempt.error deliveryId={}", id, e);
            }
        }
        return due.size();
    }

    public WebhookDelivery attempt(UUID deliveryId) {
        WebhookDelivery snapshot = deliveryRepository.findById(deliveryId)
                .orElseThrow(() -> new NotFoundException("webhook delivery not found: " + deliveryId));
        if (snapshot.getOutcome() != DeliveryOutcome.PENDING) {
            return snapshot;
        }

        Integer responseStatus = null;
        String error = null;
        try {
            responseStatus = transport.post(snapshot.getUrl(), snapshot.getPayload(), snapshot.getSignature());
            if (responseStatus != 200) {
                error = "non-200 response: " + responseStatus;
            }
        } catch (WebhookTransportException e) {
            error = e.getMessage();
        }

        Integer status = responseStatus;
        String failure = error;
        return transactionTemplate.execute(tx -> {
            WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElseThrow();
            Instant now = clock.instant();
            if (failure == null) {
                delivery.markDelivered(status, now);
                log.info("event=webhook.attempt.delivered deliveryId={} orderId={} attempt={}",
                        deliveryId, delivery.getOrderId(), delivery.getAttemptCount());
            } else {
                Instant next = nextAttemptAfter(delivery.attemptsInRound() + 1, now);
                delivery.markAttemptFailed(status, failure, next, now);
                if (next == null) {
                    log.warn("event=webhook.attempt.exhausted deliveryId={} orderId={} attempts={} lastError={}",
                            deliveryId, delivery.getOrderId(), delivery.getAttemptCount(), failure);
                } else {
                    log.info("event=webhook.attempt.failed deliveryId={} orderId={} attempt={} nextAttemptAt={} error={}",
                            deliveryId, delivery.getOrderId(), delivery.getAttemptCount(), next, failure);
                }
            }
            return deliveryRepository.save(delivery);
        });
    }

    /** Puts a permanently failed delivery back in the queue. */
    public WebhookDelivery resend(UUID deliveryId) {
        return transactionTemplate.execute(tx -> {
            WebhookDelivery delivery = deliveryRepository.findById(deliveryId)
                    .orElseThrow(() -> new NotFoundException("webhook delivery not found: " + deliveryId));
            delivery.resetForResend(clock.instant());
            log.info("event=webhook.resend.queued deliveryId={} orderId={} resend={} attemptsSoFar={}",
                    deliveryId, delivery.getOrderId(), delivery.getResendCount(), delivery.getAttemptCount());
            return deliveryRepository.save(delivery);
        });
    }

    // attemptNumber is 1-based; after the n-th failure wait backoff[n-1], none left means give up.
    private Instant nextAttemptAfter(int attemptNumber, Instant now) {
        List<Duration> backoff = properties.getWebhook().getBackoff();
        if (attemptNumber > backoff.size()) {
            return null;
        }
        return now.plus(backoff.get(attemptNumber - 1));
    }

    private static java.math.BigDecimal payloadAmount(PaymentOrder order) {
        if (order.getKind() == OrderKind.DEPOSIT && order.getSettledAmount() != null) {
            return order.getSettledAmount();
        }
        return order.getAmount();
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("failed to serialize callback payload", e);
        }
    }
}
