package lab.reconciler.orchestration;

import lab.reconciler.adapter.BroadcastRejectedException;
import lab.reconciler.adapter.ChainAdapter;
import lab.reconciler.adapter.ChainAdapter.SignedTransfer;
import lab.reconciler.adapter.ChainAdapter.TxObservation;
import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.adapter.RpcUnavailableException;
import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.common.SignatureVerificationException;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.ledger.EntryKind;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.ledger.LedgerEntry;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.FailureReason;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.OrderAuditLogRepository;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.OrderStateException;
import lab.reconciler.domain.order.OrderStatus;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lab.reconciler.ledger.LedgerService;
import lab.reconciler.ledger.PostingRequest;
import lab.reconciler.orchestration.policy.PolicyDecision;
import lab.reconciler.orchestration.policy.PolicyEngine;
import lab.reconciler.security.HotWalletDirectory;
import lab.reconciler.security.KeyVault;
import lab.reconciler.security.TotpVerifier;
import lab.reconciler.webhook.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Withdrawal lifecycle: {@code pending -> processing -> success | failed}.
 *
 * <p>Dispatch reserves {@code amount + fee} with debits tagged {@code reserved} in the same
 * transaction that moves the order to processing, signs with the hot wallet key, persists the
 * transaction hash and only then broadcasts. A rejected broadcast reverses the reservation;
 * a timeout leaves the order processing for the scanner to settle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawalOrderService {

    private final PaymentOrderRepository orderRepository;
    private final OrderAuditLogRepository auditRepository;
    private final MerchantService merchantService;
    private final LedgerService ledgerService;
    private final NotificationDispatcher notificationDispatcher;
    private final FeeCalculator feeCalculator;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderRequestValidator validator;
    private final PolicyEngine policyEngine;
    private final OrderLocks orderLocks;
    private final ChainAdapterRouter router;
    private final HotWalletDirectory hotWallets;
    private final KeyVault keyVault;
    private final TotpVerifier totpVerifier;
    private final ReconcilerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PaymentOrder createWithdrawal(CreateWithdrawalCommand command) {
        Merchant merchant = merchantService.requireActive(command.merchantNo());
        validator.requireMerchantRef(command.merchantRef());
        validator.requireCallbackUrl(command.callbackUrl());
        String chain = validator.requireChain(command.chain());
        String token = validator.requireToken(chain, command.token());
        if (command.toAddress() == null || command.toAddress().isBlank()) {
            throw new InvalidRequestException("to_address is required");
        }

        Optional<PaymentOrder> existing = orderRepository.findByMerchantIdAndKindAndMerchantRef(
                merchant.getId(), OrderKind.WITHDRAWAL, command.merchantRef());
        if (existing.isPresent()) {
            PaymentOrder order = existing.get();
            boolean same = order.getChain().equals(chain)
                    && order.getToken().equals(token)
                    && command.amount() != null
                    && order.getAmount().compareTo(command.amount()) == 0
                    && order.getToAddress().equalsIgnoreCase(command.toAddress());
            if (!same) {
                throw new IdempotencyConflictException("out_trade_no already used with different parameters: " + command.merchantRef());
            }
            log.info("event=withdrawal.create.idempotent_hit orderNo={} merchantRef={}", order.getOrderNo(), order.getMerchantRef());
            return order;
        }

        CreateWithdrawalCommand normalized = new CreateWithdrawalCommand(command.merchantNo(), command.merchantRef(), chain, token,
                command.amount(), command.toAddress(), command.callbackUrl(), command.extraData());
        PolicyDecision decision = policyEngine.evaluate(normalized);
        if (!decision.allowed()) {
            log.info("event=withdrawal.create.rejected merchantNo={} merchantRef={} reason={}",
                    merchant.getMerchantNo(), command.merchantRef(), decision.reason());
            throw new InvalidRequestException(decision.reason());
        }

        BigDecimal fee = feeCalculator.withdrawalFee(merchant, command.amount());
        String fromAddress = hotWallets.hotWallet(chain).address();
        PaymentOrder created = transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            PaymentOrder order = orderRepository.save(PaymentOrder.pendingWithdrawal(
                    orderNumberGenerator.next(OrderKind.WITHDRAWAL),
                    merchant.getId(),
                    command.merchantRef(),
                    chain,
                    token,
                    command.amount(),
                    fee,
                    fromAddress,
                    command.toAddress(),
                    properties.chain(chain).getRequiredConfirmations(),
                    command.callbackUrl(),
                    command.extraData(),
                    now
            ));
            audit(order, null, "created", OrderAuditLog.SYSTEM_ACTOR, now);
            return order;
        });
        log.info("event=withdrawal.create.done orderNo={} merchantNo={} chain={} token={} amount={} fee={} to={}",
                created.getOrderNo(), merchant.getMerchantNo(), chain, token, command.amount().toPlainString(),
                fee.toPlainString(), command.toAddress());
        return created;
    }

    /**
     * Claims due withdrawals: new ones, plus processing ones that never got a transaction hash
     * (the process stopped between reservation and signing). Returns how many were attempted.
     */
    public int dispatchDue() {
        ReconcilerProperties.Workers workers = properties.getWorkers();
        Instant staleBefore = clock.instant().minus(workers.getWithdrawalResumeAfter());
        List<UUID> due = orderRepository.findDispatchableWithdrawalIds(staleBefore, PageRequest.of(0, workers.getWithdrawalBatchSize()));
        for (UUID id : due) {
            try {
                dispatch(id);
            } catch (RuntimeException e) {
                log.error("event=withdrawal.dispatch.error orderId={}", id, e);
            }
        }
        return due.size();
    }

    public PaymentOrder dispatch(UUID orderId) {
        return orderLocks.exclusive(orderId, () -> {
            PaymentOrder reserved = reserve(orderId);
            if (reserved.getStatus() != OrderStatus.PROCESSING || reserved.getTxHash() != null) {
                return reserved;
            }

            ChainAdapter adapter = router.resolve(reserved.getChain());
            SignedTransfer signed;
            try {
                HotWalletDirectory.Wallet wallet = hotWallets.hotWallet(reserved.getChain());
                signed = keyVault.withPrivateKey(wallet.encryptedKey(), key -> adapter.sign(
                        new ChainAdapter.TransferCommand(wallet.address(), reserved.getToAddress(), reserved.getToken(), reserved.getAmount()),
                        key));
            } catch (RpcUnavailableException e) {
                log.warn("event=withdrawal.sign.rpc_unavailable orderNo={} error={}", reserved.getOrderNo(), e.getMessage());
                return reserved;
            } catch (RuntimeException e) {
                log.error("event=withdrawal.sign.failed orderNo={}", reserved.getOrderNo(), e);
                return failReserved(orderId, FailureReason.SIGNING_FAILED, e.getMessage());
            }

            SignedTransfer toBroadcast = signed;
            orderLocks.inTransaction(orderId, order -> {
                order.recordBroadcastHash(toBroadcast.txHash(), clock.instant());
                return order;
            });

            try {
                String txHash = adapter.broadcast(toBroadcast);
                log.info("event=withdrawal.broadcast.accepted orderNo={} txHash={}", reserved.getOrderNo(), txHash);
            } catch (BroadcastRejectedException e) {
                log.warn("event=withdrawal.broadcast.rejected orderNo={} detail={}", reserved.getOrderNo(), e.getChainDetail());
                return failReserved(orderId, FailureReason.BROADCAST_REJECTED, e.getChainDetail());
            } catch (RpcUnavailableException e) {
                // outcome unknown: the scanner settles it from the persisted hash
                log.warn("event=withdrawal.broadcast.rpc_unavailable orderNo={} txHash={} error={}",
                        reserved.getOrderNo(), toBroadcast.txHash(), e.getMessage());
            }
            return orderRepository.findById(orderId).orElseThrow();
        });
    }

    /**
     * Settles processing withdrawals of one chain from their on-chain status. Called by the
     * chain's scanner each tick.
     */
    public int confirmWithdrawals(String chain) {
        ChainAdapter adapter = router.resolve(chain);
        int maxWaitCycles = properties.chain(chain).getMaxConfirmationWaitCycles();
        List<PaymentOrder> processing = orderRepository.findByKindAndChainAndStatusIn(
                OrderKind.WITHDRAWAL, chain, EnumSet.of(OrderStatus.PROCESSING));
        int settled = 0;
        for (PaymentOrder snapshot : processing) {
            if (snapshot.getTxHash() == null) {
                continue;
            }
            Optional<TxObservation> observation = adapter.lookupTransaction(snapshot.getTxHash());
            boolean terminal = orderLocks.transition(snapshot.getId(), order -> {
                if (order.getStatus() != OrderStatus.PROCESSING) {
                    return false;
                }
                Instant now = clock.instant();
                if (observation.isEmpty()) {
                    int cycles = order.incrementWaitCycles(now);
                    if (cycles >= maxWaitCycles) {
                        reverseAndFail(order, FailureReason.STUCK, "not included after " + cycles + " scan cycles", now);
                        return true;
                    }
                    return false;
                }
                TxObservation tx = observation.get();
                if (!tx.success()) {
                    reverseAndFail(order, FailureReason.REVERTED, "transaction reverted at block " + tx.blockHeight(), now);
                    return true;
                }
                order.recordConfirmations(tx.blockHeight(), tx.confirmations(), now);
                if (order.hasReachedRequiredConfirmations()) {
                    succeed(order, OrderAuditLog.SYSTEM_ACTOR, "confirmations=" + tx.confirmations(), now);
                    return true;
                }
                return false;
            });
            if (terminal) {
                settled++;
            }
        }
        return settled;
    }

    /**
     * Operator completion of a processing withdrawal, gated by a TOTP code. The reservation
     * already debited the merchant, so completion posts nothing; without a live reservation
     * the call is refused.
     */
    public PaymentOrder forceComplete(String orderNo, String operator, String totpCode) {
        if (operator == null || operator.isBlank()) {
            throw new InvalidRequestException("operator is required");
        }
        if (!totpVerifier.verify(totpCode)) {
            log.warn("event=withdrawal.force_complete.denied orderNo={} operator={} reason=bad_totp", orderNo, operator);
            throw new SignatureVerificationException("invalid second factor");
        }
        PaymentOrder snapshot = orderRepository.findByOrderNo(orderNo)
                .orElseThrow(() -> new NotFoundException("order not found: " + orderNo));
        if (snapshot.getKind() != OrderKind.WITHDRAWAL) {
            throw new InvalidRequestException("only withdrawals can be force-completed: " + orderNo);
        }
        return orderLocks.transition(snapshot.getId(), order -> {
            if (order.getStatus() != OrderStatus.PROCESSING) {
                throw new OrderStateException("withdrawal is not processing: " + orderNo + " status=" + order.getStatus());
            }
            if (!ledgerService.hasOpenReservation(order.getId())) {
                throw new OrderStateException("withdrawal has no open reservation: " + orderNo);
            }
            order.markForced();
            succeed(order, operator, "forced by " + operator, clock.instant());
            log.warn("event=withdrawal.force_complete.done orderNo={} operator={}", orderNo, operator);
            return order;
        });
    }

    private PaymentOrder reserve(UUID orderId) {
        PaymentOrder snapshot = orderRepository.findById(orderId)
                .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
        LedgerAccount account = ledgerService.openAccount(snapshot.getMerchantId(), snapshot.getToken());

        return orderLocks.inTransaction(orderId, order -> {
            if (order.getStatus() != OrderStatus.PENDING) {
                return order;
            }
            Instant now = clock.instant();
            BigDecimal required = order.getAmount().add(order.getFee());
            BigDecimal balance = ledgerService.balanceOf(account.getId());
            if (balance.compareTo(required) < 0) {
                order.fail(FailureReason.INSUFFICIENT_BALANCE,
                        "balance " + balance.toPlainString() + " < required " + required.toPlainString(), now);
                audit(order, OrderStatus.PENDING, "insufficient balance", OrderAuditLog.SYSTEM_ACTOR, now);
                notificationDispatcher.enqueue(order);
                log.warn("event=withdrawal.dispatch.insufficient_balance orderNo={} balance={} required={}",
                        order.getOrderNo(), balance.toPlainString(), required.toPlainString());
                return order;
            }

            List<PostingRequest> reservation = order.getFee().signum() > 0
                    ? List.of(principalDebit(account, order), feeDebit(account, order))
                    : List.of(principalDebit(account, order));
            List<LedgerEntry> entries = ledgerService.postAll(reservation);
            order.transitionTo(OrderStatus.PROCESSING, now);
            audit(order, OrderStatus.PENDING, "reserved " + required.toPlainString(), OrderAuditLog.SYSTEM_ACTOR, now);
            log.info("event=withdrawal.dispatch.reserved orderNo={} amount={} fee={} entries={}",
                    order.getOrderNo(), order.getAmount().toPlainString(), order.getFee().toPlainString(), entries.size());
            return order;
        });
    }

    private PaymentOrder failReserved(UUID orderId, FailureReason reason, String detail) {
        return orderLocks.inTransaction(orderId, order -> {
            if (order.getStatus() == OrderStatus.PROCESSING) {
                reverseAndFail(order, reason, detail, clock.instant());
            }
            return order;
        });
    }

    private void reverseAndFail(PaymentOrder order, FailureReason reason, String detail, Instant now) {
        ledgerService.reverseOrder(order.getId(), reason.name());
        order.fail(reason, detail, now);
        audit(order, OrderStatus.PROCESSING, reason + ": " + detail, OrderAuditLog.SYSTEM_ACTOR, now);
        notificationDispatcher.enqueue(order);
        log.warn("event=withdrawal.failed orderNo={} reason={} detail={}", order.getOrderNo(), reason, detail);
    }

    private void succeed(PaymentOrder order, String actor, String reason, Instant now) {
        order.transitionTo(OrderStatus.SUCCESS, now);
        audit(order, OrderStatus.PROCESSING, reason, actor, now);
        notificationDispatcher.enqueue(order);
        log.info("event=withdrawal.success orderNo={} txHash={} confirmations={} forced={}",
                order.getOrderNo(), order.getTxHash(), order.getConfirmations(), order.isForced());
    }

    private static PostingRequest principalDebit(LedgerAccount account, PaymentOrder order) {
        return PostingRequest.debit(account.getId(), order.getId(), order.getAmount(), EntryKind.PRINCIPAL,
                LedgerEntry.RESERVED_TAG, "withdrawal " + order.getOrderNo(), "withdrawal-reserve:" + order.getId() + ":principal");
    }

    private static PostingRequest feeDebit(LedgerAccount account, PaymentOrder order) {
        return PostingRequest.debit(account.getId(), order.getId(), order.getFee(), EntryKind.FEE,
                LedgerEntry.RESERVED_TAG, "withdrawal fee " + order.getOrderNo(), "withdrawal-reserve:" + order.getId() + ":fee");
    }

    private void audit(PaymentOrder order, OrderStatus from, String reason, String actor, Instant now) {
        auditRepository.save(OrderAuditLog.of(order.getId(), from, order.getStatus(), reason, actor, now));
    }
}
