package lab.reconciler.orchestration;

import lab.reconciler.adapter.ChainAdapter.IncomingTransfer;
import lab.reconciler.common.IdempotencyConflictException;
import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.KeyedLocks;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.address.DepositAddress;
import lab.reconciler.domain.address.DepositAddressRepository;
import lab.reconciler.domain.ledger.EntryKind;
import lab.reconciler.domain.ledger.LedgerAccount;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.merchant.MerchantRepository;
import lab.reconciler.domain.order.FailureReason;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.OrderAuditLogRepository;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.OrderStatus;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lab.reconciler.ledger.LedgerService;
import lab.reconciler.ledger.PostingRequest;
import lab.reconciler.webhook.NotificationDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deposit lifecycle: {@code pending -> detected -> confirming -> success}, or {@code expired}
 * when nothing arrives before the deadline, or {@code failed} when the transfer disappears.
 * Every transition runs under the order's exclusive lock; the success transition is the only
 * place a deposit credits the ledger.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DepositOrderService {

    static final int TOKEN_SCALE = 6;
    private static final int UNIQUE_SCALE = 3;
    private static final int UNIQUE_SUFFIXES = 9;

    private final PaymentOrderRepository orderRepository;
    private final OrderAuditLogRepository auditRepository;
    private final DepositAddressRepository addressRepository;
    private final MerchantRepository merchantRepository;
    private final MerchantService merchantService;
    private final DepositAddressService addressService;
    private final LedgerService ledgerService;
    private final NotificationDispatcher notificationDispatcher;
    private final FeeCalculator feeCalculator;
    private final ExchangeRateProvider exchangeRateProvider;
    private final OrderNumberGenerator orderNumberGenerator;
    private final OrderRequestValidator validator;
    private final OrderLocks orderLocks;
    private final ReconcilerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final KeyedLocks addressLocks = new KeyedLocks("deposit-address-orders");

    public PaymentOrder createDeposit(CreateDepositCommand command) {
        Merchant merchant = merchantService.requireActive(command.merchantNo());
        validator.requireMerchantRef(command.merchantRef());
        validator.requirePositive(command.amount());
        validator.requireCallbackUrl(command.callbackUrl());
        String chain = validator.requireChain(command.chain());
        String token = validator.requireToken(chain, command.token());
        String currency = normalizeCurrency(command.currency(), token);

        Optional<PaymentOrder> existing = orderRepository.findByMerchantIdAndKindAndMerchantRef(
                merchant.getId(), OrderKind.DEPOSIT, command.merchantRef());
        if (existing.isPresent()) {
            return replay(existing.get(), chain, token, command.amount(), currency);
        }

        BigDecimal rate = null;
        BigDecimal tokenAmount = command.amount();
        if (currency != null) {
            rate = exchangeRateProvider.rate(token, currency)
                    .orElseThrow(() -> new InvalidRequestException("no exchange rate for " + token + "/" + currency));
            tokenAmount = command.amount().divide(rate, TOKEN_SCALE, RoundingMode.HALF_UP);
            if (tokenAmount.signum() <= 0) {
                throw new InvalidRequestException("amount is too small after conversion");
            }
        }

        DepositAddress address = addressService.allocate(merchant.getId(), chain, token);
        ledgerService.openAccount(merchant.getId(), token);

        BigDecimal requested = tokenAmount;
        BigDecimal rateUsed = rate;
        PaymentOrder created = addressLocks.withLock(addressKey(chain, address.getAddress()), () -> transactionTemplate.execute(status -> {
            Instant now = clock.instant();
            BigDecimal payable = uniquePayableAmount(chain, address.getAddress(), requested);
            BigDecimal fee = feeCalculator.depositFee(merchant, payable);
            PaymentOrder order = orderRepository.save(PaymentOrder.pendingDeposit(
                    orderNumberGenerator.next(OrderKind.DEPOSIT),
                    merchant.getId(),
                    command.merchantRef(),
                    chain,
                    token,
                    command.amount(),
                    currency,
                    rateUsed,
                    payable,
                    fee,
                    address.getAddress(),
                    properties.chain(chain).getRequiredConfirmations(),
                    command.callbackUrl(),
                    command.extraData(),
                    now.plus(properties.getDeposit().getExpiry()),
                    now
            ));
            audit(order, null, "created", OrderAuditLog.SYSTEM_ACTOR, now);
            return order;
        }));
        log.info("event=deposit.create.done orderNo={} merchantNo={} chain={} token={} amount={} address={} expiresAt={}",
                created.getOrderNo(), merchant.getMerchantNo(), chain, token, created.getAmount().toPlainString(),
                created.getWalletAddress(), created.getExpiresAt());
        return created;
    }

    /**
     * Routes one transfer seen by the scanner. A transfer already bound to an order only
     * refreshes its confirmations; a new one is attached to the pending order expecting
     * exactly that amount, else the oldest pending order on the address, else a fresh order
     * for the address owner.
     */
    public PaymentOrder onTransferObserved(DepositAddress address, IncomingTransfer transfer) {
        String chain = address.getChain();
        Optional<PaymentOrder> bound = findBound(chain, address.getAddress(), transfer.txHash());
        if (bound.isPresent()) {
            return updateConfirmations(bound.get().getId(), transfer.blockHeight(), transfer.confirmations());
        }

        UUID orderId = addressLocks.withLock(addressKey(chain, address.getAddress()), () -> {
            Optional<PaymentOrder> raced = findBound(chain, address.getAddress(), transfer.txHash());
            if (raced.isPresent()) {
                return raced.get().getId();
            }
            for (PaymentOrder candidate : candidatesFor(address, transfer.amount())) {
                if (orderLocks.transition(candidate.getId(), order -> attach(order, address, transfer))) {
                    return candidate.getId();
                }
            }
            ledgerService.openAccount(address.getMerchantId(), address.getToken());
            PaymentOrder unsolicited = transactionTemplate.execute(status -> orderRepository.save(PaymentOrder.unsolicitedDeposit(
                    orderNumberGenerator.next(OrderKind.DEPOSIT),
                    address.getMerchantId(),
                    chain,
                    address.getToken(),
                    address.getAddress(),
                    properties.chain(chain).getRequiredConfirmations(),
                    clock.instant()
            )));
            log.info("event=deposit.unsolicited.created orderNo={} chain={} address={} txHash={}",
                    unsolicited.getOrderNo(), chain, address.getAddress(), transfer.txHash());
            orderLocks.transition(unsolicited.getId(), order -> attach(order, address, transfer));
            return unsolicited.getId();
        });
        return updateConfirmations(orderId, transfer.blockHeight(), transfer.confirmations());
    }

    /**
     * Records the latest depth of a detected deposit and completes it once the chain's
     * threshold is met. Repeated calls after completion change nothing.
     */
    public PaymentOrder updateConfirmations(UUID orderId, long blockHeight, long confirmations) {
        return orderLocks.transition(orderId, order -> {
            if (order.isTerminal() || order.getStatus() == OrderStatus.PENDING) {
                return order;
            }
            Instant now = clock.instant();
            order.recordConfirmations(blockHeight, confirmations, now);
            if (order.hasReachedRequiredConfirmations()) {
                complete(order, now);
            } else if (order.getStatus() == OrderStatus.DETECTED && confirmations > 0) {
                order.transitionTo(OrderStatus.CONFIRMING, now);
                audit(order, OrderStatus.DETECTED, "confirmations=" + confirmations, OrderAuditLog.SYSTEM_ACTOR, now);
            }
            return order;
        });
    }

    /** Returns the scanner height at which the order's transaction was first found missing. */
    public long markMissing(UUID orderId, long atHeight) {
        return orderLocks.transition(orderId, order -> {
            order.markMissing(atHeight, clock.instant());
            return order.getMissingSinceHeight() == null ? atHeight : order.getMissingSinceHeight();
        });
    }

    public PaymentOrder markReorged(UUID orderId, String detail) {
        return failObserved(orderId, FailureReason.REORGED, detail);
    }

    public PaymentOrder markReverted(UUID orderId, String detail) {
        return failObserved(orderId, FailureReason.REVERTED, detail);
    }

    /** Expires pending deposits whose deadline is at or before now. Returns how many expired. */
    public int expireDue() {
        Instant now = clock.instant();
        int expired = 0;
        for (UUID id : orderRepository.findExpiredPendingDepositIds(now)) {
            try {
                boolean changed = orderLocks.transition(id, order -> {
                    if (order.getStatus() != OrderStatus.PENDING || order.getExpiresAt().isAfter(now)) {
                        return false;
                    }
                    order.expire(now);
                    audit(order, OrderStatus.PENDING, "deadline " + order.getExpiresAt(), OrderAuditLog.SYSTEM_ACTOR, now);
                    notificationDispatcher.enqueue(order);
                    log.info("event=deposit.expired orderNo={} expiresAt={}", order.getOrderNo(), order.getExpiresAt());
                    return true;
                });
                if (changed) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("event=deposit.expire.error orderId={}", id, e);
            }
        }
        return expired;
    }

    public List<PaymentOrder> openDeposits(String chain) {
        return orderRepository.findByKindAndChainAndStatusIn(OrderKind.DEPOSIT, chain,
                EnumSet.of(OrderStatus.DETECTED, OrderStatus.CONFIRMING));
    }

    private boolean attach(PaymentOrder order, DepositAddress address, IncomingTransfer transfer) {
        Instant now = clock.instant();
        if (order.getStatus() != OrderStatus.PENDING || (order.getExpiresAt() != null && !order.getExpiresAt().isAfter(now))) {
            return false;
        }
        Merchant merchant = merchantRepository.findById(order.getMerchantId())
                .orElseThrow(() -> new NotFoundException("merchant not found: " + order.getMerchantId()));
        BigDecimal fee = feeCalculator.depositFee(merchant, transfer.amount());
        order.attachTransfer(transfer.txHash(), transfer.amount(), fee, transfer.blockHeight(), transfer.confirmations(), now);
        order.transitionTo(OrderStatus.DETECTED, now);
        audit(order, OrderStatus.PENDING, "tx=" + transfer.txHash() + " amount=" + transfer.amount().toPlainString(),
                OrderAuditLog.SYSTEM_ACTOR, now);

        DepositAddress managed = addressRepository.findById(address.getId())
                .orElseThrow(() -> new NotFoundException("deposit address not found: " + address.getId()));
        managed.recordReceived(transfer.amount(), now);
        addressRepository.save(managed);

        log.info("event=deposit.detected orderNo={} txHash={} expected={} settled={} block={}",
                order.getOrderNo(), transfer.txHash(), order.getAmount().toPlainString(),
                transfer.amount().toPlainString(), transfer.blockHeight());
        return true;
    }

    private void complete(PaymentOrder order, Instant now) {
        OrderStatus from = order.getStatus();
        order.transitionTo(OrderStatus.SUCCESS, now);
        if (order.getNetAmount().signum() > 0) {
            LedgerAccount account = ledgerService.openAccount(order.getMerchantId(), order.getToken());
            ledgerService.post(PostingRequest.credit(
                    account.getId(),
                    order.getId(),
                    order.getNetAmount(),
                    EntryKind.PRINCIPAL,
                    "deposit " + order.getOrderNo(),
                    "deposit:" + order.getId()
            ));
        }
        audit(order, from, "confirmations=" + order.getConfirmations(), OrderAuditLog.SYSTEM_ACTOR, now);
        notificationDispatcher.enqueue(order);
        log.info("event=deposit.success orderNo={} net={} fee={} confirmations={}",
                order.getOrderNo(), order.getNetAmount().toPlainString(), order.getFee().toPlainString(), order.getConfirmations());
    }

    private PaymentOrder failObserved(UUID orderId, FailureReason reason, String detail) {
        return orderLocks.transition(orderId, order -> {
            if (order.isTerminal()) {
                return order;
            }
            Instant now = clock.instant();
            OrderStatus from = order.getStatus();
            ledgerService.reverseOrder(order.getId(), reason.name().toLowerCase(Locale.ROOT));
            order.fail(reason, detail, now);
            audit(order, from, reason + ": " + detail, OrderAuditLog.SYSTEM_ACTOR, now);
            notificationDispatcher.enqueue(order);
            log.warn("event=deposit.failed orderNo={} reason={} txHash={} detail={}",
                    order.getOrderNo(), reason, order.getTxHash(), detail);
            return order;
        });
    }

    private Optional<PaymentOrder> findBound(String chain, String address, String txHash) {
        return orderRepository.findLiveDepositsByTransfer(chain, address, txHash).stream().findFirst();
    }

    private List<PaymentOrder> candidatesFor(DepositAddress address, BigDecimal amount) {
        Instant now = clock.instant();
        List<PaymentOrder> pending = orderRepository.findByKindAndChainAndWalletAddressAndStatusOrderByCreatedAtAsc(
                        OrderKind.DEPOSIT, address.getChain(), address.getAddress(), OrderStatus.PENDING).stream()
                .filter(order -> order.getExpiresAt() == null || order.getExpiresAt().isAfter(now))
                .filter(order -> order.getToken().equals(address.getToken()))
                .toList();
        List<PaymentOrder> ordered = new ArrayList<>(pending);
        // stable sort keeps creation order among equally ranked candidates
        ordered.sort(Comparator.comparing(order -> order.getAmount().compareTo(amount) == 0 ? 0 : 1));
        return ordered;
    }

    /**
     * Two pending orders on one address must not expect the same amount, otherwise a
     * transfer could not tell them apart. Collisions get a 0.001..0.009 suffix.
     */
    private BigDecimal uniquePayableAmount(String chain, String address, BigDecimal amount) {
        if (!properties.getDeposit().isUniqueAmount()) {
            return amount;
        }
        Set<BigDecimal> taken = orderRepository.findByKindAndChainAndWalletAddressAndStatusOrderByCreatedAtAsc(
                        OrderKind.DEPOSIT, chain, address, OrderStatus.PENDING).stream()
                .map(order -> order.getAmount().setScale(UNIQUE_SCALE, RoundingMode.DOWN))
                .collect(Collectors.toSet());
        BigDecimal base = amount.setScale(UNIQUE_SCALE, RoundingMode.DOWN);
        if (!taken.contains(base)) {
            return amount;
        }
        for (int i = 1; i <= UNIQUE_SUFFIXES; i++) {
            BigDecimal candidate = base.add(BigDecimal.valueOf(i, UNIQUE_SCALE));
            if (!taken.contains(candidate)) {
                log.info("event=deposit.amount.suffixed address={} requested={} payable={}",
                        address, amount.toPlainString(), candidate.toPlainString());
                return candidate;
            }
        }
        throw new AddressPoolExhaustedException("no unique amount left for " + amount.toPlainString() + " on " + address);
    }

    private PaymentOrder replay(PaymentOrder existing, String chain, String token, BigDecimal amount, String currency) {
        boolean same = existing.getChain().equals(chain)
                && existing.getToken().equals(token)
                && existing.getRequestedAmount().compareTo(amount) == 0
                && Objects.equals(existing.getRequestedCurrency(), currency);
        if (!same) {
            throw new IdempotencyConflictException("out_trade_no already used with different parameters: " + existing.getMerchantRef());
        }
        log.info("event=deposit.create.idempotent_hit orderNo={} merchantRef={}", existing.getOrderNo(), existing.getMerchantRef());
        return existing;
    }

    private static String normalizeCurrency(String currency, String token) {
        if (currency == null || currency.isBlank() || currency.trim().equalsIgnoreCase(token)) {
            return null;
        }
        return currency.trim().toUpperCase(Locale.ROOT);
    }

    private static String addressKey(String chain, String address) {
        return chain + ":" + address;
    }

    private void audit(PaymentOrder order, OrderStatus from, String reason, String actor, Instant now) {
        auditRepository.save(OrderAuditLog.of(order.getId(), from, order.getStatus(), reason, actor, now));
    }
}
