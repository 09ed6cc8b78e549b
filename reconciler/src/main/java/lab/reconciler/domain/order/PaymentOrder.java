package lab.reconciler.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "orders",
       uniqueConstraints = {
           @UniqueConstraint(name = "uk_order_no", columnNames = "orderNo"),
           @UniqueConstraint(name = "uk_order_merchant_ref", columnNames = {"merchantId", "kind", "merchantRef"})
       },
       indexes = {
           @Index(name = "idx_order_address_tx", columnList = "chain,walletAddress,txHash"),
           @Index(name = "idx_order_status", columnList = "kind,status")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class PaymentOrder {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false, length = 32)
    private String orderNo;

    @Column(nullable = false, updatable = false)
    private UUID merchantId;

    /** Merchant's own reference (out_trade_no); absent for unsolicited deposits. */
    @Column(updatable = false, length = 64)
    private String merchantRef;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private OrderKind kind;

    @Column(nullable = false, updatable = false, length = 16)
    private String chain;

    @Column(nullable = false, updatable = false, length = 16)
    private String token;

    @Column(precision = 38, scale = 18)
    private BigDecimal requestedAmount;

    @Column(length = 8)
    private String requestedCurrency;

    @Column(precision = 38, scale = 18)
    private BigDecimal exchangeRate;

    /** Expected payable amount for deposits, transfer amount for withdrawals. */
    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal amount;

    @Column(precision = 38, scale = 18)
    private BigDecimal settledAmount;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal fee;

    @Column(nullable = false, precision = 38, scale = 18)
    private BigDecimal netAmount;

    /** Deposit address, or the hot wallet paying a withdrawal. */
    @Column(length = 128)
    private String walletAddress;

    @Column(length = 128)
    private String toAddress;

    @Column(length = 128)
    private String txHash;

    private Long blockHeight;

    private long confirmations;

    private int requiredConfirmations;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 32)
    private FailureReason failureReason;

    @Column(length = 512)
    private String failureDetail;

    @Column(length = 512)
    private String callbackUrl;

    @Column(length = 1024)
    private String extraData;

    private Instant expiresAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant detectedAt;

    private Instant completedAt;

    @Column(nullable = false)
    private Instant updatedAt;

    /** Scanner height at which the recorded transaction was first found missing. */
    private Long missingSinceHeight;

    private int confirmationWaitCycles;

    private boolean forced;

    @Version
    private long version;

    public static PaymentOrder pendingDeposit(
            String orderNo,
            UUID merchantId,
            String merchantRef,
            String chain,
            String token,
            BigDecimal requestedAmount,
            String requestedCurrency,
            BigDecimal exchangeRate,
            BigDecimal amount,
            BigDecimal fee,
            String walletAddress,
            int requiredConfirmations,
            String callbackUrl,
            String extraData,
            Instant expiresAt,
            Instant now) {
        return PaymentOrder.builder()
                .orderNo(orderNo)
                .merchantId(merchantId)
                .merchantRef(merchantRef)
                .kind(OrderKind.DEPOSIT)
                .chain(chain)
                .token(token)
                .requestedAmount(requestedAmount)
                .requestedCurrency(requestedCurrency)
                .exchangeRate(exchangeRate)
                .amount(amount)
                .fee(fee)
                .netAmount(amount.subtract(fee))
                .walletAddress(walletAddress)
                .requiredConfirmations(requiredConfirmations)
                .status(OrderStatus.PENDING)
                .callbackUrl(callbackUrl)
                .extraData(extraData)
                .expiresAt(expiresAt)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** A transfer that arrived on an address without any pending order waiting for it. */
    public static PaymentOrder unsolicitedDeposit(
            String orderNo,
            UUID merchantId,
            String chain,
            String token,
            String walletAddress,
            int requiredConfirmations,
            Instant now) {
        return PaymentOrder.builder()
                .orderNo(orderNo)
                .merchantId(merchantId)
                .kind(OrderKind.DEPOSIT)
                .chain(chain)
                .token(token)
                .amount(BigDecimal.ZERO)
                .fee(BigDecimal.ZERO)
                .netAmount(BigDecimal.ZERO)
                .walletAddress(walletAddress)
                .requiredConfirmations(requiredConfirmations)
                .status(OrderStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public static PaymentOrder pendingWithdrawal(
            String orderNo,
            UUID merchantId,
            String merchantRef,
            String chain,
            String token,
            BigDecimal amount,
            BigDecimal fee,
            String fromAddress,
            String toAddress,
            int requiredConfirmations,
            String callbackUrl,
            String extraData,
            Instant now) {
        return PaymentOrder.builder()
                .orderNo(orderNo)
                .merchantId(merchantId)
                .merchantRef(merchantRef)
                .kind(OrderKind.WITHDRAWAL)
                .chain(chain)
                .token(token)
                .requestedAmount(amount)
                .amount(amount)
                .fee(fee)
                .netAmount(amount)
                .walletAddress(fromAddress)
                .toAddress(toAddress)
                .requiredConfirmations(requiredConfirmations)
                .status(OrderStatus.PENDING)
                .callbackUrl(callbackUrl)
                .extraData(extraData)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void transitionTo(OrderStatus next, Instant now) {
        if (status.isTerminal() || !kind.allows(status, next)) {
            throw new OrderStateException("invalid " + kind + " transition: " + status + " -> " + next + " orderNo=" + orderNo);
        }
        if (next == OrderStatus.DETECTED) {
            this.detectedAt = now;
        }
        if (next.isTerminal()) {
            this.completedAt = now;
        }
        this.status = next;
        this.updatedAt = now;
    }

    public void fail(FailureReason reason, String detail, Instant now) {
        transitionTo(OrderStatus.FAILED, now);
        this.failureReason = reason;
        this.failureDetail = detail == null || detail.length() <= 512 ? detail : detail.substring(0, 512);
    }

    public void expire(Instant now) {
        transitionTo(OrderStatus.EXPIRED, now);
        this.failureReason = FailureReason.EXPIRED;
    }

    /**
     * Binds an on-chain transfer to a deposit. The settled amount is what actually arrived,
     * and fee/net are recomputed from it.
     */
    public void attachTransfer(String txHash, BigDecimal settledAmount, BigDecimal fee, long blockHeight, long confirmations, Instant now) {
        if (kind != OrderKind.DEPOSIT) {
            throw new OrderStateException("only deposits accept observed transfers: " + orderNo);
        }
        this.txHash = txHash;
        this.settledAmount = settledAmount;
        this.fee = fee;
        this.netAmount = settledAmount.subtract(fee);
        this.blockHeight = blockHeight;
        this.confirmations = confirmations;
        this.updatedAt = now;
    }

    public void recordConfirmations(long blockHeight, long confirmations, Instant now) {
        this.blockHeight = blockHeight;
        this.confirmations = Math.max(0, confirmations);
        this.missingSinceHeight = null;
        this.updatedAt = now;
    }

    public void markMissing(long atHeight, Instant now) {
        if (missingSinceHeight == null) {
            this.missingSinceHeight = atHeight;
            this.updatedAt = now;
        }
    }

    public void recordBroadcastHash(String txHash, Instant now) {
        this.txHash = txHash;
        this.updatedAt = now;
    }

    public int incrementWaitCycles(Instant now) {
        this.confirmationWaitCycles++;
        this.updatedAt = now;
        return confirmationWaitCycles;
    }

    public void markForced() {
        this.forced = true;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean hasReachedRequiredConfirmations() {
        return confirmations >= requiredConfirmations;
    }
}
