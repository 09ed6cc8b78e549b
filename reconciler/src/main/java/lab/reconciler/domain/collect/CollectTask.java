package lab.reconciler.domain.collect;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One sweep attempt. A retry is a new row pointing at its predecessor.
 */
@Entity
@Table(name = "collect_tasks",
       indexes = {
           @Index(name = "idx_collect_task_source", columnList = "chain,sourceAddress,status"),
           @Index(name = "idx_collect_task_due", columnList = "status,scheduledAt")
       })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class CollectTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private CollectTaskType type;

    @Column(nullable = false, updatable = false, length = 16)
    private String chain;

    @Column(nullable = false, updatable = false, length = 16)
    private String token;

    /** Deposit address being swept; for top-ups, the address receiving gas. */
    @Column(nullable = false, updatable = false, length = 128)
    private String sourceAddress;

    @Column(nullable = false, updatable = false, length = 128)
    private String destinationAddress;

    @Column(nullable = false, updatable = false, precision = 38, scale = 18)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private CollectTaskStatus status;

    /** Hot wallet paying a gas top-up. */
    @Column(updatable = false, length = 128)
    private String funderAddress;

    @Column(length = 128)
    private String txHash;

    @Column(precision = 38, scale = 18)
    private BigDecimal gasUsed;

    @Column(nullable = false, updatable = false)
    private int retryCount;

    @Column(updatable = false)
    private UUID previousTaskId;

    @Column(length = 512)
    private String errorMessage;

    @Column(nullable = false)
    private Instant scheduledAt;

    private Instant executedAt;

    private Instant completedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static CollectTask gasTopUp(String chain, String nativeToken, String hotWallet, String depositAddress, BigDecimal amount, Instant now) {
        return CollectTask.builder()
                .type(CollectTaskType.GAS_TOP_UP)
                .chain(chain)
                .token(nativeToken)
                .sourceAddress(depositAddress)
                .destinationAddress(depositAddress)
                .amount(amount)
                .status(CollectTaskStatus.PENDING)
                .retryCount(0)
                .scheduledAt(now)
                .funderAddress(hotWallet)
                .createdAt(now)
                .build();
    }

    public static CollectTask collect(String chain, String token, String depositAddress, String collectionAddress, BigDecimal amount, Instant scheduledAt, Instant now) {
        return CollectTask.builder()
                .type(CollectTaskType.COLLECT)
                .chain(chain)
                .token(token)
                .sourceAddress(depositAddress)
                .destinationAddress(collectionAddress)
                .amount(amount)
                .status(CollectTaskStatus.PENDING)
                .retryCount(0)
                .scheduledAt(scheduledAt)
                .createdAt(now)
                .build();
    }

    /**
     * Successor of a failed attempt. Once the retry cap is reached it is born {@code SKIPPED}
     * and waits for an operator.
     */
    public CollectTask successor(int maxRetries, Instant scheduledAt, Instant now) {
        int nextRetry = retryCount + 1;
        boolean exhausted = nextRetry > maxRetries;
        return CollectTask.builder()
                .type(type)
                .chain(chain)
                .token(token)
                .sourceAddress(sourceAddress)
                .destinationAddress(destinationAddress)
                .funderAddress(funderAddress)
                .amount(amount)
                .status(exhausted ? CollectTaskStatus.SKIPPED : CollectTaskStatus.PENDING)
                .retryCount(nextRetry)
                .previousTaskId(id)
                .errorMessage(exhausted ? "retry limit reached: " + errorMessage : null)
                .scheduledAt(scheduledAt)
                .completedAt(exhausted ? now : null)
                .createdAt(now)
                .build();
    }

    /**
     * Fresh attempt for a skipped task, released by an operator. The retry budget starts over
     * and the skipped row is closed as failed so it no longer blocks the address.
     */
    public CollectTask releaseForRetry(Instant now) {
        requireStatus(CollectTaskStatus.SKIPPED);
        this.status = CollectTaskStatus.FAILED;
        this.errorMessage = truncate("released for retry: " + errorMessage);
        return CollectTask.builder()
                .type(type)
                .chain(chain)
                .token(token)
                .sourceAddress(sourceAddress)
                .destinationAddress(destinationAddress)
                .funderAddress(funderAddress)
                .amount(amount)
                .status(CollectTaskStatus.PENDING)
                .retryCount(0)
                .previousTaskId(id)
                .scheduledAt(now)
                .createdAt(now)
                .build();
    }

    public void markProcessing(Instant now) {
        requireStatus(CollectTaskStatus.PENDING);
        this.status = CollectTaskStatus.PROCESSING;
        this.executedAt = now;
    }

    public void recordTxHash(String txHash) {
        this.txHash = txHash;
    }

    public void markSuccess(BigDecimal gasUsed, Instant now) {
        requireStatus(CollectTaskStatus.PROCESSING);
        this.status = CollectTaskStatus.SUCCESS;
        this.gasUsed = gasUsed;
        this.completedAt = now;
    }

    public void markFailed(String errorMessage, Instant now) {
        requireStatus(CollectTaskStatus.PROCESSING);
        this.status = CollectTaskStatus.FAILED;
        this.errorMessage = truncate(errorMessage);
        this.completedAt = now;
    }

    public boolean isBroadcast() {
        return txHash != null;
    }

    /** Top-ups are paid by the hot wallet, not by the address they fund. */
    public String payerAddress() {
        return type == CollectTaskType.GAS_TOP_UP ? funderAddress : sourceAddress;
    }

    private static String truncate(String message) {
        return message == null || message.length() <= 512 ? message : message.substring(0, 512);
    }

    private void requireStatus(CollectTaskStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("collect task " + id + " is " + status + ", expected " + expected);
        }
    }
}
