package lab.reconciler.domain.webhook;

import jakarta.persistence.*;
import lab.reconciler.domain.order.OrderStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "webhook_deliveries",
       uniqueConstraints = @UniqueConstraint(name = "uk_webhook_order_event", columnNames = {"orderId", "eventStatus"}),
       indexes = @Index(name = "idx_webhook_due", columnList = "outcome,nextAttemptAt"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private OrderStatus eventStatus;

    @Column(nullable = false, updatable = false, length = 512)
    private String url;

    @Lob
    @Column(nullable = false, updatable = false)
    private String payload;

    @Column(nullable = false, updatable = false, length = 128)
    private String signature;

    /** Every attempt ever made, across operator resends. */
    private int attemptCount;

    private int resendCount;

    /** {@code attemptCount} when the current round of the backoff schedule began. */
    private int roundStartAttempt;

    private Instant nextAttemptAt;

    private Instant lastAttemptAt;

    private Integer lastResponseStatus;

    @Column(length = 512)
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DeliveryOutcome outcome;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    private Instant deliveredAt;

    public static WebhookDelivery scheduled(UUID orderId, OrderStatus eventStatus, String url, String payload, String signature, Instant now) {
        return WebhookDelivery.builder()
                .orderId(orderId)
                .eventStatus(eventStatus)
                .url(url)
                .payload(payload)
                .signature(signature)
                .attemptCount(0)
                .resendCount(0)
                .roundStartAttempt(0)
                .nextAttemptAt(now)
                .outcome(DeliveryOutcome.PENDING)
                .createdAt(now)
                .build();
    }

    public void markDelivered(int responseStatus, Instant now) {
        this.attemptCount++;
        this.lastAttemptAt = now;
        this.lastResponseStatus = responseStatus;
        this.lastError = null;
        this.outcome = DeliveryOutcome.DELIVERED;
        this.deliveredAt = now;
        this.nextAttemptAt = null;
    }

    /**
     * Records a failed attempt; {@code nextAttempt == null} means the schedule is used up.
     */
    public void markAttemptFailed(Integer responseStatus, String error, Instant nextAttempt, Instant now) {
        this.attemptCount++;
        this.lastAttemptAt = now;
        this.lastResponseStatus = responseStatus;
        this.lastError = error == null || error.length() <= 512 ? error : error.substring(0, 512);
        if (nextAttempt == null) {
            this.outcome = DeliveryOutcome.FAILED;
            this.nextAttemptAt = null;
        } else {
            this.nextAttemptAt = nextAttempt;
        }
    }

    /** Attempts made since creation or since the last operator resend. */
    public int attemptsInRound() {
        return attemptCount - roundStartAttempt;
    }

    /** Starts a fresh backoff round; the attempt history is kept. */
    public void resetForResend(Instant now) {
        if (outcome != DeliveryOutcome.FAILED) {
            throw new IllegalStateException("only failed deliveries can be resent: " + id + " is " + outcome);
        }
        this.outcome = DeliveryOutcome.PENDING;
        this.resendCount++;
        this.roundStartAttempt = attemptCount;
        this.nextAttemptAt = now;
    }
}
