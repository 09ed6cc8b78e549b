package lab.reconciler.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "order_audit_logs",
       indexes = @Index(name = "idx_order_audit_order", columnList = "orderId"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder
public class OrderAuditLog {

    public static final String SYSTEM_ACTOR = "system";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, updatable = false)
    private UUID orderId;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 16)
    private OrderStatus fromStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private OrderStatus toStatus;

    @Column(updatable = false, length = 512)
    private String reason;

    @Column(nullable = false, updatable = false, length = 64)
    private String actor;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    public static OrderAuditLog of(UUID orderId, OrderStatus from, OrderStatus to, String reason, String actor, Instant now) {
        return OrderAuditLog.builder()
                .orderId(orderId)
                .fromStatus(from)
                .toStatus(to)
                .reason(reason)
                .actor(actor)
                .createdAt(now)
                .build();
    }
}
