package lab.reconciler.domain.webhook;

import lab.reconciler.domain.order.OrderStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, UUID> {

    Optional<WebhookDelivery> findByOrderIdAndEventStatus(UUID orderId, OrderStatus eventStatus);

    List<WebhookDelivery> findByOrderId(UUID orderId);

    @Query("""
            select d.id from WebhookDelivery d
            where d.outcome = lab.reconciler.domain.webhook.DeliveryOutcome.PENDING
              and d.nextAttemptAt <= :now
            order by d.nextAttemptAt asc
            """)
    List<UUID> findDueIds(@Param("now") Instant now, Pageable page);
}
