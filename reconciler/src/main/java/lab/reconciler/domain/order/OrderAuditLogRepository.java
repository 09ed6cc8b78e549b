package lab.reconciler.domain.order;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface OrderAuditLogRepository extends JpaRepository<OrderAuditLog, UUID> {
    List<OrderAuditLog> findByOrderIdOrderByCreatedAtAsc(UUID orderId);
}
