package lab.reconciler.orchestration;

import lab.reconciler.common.InvalidRequestException;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.domain.merchant.Merchant;
import lab.reconciler.domain.order.OrderAuditLog;
import lab.reconciler.domain.order.OrderAuditLogRepository;
import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class OrderQueryService {

    private final PaymentOrderRepository orderRepository;
    private final OrderAuditLogRepository auditRepository;

    /**
     * Looks an order up by system number, or by merchant reference plus kind. Orders of other
     * merchants are reported as missing.
     */
    @Transactional(readOnly = true)
    public PaymentOrder find(Merchant merchant, String orderNo, String merchantRef, OrderKind kind) {
        PaymentOrder order;
        if (orderNo != null && !orderNo.isBlank()) {
            order = orderRepository.findByOrderNo(orderNo)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderNo));
        } else if (merchantRef != null && !merchantRef.isBlank() && kind != null) {
            order = orderRepository.findByMerchantIdAndKindAndMerchantRef(merchant.getId(), kind, merchantRef)
                    .orElseThrow(() -> new NotFoundException("order not found: " + merchantRef));
        } else {
            throw new InvalidRequestException("order_no or out_trade_no with order_type is required");
        }
        if (!order.getMerchantId().equals(merchant.getId()) || (kind != null && order.getKind() != kind)) {
            throw new NotFoundException("order not found: " + (orderNo != null ? orderNo : merchantRef));
        }
        return order;
    }

    @Transactional(readOnly = true)
    public PaymentOrder findByOrderNo(String orderNo) {
        return orderRepository.findByOrderNo(orderNo)
                .orElseThrow(() -> new NotFoundException("order not found: " + orderNo));
    }

    @Transactional(readOnly = true)
    public List<OrderAuditLog> history(UUID orderId) {
        return auditRepository.findByOrderIdOrderByCreatedAtAsc(orderId);
    }
}
