package lab.reconciler.orchestration;

import lab.reconciler.common.KeyedLocks;
import lab.reconciler.common.NotFoundException;
import lab.reconciler.domain.order.PaymentOrder;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Total order of transitions per order: an in-JVM lock keyed on the order id, then a
 * transaction holding the order row with {@code SELECT ... FOR UPDATE}.
 */
@Component
@RequiredArgsConstructor
public class OrderLocks {

    private final PaymentOrderRepository orderRepository;
    private final TransactionTemplate transactionTemplate;
    private final KeyedLocks locks = new KeyedLocks("order");

    public <T> T transition(UUID orderId, Function<PaymentOrder, T> action) {
        return locks.withLock(orderId.toString(), () -> inTransaction(orderId, action));
    }

    /** Holds only the in-JVM lock, for flows that mix several transactions with RPC calls. */
    public <T> T exclusive(UUID orderId, Supplier<T> action) {
        return locks.withLock(orderId.toString(), action);
    }

    /** Row-locked transaction; the caller already holds {@link #exclusive}. */
    public <T> T inTransaction(UUID orderId, Function<PaymentOrder, T> action) {
        return transactionTemplate.execute(status -> {
            PaymentOrder order = orderRepository.findByIdForUpdate(orderId)
                    .orElseThrow(() -> new NotFoundException("order not found: " + orderId));
            T result = action.apply(order);
            orderRepository.save(order);
            return result;
        });
    }
}
