package lab.reconciler.domain.order;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static lab.reconciler.domain.order.OrderStatus.CONFIRMING;
import static lab.reconciler.domain.order.OrderStatus.DETECTED;
import static lab.reconciler.domain.order.OrderStatus.EXPIRED;
import static lab.reconciler.domain.order.OrderStatus.FAILED;
import static lab.reconciler.domain.order.OrderStatus.PENDING;
import static lab.reconciler.domain.order.OrderStatus.PROCESSING;
import static lab.reconciler.domain.order.OrderStatus.SUCCESS;

/**
 * Order kinds and the lifecycle each one is allowed to follow.
 */
public enum OrderKind {

    DEPOSIT("DEP", Map.of(
            PENDING, EnumSet.of(DETECTED, EXPIRED, FAILED),
            DETECTED, EnumSet.of(CONFIRMING, SUCCESS, FAILED),
            CONFIRMING, EnumSet.of(SUCCESS, FAILED)
    )),
    WITHDRAWAL("WDR", Map.of(
            PENDING, EnumSet.of(PROCESSING, FAILED),
            PROCESSING, EnumSet.of(SUCCESS, FAILED)
    ));

    private final String orderNoPrefix;
    private final Map<OrderStatus, Set<OrderStatus>> transitions;

    OrderKind(String orderNoPrefix, Map<OrderStatus, Set<OrderStatus>> transitions) {
        this.orderNoPrefix = orderNoPrefix;
        this.transitions = new EnumMap<>(transitions);
    }

    public String orderNoPrefix() {
        return orderNoPrefix;
    }

    public boolean allows(OrderStatus from, OrderStatus to) {
        return transitions.getOrDefault(from, Set.of()).contains(to);
    }
}
