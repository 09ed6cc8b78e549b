package lab.reconciler.orchestration;

import lab.reconciler.domain.order.OrderKind;
import lab.reconciler.domain.order.PaymentOrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * {@code DEP20240101120000123456}: kind prefix, UTC timestamp to the second, six random digits.
 */
@Component
@RequiredArgsConstructor
public class OrderNumberGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);
    private static final int MAX_TRIES = 10;

    private final PaymentOrderRepository orderRepository;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public String next(OrderKind kind) {
        for (int i = 0; i < MAX_TRIES; i++) {
            String candidate = kind.orderNoPrefix() + TIMESTAMP.format(clock.instant()) + "%06d".formatted(random.nextInt(1_000_000));
            if (orderRepository.findByOrderNo(candidate).isEmpty()) {
                return candidate;
            }
        }
        throw new IllegalStateException("could not allocate a unique order number for " + kind);
    }
}
