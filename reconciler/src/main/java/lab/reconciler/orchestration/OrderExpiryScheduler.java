package lab.reconciler.orchestration;

import lab.reconciler.common.logging.WorkerCorrelation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "reconciler.workers", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OrderExpiryScheduler {

    private final DepositOrderService depositService;

    @Scheduled(fixedDelayString = "${reconciler.workers.expiry-interval:PT30S}")
    public void expire() {
        try {
            int expired = WorkerCorrelation.run("expiry", depositService::expireDue);
            if (expired > 0) {
                log.info("event=deposit.expiry.tick expired={}", expired);
            }
        } catch (RuntimeException e) {
            log.error("event=deposit.expiry.tick_failed", e);
        }
    }
}
