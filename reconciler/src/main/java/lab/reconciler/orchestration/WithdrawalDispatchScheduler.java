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
public class WithdrawalDispatchScheduler {

    private final WithdrawalOrderService withdrawalService;

    @Scheduled(fixedDelayString = "${reconciler.workers.withdrawal-interval:PT5S}")
    public void dispatch() {
        try {
            int attempted = WorkerCorrelation.run("withdrawal", withdrawalService::dispatchDue);
            if (attempted > 0) {
                log.info("event=withdrawal.dispatch.tick attempted={}", attempted);
            }
        } catch (RuntimeException e) {
            log.error("event=withdrawal.dispatch.tick_failed", e);
        }
    }
}
