package lab.reconciler.sweep;

import lab.reconciler.common.logging.WorkerCorrelation;
import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "reconciler.workers", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SweepScheduler {

    private final SweepService sweepService;
    private final ReconcilerProperties properties;

    @Scheduled(fixedDelayString = "${reconciler.workers.sweep-interval:PT1M}")
    public void sweep() {
        for (String chain : properties.getChains().keySet()) {
            try {
                WorkerCorrelation.run("sweep-" + chain, () -> sweepService.runOnce(chain));
            } catch (RuntimeException e) {
                // one chain failing must not hold back the others
                log.error("event=sweep.run.failed chain={}", chain, e);
            }
        }
    }
}
