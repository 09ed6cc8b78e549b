package lab.reconciler.webhook;

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
public class WebhookRetryScheduler {

    private final NotificationDispatcher dispatcher;

    @Scheduled(fixedDelayString = "${reconciler.workers.webhook-interval:PT15S}")
    public void deliver() {
        try {
            int attempted = WorkerCorrelation.run("webhook", dispatcher::dispatchDue);
            if (attempted > 0) {
                log.info("event=webhook.retry.tick attempted={}", attempted);
            }
        } catch (RuntimeException e) {
            log.error("event=webhook.retry.tick_failed", e);
        }
    }
}
