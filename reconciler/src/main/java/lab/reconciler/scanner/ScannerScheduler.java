package lab.reconciler.scanner;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One single-threaded executor per chain, so a chain whose RPC hangs only delays its own
 * scanner.
 */
@Component
@ConditionalOnProperty(prefix = "reconciler.workers", name = "enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class ScannerScheduler {

    private final ChainScanWorker worker;
    private final ReconcilerProperties properties;
    private final List<ScheduledExecutorService> executors = new ArrayList<>();

    @PostConstruct
    void start() {
        properties.getChains().forEach((chain, entry) -> {
            ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(
                    new CustomizableThreadFactory("scan-" + chain.toLowerCase(Locale.ROOT) + "-"));
            long interval = entry.getScanInterval().toMillis();
            executor.scheduleWithFixedDelay(() -> runTick(chain), interval, interval, TimeUnit.MILLISECONDS);
            executors.add(executor);
            log.info("event=scanner.scheduled chain={} intervalMs={} safetyLag={} confirmations={}",
                    chain, interval, entry.getSafetyLag(), entry.getRequiredConfirmations());
        });
    }

    @PreDestroy
    void stop() {
        executors.forEach(ScheduledExecutorService::shutdownNow);
    }

    private void runTick(String chain) {
        try {
            ScanResult result = worker.tick(chain);
            if (result.outcome() == ScanResult.Outcome.SCANNED) {
                log.debug("event=scanner.tick.done chain={} cursor={} transfers={}", chain, result.cursorHeight(), result.transfersSeen());
            }
        } catch (RuntimeException e) {
            // a thrown exception would cancel the periodic task
            log.error("event=scanner.tick.error chain={}", chain, e);
        }
    }
}
