package lab.reconciler.common.logging;

import lab.reconciler.common.CorrelationIdFilter;
import org.slf4j.MDC;

import java.util.Locale;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Background ticks get their own correlation id ({@code scan-eth-<uuid>}) so their log lines
 * can be followed the same way as request logs.
 */
public final class WorkerCorrelation {

    private WorkerCorrelation() {
    }

    public static <T> T run(String worker, Supplier<T> tick) {
        String previous = MDC.get(CorrelationIdFilter.MDC_CORRELATION_ID_KEY);
        MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID_KEY, worker.toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID());
        try {
            return tick.get();
        } finally {
            if (previous == null) {
                MDC.remove(CorrelationIdFilter.MDC_CORRELATION_ID_KEY);
            } else {
                MDC.put(CorrelationIdFilter.MDC_CORRELATION_ID_KEY, previous);
            }
        }
    }
}
