package lab.reconciler.domain.webhook;

public enum DeliveryOutcome {
    PENDING,
    DELIVERED,
    /** Backoff schedule exhausted; waits for a manual resend. */
    FAILED
}
