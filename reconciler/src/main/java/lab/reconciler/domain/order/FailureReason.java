package lab.reconciler.domain.order;

/**
 * Reason codes exposed to merchants through order queries and callbacks.
 */
public enum FailureReason {
    REORGED,
    BROADCAST_REJECTED,
    SIGNING_FAILED,
    REVERTED,
    STUCK,
    INSUFFICIENT_BALANCE,
    EXPIRED
}
