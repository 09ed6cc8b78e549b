package lab.reconciler.domain.collect;

public enum CollectTaskStatus {
    PENDING,
    PROCESSING,
    SUCCESS,
    FAILED,
    SKIPPED;

    public boolean isInFlight() {
        return this == PENDING || this == PROCESSING;
    }
}
