package lab.reconciler.domain.order;

public enum OrderStatus {
    PENDING,
    DETECTED,
    CONFIRMING,
    PROCESSING,
    SUCCESS,
    EXPIRED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == EXPIRED || this == FAILED;
    }
}
