package lab.reconciler.domain.collect;

public enum CollectTaskType {
    /** Native coin sent from the hot wallet so the deposit address can pay for its own transfer. */
    GAS_TOP_UP,
    COLLECT
}
