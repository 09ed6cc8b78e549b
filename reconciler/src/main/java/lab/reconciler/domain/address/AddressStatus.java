package lab.reconciler.domain.address;

public enum AddressStatus {
    AVAILABLE,
    ASSIGNED,
    LOCKED,
    DISABLED
}
