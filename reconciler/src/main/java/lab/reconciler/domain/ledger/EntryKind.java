package lab.reconciler.domain.ledger;

public enum EntryKind {
    PRINCIPAL,
    FEE,
    ADJUSTMENT
}
