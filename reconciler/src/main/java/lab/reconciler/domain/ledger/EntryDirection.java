package lab.reconciler.domain.ledger;

import java.math.BigDecimal;

public enum EntryDirection {
    CREDIT,
    DEBIT;

    public BigDecimal apply(BigDecimal balance, BigDecimal amount) {
        return this == CREDIT ? balance.add(amount) : balance.subtract(amount);
    }

    public EntryDirection opposite() {
        return this == CREDIT ? DEBIT : CREDIT;
    }
}
