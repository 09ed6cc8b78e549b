package lab.reconciler.ledger;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

@Getter
public class InsufficientBalanceException extends RuntimeException {

    private final UUID accountId;
    private final BigDecimal balance;
    private final BigDecimal requested;

    public InsufficientBalanceException(UUID accountId, BigDecimal balance, BigDecimal requested) {
        super("insufficient balance on account " + accountId + ": balance=" + balance.toPlainString()
                + " requested=" + requested.toPlainString());
        this.accountId = accountId;
        this.balance = balance;
        this.requested = requested;
    }
}
