package lab.reconciler.orchestration;

import java.math.BigDecimal;

/**
 * {@code currency} is null when {@code amount} is already in token units.
 */
public record CreateDepositCommand(
        String merchantNo,
        String merchantRef,
        String chain,
        String token,
        BigDecimal amount,
        String currency,
        String callbackUrl,
        String extraData
) {}
