package lab.reconciler.orchestration;

import java.math.BigDecimal;

public record CreateWithdrawalCommand(
        String merchantNo,
        String merchantRef,
        String chain,
        String token,
        BigDecimal amount,
        String toAddress,
        String callbackUrl,
        String extraData
) {}
