package lab.reconciler.orchestration.policy;

import lab.reconciler.orchestration.CreateWithdrawalCommand;
import lab.reconciler.orchestration.FeeCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

@Component
@Order(10)
@RequiredArgsConstructor
public class AmountLimitPolicyRule implements PolicyRule {

    private final FeeCalculator feeCalculator;

    @Override
    public PolicyDecision evaluate(CreateWithdrawalCommand command) {
        if (command.amount() == null || command.amount().signum() <= 0) {
            return PolicyDecision.reject("AMOUNT_NOT_POSITIVE");
        }
        BigDecimal minimum = feeCalculator.minimumWithdrawal();
        if (command.amount().compareTo(minimum) < 0) {
            return PolicyDecision.reject("AMOUNT_BELOW_MINIMUM: min=" + minimum.toPlainString() + ", requested=" + command.amount().toPlainString());
        }
        return PolicyDecision.allow();
    }
}
