package lab.reconciler.orchestration.policy;

import lab.reconciler.orchestration.CreateWithdrawalCommand;

public interface PolicyRule {
    PolicyDecision evaluate(CreateWithdrawalCommand command);
}
