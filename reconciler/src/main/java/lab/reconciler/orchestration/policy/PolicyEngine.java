package lab.reconciler.orchestration.policy;

import lab.reconciler.orchestration.CreateWithdrawalCommand;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
public class PolicyEngine {

    private final List<PolicyRule> rules;

    // Rules run in @Order sequence; the first rejection wins so the reason names one concrete problem.
    public PolicyDecision evaluate(CreateWithdrawalCommand command) {
        for (PolicyRule rule : rules) {
            PolicyDecision decision = rule.evaluate(command);
            if (!decision.allowed()) {
                return decision;
            }
        }
        return PolicyDecision.allow();
    }
}
