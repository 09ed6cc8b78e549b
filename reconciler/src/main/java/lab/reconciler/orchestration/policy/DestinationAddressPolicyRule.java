package lab.reconciler.orchestration.policy;

import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.orchestration.CreateWithdrawalCommand;
import lab.reconciler.security.HotWalletDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
@RequiredArgsConstructor
public class DestinationAddressPolicyRule implements PolicyRule {

    private final ChainAdapterRouter router;
    private final HotWalletDirectory hotWallets;

    @Override
    public PolicyDecision evaluate(CreateWithdrawalCommand command) {
        if (!router.resolve(command.chain()).isValidAddress(command.toAddress())) {
            return PolicyDecision.reject("INVALID_TO_ADDRESS: " + command.toAddress());
        }
        if (command.toAddress().equalsIgnoreCase(hotWallets.hotWallet(command.chain()).address())) {
            return PolicyDecision.reject("TO_ADDRESS_IS_HOT_WALLET");
        }
        return PolicyDecision.allow();
    }
}
