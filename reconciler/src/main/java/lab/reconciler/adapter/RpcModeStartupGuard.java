package lab.reconciler.adapter;

import jakarta.annotation.PostConstruct;
import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "reconciler", name = "mode", havingValue = "rpc")
public class RpcModeStartupGuard {

    private final ReconcilerProperties properties;

    @PostConstruct
    void validate() {
        if (properties.getChains().isEmpty()) {
            throw new IllegalStateException("rpc mode needs at least one entry under reconciler.chains");
        }
        for (Map.Entry<String, ReconcilerProperties.ChainEntry> entry : properties.getChains().entrySet()) {
            validateChain(entry.getKey(), entry.getValue());
        }
    }

    private void validateChain(String chain, ReconcilerProperties.ChainEntry config) {
        String prefix = "reconciler.chains." + chain;
        if (config.getRpcUrl() == null || config.getRpcUrl().isBlank()) {
            throw new IllegalStateException(prefix + ".rpc-url must be configured in rpc mode");
        }
        if (config.getChainId() <= 0) {
            throw new IllegalStateException(prefix + ".chain-id must be configured in rpc mode");
        }
        if (config.getNativeSymbol() == null || config.getNativeSymbol().isBlank()) {
            throw new IllegalStateException(prefix + ".native-symbol must be configured in rpc mode");
        }
        if (config.getRequiredConfirmations() < 1) {
            throw new IllegalStateException(prefix + ".required-confirmations must be at least 1");
        }
        if (config.getSafetyLag() < 0 || config.getReorgToleranceBlocks() < 1) {
            throw new IllegalStateException(prefix + " safety-lag must be >= 0 and reorg-tolerance-blocks >= 1");
        }
        config.getTokens().forEach((symbol, token) -> {
            if (token.getContract() == null || token.getContract().isBlank()) {
                throw new IllegalStateException(prefix + ".tokens." + symbol + ".contract must be configured");
            }
        });
    }
}
