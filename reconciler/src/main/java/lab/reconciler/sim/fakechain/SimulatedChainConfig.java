package lab.reconciler.sim.fakechain;

import lab.reconciler.adapter.ChainAdapterRouter;
import lab.reconciler.config.ReconcilerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "reconciler", name = "mode", havingValue = "mock", matchIfMissing = true)
@Slf4j
public class SimulatedChainConfig {

    @Bean
    public ChainAdapterRouter chainAdapterRouter(ReconcilerProperties properties) {
        List<SimulatedChainAdapter> adapters = new ArrayList<>();
        properties.getChains().forEach((chain, entry) -> {
            FakeChain fakeChain = new FakeChain(chain, entry.getNativeSymbol(), entry.getSimulatedFee(), 0);
            adapters.add(new SimulatedChainAdapter(fakeChain, entry));
            log.info("event=adapter.simulated.registered chain={} confirmations={}", chain, entry.getRequiredConfirmations());
        });
        return new ChainAdapterRouter(adapters);
    }
}
