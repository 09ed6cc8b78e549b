package lab.reconciler.orchestration;

import lab.reconciler.config.ReconcilerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ConfiguredExchangeRateProvider implements ExchangeRateProvider {

    private final ReconcilerProperties properties;

    @Override
    public Optional<BigDecimal> rate(String token, String currency) {
        Map<String, BigDecimal> rates = properties.getExchangeRates().get(token.toUpperCase(Locale.ROOT));
        if (rates == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rates.get(currency.toUpperCase(Locale.ROOT)))
                .filter(rate -> rate.signum() > 0);
    }
}
