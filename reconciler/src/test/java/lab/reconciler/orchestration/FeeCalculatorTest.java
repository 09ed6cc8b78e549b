package lab.reconciler.orchestration;

import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.merchant.Merchant;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class FeeCalculatorTest {

    private final ReconcilerProperties properties = new ReconcilerProperties();
    private final FeeCalculator calculator = new FeeCalculator(properties);

    @Test
    void depositFee_isPercentOfTokenAmount() {
        Merchant merchant = merchant();

        assertThat(calculator.depositFee(merchant, new BigDecimal("99.5"))).isEqualByComparingTo("0.995");
        assertThat(calculator.depositFee(merchant, new BigDecimal("99.5")).scale()).isEqualTo(8);
    }

    @Test
    void depositFee_neverExceedsTheAmount() {
        properties.getFees().getDeposit().setFixed(new BigDecimal("5"));

        assertThat(calculator.depositFee(merchant(), new BigDecimal("2"))).isEqualByComparingTo("2");
    }

    @Test
    void withdrawalFee_addsFixedPart() {
        assertThat(calculator.withdrawalFee(merchant(), new BigDecimal("200"))).isEqualByComparingTo("3");
        assertThat(calculator.minimumWithdrawal()).isEqualByComparingTo("10");
    }

    @Test
    void merchantOverrides_winOverDefaults() {
        Merchant merchant = merchant();
        merchant.overrideFees(new BigDecimal("0.005"), BigDecimal.ZERO, new BigDecimal("0.5"));

        assertThat(calculator.depositFee(merchant, new BigDecimal("1000"))).isEqualByComparingTo("5");
        assertThat(calculator.withdrawalFee(merchant, new BigDecimal("1000"))).isEqualByComparingTo("0.5");
    }

    private static Merchant merchant() {
        return Merchant.register("M1", "Shop", "dk", "wk", Instant.parse("2026-01-01T00:00:00Z"));
    }
}
