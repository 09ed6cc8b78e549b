package lab.reconciler.orchestration;

import lab.reconciler.config.ReconcilerProperties;
import lab.reconciler.domain.merchant.Merchant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * {@code fee = amount * percent + fixed}, always on the token amount. Merchant overrides win
 * over configured defaults.
 */
@Component
@RequiredArgsConstructor
public class FeeCalculator {

    static final int FEE_SCALE = 8;

    private final ReconcilerProperties properties;

    public BigDecimal depositFee(Merchant merchant, BigDecimal tokenAmount) {
        ReconcilerProperties.FeeRule rule = properties.getFees().getDeposit();
        BigDecimal percent = merchant.getDepositFeePercent() != null ? merchant.getDepositFeePercent() : rule.getPercent();
        BigDecimal fee = compute(tokenAmount, percent, rule.getFixed());
        return fee.min(tokenAmount);
    }

    public BigDecimal withdrawalFee(Merchant merchant, BigDecimal tokenAmount) {
        ReconcilerProperties.FeeRule rule = properties.getFees().getWithdrawal();
        BigDecimal percent = merchant.getWithdrawalFeePercent() != null ? merchant.getWithdrawalFeePercent() : rule.getPercent();
        BigDecimal fixed = merchant.getWithdrawalFixedFee() != null ? merchant.getWithdrawalFixedFee() : rule.getFixed();
        return compute(tokenAmount, percent, fixed);
    }

    public BigDecimal minimumWithdrawal() {
        return properties.getFees().getWithdrawal().getMinAmount();
    }

    private static BigDecimal compute(BigDecimal amount, BigDecimal percent, BigDecimal fixed) {
        return amount.multiply(percent).add(fixed).setScale(FEE_SCALE, RoundingMode.HALF_UP);
    }
}
