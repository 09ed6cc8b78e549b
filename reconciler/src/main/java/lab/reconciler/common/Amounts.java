package lab.reconciler.common;

import java.math.BigDecimal;

public final class Amounts {

    private Amounts() {
    }

    /** Canonical text form used in payloads and signatures: no exponent, no trailing zeros. */
    public static String format(BigDecimal amount) {
        if (amount == null) {
            return "";
        }
        if (amount.signum() == 0) {
            return "0";
        }
        return amount.stripTrailingZeros().toPlainString();
    }
}
