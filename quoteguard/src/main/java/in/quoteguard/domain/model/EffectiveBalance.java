package in.quoteguard.domain.model;

import java.math.BigDecimal;

/**
 * Fillable capacity of a maker for one validation call.
 *
 * Either unconstrained (registered maker not sampled yet) or a concrete non-negative amount.
 * Never persisted.
 */
public record EffectiveBalance(boolean unconstrained, BigDecimal amount, BalanceStatus status) {

    public EffectiveBalance {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (unconstrained && amount != null) {
            throw new IllegalArgumentException("Unconstrained balance cannot carry an amount");
        }
        if (!unconstrained && (amount == null || amount.signum() < 0)) {
            throw new IllegalArgumentException("Amount must be non-negative: " + amount);
        }
    }

    public static EffectiveBalance unconstrained(BalanceStatus status) {
        return new EffectiveBalance(true, null, status);
    }

    public static EffectiveBalance of(BigDecimal amount, BalanceStatus status) {
        return new EffectiveBalance(false, amount, status);
    }

    public static EffectiveBalance denied(BalanceStatus status) {
        return new EffectiveBalance(false, BigDecimal.ZERO, status);
    }

    /**
     * Whether this balance can back the full maker amount of a quote.
     */
    public boolean covers(BigDecimal makerAssetAmount) {
        return unconstrained || amount.compareTo(makerAssetAmount) >= 0;
    }

    @Override
    public String toString() {
        return unconstrained ? "UNCONSTRAINED(" + status + ")" : amount.toPlainString() + "(" + status + ")";
    }
}
