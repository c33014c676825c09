package com.marketengine.common.margin;

import com.marketengine.common.exception.InvalidCostOverrideException;
import com.marketengine.common.model.CostOverrides;

import java.util.Locale;

/**
 * Rejects overrides that cannot describe a real product. Nothing is clamped;
 * the first violation found is thrown with a reason the user can act on.
 */
public final class CostOverrideValidator {

    private CostOverrideValidator() {}

    /** Checks the price override alone, before any price is resolved. */
    public static void validatePrice(CostOverrides overrides) {
        if (overrides.price() != null && !(overrides.price() > 0 && Double.isFinite(overrides.price()))) {
            throw new InvalidCostOverrideException(
                "Price override must be a positive amount, got " + money(overrides.price()));
        }
    }

    /** Checks COGS and fee overrides against the resolved selling price. */
    public static void validateCosts(CostOverrides overrides, double price) {
        Double cogs = overrides.cogs();
        if (cogs != null) {
            if (!(cogs > 0) || !Double.isFinite(cogs)) {
                throw new InvalidCostOverrideException("COGS must be a positive amount, got " + money(cogs));
            }
            if (cogs >= price) {
                throw new InvalidCostOverrideException(
                    "COGS " + money(cogs) + " must be below the selling price " + money(price));
            }
        }
        Double fee = overrides.fbaFee();
        if (fee != null) {
            if (!(fee >= 0) || !Double.isFinite(fee)) {
                throw new InvalidCostOverrideException("FBA fee cannot be negative, got " + money(fee));
            }
            if (fee >= price) {
                throw new InvalidCostOverrideException(
                    "FBA fee " + money(fee) + " must be below the selling price " + money(price));
            }
        }
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%.2f", amount);
    }
}
