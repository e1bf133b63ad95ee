package com.gillianbc.networth.service;

import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.ScenarioDelta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Builds what-if profiles from a baseline and a list of category deltas.
 */
@Slf4j
@Service
public class ScenarioService {

    /**
     * Applies the deltas in list order. Deltas on the same category compound: two percentage
     * changes p1 then p2 give {@code value * (1 + p1/100) * (1 + p2/100)}.
     * <p>
     * {@code income} targets the monthly income, {@code savings} the current savings, every
     * other category the matching monthly expense. The base profile is left untouched and no
     * sign checks are made here; a negative result is rejected when the profile is projected.
     *
     * @param base   baseline profile
     * @param deltas changes to apply, possibly empty
     * @return a new profile with all deltas applied
     */
    public FinancialProfile apply(FinancialProfile base, List<ScenarioDelta> deltas) {
        Objects.requireNonNull(base, "base must not be null");
        Objects.requireNonNull(deltas, "deltas must not be null");

        FinancialProfile result = base;
        for (ScenarioDelta delta : deltas) {
            Objects.requireNonNull(delta, "deltas contains null");
            result = applyOne(result, delta);
        }

        log.debug("Applied {} scenario deltas", deltas.size());
        return result;
    }

    private static FinancialProfile applyOne(FinancialProfile profile, ScenarioDelta delta) {
        return switch (delta.getCategory()) {
            case INCOME -> profile.withMonthlyIncome(adjust(profile.getMonthlyIncome(), delta));
            case SAVINGS -> profile.withCurrentSavings(adjust(profile.getCurrentSavings(), delta));
            default -> profile.withMonthlyExpenses(profile.getMonthlyExpenses().with(
                    delta.getCategory(),
                    adjust(profile.getMonthlyExpenses().get(delta.getCategory()), delta)));
        };
    }

    private static BigDecimal adjust(BigDecimal value, ScenarioDelta delta) {
        if (delta.isPercent()) {
            BigDecimal factor = BigDecimal.ONE.add(delta.getChangePercent().divide(Amounts.HUNDRED, Amounts.MATH_CONTEXT));
            return value.multiply(factor, Amounts.MATH_CONTEXT);
        }
        return value.add(delta.getChangeAmount());
    }
}
