package com.gillianbc.networth.service;

import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.InvalidProjectionInputException;
import com.gillianbc.networth.model.ScenarioCategory;
import com.gillianbc.networth.model.ScenarioDelta;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

@Slf4j
class ScenarioServiceTest {

    private final ScenarioService service = new ScenarioService();

    @Test
    @DisplayName("No deltas leaves the profile as it was")
    void apply_emptyDeltas_returnsBase() {
        FinancialProfile base = Fixtures.profile();
        assertSame(base, service.apply(base, List.of()));
    }

    @Test
    @DisplayName("Cutting food by 10% takes 600 down to 540")
    void apply_foodMinusTenPercent() {
        FinancialProfile result = service.apply(Fixtures.profile(),
                List.of(ScenarioDelta.percent(ScenarioCategory.FOOD, new BigDecimal("-10"))));

        assertEquals(0, new BigDecimal("540").compareTo(result.getMonthlyExpenses().getFood()));
        assertEquals(0, new BigDecimal("2940").compareTo(result.totalMonthlyExpenses()));
    }

    @Test
    @DisplayName("Two percentage changes on the same category compound")
    void apply_percentagesCompound() {
        FinancialProfile result = service.apply(Fixtures.profile(), List.of(
                ScenarioDelta.percent(ScenarioCategory.HOUSING, new BigDecimal("10")),
                ScenarioDelta.percent(ScenarioCategory.HOUSING, new BigDecimal("10"))));

        // 1500 * 1.1 * 1.1
        assertEquals(0, new BigDecimal("1815").compareTo(result.getMonthlyExpenses().getHousing()));
    }

    @Test
    @DisplayName("Income and savings are synthetic categories targeting the profile balances")
    void apply_incomeAndSavings() {
        FinancialProfile result = service.apply(Fixtures.profile(), List.of(
                ScenarioDelta.amount(ScenarioCategory.INCOME, new BigDecimal("500")),
                ScenarioDelta.percent(ScenarioCategory.SAVINGS, new BigDecimal("50"))));

        assertEquals(0, new BigDecimal("5500").compareTo(result.getMonthlyIncome()));
        assertEquals(0, new BigDecimal("15000").compareTo(result.getCurrentSavings()));
        assertEquals(Fixtures.expenses(), result.getMonthlyExpenses());
    }

    @Test
    @DisplayName("The base profile is never modified")
    void apply_baseUnchanged() {
        FinancialProfile base = Fixtures.profile();
        service.apply(base, List.of(ScenarioDelta.amount(ScenarioCategory.ENTERTAINMENT, new BigDecimal("-200"))));
        assertEquals(Fixtures.profile(), base);
    }

    @Test
    @DisplayName("A delta may drive a category negative; projecting that profile is rejected")
    void apply_negativeCategory_rejectedOnValidation() {
        FinancialProfile result = service.apply(Fixtures.profile(),
                List.of(ScenarioDelta.amount(ScenarioCategory.FOOD, new BigDecimal("-1000"))));

        assertEquals(0, new BigDecimal("-400").compareTo(result.getMonthlyExpenses().getFood()));
        assertThrows(InvalidProjectionInputException.class, () -> ProfileValidator.validateProfile(result));
    }

    @Test
    @DisplayName("A delta must carry exactly one of percent or amount")
    void delta_percentXorAmount() {
        assertThrows(InvalidProjectionInputException.class,
                () -> new ScenarioDelta(ScenarioCategory.FOOD, BigDecimal.ONE, BigDecimal.ONE));
        assertThrows(InvalidProjectionInputException.class,
                () -> new ScenarioDelta(ScenarioCategory.FOOD, null, null));
    }
}
