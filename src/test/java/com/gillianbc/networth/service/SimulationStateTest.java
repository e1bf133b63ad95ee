package com.gillianbc.networth.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SimulationStateTest {

    @Test
    @DisplayName("Debt payments are capped at the balance and leave cash alone")
    void payDebt_cappedAtBalance() {
        SimulationState state = new SimulationState(Fixtures.profile(Fixtures.SAVINGS, "250.00"));

        BigDecimal paid = state.payDebt(new BigDecimal("600"));

        assertEquals(0, new BigDecimal("250").compareTo(paid));
        assertEquals(0, state.getDebtBalance().signum());
        assertFalse(state.hasDebt());
        assertEquals(0, new BigDecimal(Fixtures.SAVINGS).compareTo(state.getCashSavings()));
        assertEquals(0, state.payDebt(new BigDecimal("100")).signum());
    }

    @Test
    @DisplayName("No interest accrues once the debt is gone")
    void accrueDebtInterest_noDebt() {
        SimulationState state = new SimulationState(Fixtures.profile(Fixtures.SAVINGS, "0"));
        state.accrueDebtInterest(new BigDecimal("0.01"));
        assertEquals(0, state.getDebtBalance().signum());
    }

    @Test
    @DisplayName("The emergency fund is earmarked cash and shrinks with it")
    void emergencyFund_backedByCash() {
        SimulationState state = new SimulationState(Fixtures.profile("4000.00", "0"));
        state.openEmergencyFund(new BigDecimal("18000"));

        assertEquals(0, new BigDecimal("4000").compareTo(state.getEmergencyFund()));
        assertEquals(0, new BigDecimal("14000").compareTo(state.emergencyFundGap()));
        assertFalse(state.isEmergencyFundComplete());

        state.addCash(new BigDecimal("-3000"));
        assertEquals(0, new BigDecimal("1000").compareTo(state.getEmergencyFund()));

        state.addCash(new BigDecimal("20000"));
        state.earmarkEmergencyFund(new BigDecimal("17000"));
        assertTrue(state.isEmergencyFundComplete());
        assertEquals(0, state.emergencyFundGap().signum());
    }

    @Test
    @DisplayName("Windfalls and unplanned expenses flow through the running totals")
    void oneOffs_updateTotals() {
        SimulationState state = new SimulationState(Fixtures.profile());
        state.receiveWindfall(new BigDecimal("3000"));
        state.payUnplannedExpense(new BigDecimal("1000"));

        assertEquals(0, new BigDecimal("12000").compareTo(state.getCashSavings()));
        assertEquals(0, new BigDecimal("1000").compareTo(state.getTotalSpent()));
        assertEquals(0, new BigDecimal("2000").compareTo(state.getTotalSaved()));
    }
}
