package com.gillianbc.networth.service;

import com.gillianbc.networth.model.FinancialProfile;
import com.gillianbc.networth.model.TimelinePoint;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Running balances of a single projection. Created fresh for every run and discarded
 * once the timeline has been produced; never shared between runs or threads.
 * <p>
 * The emergency fund is a tracked portion of cash, not a separate pot, so
 * {@code savings = cashSavings + investmentPortfolio} always covers it.
 */
@Getter
public final class SimulationState {

    private BigDecimal monthlyIncome;
    private BigDecimal cashSavings;
    private BigDecimal investmentPortfolio = BigDecimal.ZERO;
    private BigDecimal emergencyFund = BigDecimal.ZERO;
    private BigDecimal emergencyFundTarget = BigDecimal.ZERO;
    private BigDecimal debtBalance;
    private BigDecimal totalSpent = BigDecimal.ZERO;
    private BigDecimal totalSaved = BigDecimal.ZERO;

    SimulationState(FinancialProfile profile) {
        this.monthlyIncome = profile.getMonthlyIncome();
        this.cashSavings = profile.getCurrentSavings();
        this.debtBalance = profile.getCurrentDebt();
    }

    public boolean hasDebt() {
        return debtBalance.signum() > 0;
    }

    public void raiseIncome(BigDecimal fraction) {
        monthlyIncome = Amounts.grow(monthlyIncome, fraction);
    }

    /**
     * Adds (or, if negative, withdraws) cash. The emergency fund never exceeds the cash that backs it.
     */
    public void addCash(BigDecimal amount) {
        cashSavings = cashSavings.add(amount, Amounts.MATH_CONTEXT);
        BigDecimal backing = Amounts.positivePart(cashSavings);
        if (emergencyFund.compareTo(backing) > 0) {
            emergencyFund = backing;
        }
    }

    public void addInvestment(BigDecimal amount) {
        investmentPortfolio = investmentPortfolio.add(amount, Amounts.MATH_CONTEXT);
    }

    public void growInvestments(BigDecimal monthlyRate) {
        investmentPortfolio = Amounts.grow(investmentPortfolio, monthlyRate);
    }

    /**
     * Sets the emergency fund target and earmarks as much existing cash towards it as possible.
     */
    public void openEmergencyFund(BigDecimal target) {
        emergencyFundTarget = target;
        emergencyFund = BigDecimal.ZERO;
        earmarkEmergencyFund(target);
    }

    public boolean isEmergencyFundComplete() {
        return emergencyFund.compareTo(emergencyFundTarget) >= 0;
    }

    public BigDecimal emergencyFundGap() {
        return Amounts.positivePart(emergencyFundTarget.subtract(emergencyFund, Amounts.MATH_CONTEXT));
    }

    /**
     * Marks part of the existing cash as emergency fund.
     */
    public void earmarkEmergencyFund(BigDecimal amount) {
        emergencyFund = emergencyFund.add(amount, Amounts.MATH_CONTEXT).min(Amounts.positivePart(cashSavings));
    }

    public void accrueDebtInterest(BigDecimal monthlyRate) {
        if (hasDebt()) {
            debtBalance = Amounts.grow(debtBalance, monthlyRate);
        }
    }

    /**
     * Pays down debt out of the month's surplus; cash is not touched, the caller allocates
     * only what is left. The payment is capped at the outstanding balance and the balance
     * never goes below zero.
     *
     * @return amount actually paid
     */
    public BigDecimal payDebt(BigDecimal requested) {
        if (!hasDebt() || requested.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal payment = requested.min(debtBalance);
        debtBalance = debtBalance.subtract(payment, Amounts.MATH_CONTEXT).max(BigDecimal.ZERO);
        return payment;
    }

    void recordSpending(BigDecimal amount) {
        totalSpent = totalSpent.add(amount, Amounts.MATH_CONTEXT);
    }

    void recordSaving(BigDecimal amount) {
        totalSaved = totalSaved.add(amount, Amounts.MATH_CONTEXT);
    }

    /**
     * One-off cash inflow outside regular income (bonus, windfall).
     */
    public void receiveWindfall(BigDecimal amount) {
        addCash(amount);
        recordSaving(amount);
    }

    /**
     * One-off cash outflow outside regular expenses.
     */
    public void payUnplannedExpense(BigDecimal amount) {
        addCash(amount.negate());
        recordSpending(amount);
        recordSaving(amount.negate());
    }

    public BigDecimal savings() {
        return cashSavings.add(investmentPortfolio, Amounts.MATH_CONTEXT);
    }

    TimelinePoint snapshot(int month) {
        return new TimelinePoint(month, savings(), debtBalance, totalSpent, totalSaved);
    }
}
