package com.gillianbc.networth.service.policy;

import com.gillianbc.networth.market.MarketDataProvider;
import com.gillianbc.networth.market.CyclePhase;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Amounts;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RealisticPolicyTest {

    @Test
    @DisplayName("Market returns are scaled to 80% after 20 years and 60% after 30")
    void horizonScale_stepsDown() {
        assertEquals(0, BigDecimal.ONE.compareTo(RealisticPolicy.horizonScale(240)));
        assertEquals(0, new BigDecimal("0.8").compareTo(RealisticPolicy.horizonScale(241)));
        assertEquals(0, new BigDecimal("0.6").compareTo(RealisticPolicy.horizonScale(361)));
    }

    @Test
    @DisplayName("Income tapers 2% a year after 30 years, never below 40%")
    void retirementTaper() {
        assertEquals(0, BigDecimal.ONE.compareTo(RealisticPolicy.retirementTaper(360)));
        assertEquals(0, new BigDecimal("0.98").compareTo(RealisticPolicy.retirementTaper(372)));
        assertEquals(0, new BigDecimal("0.80").compareTo(RealisticPolicy.retirementTaper(480)));
        assertEquals(0, new BigDecimal("0.40").compareTo(RealisticPolicy.retirementTaper(720)));
        assertEquals(0, new BigDecimal("0.40").compareTo(RealisticPolicy.retirementTaper(900)));
    }

    @Test
    @DisplayName("3% inflation and 5% interest on debt; income multiplier follows the taper")
    void assumptions() {
        RealisticPolicy policy = new RealisticPolicy(new MarketDataProvider());
        assertEquals(ModelVariant.REALISTIC, policy.variant());
        assertEquals(new BigDecimal("0.03"), policy.annualInflation());
        assertEquals(new BigDecimal("0.05"), policy.annualDebtInterest());
        assertEquals(0, new BigDecimal("0.98").compareTo(policy.incomeMultiplier(372)));
    }

    @Test
    @DisplayName("The sector adjustment follows the historical trend, a bull market, even through extrapolated recessions")
    void trendAdjustment_fixedByHistoricalTrend() {
        MarketDataProvider provider = new MarketDataProvider();
        RealisticPolicy policy = new RealisticPolicy(provider);

        assertEquals(CyclePhase.BUST, CyclePhase.forMonth(40));
        assertTrue(provider.combinedSampleFor(40, new Random(1)).isRecession());
        assertEquals(0, Amounts.monthly(new BigDecimal("0.02")).compareTo(policy.trendAdjustment()));
    }
}
