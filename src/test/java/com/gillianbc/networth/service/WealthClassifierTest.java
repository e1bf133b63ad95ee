package com.gillianbc.networth.service;

import com.gillianbc.networth.model.AvatarState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WealthClassifierTest {

    private final WealthClassifier classifier = new WealthClassifier();

    private AvatarState classify(String netWorth, String debt) {
        return classifier.classify(new BigDecimal(netWorth), new BigDecimal(debt));
    }

    @Test
    @DisplayName("Wealthy needs more than 50,000 and no debt at all")
    void classify_wealthy() {
        assertEquals(AvatarState.WEALTHY, classify("60000", "0"));
        assertEquals(AvatarState.THRIVING, classify("60000", "100"));
        assertEquals(AvatarState.THRIVING, classify("50000", "0"));
    }

    @Test
    @DisplayName("Thriving needs more than 10,000 with debt under a fifth of net worth")
    void classify_thriving() {
        assertEquals(AvatarState.THRIVING, classify("15000", "1000"));
        assertEquals(AvatarState.STABLE, classify("15000", "3000"));
        assertEquals(AvatarState.STABLE, classify("10000", "0"));
    }

    @Test
    @DisplayName("Stable needs a positive net worth above the debt")
    void classify_stable() {
        assertEquals(AvatarState.STABLE, classify("20000", "5000"));
        assertEquals(AvatarState.STRUGGLING, classify("5000", "6000"));
    }

    @Test
    @DisplayName("Zero or negative net worth is struggling")
    void classify_struggling() {
        assertEquals(AvatarState.STRUGGLING, classify("0", "0"));
        assertEquals(AvatarState.STRUGGLING, classify("-100", "0"));
    }

    @Test
    @DisplayName("A timeline point is classified on its net worth and debt")
    void classify_point() {
        assertEquals(AvatarState.WEALTHY, classifier.classify(Fixtures.point(1, "75000.00", "0")));
    }
}
