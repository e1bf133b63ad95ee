package com.gillianbc.networth.service;

import com.gillianbc.networth.model.InvalidProjectionInputException;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.model.PromotionEvent;
import com.gillianbc.networth.model.PromotionKind;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class PromotionSchedulerTest {

    private final PromotionScheduler scheduler = new PromotionScheduler();

    @Test
    @DisplayName("The linear model has no income events")
    void schedule_linear_isEmpty() {
        assertTrue(scheduler.schedule(600, ModelVariant.LINEAR, 42L).isEmpty());
    }

    @Test
    @DisplayName("Events are 18 to 30 months apart and stay inside the horizon")
    void schedule_spacingAndBounds() {
        for (long seed = 0; seed < 50; seed++) {
            List<PromotionEvent> events = scheduler.schedule(480, ModelVariant.REALISTIC, seed);
            assertFalse(events.isEmpty());

            int previous = 0;
            for (PromotionEvent event : events) {
                int gap = event.getMonth() - previous;
                assertTrue(gap >= 18 && gap <= 30, "gap of " + gap + " months with seed " + seed);
                assertTrue(event.getMonth() <= 480);
                previous = event.getMonth();
            }
        }
    }

    @Test
    @DisplayName("A horizon shorter than the minimum gap has no events")
    void schedule_shortHorizon_isEmpty() {
        assertTrue(scheduler.schedule(12, ModelVariant.OPTIMISTIC, 42L).isEmpty());
    }

    @Test
    @DisplayName("The savings model only ever gives 1% raises")
    void schedule_savings_promotionsOnly() {
        List<PromotionEvent> events = scheduler.schedule(360, ModelVariant.SAVINGS, 7L);

        assertFalse(events.isEmpty());
        for (PromotionEvent event : events) {
            assertEquals(PromotionKind.PROMOTION, event.getKind());
            assertEquals(new BigDecimal("0.01"), event.getSalaryIncreaseFraction());
            assertEquals(0, event.getBonusFraction().signum());
        }
    }

    @Test
    @DisplayName("Realistic events carry the terms of their kind")
    void schedule_realistic_termsMatchKind() {
        for (long seed = 0; seed < 20; seed++) {
            for (PromotionEvent event : scheduler.schedule(600, ModelVariant.REALISTIC, seed)) {
                switch (event.getKind()) {
                    case PROMOTION -> assertEquals(new BigDecimal("0.04"), event.getSalaryIncreaseFraction());
                    case JOB_CHANGE -> assertEquals(new BigDecimal("0.12"), event.getSalaryIncreaseFraction());
                    case BONUS -> {
                        assertEquals(0, event.getSalaryIncreaseFraction().signum());
                        assertEquals(new BigDecimal("0.08"), event.getBonusFraction());
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Same seed, horizon and variant: same schedule")
    void schedule_isDeterministic() {
        assertEquals(
                scheduler.schedule(360, ModelVariant.EXPONENTIAL, 99L),
                scheduler.schedule(360, ModelVariant.EXPONENTIAL, 99L));
    }

    @Test
    @DisplayName("Horizon must be at least one month")
    void schedule_zeroMonths_throws() {
        assertThrows(InvalidProjectionInputException.class, () -> scheduler.schedule(0, ModelVariant.REALISTIC, 1L));
    }
}
