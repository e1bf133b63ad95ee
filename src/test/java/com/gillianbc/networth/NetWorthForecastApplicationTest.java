package com.gillianbc.networth;

import com.gillianbc.networth.config.ProjectionProperties;
import com.gillianbc.networth.model.ForecastRequest;
import com.gillianbc.networth.model.ForecastResult;
import com.gillianbc.networth.model.ModelVariant;
import com.gillianbc.networth.service.Fixtures;
import com.gillianbc.networth.service.ForecastService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@SpringBootTest
class NetWorthForecastApplicationTest {

    @Autowired
    private ForecastService forecastService;

    @Autowired
    private ProjectionProperties properties;

    @Test
    @DisplayName("Defaults are bound from application.properties")
    void properties_bound() {
        assertEquals(12, properties.defaultMonths());
        assertEquals(120, properties.maxMonths());
        assertEquals("realistic", properties.defaultVariant());
        assertNull(properties.seed());
    }

    @Test
    @DisplayName("All seven policies are wired and a default forecast runs")
    void forecast_wired() {
        ForecastResult result = forecastService.forecast(ForecastRequest.builder().profile(Fixtures.profile()).seed(42L).build());

        assertEquals(ModelVariant.REALISTIC, result.getVariant());
        assertEquals(12, result.getStatusQuo().size());
    }
}
