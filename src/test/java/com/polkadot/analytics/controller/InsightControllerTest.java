package com.polkadot.analytics.controller;

import com.polkadot.analytics.exception.ConfigurationException;
import com.polkadot.analytics.model.InsightReport;
import com.polkadot.analytics.model.InsightsRequest;
import com.polkadot.analytics.service.InsightService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InsightController.class)
class InsightControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InsightService insightService;

    @Test
    void generate_forParachain() throws Exception {
        when(insightService.generate(any(InsightsRequest.class))).thenReturn(InsightReport.builder()
                .entityId("2004")
                .insights(List.of("TVL has increased by 12.0% over the past 30 days, indicating growth momentum."))
                .summary("TVL has increased by 12.0% over the past 30 days, indicating growth momentum.")
                .confidence(0.85)
                .dataPointsAnalyzed(30)
                .timeRangeDays(30)
                .aiEnhanced(false)
                .build());

        mockMvc.perform(post("/api/v1/insights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"entityId\":\"2004\",\"timeRangeDays\":30}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insights[0]").exists())
                .andExpect(jsonPath("$.confidence").value(0.85))
                .andExpect(jsonPath("$.aiEnhanced").value(false));

        ArgumentCaptor<InsightsRequest> request = ArgumentCaptor.forClass(InsightsRequest.class);
        verify(insightService).generate(request.capture());
        assertThat(request.getValue().getEntityId()).isEqualTo("2004");
        assertThat(request.getValue().getTimeRangeDays()).isEqualTo(30);
        assertThat(request.getValue().getIncludePredictions()).isNull();
    }

    @Test
    void generate_withoutBody_analyzesAllParachains() throws Exception {
        when(insightService.generate(any(InsightsRequest.class))).thenReturn(InsightReport.builder()
                .insights(List.of("No data available for analysis"))
                .summary("No data available for analysis")
                .confidence(0.85)
                .build());

        mockMvc.perform(post("/api/v1/insights"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.insights[0]").value("No data available for analysis"));

        ArgumentCaptor<InsightsRequest> request = ArgumentCaptor.forClass(InsightsRequest.class);
        verify(insightService).generate(request.capture());
        assertThat(request.getValue().getEntityId()).isNull();
    }

    @Test
    void generate_invalidRange_returns400() throws Exception {
        when(insightService.generate(any(InsightsRequest.class)))
                .thenThrow(new ConfigurationException("timeRangeDays must be positive, got 0"));

        mockMvc.perform(post("/api/v1/insights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"timeRangeDays\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("timeRangeDays must be positive, got 0"));
    }
}
