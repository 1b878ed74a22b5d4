package com.example.infracopilot.controller;

import com.example.infracopilot.agent.NarrativeService;
import com.example.infracopilot.agent.NarrativeServiceException;
import com.example.infracopilot.config.AppConfig;
import com.example.infracopilot.domain.CloudHealthSnapshot;
import com.example.infracopilot.domain.EndpointChecks;
import com.example.infracopilot.domain.HealthSummary;
import com.example.infracopilot.domain.LocalHealthSnapshot;
import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.example.infracopilot.monitoring.HealthAggregator;
import com.example.infracopilot.monitoring.MetricsSynthesizer;
import com.example.infracopilot.service.ReportCompiler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
@Import(AppConfig.class)
class HealthControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthAggregator healthAggregator;

    @MockBean
    private MetricsSynthesizer metricsSynthesizer;

    @MockBean
    private ReportCompiler reportCompiler;

    @MockBean
    private NarrativeService narrativeService;

    private static UnifiedHealthReport degradedReport() {
        return UnifiedHealthReport.builder()
                .timestamp(NOW)
                .summary(HealthSummary.builder().total(2).healthy(1).warnings(1).build())
                .warning("CUSTOM: api DOWN (Bad status 503)")
                .local(LocalHealthSnapshot.builder().cpuPercent(12.5).build())
                .azure(CloudHealthSnapshot.notConfigured())
                .custom(EndpointChecks.builder().configured(true).warning("CUSTOM: api DOWN (Bad status 503)").build())
                .build();
    }

    @Test
    void livenessNeedsNoDependencies() throws Exception {
        mockMvc.perform(get("/healthz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void degradedHealthIsStillOk() throws Exception {
        when(healthAggregator.aggregate()).thenReturn(degradedReport());

        mockMvc.perform(get("/api/healthcheck"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.summary.warnings").value(1))
                .andExpect(jsonPath("$.data.local.cpu_percent").value(12.5))
                .andExpect(jsonPath("$.data.azure.status").value("not_configured"))
                .andExpect(jsonPath("$.data.warnings[0]").value("CUSTOM: api DOWN (Bad status 503)"));
    }

    @Test
    void metricsAreMarkedSynthetic() throws Exception {
        when(metricsSynthesizer.synthesizeLive()).thenReturn(MetricsSeries.builder()
                .timestamp(NOW).cpu(List.of()).memory(List.of()).build());

        mockMvc.perform(get("/api/metrics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.range").value("24h"))
                .andExpect(jsonPath("$.data.syntheticTrend").value(true));
    }

    @Test
    void reportWithoutBodyCompilesFreshData() throws Exception {
        ReportContext report = ReportContext.builder()
                .generatedAt(NOW)
                .framing(ReportContext.Framing.DAILY)
                .riskLevel(ReportContext.RiskLevel.MEDIUM)
                .build();
        when(reportCompiler.compile(isNull(), isNull(), eq(ReportContext.Framing.DAILY))).thenReturn(report);
        when(narrativeService.writeReport(report)).thenReturn("## Daily report");
        when(narrativeService.getModelId()).thenReturn("gemini-1.5-flash");

        mockMvc.perform(post("/api/report")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"framing\":\"daily\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.report.riskLevel").value("MEDIUM"))
                .andExpect(jsonPath("$.reportMarkdown").value("## Daily report"))
                .andExpect(jsonPath("$.usedModel").value("gemini-1.5-flash"));
    }

    @Test
    void narrativeOutageIsBadGateway() throws Exception {
        when(reportCompiler.compile(any(), any(), any())).thenReturn(ReportContext.builder().build());
        when(narrativeService.writeReport(any())).thenThrow(new NarrativeServiceException("LLM API error 503: overloaded"));

        mockMvc.perform(post("/api/report").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.code").value("NARRATIVE_UNAVAILABLE"));
    }

    @Test
    void unknownFramingIsRejected() throws Exception {
        mockMvc.perform(post("/api/report").contentType(MediaType.APPLICATION_JSON).content("{\"framing\":\"weekly\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));
    }

    @Test
    void parsesFraming() {
        assertEquals(ReportContext.Framing.STANDARD, HealthController.parseFraming(null));
        assertEquals(ReportContext.Framing.DAILY, HealthController.parseFraming(" Daily "));
    }
}
