package com.example.infracopilot.controller;

import com.example.infracopilot.agent.InvalidRequestException;
import com.example.infracopilot.agent.NarrativeService;
import com.example.infracopilot.domain.ReportContext;
import com.example.infracopilot.monitoring.HealthAggregator;
import com.example.infracopilot.monitoring.MetricsSynthesizer;
import com.example.infracopilot.service.ReportCompiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Direct health, metrics and report endpoints. These bypass the agent; a
 * degraded report is still a 200 with ok=true.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final HealthAggregator healthAggregator;
    private final MetricsSynthesizer metricsSynthesizer;
    private final ReportCompiler reportCompiler;
    private final NarrativeService narrativeService;
    private final Clock clock;

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> healthz() {
        return ResponseEntity.ok(Map.of("ok", true, "timestamp", clock.instant()));
    }

    @GetMapping("/api/healthcheck")
    public ResponseEntity<Map<String, Object>> healthcheck() {
        return ResponseEntity.ok(Map.of("ok", true, "data", healthAggregator.aggregate()));
    }

    @GetMapping("/api/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(Map.of("ok", true, "data", metricsSynthesizer.synthesizeLive()));
    }

    @PostMapping("/api/report")
    public ResponseEntity<Map<String, Object>> report(@RequestBody(required = false) ReportRequest request) {
        ReportRequest body = request != null ? request : new ReportRequest(null, null, null);
        ReportContext report = reportCompiler.compile(body.health(), body.metrics(), parseFraming(body.framing()));
        String markdown = narrativeService.writeReport(report);
        log.info("Report generated (framing={}, risk={})", report.getFraming(), report.getRiskLevel());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("ok", true);
        response.put("report", report);
        response.put("reportMarkdown", markdown);
        response.put("usedModel", narrativeService.getModelId());
        return ResponseEntity.ok(response);
    }

    static ReportContext.Framing parseFraming(String framing) {
        if (framing == null || framing.isBlank()) {
            return ReportContext.Framing.STANDARD;
        }
        try {
            return ReportContext.Framing.valueOf(framing.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException("Unsupported framing: " + framing + " (expected standard or daily)");
        }
    }
}
