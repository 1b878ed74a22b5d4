package com.example.infracopilot.controller;

import com.example.infracopilot.domain.MetricsSeries;
import com.example.infracopilot.domain.UnifiedHealthReport;

/**
 * Body of POST /api/report. Missing health or metrics are produced fresh.
 *
 * @param framing "standard" (default) or "daily"
 */
public record ReportRequest(UnifiedHealthReport health, MetricsSeries metrics, String framing) {
}
