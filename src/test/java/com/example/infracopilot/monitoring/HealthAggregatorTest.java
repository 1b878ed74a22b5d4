package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.AsyncConfig;
import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.CloudHealthSnapshot;
import com.example.infracopilot.domain.CloudResource;
import com.example.infracopilot.domain.EndpointCheckResult;
import com.example.infracopilot.domain.HealthSummary;
import com.example.infracopilot.domain.LocalHealthSnapshot;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class HealthAggregatorTest {

    private static final LocalThresholds THRESHOLDS = new LocalThresholds(85, 90, 90);
    private static final CloudScope SCOPE = new CloudScope("sub-1", "rg-prod");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    private final ExecutorService executor = Executors.newFixedThreadPool(8);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    private HealthSource<LocalThresholds, LocalHealthSnapshot> localSource =
            thresholds -> LocalHealthSnapshot.builder().cpuPercent(12).memoryPercent(40).diskPercent(55).build();
    private HealthSource<CloudScope, CloudHealthSnapshot> cloudSource = scope -> CloudHealthSnapshot.builder()
            .configured(true).status(CloudHealthSnapshot.Status.OK).message("Azure checks executed.").build();
    private HealthSource<EndpointTarget, EndpointCheckResult> endpointSource = HealthAggregatorTest::up;

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private HealthAggregator aggregator(CopilotProperties properties) {
        return aggregator(properties, executor);
    }

    private HealthAggregator aggregator(CopilotProperties properties, Executor branchExecutor) {
        return new HealthAggregator(localSource, cloudSource, endpointSource, branchExecutor, meterRegistry, CLOCK,
                properties, new ObjectMapper());
    }

    private HealthAggregator aggregator() {
        return aggregator(new CopilotProperties());
    }

    private static HealthCheckConfig config(CloudScope scope, List<EndpointTarget> endpoints) {
        return new HealthCheckConfig(THRESHOLDS, scope, endpoints, Duration.ofSeconds(5));
    }

    private static EndpointTarget target(String name) {
        return new EndpointTarget(name, "http://" + name + ".internal/health", Duration.ofSeconds(2));
    }

    private static EndpointCheckResult up(EndpointTarget target) {
        return EndpointCheckResult.builder().name(target.name()).url(target.url())
                .status(EndpointCheckResult.Status.UP).httpStatus(200).latencyMs(3L).build();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Test
    void unconfiguredSourcesStillProduceLocalReport() {
        cloudSource = scope -> fail("cloud source must not run without a scope");

        UnifiedHealthReport report = aggregator().aggregate();

        assertEquals(CloudHealthSnapshot.Status.NOT_CONFIGURED, report.getAzure().getStatus());
        assertFalse(report.getCustom().isConfigured());
        assertTrue(report.getCustom().getResults().isEmpty());
        assertEquals(HealthSummary.builder().total(1).healthy(1).warnings(0).build(), report.getSummary());
        assertEquals(CLOCK.instant(), report.getTimestamp());
    }

    @Test
    void endpointResultsKeepDeclarationOrder() {
        endpointSource = target -> {
            sleep(target.name().equals("first") ? 300 : 0);
            return up(target);
        };

        UnifiedHealthReport report = aggregator().aggregate(config(new CloudScope("", ""),
                List.of(target("first"), target("second"), target("third"))));

        assertEquals(List.of("first", "second", "third"),
                report.getCustom().getResults().stream().map(EndpointCheckResult::getName).toList());
        assertTrue(report.getCustom().isConfigured());
        assertEquals(4, report.getSummary().getTotal());
    }

    @Test
    void overrunningEndpointTimesOutWithoutDelayingSiblings() {
        endpointSource = target -> {
            if (target.name().equals("stuck")) {
                sleep(5_000);
            }
            return up(target);
        };
        EndpointTarget stuck = new EndpointTarget("stuck", "http://stuck.internal", Duration.ofMillis(100));

        long start = System.nanoTime();
        UnifiedHealthReport report = aggregator().aggregate(config(new CloudScope("", ""),
                List.of(stuck, target("ok"))));
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertTrue(elapsedMillis < 3_000, "aggregation waited " + elapsedMillis + "ms");
        EndpointCheckResult stuckResult = report.getCustom().getResults().get(0);
        assertEquals(EndpointCheckResult.Status.DOWN, stuckResult.getStatus());
        assertEquals("Timed out after 100ms", stuckResult.getError());
        assertEquals(EndpointCheckResult.Status.UP, report.getCustom().getResults().get(1).getStatus());
        assertEquals(List.of("CUSTOM: stuck DOWN (Timed out after 100ms)"), report.getWarnings());
    }

    @Test
    void moreSlowEndpointsThanCoreThreadsAllStayUp() {
        endpointSource = target -> {
            sleep(target.name().equals("ninth") ? 700 : 900);
            return up(target);
        };
        List<EndpointTarget> targets = new ArrayList<>();
        for (int i = 1; i <= 8; i++) {
            targets.add(new EndpointTarget("slow-" + i, "http://slow-" + i + ".internal", Duration.ofSeconds(1)));
        }
        targets.add(new EndpointTarget("ninth", "http://ninth.internal", Duration.ofSeconds(1)));

        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) new AsyncConfig().healthCheckExecutor();
        try {
            UnifiedHealthReport report = aggregator(new CopilotProperties(), pool)
                    .aggregate(config(new CloudScope("", ""), targets));

            for (EndpointCheckResult result : report.getCustom().getResults()) {
                assertEquals(EndpointCheckResult.Status.UP, result.getStatus(), result.getName() + ": " + result.getError());
            }
            assertEquals(10, report.getSummary().getHealthy());
        } finally {
            pool.shutdown();
        }
    }

    @Test
    void waitingForAThreadDoesNotCountAgainstTheBudget() {
        endpointSource = target -> {
            sleep(900);
            return up(target);
        };
        EndpointTarget first = new EndpointTarget("first", "http://first.internal", Duration.ofSeconds(1));
        EndpointTarget second = new EndpointTarget("second", "http://second.internal", Duration.ofSeconds(1));

        ExecutorService single = Executors.newSingleThreadExecutor();
        try {
            UnifiedHealthReport report = aggregator(new CopilotProperties(), single)
                    .aggregate(config(new CloudScope("", ""), List.of(first, second)));

            assertEquals(EndpointCheckResult.Status.UP, report.getCustom().getResults().get(0).getStatus());
            assertEquals(EndpointCheckResult.Status.UP, report.getCustom().getResults().get(1).getStatus());
        } finally {
            single.shutdownNow();
        }
    }

    @Test
    void rejectedBranchesResolveToTheirFailureOutcome() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("pool exhausted");
        };

        UnifiedHealthReport report = aggregator(new CopilotProperties(), saturated)
                .aggregate(config(SCOPE, List.of(target("api"))));

        EndpointCheckResult api = report.getCustom().getResults().get(0);
        assertEquals(EndpointCheckResult.Status.DOWN, api.getStatus());
        assertEquals("health-check executor saturated", api.getError());
        assertEquals(List.of(
                "AZURE: check failed - health-check executor saturated",
                "CUSTOM: api DOWN (health-check executor saturated)"), report.getWarnings());
    }

    @Test
    void cloudTimeoutIsReportedAsWarnings() {
        cloudSource = scope -> {
            sleep(5_000);
            return CloudHealthSnapshot.notConfigured();
        };

        UnifiedHealthReport report = aggregator().aggregate(
                new HealthCheckConfig(THRESHOLDS, SCOPE, List.of(target("api")), Duration.ofSeconds(1)));

        assertEquals(CloudHealthSnapshot.Status.WARNINGS, report.getAzure().getStatus());
        assertEquals(List.of("AZURE: check timed out after 1s"), report.getAzure().getWarnings());
        assertEquals(EndpointCheckResult.Status.UP, report.getCustom().getResults().get(0).getStatus());
    }

    @Test
    void failingBranchesAreIsolated() {
        cloudSource = scope -> {
            throw new IllegalStateException("cloud exploded");
        };
        localSource = thresholds -> {
            throw new IllegalStateException("no mxbean");
        };

        UnifiedHealthReport report = aggregator().aggregate(config(SCOPE, List.of(target("api"))));

        assertEquals(List.of(
                "LOCAL: metrics unavailable - no mxbean",
                "AZURE: check failed - cloud exploded"), report.getWarnings());
        assertEquals(EndpointCheckResult.Status.UP, report.getCustom().getResults().get(0).getStatus());
        assertEquals(2, report.getSummary().getTotal());
        assertEquals(1, report.getSummary().getWarnings());
    }

    @Test
    void warningsAreOrderedLocalCloudEndpoints() {
        localSource = thresholds -> LocalHealthSnapshot.builder().cpuPercent(97).warning("LOCAL: High CPU").build();
        cloudSource = scope -> CloudHealthSnapshot.authFailed("401");
        endpointSource = target -> EndpointCheckResult.down(target.name(), target.url(), "Bad status 503", 4L);

        UnifiedHealthReport report = aggregator().aggregate(config(SCOPE, List.of(target("api"))));

        assertEquals(List.of("LOCAL: High CPU", "AZURE: auth_failed - 401", "CUSTOM: api DOWN (Bad status 503)"),
                report.getWarnings());
        assertEquals(HealthSummary.builder().total(2).healthy(0).warnings(2).build(), report.getSummary());
    }

    @RepeatedTest(20)
    void summaryAlwaysBalances() {
        Random random = new Random();
        boolean localHealthy = random.nextBoolean();
        localSource = thresholds -> localHealthy
                ? LocalHealthSnapshot.builder().build()
                : LocalHealthSnapshot.builder().warning("LOCAL: High Disk").build();

        List<CloudResource> vms = new ArrayList<>();
        int vmCount = random.nextInt(5);
        for (int i = 0; i < vmCount; i++) {
            boolean healthy = random.nextBoolean();
            vms.add(CloudResource.builder().name("vm-" + i).kind(CloudResource.Kind.VM)
                    .state(healthy ? "running" : "unknown").healthy(healthy).build());
        }
        cloudSource = scope -> CloudHealthSnapshot.builder().configured(true)
                .status(CloudHealthSnapshot.Status.WARNINGS).vms(vms).build();

        Map<String, Boolean> upByName = new ConcurrentHashMap<>();
        List<EndpointTarget> targets = new ArrayList<>();
        int endpointCount = random.nextInt(6);
        for (int i = 0; i < endpointCount; i++) {
            EndpointTarget target = target("ep" + i);
            upByName.put(target.name(), random.nextBoolean());
            targets.add(target);
        }
        endpointSource = target -> upByName.get(target.name())
                ? up(target)
                : EndpointCheckResult.down(target.name(), target.url(), "Bad status 500", 1L);

        HealthSummary summary = aggregator().aggregate(config(SCOPE, targets)).getSummary();

        long expectedDegraded = (localHealthy ? 0 : 1)
                + vms.stream().filter(vm -> !vm.isHealthy()).count()
                + upByName.values().stream().filter(isUp -> !isUp).count();
        assertEquals(1 + vms.size() + targets.size(), summary.getTotal());
        assertEquals(summary.getTotal(), summary.getHealthy() + summary.getWarnings());
        assertEquals(expectedDegraded, summary.getWarnings());
    }

    @Test
    void recordsTimerAndEndpointCounters() {
        aggregator().aggregate(config(new CloudScope("", ""), List.of(target("api"))));

        assertEquals(1, meterRegistry.get("infracopilot.health.aggregation").tag("cloud", "not_configured")
                .timer().count());
        assertEquals(1.0, meterRegistry.get("infracopilot.endpoint.checks").tag("endpoint", "api")
                .tag("status", "UP").counter().count());
    }

    @Test
    void defaultConfigReadsEndpointJson() {
        CopilotProperties properties = new CopilotProperties();
        properties.getEndpoints().setJson(
                "[{\"name\":\"api\",\"url\":\"https://api.example.com/health\"},{\"name\":\"\",\"url\":\"x\"}]");

        HealthCheckConfig config = aggregator(properties).getDefaultConfig();

        assertEquals(1, config.endpoints().size());
        assertEquals(Duration.ofSeconds(5), config.endpoints().get(0).timeout());
    }

    @Test
    void invalidEndpointJsonFailsFast() {
        CopilotProperties properties = new CopilotProperties();
        properties.getEndpoints().setJson("{\"name\":\"api\"}");

        assertThrows(IllegalArgumentException.class, () -> aggregator(properties));
    }
}
