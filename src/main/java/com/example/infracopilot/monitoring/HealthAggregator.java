package com.example.infracopilot.monitoring;

import com.example.infracopilot.config.CopilotProperties;
import com.example.infracopilot.domain.CloudHealthSnapshot;
import com.example.infracopilot.domain.EndpointCheckResult;
import com.example.infracopilot.domain.EndpointChecks;
import com.example.infracopilot.domain.HealthSummary;
import com.example.infracopilot.domain.LocalHealthSnapshot;
import com.example.infracopilot.domain.UnifiedHealthReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fans out to the health sources and merges their outcomes.
 *
 * The local check runs on the caller's thread. The cloud check and every
 * endpoint run as independent branches on the health-check executor, each with
 * its own budget; a branch that overruns or fails resolves to its failure
 * outcome without affecting its siblings. Results are merged in declaration
 * order regardless of completion order.
 */
@Slf4j
@Service
public class HealthAggregator {

    /** Extra time granted to an endpoint branch beyond the probe's own call timeout. */
    static final Duration ENDPOINT_GRACE = Duration.ofMillis(500);

    private final HealthSource<LocalThresholds, LocalHealthSnapshot> localSource;
    private final HealthSource<CloudScope, CloudHealthSnapshot> cloudSource;
    private final HealthSource<EndpointTarget, EndpointCheckResult> endpointSource;
    private final Executor executor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final HealthCheckConfig defaultConfig;

    public HealthAggregator(HealthSource<LocalThresholds, LocalHealthSnapshot> localSource,
                            HealthSource<CloudScope, CloudHealthSnapshot> cloudSource,
                            HealthSource<EndpointTarget, EndpointCheckResult> endpointSource,
                            @Qualifier("healthCheckExecutor") Executor executor,
                            MeterRegistry meterRegistry,
                            Clock clock,
                            CopilotProperties properties,
                            ObjectMapper objectMapper) {
        this.localSource = localSource;
        this.cloudSource = cloudSource;
        this.endpointSource = endpointSource;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.defaultConfig = HealthCheckConfig.from(properties, objectMapper);
        log.info("Health aggregation configured: cloud={}, endpoints={}",
                defaultConfig.cloudScope().isConfigured(), defaultConfig.endpoints().size());
    }

    /** Aggregates with the configuration bound at startup. */
    public UnifiedHealthReport aggregate() {
        return aggregate(defaultConfig);
    }

    public HealthCheckConfig getDefaultConfig() {
        return defaultConfig;
    }

    public UnifiedHealthReport aggregate(HealthCheckConfig config) {
        Timer.Sample sample = Timer.start(meterRegistry);

        CompletableFuture<CloudHealthSnapshot> cloudFuture = cloudBranch(config);
        List<CompletableFuture<EndpointCheckResult>> endpointFutures = new ArrayList<>();
        for (EndpointTarget target : config.endpoints()) {
            endpointFutures.add(endpointBranch(target));
        }

        LocalHealthSnapshot local = checkLocal(config.thresholds());

        List<CompletableFuture<?>> all = new ArrayList<>(endpointFutures);
        all.add(cloudFuture);
        CompletableFuture.allOf(all.toArray(new CompletableFuture[0])).join();

        CloudHealthSnapshot azure = cloudFuture.join();
        EndpointChecks.EndpointChecksBuilder custom = EndpointChecks.builder()
                .configured(!config.endpoints().isEmpty());
        for (CompletableFuture<EndpointCheckResult> future : endpointFutures) {
            EndpointCheckResult result = future.join();
            custom.result(result);
            if (!result.isUp()) {
                custom.warning(EndpointHealthSource.warningFor(result));
            }
            countEndpoint(result);
        }
        EndpointChecks endpoints = custom.build();

        HealthSummary summary = HealthSummary.compute(local, azure, endpoints);
        UnifiedHealthReport report = UnifiedHealthReport.builder()
                .timestamp(clock.instant())
                .summary(summary)
                .warnings(local.getWarnings())
                .warnings(azure.getWarnings())
                .warnings(endpoints.getWarnings())
                .local(local)
                .azure(azure)
                .custom(endpoints)
                .build();

        sample.stop(Timer.builder("infracopilot.health.aggregation")
                .tag("cloud", azure.getStatus().getWireName())
                .register(meterRegistry));
        log.info("Health aggregated: total={}, healthy={}, warnings={}",
                summary.getTotal(), summary.getHealthy(), summary.getWarnings());
        return report;
    }

    private LocalHealthSnapshot checkLocal(LocalThresholds thresholds) {
        try {
            return localSource.check(thresholds);
        } catch (RuntimeException e) {
            log.error("Local health source threw unexpectedly", e);
            return LocalHealthSnapshot.builder()
                    .warning("LOCAL: metrics unavailable - " + e.getMessage())
                    .build();
        }
    }

    private CompletableFuture<CloudHealthSnapshot> cloudBranch(HealthCheckConfig config) {
        CloudScope scope = config.cloudScope();
        if (!scope.isConfigured()) {
            return CompletableFuture.completedFuture(CloudHealthSnapshot.notConfigured());
        }
        Duration timeout = config.cloudTimeout();
        return launch("Cloud", () -> cloudSource.check(scope), timeout.toMillis(),
                cloudTimedOut(timeout), HealthAggregator::cloudFailed);
    }

    private CompletableFuture<EndpointCheckResult> endpointBranch(EndpointTarget target) {
        long budget = target.timeout().plus(ENDPOINT_GRACE).toMillis();
        return launch("Endpoint " + target.name(), () -> endpointSource.check(target), budget,
                EndpointHealthSource.timedOut(target),
                reason -> EndpointCheckResult.down(target.name(), target.url(), reason, null));
    }

    /**
     * Runs one branch on the executor. The budget is armed when the task starts
     * running, so time spent waiting for a pool thread is not charged to it. A
     * rejected submission resolves to the branch's failure outcome.
     */
    private <T> CompletableFuture<T> launch(String branchName, Supplier<T> task, long budgetMillis,
                                            T timedOut, Function<String, T> failed) {
        CompletableFuture<T> branch = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                branch.completeOnTimeout(timedOut, budgetMillis, TimeUnit.MILLISECONDS);
                try {
                    branch.complete(task.get());
                } catch (RuntimeException e) {
                    log.error("{} branch failed", branchName, e);
                    branch.complete(failed.apply(causeMessage(e)));
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("{} branch rejected by the health-check executor", branchName, e);
            branch.complete(failed.apply("health-check executor saturated"));
        }
        return branch;
    }

    private void countEndpoint(EndpointCheckResult result) {
        Counter.builder("infracopilot.endpoint.checks")
                .tag("endpoint", result.getName())
                .tag("status", result.getStatus().name())
                .register(meterRegistry)
                .increment();
    }

    private static String causeMessage(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    static CloudHealthSnapshot cloudTimedOut(Duration timeout) {
        String reason = "check timed out after " + timeout.toSeconds() + "s";
        return CloudHealthSnapshot.builder()
                .configured(true)
                .status(CloudHealthSnapshot.Status.WARNINGS)
                .message("Azure " + reason)
                .warning("AZURE: " + reason)
                .build();
    }

    private static CloudHealthSnapshot cloudFailed(String reason) {
        return CloudHealthSnapshot.builder()
                .configured(true)
                .status(CloudHealthSnapshot.Status.WARNINGS)
                .message("Azure checks failed: " + reason)
                .warning("AZURE: check failed - " + reason)
                .build();
    }
}
