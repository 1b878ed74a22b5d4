package com.example.infracopilot.monitoring;

import com.example.infracopilot.domain.EndpointCheckResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Probes one endpoint. 200 through 399 is UP; any other status, a timeout or a
 * connection error is DOWN.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EndpointHealthSource implements HealthSource<EndpointTarget, EndpointCheckResult> {

    private final EndpointProbe probe;

    @Override
    public EndpointCheckResult check(EndpointTarget target) {
        long start = System.nanoTime();
        try {
            int code = probe.probe(target.url(), target.timeout());
            long latency = elapsedMillis(start);
            if (code >= 200 && code < 400) {
                return EndpointCheckResult.builder()
                        .name(target.name())
                        .url(target.url())
                        .status(EndpointCheckResult.Status.UP)
                        .httpStatus(code)
                        .latencyMs(latency)
                        .build();
            }
            log.warn("Endpoint {} answered {}", target.name(), code);
            return EndpointCheckResult.builder()
                    .name(target.name())
                    .url(target.url())
                    .status(EndpointCheckResult.Status.DOWN)
                    .httpStatus(code)
                    .latencyMs(latency)
                    .error("Bad status " + code)
                    .build();
        } catch (Exception e) {
            log.warn("Endpoint {} unreachable: {}", target.name(), e.getMessage());
            return EndpointCheckResult.down(target.name(), target.url(), describe(e), elapsedMillis(start));
        }
    }

    /** The result a branch resolves to when it exceeds its time budget. */
    public static EndpointCheckResult timedOut(EndpointTarget target) {
        return EndpointCheckResult.down(target.name(), target.url(),
                "Timed out after " + target.timeout().toMillis() + "ms", target.timeout().toMillis());
    }

    static String warningFor(EndpointCheckResult result) {
        return "CUSTOM: " + result.getName() + " DOWN (" + result.getError() + ")";
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
