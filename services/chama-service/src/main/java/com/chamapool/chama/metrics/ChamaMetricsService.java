package com.chamapool.chama.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Chama Metrics Service
 * Tracks group activity and rejected operations for monitoring
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChamaMetricsService {

    private final MeterRegistry meterRegistry;

    /**
     * Record one committed group event
     */
    public void recordGroupEvent(String eventType) {
        log.debug("Recording group event metric: type={}", eventType);

        Counter.builder("chama.group.events")
                .tag("type", eventType)
                .description("Number of committed group events by type")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record value moved through a group pool
     */
    public void recordPoolFlow(String direction, BigDecimal amount) {
        if (amount == null) {
            return;
        }
        Counter.builder("chama.pool.value")
                .tag("direction", direction)
                .description("Value moved into and out of group pools")
                .register(meterRegistry)
                .increment(amount.doubleValue());
    }

    /**
     * Record an operation rejected by a group or the registry
     */
    public void recordRejectedOperation(String operation, String errorCode) {
        Counter.builder("chama.operations.rejected")
                .tag("operation", operation)
                .tag("error_code", errorCode)
                .description("Group operations rejected by business rules")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record event publication failures
     */
    public void recordPublishFailure(String eventType) {
        Counter.builder("chama.events.publish.failures")
                .tag("type", eventType)
                .description("Group events that could not be published")
                .register(meterRegistry)
                .increment();
    }
}
