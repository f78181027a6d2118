package com.parlayarchitect.observability;

import com.parlayarchitect.domain.enums.RejectionReason;
import com.parlayarchitect.domain.model.SelectionResult;
import com.parlayarchitect.event.SelectionCompletedEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the selection engine, fed by {@link SelectionCompletedEvent}.
 *
 * <ul>
 *   <li><b>parlay.selection.accepted</b> (counter): accepted selections</li>
 *   <li><b>parlay.selection.rejected</b> (counter, tag {@code reason}): rejections per reason code</li>
 *   <li><b>parlay.selection.relaxation.step</b> (summary): ladder rung of each acceptance</li>
 *   <li><b>parlay.selection.latency</b> (timer): end-to-end selection time</li>
 * </ul>
 */
@Service
public class SelectionMetricsService {

    private final Counter acceptedCounter;
    private final Map<RejectionReason, Counter> rejectedCounters = new EnumMap<>(RejectionReason.class);
    private final DistributionSummary relaxationStepSummary;
    private final Timer selectionTimer;

    public SelectionMetricsService(MeterRegistry meterRegistry) {
        this.acceptedCounter = Counter.builder("parlay.selection.accepted")
                .description("Selections that produced a complete parlay")
                .register(meterRegistry);

        for (RejectionReason reason : RejectionReason.values()) {
            rejectedCounters.put(
                    reason,
                    Counter.builder("parlay.selection.rejected")
                            .description("Selections rejected, by reason code")
                            .tag("reason", reason.name())
                            .register(meterRegistry));
        }

        this.relaxationStepSummary = DistributionSummary.builder("parlay.selection.relaxation.step")
                .description("Fallback ladder step at which a selection was accepted")
                .register(meterRegistry);

        this.selectionTimer = Timer.builder("parlay.selection.latency")
                .description("End-to-end selection time including intake and ladder")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);
    }

    @EventListener
    @Order(20)
    public void onSelectionCompleted(SelectionCompletedEvent event) {
        SelectionResult result = event.getResult();
        if (result instanceof SelectionResult.Accepted accepted) {
            acceptedCounter.increment();
            relaxationStepSummary.record(accepted.getRelaxationStep());
        } else if (result instanceof SelectionResult.Rejected rejected) {
            rejectedCounters.get(rejected.getReasonCode()).increment();
        }
        selectionTimer.record(event.getElapsedNanos(), TimeUnit.NANOSECONDS);
    }
}
