package com.parlayarchitect.event;

import com.parlayarchitect.domain.model.SelectionRequest;
import com.parlayarchitect.domain.model.SelectionResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per selection after the result is final and the audit record was written.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>SelectionMetricsService -- acceptance/rejection counters and relaxation depth</li>
 * </ul>
 */
public class SelectionCompletedEvent extends ApplicationEvent {

    private final SelectionRequest request;
    private final SelectionResult result;
    private final long elapsedNanos;

    public SelectionCompletedEvent(Object source, SelectionRequest request, SelectionResult result, long elapsedNanos) {
        super(source);
        this.request = request;
        this.result = result;
        this.elapsedNanos = elapsedNanos;
    }

    /** May be null when the caller passed no request. */
    public SelectionRequest getRequest() {
        return request;
    }

    public SelectionResult getResult() {
        return result;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }
}
