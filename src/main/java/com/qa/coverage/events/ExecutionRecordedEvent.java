package com.qa.coverage.events;

import com.qa.coverage.engine.EventSource;
import org.springframework.context.ApplicationEvent;

/**
 * Published whenever a manual execution or an automation run is recorded for a test case.
 */
public class ExecutionRecordedEvent extends ApplicationEvent {

    private final Long testCaseId;
    private final EventSource eventSource;

    public ExecutionRecordedEvent(Object source, Long testCaseId, EventSource eventSource) {
        super(source);
        this.testCaseId = testCaseId;
        this.eventSource = eventSource;
    }

    public Long getTestCaseId() {
        return testCaseId;
    }

    public EventSource getEventSource() {
        return eventSource;
    }
}
