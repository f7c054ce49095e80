package com.qa.coverage.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds manual executions and automation runs into {@link StatusEvent}s grouped by test case.
 * Pure and order independent; sorting is left to the resolver.
 *
 * <ul>
 * <li>Manual result missing: {@link ExecutionResult#SKIPPED} (degraded).</li>
 * <li>Manual execution date missing: record creation time (degraded).</li>
 * <li>Manual record with neither timestamp, or an unknown result: malformed, dropped.</li>
 * <li>Automation without a last run result: no event.</li>
 * <li>Automation with a result but no run date, or an unknown result: malformed, dropped.</li>
 * </ul>
 */
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);

    public NormalizationResult normalize(Collection<ManualExecutionRecord> manualExecutions,
                                         Collection<AutomationRunRecord> automatedRuns) {
        Map<Long, List<StatusEvent>> events = new LinkedHashMap<>();
        NormalizationDiagnostics diagnostics = new NormalizationDiagnostics();

        if (manualExecutions != null) {
            for (ManualExecutionRecord record : manualExecutions) {
                toManualEvent(record, diagnostics).ifPresent(e -> add(events, e));
            }
        }
        if (automatedRuns != null) {
            for (AutomationRunRecord record : automatedRuns) {
                toAutomatedEvent(record, diagnostics).ifPresent(e -> add(events, e));
            }
        }
        return new NormalizationResult(events, diagnostics);
    }

    private Optional<StatusEvent> toManualEvent(ManualExecutionRecord record, NormalizationDiagnostics diagnostics) {
        if (record.getTestCaseId() == null) {
            logger.debug("Dropping manual execution {}: no test case", record.getId());
            diagnostics.manualMalformed();
            return Optional.empty();
        }

        boolean degraded = false;
        ExecutionResult result;
        Optional<String> raw = record.getResult().filter(s -> !s.isBlank());
        if (raw.isPresent()) {
            Optional<ExecutionResult> parsed = ExecutionResult.fromRaw(raw.get());
            if (parsed.isEmpty() || parsed.get() == ExecutionResult.NOT_EXECUTED) {
                logger.debug("Dropping manual execution {}: unknown result '{}'", record.getId(), raw.get());
                diagnostics.manualMalformed();
                return Optional.empty();
            }
            result = parsed.get();
        } else {
            result = ExecutionResult.SKIPPED;
            degraded = true;
        }

        Optional<Instant> createdAt = record.getCreatedAt();
        Instant effective;
        if (record.getExecutionDate().isPresent()) {
            effective = record.getExecutionDate().get();
        } else if (createdAt.isPresent()) {
            effective = createdAt.get();
            degraded = true;
        } else {
            logger.debug("Dropping manual execution {}: neither execution date nor creation time", record.getId());
            diagnostics.manualMalformed();
            return Optional.empty();
        }

        if (degraded) {
            diagnostics.manualDegraded();
        }
        return Optional.of(StatusEvent.manual(record.getTestCaseId(), result, effective,
                createdAt.orElse(effective), record.getId()));
    }

    private Optional<StatusEvent> toAutomatedEvent(AutomationRunRecord record, NormalizationDiagnostics diagnostics) {
        Optional<String> raw = record.getLastRunResult().filter(s -> !s.isBlank());
        if (raw.isEmpty()) {
            diagnostics.automationNeverRun();
            return Optional.empty();
        }
        if (record.getTestCaseId() == null) {
            logger.debug("Dropping automation {}: no test case", record.getAutomationId());
            diagnostics.automatedMalformed();
            return Optional.empty();
        }
        Optional<ExecutionResult> parsed = ExecutionResult.fromRaw(raw.get());
        if (parsed.isEmpty() || parsed.get() == ExecutionResult.NOT_EXECUTED) {
            logger.debug("Dropping automation {}: unknown result '{}'", record.getAutomationId(), raw.get());
            diagnostics.automatedMalformed();
            return Optional.empty();
        }
        if (record.getLastRunDate().isEmpty()) {
            logger.debug("Dropping automation {}: result without a run date", record.getAutomationId());
            diagnostics.automatedMalformed();
            return Optional.empty();
        }
        return Optional.of(StatusEvent.automated(record.getTestCaseId(), parsed.get(),
                record.getLastRunDate().get(), record.getAutomationId()));
    }

    private static void add(Map<Long, List<StatusEvent>> events, StatusEvent event) {
        events.computeIfAbsent(event.getTestCaseId(), k -> new ArrayList<>()).add(event);
    }
}
