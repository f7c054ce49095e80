package com.qa.coverage.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.qa.coverage.dto.AutomationRunRequestDTO;
import com.qa.coverage.dto.ManualExecutionRequestDTO;
import com.qa.coverage.engine.EventSource;
import com.qa.coverage.engine.ExecutionResult;
import com.qa.coverage.events.ExecutionRecordedEvent;
import com.qa.coverage.model.Automation;
import com.qa.coverage.model.ManualExecution;
import com.qa.coverage.repository.AutomationRepository;
import com.qa.coverage.repository.ManualExecutionRepository;
import com.qa.coverage.utils.UtcTimes;

/**
 * Minimal producer side: records manual executions and automation runs and announces them so cached
 * trends for the affected scopes are dropped.
 */
@Service
public class ExecutionRecordService {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionRecordService.class);

    private final ManualExecutionRepository manualExecutionRepository;
    private final AutomationRepository automationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public ExecutionRecordService(ManualExecutionRepository manualExecutionRepository,
                                  AutomationRepository automationRepository,
                                  ApplicationEventPublisher eventPublisher, Clock clock) {
        this.manualExecutionRepository = manualExecutionRepository;
        this.automationRepository = automationRepository;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Transactional
    public ManualExecution recordManualExecution(ManualExecutionRequestDTO dto) {
        if (dto.getTestCaseId() == null) {
            throw new IllegalArgumentException("testCaseId is required");
        }
        ExecutionResult result = parseResult(dto.getResult());

        LocalDateTime now = UtcTimes.toLocal(clock.instant());
        ManualExecution execution = new ManualExecution();
        execution.setTestCaseId(dto.getTestCaseId());
        execution.setReleaseId(dto.getReleaseId());
        execution.setResult(result.name().toLowerCase(Locale.ROOT));
        execution.setExecutionDate(dto.getExecutionDate() == null ? now : UtcTimes.toLocal(dto.getExecutionDate()));
        execution.setCreatedOn(now);
        execution.setExecutedBy(dto.getExecutedBy());
        execution.setNotes(dto.getNotes());

        ManualExecution saved = manualExecutionRepository.save(execution);
        logger.info("Recorded manual execution {} for test case {}: {}", saved.getId(), saved.getTestCaseId(),
                saved.getResult());
        eventPublisher.publishEvent(new ExecutionRecordedEvent(this, saved.getTestCaseId(), EventSource.MANUAL));
        return saved;
    }

    @Transactional
    public Automation recordAutomationRun(Long automationId, AutomationRunRequestDTO dto) {
        Automation automation = automationRepository.findById(automationId)
                .orElseThrow(() -> new RecordNotFoundException("Automation not found with id " + automationId));
        if (StringUtils.isBlank(dto.getResult())) {
            throw new IllegalArgumentException("result is required");
        }
        // "error" is kept verbatim; the normalizer reads it as a failure
        String raw = dto.getResult().trim().toLowerCase(Locale.ROOT);
        if (!"error".equals(raw)) {
            raw = parseResult(raw).name().toLowerCase(Locale.ROOT);
        }

        Instant runDate = Optional.ofNullable(dto.getRunDate()).orElse(clock.instant());
        automation.setLastRunResult(raw);
        automation.setLastRunDate(UtcTimes.toLocal(runDate));
        automation.setModifiedOn(UtcTimes.toLocal(clock.instant()));

        Automation saved = automationRepository.save(automation);
        logger.info("Recorded run of automation {} for test case {}: {}", automationId, saved.getTestCaseId(), raw);
        eventPublisher.publishEvent(new ExecutionRecordedEvent(this, saved.getTestCaseId(), EventSource.AUTOMATED));
        return saved;
    }

    private static ExecutionResult parseResult(String raw) {
        return ExecutionResult.fromRaw(raw)
                .filter(r -> r != ExecutionResult.NOT_EXECUTED)
                .orElseThrow(() -> new IllegalArgumentException(
                        "result must be one of passed, failed, blocked, skipped; got '" + raw + "'"));
    }
}
