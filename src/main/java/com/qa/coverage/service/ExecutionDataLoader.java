package com.qa.coverage.service;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.qa.coverage.engine.AutomationRunRecord;
import com.qa.coverage.engine.ManualExecutionRecord;
import com.qa.coverage.engine.ReleaseRef;
import com.qa.coverage.engine.RequirementRef;
import com.qa.coverage.engine.TestCaseLinks;
import com.qa.coverage.model.Automation;
import com.qa.coverage.model.ManualExecution;
import com.qa.coverage.model.TestCase;
import com.qa.coverage.repository.AutomationRepository;
import com.qa.coverage.repository.ManualExecutionRepository;
import com.qa.coverage.repository.ReleaseRepository;
import com.qa.coverage.repository.RequirementRepository;
import com.qa.coverage.repository.TestCaseRepository;
import com.qa.coverage.utils.LinkIdsParser;
import com.qa.coverage.utils.UtcTimes;

/**
 * Reads the directories and the two event sources and maps them into engine inputs.
 */
@Component
public class ExecutionDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionDataLoader.class);

    private final TestCaseRepository testCaseRepository;
    private final RequirementRepository requirementRepository;
    private final ReleaseRepository releaseRepository;
    private final ManualExecutionRepository manualExecutionRepository;
    private final AutomationRepository automationRepository;

    public ExecutionDataLoader(TestCaseRepository testCaseRepository,
                               RequirementRepository requirementRepository,
                               ReleaseRepository releaseRepository,
                               ManualExecutionRepository manualExecutionRepository,
                               AutomationRepository automationRepository) {
        this.testCaseRepository = testCaseRepository;
        this.requirementRepository = requirementRepository;
        this.releaseRepository = releaseRepository;
        this.manualExecutionRepository = manualExecutionRepository;
        this.automationRepository = automationRepository;
    }

    public ExecutionDataSet loadAll() {
        List<TestCaseLinks> testCases = testCaseRepository.findByIsActiveTrue().stream()
                .map(this::toLinks)
                .collect(Collectors.toList());
        List<RequirementRef> requirements = requirementRepository.findAll().stream()
                .map(r -> new RequirementRef(r.getIdRequirement(), r.getReleaseId()))
                .collect(Collectors.toList());
        List<ReleaseRef> releases = releaseRepository.findAll().stream()
                .map(r -> new ReleaseRef(r.getIdRelease()))
                .collect(Collectors.toList());

        // inactive test cases are out of every scope, their events are simply never looked at
        List<ManualExecutionRecord> manual = manualExecutionRepository.findAll().stream()
                .map(ExecutionDataLoader::toRecord)
                .collect(Collectors.toList());
        List<AutomationRunRecord> runs = automationRepository.findAll().stream()
                .map(ExecutionDataLoader::toRecord)
                .collect(Collectors.toList());

        logger.debug("Loaded {} test cases, {} requirements, {} releases, {} executions, {} automations",
                testCases.size(), requirements.size(), releases.size(), manual.size(), runs.size());
        return new ExecutionDataSet(testCases, requirements, releases, manual, runs);
    }

    /** Only the events of one test case; directories are not needed to resolve a single status. */
    public ExecutionDataSet loadForTestCase(Long testCaseId) {
        List<ManualExecutionRecord> manual = manualExecutionRepository.findByTestCaseId(testCaseId).stream()
                .map(ExecutionDataLoader::toRecord)
                .collect(Collectors.toList());
        List<AutomationRunRecord> runs = automationRepository.findByTestCaseId(testCaseId).stream()
                .map(ExecutionDataLoader::toRecord)
                .collect(Collectors.toList());
        return new ExecutionDataSet(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
                manual, runs);
    }

    public boolean isActiveTestCase(Long testCaseId) {
        return testCaseRepository.findByIdTCAndIsActiveTrue(testCaseId).isPresent();
    }

    TestCaseLinks toLinks(TestCase tc) {
        String context = "test case " + tc.getIdTC();
        Set<Long> requirementIds = LinkIdsParser.parseMetadataField(tc.getMetadataJson(), "requirementIds", context);
        if (requirementIds == null) {
            requirementIds = tc.getRequirementId() == null ? Collections.emptySet()
                    : Collections.singleton(tc.getRequirementId());
        }
        Set<Long> releaseIds = LinkIdsParser.parseMetadataField(tc.getMetadataJson(), "releaseIds", context);
        return new TestCaseLinks(tc.getIdTC(), requirementIds, releaseIds);
    }


    private static ManualExecutionRecord toRecord(ManualExecution e) {
        return new ManualExecutionRecord(e.getId(), e.getTestCaseId(), e.getResult(),
                UtcTimes.toInstant(e.getExecutionDate()), UtcTimes.toInstant(e.getCreatedOn()));
    }

    private static AutomationRunRecord toRecord(Automation a) {
        return new AutomationRunRecord(a.getIdAutomation(), a.getTestCaseId(), a.getLastRunResult(),
                UtcTimes.toInstant(a.getLastRunDate()));
    }
}
