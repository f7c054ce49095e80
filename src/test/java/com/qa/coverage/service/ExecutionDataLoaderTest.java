package com.qa.coverage.service;

import com.qa.coverage.engine.AutomationRunRecord;
import com.qa.coverage.engine.ManualExecutionRecord;
import com.qa.coverage.engine.ReleaseRef;
import com.qa.coverage.engine.TestCaseLinks;
import com.qa.coverage.model.Automation;
import com.qa.coverage.model.ManualExecution;
import com.qa.coverage.model.Release;
import com.qa.coverage.model.TestCase;
import com.qa.coverage.repository.AutomationRepository;
import com.qa.coverage.repository.ManualExecutionRepository;
import com.qa.coverage.repository.ReleaseRepository;
import com.qa.coverage.repository.RequirementRepository;
import com.qa.coverage.repository.TestCaseRepository;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ExecutionDataLoaderTest {

    private TestCaseRepository testCaseRepository;
    private RequirementRepository requirementRepository;
    private ReleaseRepository releaseRepository;
    private ManualExecutionRepository manualExecutionRepository;
    private AutomationRepository automationRepository;
    private ExecutionDataLoader loader;

    @Before
    public void setUp() {
        testCaseRepository = mock(TestCaseRepository.class);
        requirementRepository = mock(RequirementRepository.class);
        releaseRepository = mock(ReleaseRepository.class);
        manualExecutionRepository = mock(ManualExecutionRepository.class);
        automationRepository = mock(AutomationRepository.class);
        loader = new ExecutionDataLoader(testCaseRepository, requirementRepository, releaseRepository,
                manualExecutionRepository, automationRepository);
    }

    @Test
    public void metadataLinksWinOverLegacyRequirement() {
        TestCase tc = testCase(1L, "{\"requirementIds\": [5, 6], \"releaseIds\": [2]}", 9L);

        TestCaseLinks links = loader.toLinks(tc);
        assertEquals(new HashSet<>(Arrays.asList(5L, 6L)), links.getRequirementIds());
        assertEquals(Collections.singleton(2L), links.getReleaseIds());
    }

    @Test
    public void legacyRequirementUsedWhenMetadataHasNone() {
        TestCaseLinks links = loader.toLinks(testCase(1L, "{\"releaseIds\": [3]}", 9L));
        assertEquals(Collections.singleton(9L), links.getRequirementIds());
        assertEquals(Collections.singleton(3L), links.getReleaseIds());

        TestCaseLinks noMetadata = loader.toLinks(testCase(2L, null, null));
        assertTrue(noMetadata.getRequirementIds().isEmpty());
        assertTrue(noMetadata.getReleaseIds().isEmpty());
    }

    @Test
    public void unreadableMetadataDegradesToNoLinks() {
        TestCaseLinks links = loader.toLinks(testCase(1L, "{oops", 9L));

        assertTrue(links.getRequirementIds().isEmpty());
        assertTrue(links.getReleaseIds().isEmpty());
    }

    @Test
    public void loadAllMapsEntitiesIntoEngineInputs() {
        when(testCaseRepository.findByIsActiveTrue()).thenReturn(Collections.singletonList(testCase(1L, null, 4L)));
        Release release = new Release();
        release.setIdRelease(7L);
        when(releaseRepository.findAll()).thenReturn(Collections.singletonList(release));

        ManualExecution execution = new ManualExecution();
        execution.setId(30L);
        execution.setTestCaseId(1L);
        execution.setResult("passed");
        execution.setCreatedOn(LocalDateTime.parse("2024-05-01T08:15:00"));
        when(manualExecutionRepository.findAll()).thenReturn(Collections.singletonList(execution));

        Automation automation = new Automation();
        automation.setIdAutomation(40L);
        automation.setTestCaseId(1L);
        automation.setLastRunResult("failed");
        automation.setLastRunDate(LocalDateTime.parse("2024-05-02T22:00:00"));
        when(automationRepository.findAll()).thenReturn(Collections.singletonList(automation));

        ExecutionDataSet data = loader.loadAll();

        assertEquals(1, data.getTestCases().size());
        ReleaseRef ref = data.getReleases().get(0);
        assertEquals(Long.valueOf(7L), ref.getId());

        ManualExecutionRecord manual = data.getManualExecutions().get(0);
        assertFalse(manual.getExecutionDate().isPresent());
        assertEquals(Instant.parse("2024-05-01T08:15:00Z"), manual.getCreatedAt().get());

        AutomationRunRecord run = data.getAutomationRuns().get(0);
        assertEquals(Instant.parse("2024-05-02T22:00:00Z"), run.getLastRunDate().get());
        assertEquals("failed", run.getLastRunResult().get());
    }

    @Test
    public void singleTestCaseLoadSkipsDirectories() {
        ExecutionDataSet data = loader.loadForTestCase(1L);

        assertTrue(data.getTestCases().isEmpty());
        verify(manualExecutionRepository).findByTestCaseId(1L);
        verify(automationRepository).findByTestCaseId(1L);
        verify(testCaseRepository, never()).findByIsActiveTrue();
    }

    private static TestCase testCase(Long id, String metadataJson, Long legacyRequirementId) {
        TestCase tc = new TestCase();
        tc.setIdTC(id);
        tc.setMetadataJson(metadataJson);
        tc.setRequirementId(legacyRequirementId);
        tc.setIsActive(true);
        return tc;
    }
}
