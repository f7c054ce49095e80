package com.qa.coverage.engine;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Buckets resolved statuses over a scope and computes requirement coverage.
 */
public class Aggregator {

    private final StatusResolver resolver;

    public Aggregator(StatusResolver resolver) {
        this.resolver = resolver;
    }

    public StatusResolver getResolver() {
        return resolver;
    }

    public AggregateSnapshot aggregate(Scope scope, Instant cutoff, Map<Long, List<StatusEvent>> eventsByTestCase,
                                       Collection<TestCaseLinks> testCases) {
        return aggregate(scope, cutoff, StatusTimelines.build(eventsByTestCase, resolver), testCases);
    }

    /** Status counts plus requirement coverage at the cutoff. */
    public AggregateSnapshot aggregate(Scope scope, Instant cutoff, StatusTimelines timelines,
                                       Collection<TestCaseLinks> testCases) {
        InvalidCutoffException.requireValid(cutoff);
        Map<Long, ExecutionResult> results = resolveAll(scope, cutoff, timelines);
        RequirementCoverage coverage = requirementCoverage(scope, testCases, results);
        return snapshot(cutoff, results, coverage);
    }

    /** Status counts only, as needed per trend day. */
    public AggregateSnapshot countStatuses(Scope scope, Instant cutoff, StatusTimelines timelines) {
        InvalidCutoffException.requireValid(cutoff);
        return snapshot(cutoff, resolveAll(scope, cutoff, timelines), null);
    }

    /** Covered = at least one in-scope test case links to the requirement. Independent of any cutoff. */
    public CoverageSummary coverage(Scope scope, Collection<TestCaseLinks> testCases) {
        Set<Long> linked = linkedRequirementIds(scope, testCases);
        int covered = 0;
        for (Long requirementId : scope.getRequirementIds()) {
            if (linked.contains(requirementId)) {
                covered++;
            }
        }
        return new CoverageSummary(covered, scope.getRequirementIds().size());
    }

    private Map<Long, ExecutionResult> resolveAll(Scope scope, Instant cutoff, StatusTimelines timelines) {
        Map<Long, ExecutionResult> results = new HashMap<>();
        for (Long testCaseId : scope.getTestCaseIds()) {
            results.put(testCaseId, timelines.statusAt(testCaseId, cutoff).getResult());
        }
        return results;
    }

    private static AggregateSnapshot snapshot(Instant cutoff, Map<Long, ExecutionResult> results,
                                              RequirementCoverage coverage) {
        int passed = 0;
        int failed = 0;
        int blocked = 0;
        int notExecuted = 0;
        for (ExecutionResult result : results.values()) {
            switch (result) {
                case PASSED:
                    passed++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case BLOCKED:
                    blocked++;
                    break;
                default:
                    notExecuted++;
            }
        }
        return new AggregateSnapshot(cutoff, passed, failed, blocked, notExecuted, coverage);
    }

    private RequirementCoverage requirementCoverage(Scope scope, Collection<TestCaseLinks> testCases,
                                                    Map<Long, ExecutionResult> results) {
        Map<Long, List<Long>> testCasesByRequirement = new HashMap<>();
        if (testCases != null) {
            for (TestCaseLinks tc : testCases) {
                if (!scope.containsTestCase(tc.getId())) {
                    continue;
                }
                for (Long requirementId : tc.getRequirementIds()) {
                    testCasesByRequirement.computeIfAbsent(requirementId, k -> new ArrayList<>())
                            .add(tc.getId());
                }
            }
        }

        int withTests = 0;
        int linked = 0;
        int executed = 0;
        Set<Long> fullyTested = new LinkedHashSet<>();
        for (Long requirementId : scope.getRequirementIds()) {
            List<Long> linkedTestCases = testCasesByRequirement.getOrDefault(requirementId, Collections.emptyList());
            if (linkedTestCases.isEmpty()) {
                continue;
            }
            withTests++;
            linked += linkedTestCases.size();
            boolean allPassed = true;
            for (Long testCaseId : linkedTestCases) {
                ExecutionResult result = results.getOrDefault(testCaseId, ExecutionResult.NOT_EXECUTED);
                if (result.isMeaningfullyExecuted()) {
                    executed++;
                }
                if (result != ExecutionResult.PASSED) {
                    allPassed = false;
                }
            }
            if (allPassed) {
                fullyTested.add(requirementId);
            }
        }
        return new RequirementCoverage(scope.getRequirementIds().size(), withTests, linked, executed, fullyTested);
    }

    private static Set<Long> linkedRequirementIds(Scope scope, Collection<TestCaseLinks> testCases) {
        Set<Long> linked = new HashSet<>();
        if (testCases != null) {
            for (TestCaseLinks tc : testCases) {
                if (scope.containsTestCase(tc.getId())) {
                    linked.addAll(tc.getRequirementIds());
                }
            }
        }
        return linked;
    }
}
