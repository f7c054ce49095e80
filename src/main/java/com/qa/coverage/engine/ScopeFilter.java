package com.qa.coverage.engine;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the requirements and test cases reachable from a release selection.
 *
 * <p>An empty selection means "no filter". Otherwise a requirement is in scope when its release is
 * selected, and a test case is in scope when it is tagged with a selected release or links to an
 * in-scope requirement.
 */
public class ScopeFilter {

    private static final Logger logger = LoggerFactory.getLogger(ScopeFilter.class);

    public Scope scope(Set<Long> selectedReleaseIds, Collection<TestCaseLinks> testCases,
                       Collection<RequirementRef> requirements, Collection<ReleaseRef> releases) {
        Collection<TestCaseLinks> tcs = testCases == null ? Collections.emptyList() : testCases;
        Collection<RequirementRef> reqs = requirements == null ? Collections.emptyList() : requirements;
        Collection<ReleaseRef> rels = releases == null ? Collections.emptyList() : releases;
        Set<Long> selected = selectedReleaseIds == null ? Collections.emptySet()
                : selectedReleaseIds.stream().filter(id -> id != null).collect(Collectors.toSet());

        if (selected.isEmpty()) {
            Set<Long> allRequirements = reqs.stream().map(RequirementRef::getId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            Set<Long> allTestCases = tcs.stream().map(TestCaseLinks::getId)
                    .collect(Collectors.toCollection(LinkedHashSet::new));
            return new Scope(selected, allRequirements, allTestCases, Collections.emptySet());
        }

        Set<Long> knownReleases = rels.stream().map(ReleaseRef::getId).collect(Collectors.toSet());

        Set<Long> requirementIds = new LinkedHashSet<>();
        for (RequirementRef req : reqs) {
            if (req.getReleaseId() != null && selected.contains(req.getReleaseId())) {
                requirementIds.add(req.getId());
            }
        }

        Set<Long> testCaseIds = new LinkedHashSet<>();
        for (TestCaseLinks tc : tcs) {
            if (intersects(tc.getReleaseIds(), selected)
                    || intersects(tc.getRequirementIds(), requirementIds)) {
                testCaseIds.add(tc.getId());
            }
        }

        Set<Long> unknown = new LinkedHashSet<>(selected);
        unknown.removeAll(knownReleases);
        if (!unknown.isEmpty()) {
            // a release may exist only as a reference on requirements or test cases
            reqs.forEach(r -> unknown.remove(r.getReleaseId()));
            tcs.forEach(t -> unknown.removeAll(t.getReleaseIds()));
        }
        if (!unknown.isEmpty()) {
            logger.warn("Unknown scope: release ids {} match no release", unknown);
        }

        return new Scope(selected, requirementIds, testCaseIds, unknown);
    }

    private static boolean intersects(Set<Long> a, Set<Long> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        Set<Long> smaller = a.size() <= b.size() ? a : b;
        Set<Long> larger = smaller == a ? b : a;
        for (Long id : smaller) {
            if (larger.contains(id)) {
                return true;
            }
        }
        return false;
    }
}
