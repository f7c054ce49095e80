package com.qa.coverage.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Requirement and test case ids a query is restricted to. An unrestricted scope (no release
 * selected) still lists every known id so callers can iterate it.
 */
public final class Scope {

    private final Set<Long> selectedReleaseIds;
    private final Set<Long> requirementIds;
    private final Set<Long> testCaseIds;
    private final Set<Long> unknownReleaseIds;

    Scope(Set<Long> selectedReleaseIds, Set<Long> requirementIds, Set<Long> testCaseIds,
          Set<Long> unknownReleaseIds) {
        this.selectedReleaseIds = Collections.unmodifiableSet(new TreeSet<>(selectedReleaseIds));
        this.requirementIds = Collections.unmodifiableSet(new LinkedHashSet<>(requirementIds));
        this.testCaseIds = Collections.unmodifiableSet(new LinkedHashSet<>(testCaseIds));
        this.unknownReleaseIds = Collections.unmodifiableSet(new TreeSet<>(unknownReleaseIds));
    }

    public boolean isUnrestricted() {
        return selectedReleaseIds.isEmpty();
    }

    public Set<Long> getSelectedReleaseIds() {
        return selectedReleaseIds;
    }

    public Set<Long> getRequirementIds() {
        return requirementIds;
    }

    public Set<Long> getTestCaseIds() {
        return testCaseIds;
    }

    /** Selected release ids that matched no release and no link. Not an error, just an empty contribution. */
    public Set<Long> getUnknownReleaseIds() {
        return unknownReleaseIds;
    }

    public boolean containsTestCase(Long testCaseId) {
        return testCaseIds.contains(testCaseId);
    }

    /** Stable key for caches: sorted selected release ids, or "*" for the unrestricted scope. */
    public String signature() {
        return signatureOf(selectedReleaseIds);
    }

    public static String signatureOf(Set<Long> selectedReleaseIds) {
        if (selectedReleaseIds == null || selectedReleaseIds.isEmpty()) {
            return "*";
        }
        StringBuilder sb = new StringBuilder();
        for (Long id : new TreeSet<>(selectedReleaseIds)) {
            if (sb.length() > 0) {
                sb.append(',');
            }
            sb.append(id);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Scope{releases=" + signature() + ", requirements=" + requirementIds.size()
                + ", testCases=" + testCaseIds.size() + "}";
    }
}
