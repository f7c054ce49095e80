package com.qa.coverage.engine;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public final class TestCaseLinks {

    private final Long id;
    private final Set<Long> requirementIds;
    private final Set<Long> releaseIds;

    public TestCaseLinks(Long id, Set<Long> requirementIds, Set<Long> releaseIds) {
        this.id = id;
        this.requirementIds = requirementIds == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(requirementIds));
        this.releaseIds = releaseIds == null ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(releaseIds));
    }

    public Long getId() {
        return id;
    }

    public Set<Long> getRequirementIds() {
        return requirementIds;
    }

    public Set<Long> getReleaseIds() {
        return releaseIds;
    }
}
