package com.qa.coverage.engine;

public final class RequirementRef {

    private final Long id;
    private final Long releaseId;

    public RequirementRef(Long id, Long releaseId) {
        this.id = id;
        this.releaseId = releaseId;
    }

    public Long getId() {
        return id;
    }

    /** Null when the requirement is not assigned to a release. */
    public Long getReleaseId() {
        return releaseId;
    }
}
