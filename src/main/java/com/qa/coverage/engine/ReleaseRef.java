package com.qa.coverage.engine;

/**
 * Release identity only. Scoping is done by id membership on requirements and test cases.
 */
public final class ReleaseRef {

    private final Long id;

    public ReleaseRef(Long id) {
        this.id = id;
    }

    public Long getId() {
        return id;
    }
}
