package com.qa.coverage.service;

import com.qa.coverage.dto.AggregateSnapshotDTO;
import com.qa.coverage.dto.CoverageDTO;
import com.qa.coverage.dto.ResolvedStatusDTO;
import com.qa.coverage.dto.TrendPointDTO;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface ExecutionStatusService {

    // cutoff null = now
    ResolvedStatusDTO getCurrentStatus(Long testCaseId, Instant cutoff);

    // empty release selection = every release
    AggregateSnapshotDTO getAggregateSnapshot(Set<Long> selectedReleaseIds, Instant cutoff);

    List<TrendPointDTO> getTrend(Set<Long> selectedReleaseIds, int windowDays);

    CoverageDTO getCoverage(Set<Long> selectedReleaseIds);
}
