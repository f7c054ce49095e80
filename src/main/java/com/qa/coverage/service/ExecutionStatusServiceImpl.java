package com.qa.coverage.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.qa.coverage.cache.TrendCache;
import com.qa.coverage.cache.TrendCacheKey;
import com.qa.coverage.dto.AggregateSnapshotDTO;
import com.qa.coverage.dto.CoverageDTO;
import com.qa.coverage.dto.RequirementCoverageDTO;
import com.qa.coverage.dto.ResolvedStatusDTO;
import com.qa.coverage.dto.TrendPointDTO;
import com.qa.coverage.engine.AggregateSnapshot;
import com.qa.coverage.engine.Aggregator;
import com.qa.coverage.engine.CoverageSummary;
import com.qa.coverage.engine.EventNormalizer;
import com.qa.coverage.engine.InvalidCutoffException;
import com.qa.coverage.engine.NormalizationDiagnostics;
import com.qa.coverage.engine.NormalizationResult;
import com.qa.coverage.engine.RequirementCoverage;
import com.qa.coverage.engine.ResolvedStatus;
import com.qa.coverage.engine.Scope;
import com.qa.coverage.engine.ScopeFilter;
import com.qa.coverage.engine.StatusResolver;
import com.qa.coverage.engine.StatusTimelines;
import com.qa.coverage.engine.TrendBuilder;

@Service
@Transactional(readOnly = true)
public class ExecutionStatusServiceImpl implements ExecutionStatusService {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionStatusServiceImpl.class);

    private static final DateTimeFormatter TREND_LABEL = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);

    private final ExecutionDataLoader dataLoader;
    private final EventNormalizer normalizer;
    private final StatusResolver resolver;
    private final ScopeFilter scopeFilter;
    private final Aggregator aggregator;
    private final TrendBuilder trendBuilder;
    private final TrendCache trendCache;
    private final Clock clock;

    public ExecutionStatusServiceImpl(ExecutionDataLoader dataLoader, EventNormalizer normalizer,
                                      StatusResolver resolver, ScopeFilter scopeFilter, Aggregator aggregator,
                                      TrendBuilder trendBuilder, TrendCache trendCache, Clock clock) {
        this.dataLoader = dataLoader;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.scopeFilter = scopeFilter;
        this.aggregator = aggregator;
        this.trendBuilder = trendBuilder;
        this.trendCache = trendCache;
        this.clock = clock;
    }

    // ---------------- STATUS ----------------
    @Override
    public ResolvedStatusDTO getCurrentStatus(Long testCaseId, Instant cutoff) {
        Instant asOf = InvalidCutoffException.requireValid(cutoff == null ? clock.instant() : cutoff);
        if (!dataLoader.isActiveTestCase(testCaseId)) {
            logger.warn("Status requested for unknown or inactive test case {}", testCaseId);
        }

        ExecutionDataSet data = dataLoader.loadForTestCase(testCaseId);
        NormalizationResult normalized = normalizer.normalize(data.getManualExecutions(), data.getAutomationRuns());
        logDiagnostics(normalized.getDiagnostics());

        ResolvedStatus status = resolver.resolve(testCaseId, normalized.eventsFor(testCaseId), asOf);
        logger.info("Test case {} as of {} -> {} ({})", testCaseId, asOf, status.getResult(), status.getSource());
        return toStatusDTO(status);
    }

    // ---------------- SNAPSHOT ----------------
    @Override
    public AggregateSnapshotDTO getAggregateSnapshot(Set<Long> selectedReleaseIds, Instant cutoff) {
        Instant asOf = InvalidCutoffException.requireValid(cutoff == null ? clock.instant() : cutoff);
        ExecutionDataSet data = dataLoader.loadAll();
        Scope scope = scope(selectedReleaseIds, data);

        NormalizationResult normalized = normalizer.normalize(data.getManualExecutions(), data.getAutomationRuns());
        logDiagnostics(normalized.getDiagnostics());
        StatusTimelines timelines = StatusTimelines.build(normalized.getEventsByTestCase(), resolver);

        AggregateSnapshot snapshot = aggregator.aggregate(scope, asOf, timelines, data.getTestCases());
        logger.info("Snapshot {} as of {} -> {}", scope, asOf, snapshot);

        AggregateSnapshotDTO dto = toSnapshotDTO(snapshot, scope);
        dto.setDiagnostics(toDiagnosticsMap(normalized.getDiagnostics()));
        return dto;
    }

    // ---------------- TREND ----------------
    @Override
    public List<TrendPointDTO> getTrend(Set<Long> selectedReleaseIds, int windowDays) {
        TrendBuilder.requireValidWindow(windowDays);
        Instant now = clock.instant();
        Set<Long> selected = normalizeSelection(selectedReleaseIds);

        TrendCacheKey key = trendCache.keyFor(Scope.signatureOf(selected), windowDays, now);
        List<AggregateSnapshot> trend = trendCache.get(key).orElse(null);
        if (trend == null) {
            long generation = trendCache.generation();
            ExecutionDataSet data = dataLoader.loadAll();
            Scope scope = scope(selected, data);
            NormalizationResult normalized = normalizer.normalize(data.getManualExecutions(),
                    data.getAutomationRuns());
            logDiagnostics(normalized.getDiagnostics());

            StatusTimelines timelines = StatusTimelines.build(normalized.getEventsByTestCase(), resolver);
            trend = trendBuilder.buildTrend(windowDays, scope, timelines, now);
            trendCache.put(key, scope, trend, generation);
            logger.info("Trend {} over {} days computed for {} test cases", scope.signature(), windowDays,
                    scope.getTestCaseIds().size());
        } else {
            logger.info("Trend {} over {} days served from cache", key.getScopeSignature(), windowDays);
        }
        return trend.stream().map(this::toTrendPoint).collect(Collectors.toList());
    }

    // ---------------- COVERAGE ----------------
    @Override
    public CoverageDTO getCoverage(Set<Long> selectedReleaseIds) {
        ExecutionDataSet data = dataLoader.loadAll();
        Scope scope = scope(selectedReleaseIds, data);
        CoverageSummary summary = aggregator.coverage(scope, data.getTestCases());
        logger.info("Coverage {} -> {}/{} covered", scope, summary.getCovered(), summary.getTotal());

        CoverageDTO dto = new CoverageDTO();
        dto.setCovered(summary.getCovered());
        dto.setNotCovered(summary.getNotCovered());
        dto.setTotal(summary.getTotal());
        dto.setPercentage(summary.getPercentage());
        return dto;
    }

    // ---------------- HELPERS ----------------
    private Scope scope(Set<Long> selectedReleaseIds, ExecutionDataSet data) {
        return scopeFilter.scope(normalizeSelection(selectedReleaseIds), data.getTestCases(),
                data.getRequirements(), data.getReleases());
    }

    private static Set<Long> normalizeSelection(Set<Long> selectedReleaseIds) {
        if (selectedReleaseIds == null) {
            return Collections.emptySet();
        }
        return selectedReleaseIds.stream().filter(id -> id != null).collect(Collectors.toCollection(TreeSet::new));
    }

    private void logDiagnostics(NormalizationDiagnostics diagnostics) {
        if (diagnostics.getMalformedTotal() > 0) {
            logger.warn("Skipped malformed execution records: {}", diagnostics);
        } else if (diagnostics.getDegradedManual() > 0) {
            logger.debug("Execution records with fallbacks applied: {}", diagnostics);
        }
    }

    private static Map<String, Integer> toDiagnosticsMap(NormalizationDiagnostics diagnostics) {
        Map<String, Integer> map = new LinkedHashMap<>();
        if (diagnostics.getMalformedManual() > 0) {
            map.put("malformedManualExecutions", diagnostics.getMalformedManual());
        }
        if (diagnostics.getMalformedAutomated() > 0) {
            map.put("malformedAutomationRuns", diagnostics.getMalformedAutomated());
        }
        if (diagnostics.getDegradedManual() > 0) {
            map.put("degradedManualExecutions", diagnostics.getDegradedManual());
        }
        return map;
    }

    private ResolvedStatusDTO toStatusDTO(ResolvedStatus status) {
        ResolvedStatusDTO dto = new ResolvedStatusDTO();
        dto.setTestCaseId(status.getTestCaseId());
        dto.setResult(status.getResult().name());
        dto.setSource(status.getSource().name());
        dto.setAsOf(status.getAsOf());
        dto.setLastExecutedAt(status.getEffectiveTime());
        return dto;
    }

    private AggregateSnapshotDTO toSnapshotDTO(AggregateSnapshot snapshot, Scope scope) {
        AggregateSnapshotDTO dto = new AggregateSnapshotDTO();
        dto.setCutoff(snapshot.getCutoff());
        dto.setSelectedReleaseIds(scope.getSelectedReleaseIds());
        dto.setPassed(snapshot.getPassed());
        dto.setFailed(snapshot.getFailed());
        dto.setBlocked(snapshot.getBlocked());
        dto.setNotExecuted(snapshot.getNotExecuted());
        dto.setTotal(snapshot.getTotal());
        dto.setExecutionRate(snapshot.getExecutionRate());
        dto.setPassRate(snapshot.getPassRate());
        dto.setUnknownReleaseIds(scope.getUnknownReleaseIds());
        snapshot.getCoverage().ifPresent(c -> dto.setCoverage(toCoverageDTO(c)));
        return dto;
    }

    private static RequirementCoverageDTO toCoverageDTO(RequirementCoverage coverage) {
        RequirementCoverageDTO dto = new RequirementCoverageDTO();
        dto.setRequirementsTotal(coverage.getRequirementsTotal());
        dto.setRequirementsWithTests(coverage.getRequirementsWithTests());
        dto.setRequirementsFullyTested(coverage.getRequirementsFullyTested());
        dto.setTestcasesLinked(coverage.getTestcasesLinked());
        dto.setTestcasesExecuted(coverage.getTestcasesExecuted());
        dto.setCoveragePercentage(coverage.getCoveragePercentage());
        dto.setFullyTestedPercentage(coverage.getFullyTestedPercentage());
        dto.setFullyTestedRequirementIds(coverage.getFullyTestedRequirementIds());
        return dto;
    }

    private TrendPointDTO toTrendPoint(AggregateSnapshot snapshot) {
        LocalDate day = trendBuilder.dayOf(snapshot.getCutoff());
        TrendPointDTO dto = new TrendPointDTO();
        dto.setDate(day);
        dto.setLabel(day.format(TREND_LABEL));
        dto.setCutoff(snapshot.getCutoff());
        dto.setPassed(snapshot.getPassed());
        dto.setFailed(snapshot.getFailed());
        dto.setBlocked(snapshot.getBlocked());
        dto.setNotExecuted(snapshot.getNotExecuted());
        dto.setTotal(snapshot.getTotal());
        return dto;
    }
}
