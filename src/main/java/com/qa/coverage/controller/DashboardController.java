package com.qa.coverage.controller;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.qa.coverage.dto.AggregateSnapshotDTO;
import com.qa.coverage.dto.CoverageDTO;
import com.qa.coverage.dto.ResolvedStatusDTO;
import com.qa.coverage.dto.TrendPointDTO;
import com.qa.coverage.engine.CoverageEngineException;
import com.qa.coverage.service.ExecutionStatusService;
import com.qa.coverage.utils.CutoffParser;

@RestController
@RequestMapping("/api/dashboard")
public class DashboardController {

	private static final Logger logger = LogManager.getLogger(DashboardController.class);

	private final ExecutionStatusService executionStatusService;
	private final ZoneId referenceZone;

	public DashboardController(ExecutionStatusService executionStatusService, ZoneId referenceZone) {
		this.executionStatusService = executionStatusService;
		this.referenceZone = referenceZone;
	}

	/**
	 * Effective status of one test case, now or as of the given cutoff
	 */
	@GetMapping("/status/{testCaseId}")
	public ResponseEntity<?> getStatus(@PathVariable Long testCaseId,
			@RequestParam(name = "cutoff", required = false) String cutoff) {
		logger.info("Status request for test case {} (cutoff={})", testCaseId, cutoff);
		try {
			Instant asOf = CutoffParser.parse(cutoff, referenceZone);
			ResolvedStatusDTO status = executionStatusService.getCurrentStatus(testCaseId, asOf);
			return ResponseEntity.ok(status);
		} catch (CoverageEngineException e) {
			return rejected(e);
		}
	}

	/**
	 * Status counts and requirement coverage for the selected releases (none selected = all)
	 */
	@GetMapping("/snapshot")
	public ResponseEntity<?> getSnapshot(@RequestParam(name = "releaseIds", required = false) List<Long> releaseIds,
			@RequestParam(name = "cutoff", required = false) String cutoff) {
		logger.info("Snapshot request for releases {} (cutoff={})", releaseIds, cutoff);
		try {
			Instant asOf = CutoffParser.parse(cutoff, referenceZone);
			AggregateSnapshotDTO snapshot = executionStatusService.getAggregateSnapshot(toSet(releaseIds), asOf);
			return ResponseEntity.ok(snapshot);
		} catch (CoverageEngineException e) {
			return rejected(e);
		}
	}

	/**
	 * One point per calendar day, oldest first
	 */
	@GetMapping("/trend")
	public ResponseEntity<?> getTrend(@RequestParam(name = "releaseIds", required = false) List<Long> releaseIds,
			@RequestParam(name = "days", defaultValue = "7") int days) {
		logger.info("Trend request for releases {} over {} days", releaseIds, days);
		try {
			List<TrendPointDTO> trend = executionStatusService.getTrend(toSet(releaseIds), days);
			return ResponseEntity.ok(trend);
		} catch (CoverageEngineException e) {
			return rejected(e);
		}
	}

	@GetMapping("/coverage")
	public ResponseEntity<CoverageDTO> getCoverage(
			@RequestParam(name = "releaseIds", required = false) List<Long> releaseIds) {
		logger.info("Coverage request for releases {}", releaseIds);
		return ResponseEntity.ok(executionStatusService.getCoverage(toSet(releaseIds)));
	}

	private static Set<Long> toSet(List<Long> releaseIds) {
		Set<Long> set = new TreeSet<>();
		if (releaseIds != null) {
			releaseIds.stream().filter(id -> id != null).forEach(set::add);
		}
		return set;
	}

	private ResponseEntity<Map<String, Object>> rejected(CoverageEngineException e) {
		logger.warn("Rejected dashboard request: {}", e.getMessage());
		return ResponseEntity.badRequest().body(Map.of("error", e.getErrorType(), "details", e.getMessage()));
	}
}
