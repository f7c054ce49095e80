package com.qa.coverage.controller;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.qa.coverage.dto.AutomationRunRequestDTO;
import com.qa.coverage.dto.ManualExecutionRequestDTO;
import com.qa.coverage.model.Automation;
import com.qa.coverage.model.ManualExecution;
import com.qa.coverage.service.ExecutionRecordService;
import com.qa.coverage.service.RecordNotFoundException;

@RestController
@RequestMapping("/api")
public class ExecutionController {

	private static final Logger logger = LogManager.getLogger(ExecutionController.class);

	private final ExecutionRecordService executionRecordService;

	public ExecutionController(ExecutionRecordService executionRecordService) {
		this.executionRecordService = executionRecordService;
	}

	@PostMapping("/executions")
	public ResponseEntity<?> recordExecution(@RequestBody ManualExecutionRequestDTO dto) {
		logger.info("Recording manual execution for test case {}", dto.getTestCaseId());
		try {
			ManualExecution saved = executionRecordService.recordManualExecution(dto);
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("id", saved.getId());
			body.put("testCaseId", saved.getTestCaseId());
			body.put("result", saved.getResult());
			return ResponseEntity.status(HttpStatus.CREATED).body(body);
		} catch (IllegalArgumentException e) {
			logger.warn("Invalid execution: {}", e.getMessage());
			return ResponseEntity.badRequest().body(Map.of("error", "Invalid execution", "details", e.getMessage()));
		}
	}

	@PutMapping("/automations/{id}/last-run")
	public ResponseEntity<?> recordAutomationRun(@PathVariable Long id, @RequestBody AutomationRunRequestDTO dto) {
		logger.info("Recording run of automation {}", id);
		try {
			Automation saved = executionRecordService.recordAutomationRun(id, dto);
			// an automation may not be linked to a test case yet
			Map<String, Object> body = new LinkedHashMap<>();
			body.put("id", saved.getIdAutomation());
			body.put("testCaseId", saved.getTestCaseId());
			body.put("lastRunResult", saved.getLastRunResult());
			return ResponseEntity.ok(body);
		} catch (RecordNotFoundException e) {
			logger.warn(e.getMessage());
			return ResponseEntity.status(404).body(Map.of("message", e.getMessage()));
		} catch (IllegalArgumentException e) {
			logger.warn("Invalid automation run for {}: {}", id, e.getMessage());
			return ResponseEntity.badRequest().body(Map.of("error", "Invalid automation run", "details", e.getMessage()));
		}
	}
}
