package com.qa.coverage.repository;

import com.qa.coverage.model.ManualExecution;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ManualExecutionRepository extends JpaRepository<ManualExecution, Long> {

    List<ManualExecution> findByTestCaseId(Long testCaseId);
}
