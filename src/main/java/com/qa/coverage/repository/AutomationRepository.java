package com.qa.coverage.repository;

import com.qa.coverage.model.Automation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AutomationRepository extends JpaRepository<Automation, Long> {

    List<Automation> findByTestCaseId(Long testCaseId);
}
