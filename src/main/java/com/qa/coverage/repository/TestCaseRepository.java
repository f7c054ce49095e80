package com.qa.coverage.repository;

import com.qa.coverage.model.TestCase;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TestCaseRepository extends JpaRepository<TestCase, Long> {

    Optional<TestCase> findByIdTCAndIsActiveTrue(Long idTC);

    List<TestCase> findByIsActiveTrue();
}
