package com.team.formtest.repository;

import com.team.formtest.model.entity.TestRunRecord;
import com.team.formtest.model.run.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TestRunRecordRepository extends JpaRepository<TestRunRecord, Long> {

    Optional<TestRunRecord> findByRunId(String runId);

    boolean existsByRunId(String runId);

    List<TestRunRecord> findByMetadataRefOrderByFinishedAtDesc(String metadataRef);

    long countByStatus(RunStatus status);
}
