package com.team.formtest.repository;

import com.team.formtest.model.entity.ScreenshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScreenshotRecordRepository extends JpaRepository<ScreenshotRecord, Long> {

    List<ScreenshotRecord> findByTestRunRunIdOrderByCapturedAtAsc(String runId);
}
