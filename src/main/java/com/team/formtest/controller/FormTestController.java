package com.team.formtest.controller;

import com.team.formtest.exception.NotFoundException;
import com.team.formtest.model.analytics.AnalyticsSnapshot;
import com.team.formtest.model.dto.RunRequest;
import com.team.formtest.model.dto.SynthesizeRequest;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.CancelAck;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.service.analytics.AnalyticsAggregator;
import com.team.formtest.service.execution.RunScheduler;
import com.team.formtest.service.generation.DataSynthesizer;
import com.team.formtest.service.metadata.FormMetadataProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Form test API.
 *
 * Endpoints:
 * - POST /api/form-tests/metadata           register extracted form metadata
 * - POST /api/form-tests/synthesize         generate test data without running it
 * - POST /api/form-tests/runs               start runs (returns PENDING handles at once)
 * - GET  /api/form-tests/runs/{id}          current state of a run
 * - POST /api/form-tests/runs/{id}/cancel   cancel a run
 * - GET  /api/form-tests/analytics          rolling metrics
 */
@RestController
@RequestMapping("/api/form-tests")
@Slf4j
@RequiredArgsConstructor
public class FormTestController {

    private final FormMetadataProvider metadataProvider;
    private final DataSynthesizer synthesizer;
    private final RunScheduler scheduler;
    private final AnalyticsAggregator aggregator;

    @PostMapping("/metadata")
    public ResponseEntity<FormMetadata> registerMetadata(@RequestBody FormMetadata metadata) {
        return ResponseEntity.status(HttpStatus.CREATED).body(metadataProvider.register(metadata));
    }

    @GetMapping("/metadata")
    public List<FormMetadata> listMetadata() {
        return metadataProvider.list();
    }

    /**
     * Example request:
     * POST /api/form-tests/synthesize
     * { "metadataId": "a1b2c3d4", "scenario": "BOUNDARY", "seed": 42 }
     */
    @PostMapping("/synthesize")
    public Map<String, Object> synthesize(@RequestBody SynthesizeRequest request) {
        FormMetadata metadata = resolveMetadata(request.getMetadataId(), request.getMetadata());
        Scenario scenario = request.getScenario() != null ? request.getScenario() : Scenario.VALID;
        long seed = request.getSeed() != null ? request.getSeed() : synthesizer.nextSeed();

        List<GeneratedValue> values = synthesizer.synthesize(metadata, scenario, seed);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("metadataId", metadata.getId());
        body.put("scenario", scenario);
        body.put("seed", seed);
        body.put("values", values);
        return body;
    }

    /**
     * Example request:
     * POST /api/form-tests/runs
     * { "metadataId": "a1b2c3d4", "scenarios": ["VALID", "INVALID"] }
     */
    @PostMapping("/runs")
    public ResponseEntity<List<TestRun>> submitRuns(@RequestBody RunRequest request) {
        FormMetadata metadata = resolveMetadata(request.getMetadataId(), request.getMetadata());
        List<Scenario> scenarios = request.getScenarios() != null && !request.getScenarios().isEmpty()
                ? request.getScenarios() : List.of(Scenario.VALID);
        log.info("Run request for form {}: {}", metadata.getId(), scenarios);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(scheduler.submitRun(metadata, scenarios));
    }

    @GetMapping("/runs")
    public List<TestRun> listRuns() {
        return scheduler.listRuns();
    }

    @GetMapping("/runs/{id}")
    public TestRun getRun(@PathVariable String id) {
        return scheduler.getRun(id);
    }

    @PostMapping("/runs/{id}/cancel")
    public Map<String, Object> cancelRun(@PathVariable String id) {
        CancelAck ack = scheduler.cancelRun(id);
        if (ack == CancelAck.NOT_FOUND) {
            throw new NotFoundException("Run not found: " + id);
        }
        return Map.of("runId", id, "result", ack);
    }

    @GetMapping("/analytics")
    public AnalyticsSnapshot analytics() {
        return aggregator.snapshot();
    }

    private FormMetadata resolveMetadata(String metadataId, FormMetadata inline) {
        if (metadataId != null && !metadataId.isBlank()) {
            return metadataProvider.find(metadataId)
                    .orElseThrow(() -> new NotFoundException("Form metadata not found: " + metadataId));
        }
        if (inline != null) {
            return metadataProvider.register(inline);
        }
        throw new IllegalArgumentException("metadataId or metadata is required");
    }
}
