package com.driftfix.controller;

import com.driftfix.domain.AnalysisMode;
import com.driftfix.domain.AppliedPatch;
import com.driftfix.domain.DriftFixResult;
import com.driftfix.domain.DriftResult;
import com.driftfix.domain.FeatureMatrix;
import com.driftfix.domain.FixOptions;
import com.driftfix.domain.FixStage;
import com.driftfix.domain.PreprocessingRuleSet;
import com.driftfix.dto.AsyncJobResponse;
import com.driftfix.dto.DriftAnalysisRequest;
import com.driftfix.dto.DriftFixRequest;
import com.driftfix.dto.RuleSetResponse;
import com.driftfix.dto.TransformRequest;
import com.driftfix.dto.TransformResponse;
import com.driftfix.exception.CorruptDataException;
import com.driftfix.service.AsyncJobService;
import com.driftfix.service.DriftFixOrchestrator;
import com.driftfix.service.PatchEngine;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.function.Consumer;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DriftFixController {

    private static final String MODEL_ID_PATTERN = "^[a-zA-Z0-9._-]{1,128}$";
    private static final String MODEL_ID_MESSAGE = "modelId must match " + MODEL_ID_PATTERN;

    private final DriftFixOrchestrator orchestrator;
    private final PatchEngine patchEngine;
    private final AsyncJobService asyncJobService;

    @PostMapping("/models/{modelId}/drift/analyze")
    public ResponseEntity<DriftResult> analyze(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId,
            @Valid @RequestBody DriftAnalysisRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /drift/analyze | modelId={} | reference={} | current={} | requestId={}",
                 modelId, request.getReference().size(), request.getCurrent().size(), requestId);
        DriftResult result = orchestrator.analyze(modelId,
            FeatureMatrix.fromLists(request.getReference()),
            FeatureMatrix.fromLists(request.getCurrent()),
            toDoubles(request.getFeatureWeights()),
            request.getMode() == null ? AnalysisMode.STRICT : request.getMode());
        return ResponseEntity.ok().header("X-Request-ID", requestId).body(result);
    }

    @PostMapping("/models/{modelId}/drift/fix")
    public ResponseEntity<DriftFixResult> fix(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId,
            @Valid @RequestBody DriftFixRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /drift/fix | modelId={} | reference={} | current={} | requestId={}",
                 modelId, request.getReference().size(), request.getCurrent().size(), requestId);
        DriftFixResult result = runFix(modelId, request, stage -> { });
        return ResponseEntity.ok().header("X-Request-ID", requestId).body(result);
    }

    @PostMapping("/models/{modelId}/drift/fix/async")
    public ResponseEntity<AsyncJobResponse> fixAsync(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId,
            @Valid @RequestBody DriftFixRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        UUID jobId = asyncJobService.submit("DRIFT_FIX", modelId, requestId, progress -> runFix(modelId, request, progress));
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/models/{modelId}/ruleset")
    public ResponseEntity<RuleSetResponse> ruleSet(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId) {
        return ResponseEntity.ok(RuleSetResponse.builder()
            .modelId(modelId)
            .ruleSet(patchEngine.activeRuleSet(modelId))
            .canRollBack(patchEngine.canRollBack(modelId))
            .build());
    }

    @GetMapping("/models/{modelId}/patches")
    public ResponseEntity<List<AppliedPatch>> patches(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId) {
        return ResponseEntity.ok(patchEngine.patchLog(modelId));
    }

    @PostMapping("/models/{modelId}/rollback")
    public ResponseEntity<RuleSetResponse> rollback(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /rollback | modelId={} | requestId={}", modelId, requestId);
        PreprocessingRuleSet restored = patchEngine.rollback(modelId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(RuleSetResponse.builder()
                .modelId(modelId)
                .ruleSet(restored)
                .canRollBack(false)
                .build());
    }

    @PostMapping("/models/{modelId}/transform")
    public ResponseEntity<TransformResponse> transform(
            @PathVariable @Pattern(regexp = MODEL_ID_PATTERN, message = MODEL_ID_MESSAGE) String modelId,
            @Valid @RequestBody TransformRequest request) {
        PreprocessingRuleSet active = patchEngine.activeRuleSet(modelId);
        FeatureMatrix features = patchEngine.transform(modelId, FeatureMatrix.fromLists(request.getFeatures()));
        FeatureMatrix outputs = request.getOutputs() == null
            ? null
            : patchEngine.adjustOutputs(modelId, FeatureMatrix.fromLists(request.getOutputs()));
        return ResponseEntity.ok(TransformResponse.builder()
            .modelId(modelId)
            .ruleSetVersion(active.getVersion())
            .features(features)
            .outputs(outputs)
            .build());
    }

    private DriftFixResult runFix(String modelId, DriftFixRequest request, Consumer<FixStage> progress) {
        FixOptions options = new FixOptions(
            toDoubles(request.getFeatureWeights()),
            toInts(request.getLabels()),
            request.getOutputShift() == null ? OptionalDouble.empty() : OptionalDouble.of(request.getOutputShift()),
            request.getMode());
        return orchestrator.fix(modelId,
            FeatureMatrix.fromLists(request.getReference()),
            FeatureMatrix.fromLists(request.getCurrent()),
            options,
            progress);
    }

    private static double[] toDoubles(List<Double> values) {
        if (values == null) {
            return null;
        }
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            Double v = values.get(i);
            if (v == null || !Double.isFinite(v)) {
                throw new CorruptDataException("featureWeights[" + i + "] is not a finite number");
            }
            out[i] = v;
        }
        return out;
    }

    private static int[] toInts(List<Integer> values) {
        if (values == null) {
            return null;
        }
        int[] out = new int[values.size()];
        for (int i = 0; i < out.length; i++) {
            Integer v = values.get(i);
            if (v == null) {
                throw new CorruptDataException("labels[" + i + "] is missing");
            }
            out[i] = v;
        }
        return out;
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
