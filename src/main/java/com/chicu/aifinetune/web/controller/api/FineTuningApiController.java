package com.chicu.aifinetune.web.controller.api;

import com.chicu.aifinetune.ai.tuning.FineTuningService;
import com.chicu.aifinetune.common.enums.ExecutionMode;
import com.chicu.aifinetune.common.enums.ModelCategory;
import com.chicu.aifinetune.common.enums.ModelStatus;
import com.chicu.aifinetune.domain.FineTuningRequest;
import com.chicu.aifinetune.domain.FineTuningResult;
import com.chicu.aifinetune.domain.ModelInfo;
import com.chicu.aifinetune.domain.ModelListFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/fine-tuning")
public class FineTuningApiController {

    private final FineTuningService fineTuningService;

    /**
     * 200: модель готова, 422: заявка отработала, но success=false (ошибка внутри результата).
     */
    @PostMapping
    public ResponseEntity<FineTuningResult> fineTune(@RequestBody FineTuningRequest request) {
        FineTuningResult result = fineTuningService.fineTuneModel(request);
        HttpStatus status = result.success() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(result);
    }

    @PutMapping("/mode")
    public Map<String, Object> setMode(@RequestParam String mode) {
        fineTuningService.setOperationMode(ExecutionMode.fromValue(mode));
        return Map.of("mode", fineTuningService.getOperationMode().value());
    }

    @GetMapping("/models/{modelId}")
    public ModelInfo getModel(@PathVariable String modelId) {
        return fineTuningService.getModelInfo(modelId);
    }

    @GetMapping("/models")
    public List<ModelInfo> listModels(
            @RequestParam(required = false) String purpose,
            @RequestParam(required = false) String targetDomain,
            @RequestParam(required = false) String modelType,
            @RequestParam(required = false) Double minAccuracy,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
            @RequestParam(required = false) List<String> tags
    ) {
        ModelListFilters filters = ModelListFilters.builder()
                .purpose(purpose)
                .targetDomain(targetDomain)
                .modelType(modelType == null ? null : ModelCategory.fromValue(modelType)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown modelType: " + modelType)))
                .minAccuracy(minAccuracy)
                .status(status == null ? null : ModelStatus.fromValue(status)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown status: " + status)))
                .createdAfter(createdAfter)
                .tags(tags)
                .build();

        return fineTuningService.listModels(filters);
    }

    @DeleteMapping("/models/{modelId}")
    public Map<String, Object> deleteModel(@PathVariable String modelId) {
        return Map.of("deleted", fineTuningService.deleteModel(modelId));
    }

    @DeleteMapping("/cache")
    public Map<String, Object> clearCache() {
        fineTuningService.clearCache();
        return Map.of("status", "cleared");
    }
}
