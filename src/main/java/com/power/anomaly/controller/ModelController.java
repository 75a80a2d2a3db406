package com.power.anomaly.controller;

import com.power.anomaly.model.ModelMetadata;
import com.power.anomaly.repository.ModelRepository;
import com.power.anomaly.service.ModelTrainingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Published model metadata and training control")
public class ModelController {

    private final ModelTrainingService trainingService;
    private final ModelRepository modelRepository;

    public ModelController(ModelTrainingService trainingService,
                           ModelRepository modelRepository) {
        this.trainingService = trainingService;
        this.modelRepository = modelRepository;
    }

    @Operation(summary = "Get model metadata",
            description = "Returns metadata about the published model: version, tree count, sub-sampling size, " +
                    "contamination, threshold, training rows and training timestamp.")
    @GetMapping("/{tag}")
    public ResponseEntity<ModelMetadata> getModelMetadata(
            @Parameter(description = "Model tag", example = "default")
            @PathVariable String tag) {
        return modelRepository.findMetadata(tag)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Cancel an in-flight training",
            description = "Signals a running training for the tag to stop. The published model is left untouched.")
    @PostMapping("/{tag}/cancel")
    public ResponseEntity<Map<String, Object>> cancelTraining(
            @Parameter(description = "Model tag", example = "default")
            @PathVariable String tag) {
        boolean cancelled = trainingService.cancelTraining(tag);
        Map<String, Object> body = Map.of("tag", tag, "cancelled", cancelled);
        return ResponseEntity.ok(body);
    }
}
