package com.power.anomaly.controller;

import com.power.anomaly.model.PredictionResult;
import com.power.anomaly.model.TrainingSummary;
import com.power.anomaly.service.AnomalyQueryService;
import com.power.anomaly.service.ModelTrainingService;
import com.power.anomaly.service.QueryDateParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Anomalies", description = "Train the detector and query anomalous power consumption readings")
public class AnomalyController {

    private final ModelTrainingService trainingService;
    private final AnomalyQueryService queryService;

    public AnomalyController(ModelTrainingService trainingService, AnomalyQueryService queryService) {
        this.trainingService = trainingService;
        this.queryService = queryService;
    }

    @Operation(summary = "Train the anomaly model",
            description = "Parses the uploaded .txt (semicolon separated) or .csv file, fits the feature scaler, " +
                    "trains the Isolation Forest and publishes the pair under the given tag. " +
                    "Without a file the built-in default dataset is used.")
    @PostMapping("/train")
    public ResponseEntity<TrainingSummary> train(
            @Parameter(description = "Power consumption readings (.txt or .csv)")
            @RequestParam(value = "file", required = false) MultipartFile file,
            @Parameter(description = "Model tag", example = "default")
            @RequestParam(value = "tag", required = false) String tag) throws IOException {

        if (file == null || file.isEmpty()) {
            return ResponseEntity.ok(trainingService.trainOnDefaultDataset(tag));
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(trainingService.train(reader, file.getOriginalFilename(), tag));
        }
    }

    @Operation(summary = "Predict anomalies in a file",
            description = "Scores every reading of the uploaded file with the published model and returns the " +
                    "anomalous ones with raw feature values. Without a file the built-in default dataset is scored.")
    @PostMapping("/predict")
    public ResponseEntity<PredictionResult> predict(
            @Parameter(description = "Power consumption readings (.txt or .csv)")
            @RequestParam(value = "file", required = false) MultipartFile file,
            @Parameter(description = "Model tag", example = "default")
            @RequestParam(value = "tag", required = false) String tag) throws IOException {

        if (file == null || file.isEmpty()) {
            return ResponseEntity.ok(queryService.predictDefaultDataset(tag));
        }
        try (Reader reader = new InputStreamReader(file.getInputStream(), StandardCharsets.UTF_8)) {
            return ResponseEntity.ok(queryService.predict(reader, file.getOriginalFilename(), tag));
        }
    }

    @Operation(summary = "Query anomalies by date range",
            description = "Scores the default dataset restricted to [start_date, end_date] (inclusive). " +
                    "A feature filter orders the anomalies by that feature, highest first. " +
                    "At most 1000 anomalies are listed; anomaly_count is always the full count.")
    @GetMapping("/anomalies")
    public ResponseEntity<PredictionResult> getAnomalies(
            @Parameter(description = "Inclusive lower bound", example = "2007-01-01")
            @RequestParam(value = "start_date", required = false) String startDate,
            @Parameter(description = "Inclusive upper bound; a bare date covers the whole day", example = "2007-01-31")
            @RequestParam(value = "end_date", required = false) String endDate,
            @Parameter(description = "Feature to order anomalies by", example = "Global_active_power")
            @RequestParam(value = "feature_filter", required = false) String featureFilter,
            @Parameter(description = "Model tag", example = "default")
            @RequestParam(value = "tag", required = false) String tag) {

        return ResponseEntity.ok(queryService.query(
                QueryDateParser.parseStart(startDate),
                QueryDateParser.parseEnd(endDate),
                featureFilter,
                tag));
    }

    @Operation(summary = "Analyze the default dataset",
            description = "Scores the built-in household power consumption dataset, optionally on a " +
                    "reproducible random sample of the given size.")
    @GetMapping("/analyze-default-data")
    public ResponseEntity<PredictionResult> analyzeDefaultData(
            @Parameter(description = "Number of readings to sample", example = "10000")
            @RequestParam(value = "sample_size", required = false) Integer sampleSize,
            @Parameter(description = "Model tag", example = "default")
            @RequestParam(value = "tag", required = false) String tag) {

        return ResponseEntity.ok(queryService.analyzeDefaultDataset(sampleSize, tag));
    }
}
