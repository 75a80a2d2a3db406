package com.power.anomaly.service;

import com.power.anomaly.config.DetectionConfig;
import com.power.anomaly.config.MetricsConfig;
import com.power.anomaly.engine.parser.PowerRecordParser;
import com.power.anomaly.engine.parser.RecordFormat;
import com.power.anomaly.exception.InvalidFeatureException;
import com.power.anomaly.exception.InvalidRangeException;
import com.power.anomaly.model.AnomalyEntry;
import com.power.anomaly.model.Feature;
import com.power.anomaly.model.ModelSnapshot;
import com.power.anomaly.model.ParseResult;
import com.power.anomaly.model.PowerRecord;
import com.power.anomaly.model.PredictionResult;
import com.power.anomaly.model.ScoredRecord;
import com.power.anomaly.repository.ModelRepository;
import com.power.anomaly.repository.ReferenceDatasetRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Answers prediction and date-range queries against the currently published model.
 * Never takes the training lock: every call works on the snapshot it loaded at its start.
 */
@Service
public class AnomalyQueryService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyQueryService.class);

    private final PowerRecordParser parser;
    private final AnomalyScoringService scoringService;
    private final ModelRepository modelRepository;
    private final ReferenceDatasetRepository datasetRepository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    public AnomalyQueryService(PowerRecordParser parser,
                               AnomalyScoringService scoringService,
                               ModelRepository modelRepository,
                               ReferenceDatasetRepository datasetRepository,
                               DetectionConfig config,
                               MetricsConfig metricsConfig) {
        this.parser = parser;
        this.scoringService = scoringService;
        this.modelRepository = modelRepository;
        this.datasetRepository = datasetRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Score an uploaded file; the format is chosen from {@code filename}'s extension.
     */
    @Observed(name = "anomalies.predict", contextualName = "predict-anomalies")
    public PredictionResult predict(Reader source, String filename, String tag) {
        RecordFormat format = RecordFormat.fromFilename(filename);
        ModelSnapshot snapshot = modelRepository.load(resolveTag(tag));
        ParseResult parsed = parser.parse(source, format);
        metricsConfig.recordRowsParsed("predict", parsed.rowsParsed(), parsed.rowsDropped());
        return evaluate("predict", snapshot, parsed.records(), null, Integer.MAX_VALUE);
    }

    @Observed(name = "anomalies.predict_default", contextualName = "predict-anomalies-default-dataset")
    public PredictionResult predictDefaultDataset(String tag) {
        ModelSnapshot snapshot = modelRepository.load(resolveTag(tag));
        return evaluate("predict", snapshot, datasetRepository.load().records(), null, Integer.MAX_VALUE);
    }

    /**
     * Anomalies of the reference dataset within {@code [start, end]} (inclusive; a null bound is open).
     * With a feature filter, anomalies are ordered by that feature's raw value, highest first.
     *
     * @throws InvalidRangeException   if {@code start} is after {@code end}
     * @throws InvalidFeatureException if {@code featureFilter} names no known feature
     */
    @Observed(name = "anomalies.query", contextualName = "query-anomalies")
    public PredictionResult query(Instant start, Instant end, String featureFilter, String tag) {
        if (start != null && end != null && start.isAfter(end)) {
            throw new InvalidRangeException("start_date " + start + " is after end_date " + end);
        }
        Feature feature = resolveFeature(featureFilter);
        ModelSnapshot snapshot = modelRepository.load(resolveTag(tag));

        List<PowerRecord> window = new ArrayList<>();
        for (PowerRecord record : datasetRepository.load().records()) {
            Instant ts = record.getTimestamp();
            if ((start == null || !ts.isBefore(start)) && (end == null || !ts.isAfter(end))) {
                window.add(record);
            }
        }
        log.debug("Query [{}, {}] selected {} records", start, end, window.size());

        if (window.isEmpty()) {
            return PredictionResult.empty();
        }
        return evaluate("query", snapshot, window, feature, config.getMaxQueryAnomalies());
    }

    /**
     * Score the reference dataset, or a seeded random sample of it when
     * {@code 0 < sampleSize < dataset size}. Sampled records keep dataset order.
     */
    @Observed(name = "anomalies.analyze_default", contextualName = "analyze-default-dataset")
    public PredictionResult analyzeDefaultDataset(Integer sampleSize, String tag) {
        ModelSnapshot snapshot = modelRepository.load(resolveTag(tag));
        List<PowerRecord> records = datasetRepository.load().records();
        if (sampleSize != null && sampleSize > 0 && sampleSize < records.size()) {
            records = sample(records, sampleSize, config.getSeed());
        }
        return evaluate("analyze", snapshot, records, null, Integer.MAX_VALUE);
    }

    private PredictionResult evaluate(String operation, ModelSnapshot snapshot, List<PowerRecord> records,
                                      Feature orderBy, int maxAnomalies) {
        List<ScoredRecord> scored = scoringService.score(snapshot, records);

        List<ScoredRecord> anomalies = new ArrayList<>();
        for (ScoredRecord record : scored) {
            if (record.anomaly()) anomalies.add(record);
        }
        if (orderBy != null) {
            anomalies.sort(Comparator.comparingDouble((ScoredRecord r) -> orderBy.valueOf(r.record())).reversed());
        }

        int total = scored.size();
        int count = anomalies.size();
        List<AnomalyEntry> entries = anomalies.stream()
                .limit(maxAnomalies)
                .map(AnomalyEntry::from)
                .toList();

        metricsConfig.recordPrediction(operation, total, count);
        log.info("{}: {} anomalies out of {} records (model {} v{})",
                operation, count, total, snapshot.getTag(), snapshot.getModelVersion());

        return PredictionResult.builder()
                .anomalies(entries)
                .anomalyCount(count)
                .totalRecords(total)
                .anomalyPercentage(percentage(count, total))
                .build();
    }

    static double percentage(int count, int total) {
        return total == 0 ? 0.0 : 100.0 * count / total;
    }

    static List<PowerRecord> sample(List<PowerRecord> records, int size, long seed) {
        Random random = new Random(seed);
        int n = records.size();
        int[] indices = new int[n];
        for (int i = 0; i < n; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(n - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
        }
        int[] chosen = Arrays.copyOf(indices, size);
        Arrays.sort(chosen);

        List<PowerRecord> sampled = new ArrayList<>(size);
        for (int index : chosen) {
            sampled.add(records.get(index));
        }
        return sampled;
    }

    private static Feature resolveFeature(String featureFilter) {
        if (featureFilter == null || featureFilter.isBlank()) {
            return null;
        }
        return Feature.fromName(featureFilter)
                .orElseThrow(() -> new InvalidFeatureException(featureFilter));
    }

    private String resolveTag(String tag) {
        return tag == null || tag.isBlank() ? config.getDefaultModelTag() : tag.trim();
    }
}
