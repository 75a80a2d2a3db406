package com.power.anomaly.service;

import com.power.anomaly.config.DetectionConfig;
import com.power.anomaly.config.MetricsConfig;
import com.power.anomaly.engine.isolationforest.IsolationForest;
import com.power.anomaly.engine.isolationforest.IsolationForestTrainer;
import com.power.anomaly.engine.isolationforest.TrainingParameters;
import com.power.anomaly.engine.parser.PowerRecordParser;
import com.power.anomaly.engine.parser.RecordFormat;
import com.power.anomaly.engine.scaler.FeatureScaler;
import com.power.anomaly.engine.scaler.ScalerState;
import com.power.anomaly.exception.AnomalyDetectionException;
import com.power.anomaly.exception.InsufficientDataException;
import com.power.anomaly.exception.TrainingCancelledException;
import com.power.anomaly.exception.TrainingInProgressException;
import com.power.anomaly.model.ModelSnapshot;
import com.power.anomaly.model.ParseResult;
import com.power.anomaly.model.ScaledRecord;
import com.power.anomaly.model.TrainingSummary;
import com.power.anomaly.repository.ModelRepository;
import com.power.anomaly.repository.ReferenceDatasetRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Trains a complete (scaler, forest) pair and publishes it through the {@link ModelRepository}.
 * At most one training runs per tag; a failed or cancelled run leaves the published model as it was.
 */
@Service
public class ModelTrainingService {

    private static final Logger log = LoggerFactory.getLogger(ModelTrainingService.class);

    private final PowerRecordParser parser;
    private final FeatureScaler featureScaler;
    private final IsolationForestTrainer trainer;
    private final ModelRepository modelRepository;
    private final ReferenceDatasetRepository datasetRepository;
    private final DetectionConfig config;
    private final MetricsConfig metricsConfig;

    private final Map<String, ReentrantLock> trainingLocks = new ConcurrentHashMap<>();
    private final Map<String, AtomicBoolean> inFlight = new ConcurrentHashMap<>();

    public ModelTrainingService(PowerRecordParser parser,
                                FeatureScaler featureScaler,
                                IsolationForestTrainer trainer,
                                ModelRepository modelRepository,
                                ReferenceDatasetRepository datasetRepository,
                                DetectionConfig config,
                                MetricsConfig metricsConfig) {
        this.parser = parser;
        this.featureScaler = featureScaler;
        this.trainer = trainer;
        this.modelRepository = modelRepository;
        this.datasetRepository = datasetRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Train from an uploaded file; the format is chosen from {@code filename}'s extension.
     */
    @Observed(name = "model.train", contextualName = "train-model")
    public TrainingSummary train(Reader source, String filename, String tag) {
        String resolvedTag = resolveTag(tag);
        RecordFormat format = RecordFormat.fromFilename(filename);
        log.info("Training model {} from {}", resolvedTag, filename);
        ParseResult parsed = parser.parse(source, format);
        return trainOn(parsed, resolvedTag);
    }

    @Observed(name = "model.train_default", contextualName = "train-model-default-dataset")
    public TrainingSummary trainOnDefaultDataset(String tag) {
        String resolvedTag = resolveTag(tag);
        log.info("Training model {} from default dataset {}", resolvedTag, datasetRepository.getLocation());
        return trainOn(datasetRepository.load(), resolvedTag);
    }

    /**
     * Ask an in-flight training for {@code tag} to stop.
     *
     * @return true if a training was running and has been signalled
     */
    public boolean cancelTraining(String tag) {
        String resolvedTag = resolveTag(tag);
        AtomicBoolean flag = inFlight.get(resolvedTag);
        if (flag == null) {
            return false;
        }
        flag.set(true);
        log.info("Cancellation requested for training of model {}", resolvedTag);
        return true;
    }

    public boolean isTraining(String tag) {
        return inFlight.containsKey(resolveTag(tag));
    }

    private TrainingSummary trainOn(ParseResult parsed, String tag) {
        metricsConfig.recordRowsParsed("train", parsed.rowsParsed(), parsed.rowsDropped());

        ReentrantLock lock = trainingLocks.computeIfAbsent(tag, k -> new ReentrantLock());
        acquire(lock, tag);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        inFlight.put(tag, cancelled);
        try {
            TrainingSummary summary = buildAndPublish(parsed, tag, cancelled);
            metricsConfig.recordTraining(tag, "success");
            return summary;
        } catch (TrainingCancelledException e) {
            metricsConfig.recordTraining(tag, "cancelled");
            log.warn("Training of model {} cancelled; published model unchanged", tag);
            throw e;
        } catch (AnomalyDetectionException e) {
            metricsConfig.recordTraining(tag, "rejected");
            log.warn("Training of model {} rejected ({}): {}", tag, e.getKind(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsConfig.recordTraining(tag, "failed");
            log.error("Training of model {} failed; published model unchanged", tag, e);
            throw e;
        } finally {
            inFlight.remove(tag, cancelled);
            lock.unlock();
        }
    }

    private TrainingSummary buildAndPublish(ParseResult parsed, String tag, AtomicBoolean cancelled) {
        if (parsed.rowsParsed() < config.getMinTrainingRows()) {
            throw new InsufficientDataException("Only " + parsed.rowsParsed() + " valid rows survived parsing ("
                    + parsed.rowsDropped() + " dropped); at least " + config.getMinTrainingRows()
                    + " are required to train");
        }

        ScalerState scalerState = featureScaler.fit(parsed.records());
        List<ScaledRecord> scaled = featureScaler.transform(scalerState, parsed.records());
        double[][] matrix = new double[scaled.size()][];
        for (int i = 0; i < matrix.length; i++) {
            matrix[i] = scaled.get(i).scaled();
        }

        TrainingParameters params = new TrainingParameters(
                config.getNumTrees(), config.getMaxSamples(), config.getContamination(), config.getSeed());
        IsolationForest forest = trainer.train(matrix, params, cancelled::get);

        if (cancelled.get()) {
            throw new TrainingCancelledException("Training of model '" + tag + "' was cancelled");
        }

        ModelSnapshot snapshot = modelRepository.save(tag, scalerState, forest, matrix.length);
        metricsConfig.updatePublishedModelVersion(tag, snapshot.getModelVersion());

        log.info("Trained model {} v{}: {} rows parsed, {} dropped, threshold {}",
                tag, snapshot.getModelVersion(), parsed.rowsParsed(), parsed.rowsDropped(), forest.getThreshold());

        return TrainingSummary.builder()
                .message("Model trained and saved successfully")
                .rowsParsed(parsed.rowsParsed())
                .rowsDropped(parsed.rowsDropped())
                .modelTag(tag)
                .modelVersion(snapshot.getModelVersion())
                .threshold(forest.getThreshold())
                .trainedAt(snapshot.getTrainedAt())
                .build();
    }

    private void acquire(ReentrantLock lock, String tag) {
        long timeoutMs = config.getTrainingLockTimeout().toMillis();
        try {
            if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new TrainingInProgressException("A training for model '" + tag
                        + "' is already in progress; retry when it completes");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TrainingCancelledException("Interrupted while waiting to train model '" + tag + "'");
        }
    }

    private String resolveTag(String tag) {
        String resolved = tag == null || tag.isBlank() ? config.getDefaultModelTag() : tag.trim();
        ModelRepository.validateTag(resolved);
        return resolved;
    }
}
