package com.power.anomaly.service;

import com.power.anomaly.engine.isolationforest.IsolationForest;
import com.power.anomaly.engine.scaler.FeatureScaler;
import com.power.anomaly.model.ModelSnapshot;
import com.power.anomaly.model.PowerRecord;
import com.power.anomaly.model.ScaledRecord;
import com.power.anomaly.model.ScoredRecord;
import io.micrometer.observation.annotation.Observed;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Scales records with a snapshot's fitted scaler and scores them with its forest.
 */
@Service
public class AnomalyScoringService {

    private final FeatureScaler featureScaler;

    public AnomalyScoringService(FeatureScaler featureScaler) {
        this.featureScaler = featureScaler;
    }

    @Observed(name = "records.score", contextualName = "score-records")
    public List<ScoredRecord> score(ModelSnapshot snapshot, List<PowerRecord> records) {
        List<ScaledRecord> scaled = featureScaler.transform(snapshot.getScaler(), records);
        IsolationForest forest = snapshot.getForest();

        List<ScoredRecord> scored = new ArrayList<>(scaled.size());
        for (ScaledRecord record : scaled) {
            double score = forest.anomalyScore(record.scaled());
            scored.add(new ScoredRecord(record, score, forest.isAnomaly(score)));
        }
        return scored;
    }
}
