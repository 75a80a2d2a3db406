package com.power.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.power.anomaly.engine.isolationforest.TrainingParameters;
import com.power.anomaly.exception.IncompatibleModelVersionException;
import com.power.anomaly.exception.ModelNotFoundException;
import com.power.anomaly.model.ModelSnapshot;
import com.power.anomaly.model.PowerRecord;
import com.power.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelRepositoryTest {

    private static final TrainingParameters PARAMS = new TrainingParameters(25, 128, 0.05, 42L);

    @TempDir
    Path modelDir;

    private ModelRepository repository;
    private List<PowerRecord> records;
    private ModelSnapshot trained;

    @BeforeEach
    void setUp() {
        repository = new ModelRepository(TestDataFactory.createConfig(modelDir));
        records = TestDataFactory.datasetWithOutliers(300, 5, 11L);
        trained = TestDataFactory.trainSnapshot("default", records, PARAMS);
    }

    private ModelSnapshot save(String tag, ModelSnapshot snapshot) {
        return repository.save(tag, snapshot.getScaler(), snapshot.getForest(), snapshot.getTrainingRows());
    }

    private static double[] scores(ModelSnapshot snapshot, List<PowerRecord> records) {
        double[][] matrix = TestDataFactory.scaledMatrix(snapshot.getScaler(), records);
        double[] scores = new double[matrix.length];
        for (int i = 0; i < matrix.length; i++) {
            scores[i] = snapshot.getForest().anomalyScore(matrix[i]);
        }
        return scores;
    }

    @Test
    void save_thenLoad_returnsPublishedSnapshot() {
        ModelSnapshot saved = save("default", trained);

        ModelSnapshot loaded = repository.load("default");

        assertThat(loaded).isSameAs(saved);
        assertThat(loaded.getModelVersion()).isEqualTo(1);
        assertThat(loaded.getFormatVersion()).isEqualTo(ModelRepository.FORMAT_VERSION);
        assertThat(Files.exists(repository.fileFor("default"))).isTrue();
    }

    @Test
    void load_fromFreshRepository_reproducesIdenticalScores() {
        save("default", trained);

        ModelRepository restarted = new ModelRepository(TestDataFactory.createConfig(modelDir));
        ModelSnapshot loaded = restarted.load("default");

        assertThat(loaded.getScaler()).isEqualTo(trained.getScaler());
        assertThat(loaded.getForest().getTrees()).isEqualTo(trained.getForest().getTrees());
        assertThat(loaded.getForest().getThreshold()).isEqualTo(trained.getForest().getThreshold());
        assertThat(scores(loaded, records)).isEqualTo(scores(trained, records));
    }

    @Test
    void save_incrementsVersionPerTag_acrossRestarts() {
        save("default", trained);
        save("default", trained);
        save("kitchen", trained);

        ModelRepository restarted = new ModelRepository(TestDataFactory.createConfig(modelDir));
        ModelSnapshot next = save(restarted, "default");

        assertThat(next.getModelVersion()).isEqualTo(3);
        assertThat(restarted.load("kitchen").getModelVersion()).isEqualTo(1);
    }

    private ModelSnapshot save(ModelRepository repo, String tag) {
        return repo.save(tag, trained.getScaler(), trained.getForest(), trained.getTrainingRows());
    }

    @Test
    void save_leavesPreviouslyHeldSnapshotUntouched() {
        ModelSnapshot first = save("default", trained);
        ModelSnapshot retrained = TestDataFactory.trainSnapshot("default",
                TestDataFactory.normalRecords(200, 99L), new TrainingParameters(10, 64, 0.1, 7L));

        ModelSnapshot second = save("default", retrained);

        assertThat(repository.load("default")).isSameAs(second);
        assertThat(first.getModelVersion()).isEqualTo(1);
        assertThat(first.getForest()).isSameAs(trained.getForest());
        assertThat(first.getForest().getTrees()).hasSize(25);
        assertThat(second.getForest().getTrees()).hasSize(10);
    }

    @Test
    void save_leavesNoTempFilesBehind() throws Exception {
        save("default", trained);
        save("default", trained);

        try (Stream<Path> files = Files.list(modelDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .containsExactly("default.model.json");
        }
    }

    @Test
    void load_unknownTag_throwsModelNotFound() {
        assertThatThrownBy(() -> repository.load("missing"))
                .isInstanceOf(ModelNotFoundException.class)
                .hasMessageContaining("missing");
        assertThat(repository.findMetadata("missing")).isEmpty();
    }

    @Test
    void load_otherFormatVersion_throwsIncompatibleModelVersion() throws Exception {
        Files.writeString(modelDir.resolve("old.model.json"),
                "{\"formatVersion\":99,\"tag\":\"old\",\"modelVersion\":4}");

        assertThatThrownBy(() -> repository.load("old"))
                .isInstanceOfSatisfying(IncompatibleModelVersionException.class, e -> {
                    assertThat(e.getFoundVersion()).isEqualTo(99);
                    assertThat(e.getExpectedVersion()).isEqualTo(ModelRepository.FORMAT_VERSION);
                });
    }

    @Test
    void load_scalerWithOtherFeatures_throwsIncompatibleModelVersion() throws Exception {
        save("default", trained);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = (ObjectNode) mapper.readTree(repository.fileFor("default").toFile());
        ObjectNode scaler = (ObjectNode) root.get("scaler");
        ((ArrayNode) scaler.get("featureNames")).remove(6);
        ((ArrayNode) scaler.get("means")).remove(6);
        ((ArrayNode) scaler.get("stdDevs")).remove(6);
        mapper.writeValue(repository.fileFor("default").toFile(), root);

        ModelRepository restarted = new ModelRepository(TestDataFactory.createConfig(modelDir));

        assertThatThrownBy(() -> restarted.load("default"))
                .isInstanceOf(IncompatibleModelVersionException.class)
                .hasMessageContaining("scaler features")
                .hasMessageContaining("Retrain");
    }

    @Test
    void load_forestSplittingOnUnknownFeature_throwsIncompatibleModelVersion() throws Exception {
        save("default", trained);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = (ObjectNode) mapper.readTree(repository.fileFor("default").toFile());
        ObjectNode firstRoot = (ObjectNode) root.at("/forest/trees/0/nodes/0");
        assertThat(firstRoot.get("t").asText()).isEqualTo("INTERNAL");
        firstRoot.put("f", 9);
        mapper.writeValue(repository.fileFor("default").toFile(), root);

        ModelRepository restarted = new ModelRepository(TestDataFactory.createConfig(modelDir));

        assertThatThrownBy(() -> restarted.load("default"))
                .isInstanceOf(IncompatibleModelVersionException.class)
                .hasMessageContaining("feature 9");
    }

    @Test
    void findMetadata_describesPublishedModel() {
        save("default", trained);

        assertThat(repository.findMetadata("default")).hasValueSatisfying(metadata -> {
            assertThat(metadata.getTag()).isEqualTo("default");
            assertThat(metadata.getModelVersion()).isEqualTo(1);
            assertThat(metadata.getTreeCount()).isEqualTo(25);
            assertThat(metadata.getSampleSize()).isEqualTo(128);
            assertThat(metadata.getTrainingRows()).isEqualTo(records.size());
        });
    }

    @Test
    void clearCache_nextLoadReadsFromDisk() {
        ModelSnapshot saved = save("default", trained);

        repository.clearCache();
        ModelSnapshot reloaded = repository.load("default");

        assertThat(reloaded).isNotSameAs(saved);
        assertThat(reloaded.getModelVersion()).isEqualTo(saved.getModelVersion());
    }

    @Test
    void invalidTag_isRejectedBeforeTouchingDisk() {
        assertThatThrownBy(() -> repository.load("../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> save("", trained))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
