package com.power.anomaly.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.power.anomaly.config.DetectionConfig;
import com.power.anomaly.engine.isolationforest.IsolationForest;
import com.power.anomaly.engine.isolationforest.IsolationNode;
import com.power.anomaly.engine.isolationforest.IsolationTree;
import com.power.anomaly.engine.scaler.ScalerState;
import com.power.anomaly.exception.IncompatibleModelVersionException;
import com.power.anomaly.exception.ModelNotFoundException;
import com.power.anomaly.exception.ModelStoreException;
import com.power.anomaly.model.Feature;
import com.power.anomaly.model.ModelMetadata;
import com.power.anomaly.model.ModelSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * File-backed store of trained (scaler, forest) snapshots, one current snapshot per tag.
 *
 * Snapshots are written to a temp file and atomically moved over {@code <tag>.model.json}, so a
 * reader never sees a half-written model. Each tag has an in-memory reference cell holding the
 * published snapshot; saving swaps the reference, and readers that already hold the previous
 * snapshot keep using it.
 */
@Repository
public class ModelRepository {

    private static final Logger log = LoggerFactory.getLogger(ModelRepository.class);

    /** Bump whenever the persisted layout of the scaler or forest changes. */
    public static final int FORMAT_VERSION = 1;

    private static final Pattern TAG_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final String FILE_SUFFIX = ".model.json";

    private final Path directory;
    private final ObjectMapper objectMapper;

    // Published snapshot per tag
    private final Map<String, AtomicReference<ModelSnapshot>> published = new ConcurrentHashMap<>();

    public ModelRepository(DetectionConfig config) {
        this.directory = Path.of(config.getModelDirectory());
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Persist a new snapshot for {@code tag} and publish it. The version is one above the
     * previously published (or persisted) version.
     */
    public ModelSnapshot save(String tag, ScalerState scaler, IsolationForest forest, int trainingRows) {
        validateTag(tag);
        AtomicReference<ModelSnapshot> cell = cell(tag);
        synchronized (cell) {
            ModelSnapshot snapshot = ModelSnapshot.builder()
                    .formatVersion(FORMAT_VERSION)
                    .tag(tag)
                    .modelVersion(currentVersion(tag, cell) + 1)
                    .trainedAt(System.currentTimeMillis())
                    .trainingRows(trainingRows)
                    .scaler(scaler)
                    .forest(forest)
                    .build();

            Path target = fileFor(tag);
            Path temp = null;
            try {
                Files.createDirectories(directory);
                temp = Files.createTempFile(directory, tag + ".", ".tmp");
                objectMapper.writeValue(temp.toFile(), snapshot);
                publishFile(temp, target);
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new ModelStoreException("Failed to save model '" + tag + "'", e);
            }

            cell.set(snapshot);
            log.info("Saved model {} v{}: {} trees, {} training rows",
                    tag, snapshot.getModelVersion(), forest.getTrees().size(), trainingRows);
            return snapshot;
        }
    }

    /**
     * The currently published snapshot for {@code tag}, read from disk on first access.
     *
     * @throws ModelNotFoundException             if nothing was ever saved under {@code tag}
     * @throws IncompatibleModelVersionException  if the file was written by another format version, or its
     *                                            scaler and forest do not match this engine's features
     */
    public ModelSnapshot load(String tag) {
        validateTag(tag);
        AtomicReference<ModelSnapshot> cell = cell(tag);
        ModelSnapshot current = cell.get();
        if (current != null) return current;

        synchronized (cell) {
            current = cell.get();
            if (current != null) return current;

            Path file = fileFor(tag);
            if (!Files.exists(file)) {
                throw new ModelNotFoundException(tag);
            }
            ModelSnapshot snapshot = readSnapshot(tag, file);
            cell.set(snapshot);
            log.info("Loaded model {} v{} from {}", tag, snapshot.getModelVersion(), file);
            return snapshot;
        }
    }

    public Optional<ModelMetadata> findMetadata(String tag) {
        try {
            return Optional.of(load(tag).toMetadata());
        } catch (ModelNotFoundException e) {
            return Optional.empty();
        }
    }

    /**
     * Forget the in-memory cells; the next load reads from disk.
     */
    public void clearCache() {
        published.clear();
    }

    Path fileFor(String tag) {
        return directory.resolve(tag + FILE_SUFFIX);
    }

    private ModelSnapshot readSnapshot(String tag, Path file) {
        try {
            JsonNode tree = objectMapper.readTree(file.toFile());
            int formatVersion = tree.path("formatVersion").asInt(-1);
            if (formatVersion != FORMAT_VERSION) {
                throw new IncompatibleModelVersionException(tag, formatVersion, FORMAT_VERSION);
            }
            ModelSnapshot snapshot = objectMapper.treeToValue(tree, ModelSnapshot.class);
            checkCompatible(tag, snapshot);
            return snapshot;
        } catch (IOException e) {
            throw new ModelStoreException("Failed to read model '" + tag + "' from " + file, e);
        }
    }

    /**
     * The scaler must cover exactly the engine's features, in order, and every split of the forest
     * must index one of them.
     */
    private static void checkCompatible(String tag, ModelSnapshot snapshot) {
        ScalerState scaler = snapshot.getScaler();
        IsolationForest forest = snapshot.getForest();
        if (scaler == null || forest == null) {
            throw new IncompatibleModelVersionException(tag, FORMAT_VERSION, "scaler or forest is missing");
        }
        if (!scaler.getFeatureNames().equals(Feature.columnNames())) {
            throw new IncompatibleModelVersionException(tag, FORMAT_VERSION,
                    "scaler features " + scaler.getFeatureNames() + " differ from " + Feature.columnNames());
        }
        for (IsolationTree tree : forest.getTrees()) {
            List<IsolationNode> nodes = tree.getNodes();
            for (IsolationNode node : nodes) {
                if (node.isLeaf()) continue;
                if (node.getSplitFeature() < 0 || node.getSplitFeature() >= Feature.COUNT
                        || node.getLeft() <= 0 || node.getLeft() >= nodes.size()
                        || node.getRight() <= 0 || node.getRight() >= nodes.size()) {
                    throw new IncompatibleModelVersionException(tag, FORMAT_VERSION,
                            "forest node splits on feature " + node.getSplitFeature()
                                    + " or points outside its tree");
                }
            }
        }
    }

    private long currentVersion(String tag, AtomicReference<ModelSnapshot> cell) {
        ModelSnapshot current = cell.get();
        if (current != null) return current.getModelVersion();

        Path file = fileFor(tag);
        if (!Files.exists(file)) return 0;
        try {
            return objectMapper.readTree(file.toFile()).path("modelVersion").asLong(0);
        } catch (IOException e) {
            log.warn("Could not read the version of existing model {}; numbering from 0", tag, e);
            return 0;
        }
    }

    private static void publishFile(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported in {}; falling back to replace", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temp model file {}", temp, e);
        }
    }

    private AtomicReference<ModelSnapshot> cell(String tag) {
        return published.computeIfAbsent(tag, k -> new AtomicReference<>());
    }

    public static void validateTag(String tag) {
        if (tag == null || !TAG_PATTERN.matcher(tag).matches()) {
            throw new IllegalArgumentException("Invalid model tag '" + tag
                    + "': use 1-64 letters, digits, '-' or '_'");
        }
    }
}
