package de.mirkosertic.mcp.reranklearn.model;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Versioned history of adaptive weight snapshots with a movable "current" pointer.
 * <p>
 * History is a flat append log. Rollback only moves the pointer, it never removes entries, and
 * a save after a rollback appends a new version after the newest one. Version identifiers are
 * semantic versions starting at {@value #INITIAL_VERSION}; every save bumps the patch number
 * of the highest version ever stored, so identifiers are never reused.
 */
public class ModelStore {

    private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);

    static final String INITIAL_VERSION = "1.0.0";

    private static final Comparator<String> SEMVER_ORDER = Comparator.comparing(ModelStore::parseVersion,
            Comparator.<int[]>comparingInt(v -> v[0]).thenComparingInt(v -> v[1]).thenComparingInt(v -> v[2]));

    private final ModelRepository repository;
    private final AdaptiveWeights defaults;
    private final Clock clock;

    private final List<ModelVersion> history = new ArrayList<>();
    private String highestVersionId;
    private String currentVersionId;

    public ModelStore(final ModelRepository repository, final AdaptiveWeights defaults) {
        this(repository, defaults, Clock.systemUTC());
    }

    public ModelStore(final ModelRepository repository, final AdaptiveWeights defaults, final Clock clock) {
        this.repository = repository;
        this.defaults = defaults;
        this.clock = clock;
    }

    /**
     * Read the version index and the current pointer from the repository.
     * Versions that cannot be deserialized are logged and left out of the history.
     *
     * @throws ModelStoreException if the repository is unavailable
     */
    public synchronized void init() throws ModelStoreException {
        history.clear();
        highestVersionId = null;

        final List<String> ids = new ArrayList<>(repository.listVersionIds());
        ids.removeIf(id -> !isVersionId(id));
        ids.sort(SEMVER_ORDER);
        for (final String id : ids) {
            highestVersionId = id;
            try {
                repository.read(id).ifPresent(history::add);
            } catch (final CorruptModelException e) {
                logger.error("Skipping unreadable model version {}", id, e);
            }
        }

        currentVersionId = repository.readCurrentVersionId().orElse(highestVersionId);
        logger.info("Model store initialized: {} versions, current={}", history.size(), currentVersionId);
    }

    /**
     * Snapshot the given weights as a new version and make it current.
     *
     * @throws ModelStoreException if the version or the current pointer cannot be persisted
     */
    public synchronized ModelVersion save(final AdaptiveWeights weights) throws ModelStoreException {
        final String versionId = nextVersionId();
        final ModelVersion version = new ModelVersion(versionId, weights, clock.instant());

        repository.create(version);
        highestVersionId = versionId;
        history.add(version);

        repository.writeCurrentVersionId(versionId);
        currentVersionId = versionId;

        logger.info("Saved model version {} ({} versions in history)", versionId, history.size());
        return version;
    }

    /**
     * Weights of the current version, re-read from the repository, or the defaults if nothing
     * was ever saved.
     *
     * @throws CorruptModelException if the current version cannot be deserialized or has other features
     * @throws ModelStoreException   if the repository is unavailable
     */
    public synchronized AdaptiveWeights load() throws ModelStoreException {
        if (currentVersionId == null) {
            logger.info("No saved model version, using default weights");
            return defaults;
        }
        final ModelVersion version = repository.read(currentVersionId)
                .orElseThrow(() -> new CorruptModelException("Current model version " + currentVersionId + " is missing"));
        requireDefaultFeatures(version);
        logger.info("Loaded model version {}", currentVersionId);
        return version.weights();
    }

    /**
     * Make a recorded version current.
     *
     * @return the version now current, or empty if {@code versionId} is not in the history
     * @throws CorruptModelException if the target version cannot be deserialized or has other features
     * @throws ModelStoreException   if the pointer cannot be persisted
     */
    public synchronized Optional<ModelVersion> rollback(final String versionId) throws ModelStoreException {
        if (versionId == null || history.stream().noneMatch(v -> v.versionId().equals(versionId))) {
            logger.warn("Model version not found for rollback: {}", versionId);
            return Optional.empty();
        }
        final Optional<ModelVersion> target = repository.read(versionId);
        if (target.isEmpty()) {
            logger.warn("Model version {} vanished from the repository", versionId);
            return Optional.empty();
        }
        requireDefaultFeatures(target.get());
        repository.writeCurrentVersionId(versionId);
        final String previous = currentVersionId;
        currentVersionId = versionId;
        logger.info("Rolled back model from version {} to {}", previous, versionId);
        return target;
    }

    public synchronized List<ModelVersion> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public synchronized Optional<String> currentVersionId() {
        return Optional.ofNullable(currentVersionId);
    }

    public AdaptiveWeights getDefaults() {
        return defaults;
    }

    /**
     * The feature set is fixed at startup; a stored version with other features cannot go live.
     */
    private void requireDefaultFeatures(final ModelVersion version) throws CorruptModelException {
        if (!defaults.hasSameFeatures(version.weights())) {
            throw new CorruptModelException("Model version " + version.versionId() + " has features "
                    + version.weights().featureNames() + ", expected " + defaults.featureNames());
        }
    }

    private String nextVersionId() {
        if (highestVersionId == null) {
            return INITIAL_VERSION;
        }
        final int[] parts = parseVersion(highestVersionId);
        return parts[0] + "." + parts[1] + "." + (parts[2] + 1);
    }

    static boolean isVersionId(final String id) {
        return id != null && id.matches("\\d+\\.\\d+\\.\\d+");
    }

    private static int[] parseVersion(final String id) {
        final String[] parts = id.split("\\.");
        return new int[]{Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Integer.parseInt(parts[2])};
    }
}
