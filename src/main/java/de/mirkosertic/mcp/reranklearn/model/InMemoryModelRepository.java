package de.mirkosertic.mcp.reranklearn.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ModelRepository. Suitable for tests and for deployments
 * that do not need the model to survive a restart.
 */
public class InMemoryModelRepository implements ModelRepository {

    private final Map<String, ModelVersion> versions = new ConcurrentHashMap<>();
    private volatile String currentVersionId;

    @Override
    public void create(final ModelVersion version) throws ModelStoreException {
        if (versions.putIfAbsent(version.versionId(), version) != null) {
            throw new ModelStoreException("Model version already exists: " + version.versionId());
        }
    }

    @Override
    public Optional<ModelVersion> read(final String versionId) {
        return Optional.ofNullable(versions.get(versionId));
    }

    @Override
    public List<String> listVersionIds() {
        return new ArrayList<>(versions.keySet());
    }

    @Override
    public Optional<String> readCurrentVersionId() {
        return Optional.ofNullable(currentVersionId);
    }

    @Override
    public void writeCurrentVersionId(final String versionId) {
        this.currentVersionId = versionId;
    }
}
