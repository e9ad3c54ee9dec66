package de.mirkosertic.mcp.reranklearn.model;

import java.util.List;
import java.util.Optional;

/**
 * Durable medium for model versions, keyed by version identifier.
 * <p>
 * Versions are created once and never overwritten. The repository also keeps the identifier
 * of the version that is currently live. Implementations can be file based or in-memory.
 */
public interface ModelRepository {

    /**
     * Store a new version.
     *
     * @throws ModelStoreException if the version already exists or cannot be written
     */
    void create(ModelVersion version) throws ModelStoreException;

    /**
     * @throws CorruptModelException if the stored record cannot be deserialized
     */
    Optional<ModelVersion> read(String versionId) throws ModelStoreException;

    /** Identifiers of all stored versions, in no particular order. */
    List<String> listVersionIds() throws ModelStoreException;

    Optional<String> readCurrentVersionId() throws ModelStoreException;

    void writeCurrentVersionId(String versionId) throws ModelStoreException;
}
