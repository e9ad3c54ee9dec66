package de.mirkosertic.mcp.reranklearn.model;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeight;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores model versions as YAML files in a directory.
 * <p>
 * Every version lives in its own {@code model-<version>.yaml}, created exclusively so that a
 * stored version can never be overwritten. The live version identifier is kept in
 * {@code current.yaml}, which is replaced atomically.
 */
public class YamlModelRepository implements ModelRepository {

    private static final Logger logger = LoggerFactory.getLogger(YamlModelRepository.class);

    private static final String VERSION_FILE_PREFIX = "model-";
    private static final String VERSION_FILE_SUFFIX = ".yaml";
    private static final String CURRENT_FILE = "current.yaml";

    private final Path directory;
    private final Yaml yaml;

    public YamlModelRepository(final Path directory) {
        this.directory = directory;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    @Override
    public synchronized void create(final ModelVersion version) throws ModelStoreException {
        ensureDirectoryExists();
        final Path file = versionFile(version.versionId());

        final Map<String, Object> document = new LinkedHashMap<>();
        document.put("versionId", version.versionId());
        document.put("createdAt", version.createdAt().toString());
        final Map<String, Object> weights = new LinkedHashMap<>();
        for (final AdaptiveWeight weight : version.weights().weights().values()) {
            final Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("value", weight.value());
            entry.put("confidence", weight.confidence());
            entry.put("lastUpdated", weight.lastUpdated().toString());
            weights.put(weight.name(), entry);
        }
        document.put("weights", weights);

        try (final Writer writer = Files.newBufferedWriter(file, StandardOpenOption.CREATE_NEW)) {
            yaml.dump(document, writer);
        } catch (final FileAlreadyExistsException e) {
            throw new ModelStoreException("Model version already exists: " + version.versionId(), e);
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to write model version " + version.versionId() + " to " + file, e);
        }
        logger.info("Stored model version {} in {}", version.versionId(), file);
    }

    @Override
    public synchronized Optional<ModelVersion> read(final String versionId) throws ModelStoreException {
        final Path file = versionFile(versionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (final Reader reader = Files.newBufferedReader(file)) {
            final Map<String, Object> document = yaml.load(reader);
            if (document == null) {
                throw new CorruptModelException("Model file is empty: " + file);
            }
            return Optional.of(toModelVersion(versionId, document));
        } catch (final YAMLException | ClassCastException
                       | DateTimeParseException | IllegalArgumentException e) {
            throw new CorruptModelException("Cannot deserialize model version " + versionId + " from " + file, e);
        } catch (final CorruptModelException e) {
            throw e;
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to read model version " + versionId + " from " + file, e);
        }
    }

    @Override
    public synchronized List<String> listVersionIds() throws ModelStoreException {
        final List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return ids;
        }
        try (final DirectoryStream<Path> stream =
                     Files.newDirectoryStream(directory, VERSION_FILE_PREFIX + "*" + VERSION_FILE_SUFFIX)) {
            for (final Path file : stream) {
                final String name = file.getFileName().toString();
                ids.add(name.substring(VERSION_FILE_PREFIX.length(), name.length() - VERSION_FILE_SUFFIX.length()));
            }
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to list model versions in " + directory, e);
        }
        return ids;
    }

    @Override
    public synchronized Optional<String> readCurrentVersionId() throws ModelStoreException {
        final Path file = directory.resolve(CURRENT_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try (final Reader reader = Files.newBufferedReader(file)) {
            final Map<String, Object> document = yaml.load(reader);
            if (document == null || document.get("current") == null) {
                throw new CorruptModelException("Current model pointer is empty: " + file);
            }
            return Optional.of(document.get("current").toString());
        } catch (final YAMLException | ClassCastException e) {
            throw new CorruptModelException("Cannot parse current model pointer " + file, e);
        } catch (final CorruptModelException e) {
            throw e;
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to read current model pointer " + file, e);
        }
    }

    @Override
    public synchronized void writeCurrentVersionId(final String versionId) throws ModelStoreException {
        ensureDirectoryExists();
        final Path file = directory.resolve(CURRENT_FILE);
        final Path temp = directory.resolve(CURRENT_FILE + ".tmp");

        try (final Writer writer = Files.newBufferedWriter(temp,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(Map.of("current", versionId), writer);
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to write current model pointer " + temp, e);
        }

        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
            moveNonAtomically(temp, file);
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to replace current model pointer " + file, e);
        }
        logger.debug("Current model version set to {}", versionId);
    }

    private static void moveNonAtomically(final Path source, final Path target) throws ModelStoreException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (final IOException e) {
            throw new ModelStoreException("Failed to replace current model pointer " + target, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static ModelVersion toModelVersion(final String versionId, final Map<String, Object> document)
            throws CorruptModelException {
        final Object storedId = document.get("versionId");
        if (storedId == null || !versionId.equals(storedId.toString())) {
            throw new CorruptModelException("Model file for " + versionId + " declares version " + storedId);
        }
        final Instant createdAt = toInstant(require(document, "createdAt", versionId));

        final Map<String, Object> weightsDoc = (Map<String, Object>) require(document, "weights", versionId);
        final Map<String, AdaptiveWeight> weights = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : weightsDoc.entrySet()) {
            if (!(entry.getValue() instanceof Map)) {
                throw new CorruptModelException("Model version " + versionId + " has no values for weight " + entry.getKey());
            }
            final Map<String, Object> values = (Map<String, Object>) entry.getValue();
            final String context = versionId + " weight " + entry.getKey();
            weights.put(entry.getKey(), new AdaptiveWeight(
                    entry.getKey(),
                    ((Number) require(values, "value", context)).doubleValue(),
                    ((Number) require(values, "confidence", context)).doubleValue(),
                    toInstant(require(values, "lastUpdated", context))));
        }
        return new ModelVersion(versionId, new AdaptiveWeights(weights), createdAt);
    }

    private static Object require(final Map<String, Object> values, final String key, final String context)
            throws CorruptModelException {
        final Object value = values.get(key);
        if (value == null) {
            throw new CorruptModelException("Model version " + context + " is missing '" + key + "'");
        }
        return value;
    }

    private static Instant toInstant(final Object value) {
        // SnakeYAML resolves unquoted ISO timestamps to java.util.Date
        if (value instanceof Date date) {
            return date.toInstant();
        }
        return Instant.parse(value.toString());
    }

    private Path versionFile(final String versionId) {
        return directory.resolve(VERSION_FILE_PREFIX + versionId + VERSION_FILE_SUFFIX);
    }

    private void ensureDirectoryExists() throws ModelStoreException {
        try {
            Files.createDirectories(directory);
        } catch (final IOException e) {
            throw new ModelStoreException("Cannot create model directory " + directory, e);
        }
    }
}
