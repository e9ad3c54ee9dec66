package de.mirkosertic.mcp.reranklearn.model;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeight;
import de.mirkosertic.mcp.reranklearn.adaptation.AdaptiveWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ModelStore Tests")
class ModelStoreTest {

    private static final Instant NOW = Instant.parse("2026-05-01T08:00:00Z");

    private InMemoryModelRepository repository;
    private AdaptiveWeights defaults;
    private ModelStore store;

    @BeforeEach
    void setUp() throws ModelStoreException {
        repository = new InMemoryModelRepository();
        defaults = weights(0.3, 0.2);
        store = new ModelStore(repository, defaults, Clock.fixed(NOW, ZoneOffset.UTC));
        store.init();
    }

    static AdaptiveWeights weights(final double semantic, final double graph) {
        final Map<String, AdaptiveWeight> map = new LinkedHashMap<>();
        map.put("semantic", new AdaptiveWeight("semantic", semantic, 0.8, NOW));
        map.put("graph", new AdaptiveWeight("graph", graph, 0.7, NOW));
        return new AdaptiveWeights(map);
    }

    @Test
    @DisplayName("Load without any saved version returns the defaults")
    void loadWithoutVersionsReturnsDefaults() throws ModelStoreException {
        assertThat(store.load()).isEqualTo(defaults);
        assertThat(store.currentVersionId()).isEmpty();
    }

    @Test
    @DisplayName("Saved weights are loaded back")
    void saveThenLoad() throws ModelStoreException {
        final AdaptiveWeights saved = weights(0.5, 0.1);

        final ModelVersion version = store.save(saved);

        assertThat(version.versionId()).isEqualTo("1.0.0");
        assertThat(version.createdAt()).isEqualTo(NOW);
        assertThat(store.load()).isEqualTo(saved);
        assertThat(store.currentVersionId()).contains("1.0.0");
    }

    @Test
    @DisplayName("Every save bumps the patch version")
    void saveBumpsPatchVersion() throws ModelStoreException {
        store.save(weights(0.1, 0.1));
        store.save(weights(0.2, 0.1));
        final ModelVersion third = store.save(weights(0.3, 0.1));

        assertThat(third.versionId()).isEqualTo("1.0.2");
        assertThat(store.history()).extracting(ModelVersion::versionId).containsExactly("1.0.0", "1.0.1", "1.0.2");
    }

    @Test
    @DisplayName("Rollback to a recorded version makes it current")
    void rollbackToRecordedVersion() throws ModelStoreException {
        final AdaptiveWeights first = weights(0.1, 0.1);
        store.save(first);
        store.save(weights(0.9, 0.9));

        final Optional<ModelVersion> target = store.rollback("1.0.0");

        assertThat(target).isPresent();
        assertThat(store.currentVersionId()).contains("1.0.0");
        assertThat(store.load()).isEqualTo(first);
    }

    @Test
    @DisplayName("Rollback to an unknown version changes nothing")
    void rollbackToUnknownVersion() throws ModelStoreException {
        store.save(weights(0.1, 0.1));

        assertThat(store.rollback("2.0.0")).isEmpty();
        assertThat(store.rollback(null)).isEmpty();
        assertThat(store.currentVersionId()).contains("1.0.0");
    }

    @Test
    @DisplayName("A save after a rollback appends after the newest version")
    void saveAfterRollbackAppends() throws ModelStoreException {
        store.save(weights(0.1, 0.1));
        store.save(weights(0.2, 0.2));
        store.rollback("1.0.0");

        final ModelVersion next = store.save(weights(0.3, 0.3));

        assertThat(next.versionId()).isEqualTo("1.0.2");
        assertThat(store.history()).hasSize(3);
        assertThat(store.currentVersionId()).contains("1.0.2");
    }

    @Test
    @DisplayName("Init restores history and the current pointer from the repository")
    void initRestoresState() throws ModelStoreException {
        store.save(weights(0.1, 0.1));
        store.save(weights(0.2, 0.2));
        store.rollback("1.0.0");

        final ModelStore restored = new ModelStore(repository, defaults);
        restored.init();

        assertThat(restored.history()).extracting(ModelVersion::versionId).containsExactly("1.0.0", "1.0.1");
        assertThat(restored.currentVersionId()).contains("1.0.0");
        assertThat(restored.save(weights(0.4, 0.4)).versionId()).isEqualTo("1.0.2");
    }

    @Test
    @DisplayName("Versions are ordered numerically, not lexically")
    void versionsAreOrderedNumerically() throws ModelStoreException {
        for (int i = 0; i < 11; i++) {
            store.save(weights(0.1, 0.1));
        }

        final ModelStore restored = new ModelStore(repository, defaults);
        restored.init();

        assertThat(restored.history()).last().extracting(ModelVersion::versionId).isEqualTo("1.0.10");
        assertThat(restored.save(weights(0.1, 0.1)).versionId()).isEqualTo("1.0.11");
    }

    @Test
    @DisplayName("A version with a different feature set cannot be loaded")
    void featureMismatchIsRejected() throws ModelStoreException {
        final AdaptiveWeights other = new AdaptiveWeights(Map.of(
                "semantic", new AdaptiveWeight("semantic", 0.5, 0.5, NOW)));
        repository.create(new ModelVersion("1.0.0", other, NOW));
        repository.writeCurrentVersionId("1.0.0");
        store.init();

        assertThatThrownBy(() -> store.load()).isInstanceOf(CorruptModelException.class);
        assertThatThrownBy(() -> store.rollback("1.0.0")).isInstanceOf(CorruptModelException.class);
    }

    @Test
    @DisplayName("A failing repository leaves the history unchanged")
    void failingSaveKeepsHistory() throws ModelStoreException {
        final ModelRepository failing = mock(ModelRepository.class);
        when(failing.listVersionIds()).thenReturn(List.of());
        when(failing.readCurrentVersionId()).thenReturn(Optional.empty());
        doThrow(new ModelStoreException("disk full")).when(failing).create(any());
        final ModelStore failingStore = new ModelStore(failing, defaults);
        failingStore.init();

        assertThatThrownBy(() -> failingStore.save(weights(0.1, 0.1)))
                .isInstanceOf(ModelStoreException.class)
                .hasMessage("disk full");
        assertThat(failingStore.history()).isEmpty();
        assertThat(failingStore.currentVersionId()).isEmpty();
    }
}
