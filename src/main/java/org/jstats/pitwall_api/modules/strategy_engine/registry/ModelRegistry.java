package org.jstats.pitwall_api.modules.strategy_engine.registry;

import jakarta.annotation.PostConstruct;
import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotReadyException;
import org.jstats.pitwall_api.modules.strategy_engine.exception.TrainingFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns the servable artifact of every domain.
 * <p>
 * Readers take a snapshot from an {@link AtomicReference}; a retrain swaps in the new artifact only
 * after it is fully built and persisted. Retrains of the same domain are serialized by a per-domain
 * lock, different domains train independently. A failed retrain leaves the previous artifact serving.
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private enum Origin { LOADED, TRAINED }

    private record Entry(ModelState state, @Nullable ModelArtifact artifact, @Nullable Origin origin,
                         @Nullable String lastError) {

        static final Entry EMPTY = new Entry(ModelState.NOT_LOADED, null, null, null);
    }

    private final ModelArtifactStore store;
    private final Map<StrategyDomain, AtomicReference<Entry>> entries = new EnumMap<>(StrategyDomain.class);
    private final Map<StrategyDomain, ReentrantLock> locks = new EnumMap<>(StrategyDomain.class);

    public ModelRegistry(ModelArtifactStore store) {
        this.store = store;
        for (StrategyDomain domain : StrategyDomain.values()) {
            entries.put(domain, new AtomicReference<>(Entry.EMPTY));
            locks.put(domain, new ReentrantLock());
        }
    }

    @PostConstruct
    public void loadPersisted() {
        for (StrategyDomain domain : StrategyDomain.values()) {
            store.load(domain).ifPresentOrElse(
                    artifact -> {
                        entries.get(domain).set(new Entry(ModelState.READY, artifact, Origin.LOADED, null));
                        log.info("Loaded {} model trained at {}", domain.modelName(), artifact.trainedAt());
                    },
                    () -> log.info("No persisted {} model; domain stays not_loaded until trained", domain.modelName()));
        }
    }

    public List<ModelStatus> status() {
        List<ModelStatus> statuses = new ArrayList<>();
        for (StrategyDomain domain : StrategyDomain.values()) {
            statuses.add(statusOf(domain));
        }
        return statuses;
    }

    public ModelStatus statusOf(StrategyDomain domain) {
        Entry entry = entries.get(domain).get();
        ModelArtifact artifact = entry.artifact();
        return new ModelStatus(
                domain.modelName(),
                statusName(entry),
                domain.description(),
                artifact != null,
                artifact == null ? null : artifact.trainedAt(),
                entry.lastError());
    }

    /**
     * Looks up a domain's artifact by model name.
     *
     * @throws org.jstats.pitwall_api.modules.strategy_engine.exception.ModelNotFoundException for an unknown name
     * @throws ModelNotReadyException when the domain has nothing to serve
     */
    public ModelArtifact get(String name) {
        return require(StrategyDomain.fromName(name));
    }

    public ModelArtifact require(StrategyDomain domain) {
        ModelArtifact artifact = entries.get(domain).get().artifact();
        if (artifact == null) {
            throw new ModelNotReadyException(domain.modelName());
        }
        return artifact;
    }

    public Optional<ModelArtifact> current(StrategyDomain domain) {
        return Optional.ofNullable(entries.get(domain).get().artifact());
    }

    public boolean isReady(StrategyDomain domain) {
        return entries.get(domain).get().artifact() != null;
    }

    /**
     * Runs {@code fit} under the domain's lock, persists the result and publishes it.
     */
    public ModelArtifact retrain(StrategyDomain domain, Supplier<ModelArtifact> fit) {
        ReentrantLock lock = locks.get(domain);
        AtomicReference<Entry> ref = entries.get(domain);
        lock.lock();
        try {
            Entry previous = ref.get();
            ref.set(new Entry(ModelState.TRAINING, previous.artifact(), previous.origin(), previous.lastError()));
            try {
                ModelArtifact artifact = fit.get();
                persist(artifact);
                ref.set(new Entry(ModelState.READY, artifact, Origin.TRAINED, null));
                return artifact;
            } catch (RuntimeException ex) {
                ref.set(failed(previous, ex));
                log.error("Training {} failed: {}", domain.modelName(), ex.getMessage());
                throw ex;
            }
        } finally {
            lock.unlock();
        }
    }

    private void persist(ModelArtifact artifact) {
        try {
            store.save(artifact);
        } catch (IOException ex) {
            throw new TrainingFailureException(artifact.domain().modelName(),
                    "Failed to persist model artifact: " + ex.getMessage(), ex);
        }
    }

    private static Entry failed(Entry previous, RuntimeException ex) {
        String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        if (previous.artifact() != null) {
            return new Entry(ModelState.READY, previous.artifact(), previous.origin(), message);
        }
        return new Entry(ModelState.ERROR, null, null, message);
    }

    private static String statusName(Entry entry) {
        return switch (entry.state()) {
            case NOT_LOADED -> "not_loaded";
            case TRAINING -> "training";
            case ERROR -> "error";
            case READY -> entry.origin() == Origin.LOADED ? "loaded" : "trained";
        };
    }
}
