package org.jstats.pitwall_api.modules.strategy_engine.registry;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * One serialized artifact per domain under the models directory, named {@code <domain>_model.ser}.
 */
@Component
public class ModelArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ModelArtifactStore.class);

    private final Path modelsDir;

    public ModelArtifactStore(StrategyEngineProperties properties) {
        this.modelsDir = Path.of(properties.getModelsDir());
    }

    public Path pathFor(StrategyDomain domain) {
        return modelsDir.resolve(domain.modelName() + "_model.ser");
    }

    /**
     * Reads the persisted artifact. A missing or unreadable file yields empty.
     */
    public Optional<ModelArtifact> load(StrategyDomain domain) {
        Path file = pathFor(domain);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(file);
             ObjectInputStream objects = new ObjectInputStream(in)) {
            Object value = objects.readObject();
            if (value instanceof ModelArtifact artifact && artifact.domain() == domain) {
                return Optional.of(artifact);
            }
            log.warn("Ignoring {}: does not hold a {} artifact", file, domain.modelName());
            return Optional.empty();
        } catch (IOException | ClassNotFoundException ex) {
            log.warn("Could not read model artifact {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes to a temp file in the same directory, then moves it over the previous artifact.
     */
    public void save(ModelArtifact artifact) throws IOException {
        Files.createDirectories(modelsDir);
        Path target = pathFor(artifact.domain());
        Path temp = Files.createTempFile(modelsDir, artifact.domain().modelName() + "_", ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp);
                 ObjectOutputStream objects = new ObjectOutputStream(out)) {
                objects.writeObject(artifact);
            }
            try {
                Files.move(temp, target, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        if (log.isDebugEnabled()) {
            log.debug("Persisted {} artifact to {}", artifact.domain().modelName(), target);
        }
    }
}
