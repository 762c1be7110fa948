package com.models_api.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.models_api.dto.model.ModelInstanceDTO;
import com.models_api.dto.model.ModelMetadata;
import com.models_api.dto.model.ModelTypeDTO;
import com.models_api.entity.ModelInstance;
import com.models_api.exception.ModelExecutionException;
import com.models_api.exception.NotFoundException;
import com.models_api.exception.StorageException;
import com.models_api.exception.TaskCancelledException;
import com.models_api.exception.ValidationException;
import com.models_api.helper.ModelsHandler;
import com.models_api.plugin.ModelPlugin;
import com.models_api.plugin.ModelTypeRegistry;
import com.models_api.util.ArtifactCodec;
import com.models_api.util.ArtifactCodec.Artifact;
import com.models_api.util.CancellationToken;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Owns the model instances stored under one folder and keeps an in-memory cache of their
 * deserialized state.
 *
 * <p>Each model is one artifact file {@code <folder>/<name><suffix>} plus an optional metadata
 * sidecar. Instances are loaded lazily and reloaded whenever the file's modification time moves,
 * which is how a cache notices writes made by another process (a background worker holds its own
 * {@code ModelsManager} over the same folder). No lock is shared across processes.</p>
 */
@Slf4j
public class ModelsManager {

    static final String METADATA_SUFFIX = ".meta.json";
    private static final String TEMP_SUFFIX = ".tmp";

    @Getter
    private final Path folder;
    @Getter
    private final String suffix;
    @Getter
    private final ModelsHandler handler;
    private final ModelTypeRegistry models;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ConcurrentMap<String, ModelInstance> instances = new ConcurrentHashMap<>();

    public ModelsManager(Path folder, String suffix, ModelTypeRegistry models, ModelsHandler handler,
                         ObjectMapper objectMapper, Clock clock) {
        this.folder = folder.toAbsolutePath();
        this.suffix = suffix;
        this.models = models;
        this.handler = handler;
        this.objectMapper = objectMapper;
        this.clock = clock;
        try {
            Files.createDirectories(this.folder);
        } catch (IOException e) {
            throw new StorageException("Unable to create models folder at " + this.folder, e);
        }
    }

    public Path getFile(String name) {
        return folder.resolve(name + suffix);
    }

    Path getMetadataFile(String name) {
        return folder.resolve(name + suffix + METADATA_SUFFIX);
    }

    public boolean exists(String name) {
        return handler.isValidName(name) && Files.isRegularFile(getFile(name));
    }

    public ModelInstanceDTO create(String name, String type, Map<String, Object> settings, boolean overwrite) {
        handler.handleName(name);
        ModelInstance entry = entry(name);
        synchronized (entry) {
            // checked under the entry lock so two creates of one name cannot both pass
            handler.handleCreate(name, type, exists(name), overwrite, models);
            ModelPlugin<Object> plugin = models.get(type);
            Object state = invoke(name, "initialize", () -> plugin.initialize(settings == null ? Map.of() : settings));
            byte[] payload = serialize(name, plugin, state);
            // a new artifact has not been read back yet, so the entry stays empty (lazy)
            writeArtifact(name, type, payload);
            entry.clear();

            ZonedDateTime now = ZonedDateTime.now(clock);
            writeMetadata(name, ModelMetadata.builder()
                    .title(name)
                    .model(type)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        log.info("📦 Created model instance [{}] of type [{}] (overwrite={})", name, type, overwrite);
        return get(name);
    }

    public Object load(String name) {
        return load(name, false);
    }

    /**
     * Returns the cached state of {@code name}, deserializing it first when it is missing, stale
     * or {@code force} is set. Costs one file stat when the cache is fresh.
     */
    public Object load(String name, boolean force) {
        handler.handleName(name);
        return load(entry(name), force);
    }

    private Object load(ModelInstance entry, boolean force) {
        String name = entry.getName();
        synchronized (entry) {
            Instant lastModified = lastModified(name, entry);
            if (force || entry.isStale(lastModified)) {
                Artifact artifact = readArtifact(name);
                ModelPlugin<Object> plugin = models.get(artifact.type());
                Object state;
                try {
                    state = plugin.deserialize(artifact.payload());
                } catch (IOException e) {
                    throw new StorageException("Unable to deserialize model instance " + name, e);
                }
                entry.loaded(artifact.type(), state, clock.instant(), lastModified);
                log.debug("Loaded model instance [{}] (force={}, lastModified={})", name, force, lastModified);
            }
            return entry.getInstance();
        }
    }

    public void input(String name, List<Map<String, Object>> data, Map<String, Object> options) {
        input(name, data, options, CancellationToken.NONE);
    }

    /**
     * Trains {@code name} on {@code data} and writes the new state back to its file.
     * Cancellation is honoured up to the point where the file is replaced.
     */
    public void input(String name, List<Map<String, Object>> data, Map<String, Object> options, CancellationToken token) {
        handler.handleName(name);
        handler.handleData(data);
        Map<String, Object> safeOptions = options == null ? Map.of() : options;
        ModelInstance entry = entry(name);
        synchronized (entry) {
            token.checkpoint("load");
            Object state = load(entry, false);
            String type = entry.getType();
            ModelPlugin<Object> plugin = models.get(type);

            token.checkpoint("train");
            Object trained = invoke(name, "input", () -> plugin.train(state, data, safeOptions));
            byte[] payload = serialize(name, plugin, trained);

            token.checkpoint("persist");
            Instant modified = writeArtifact(name, type, payload);
            entry.loaded(type, trained, clock.instant(), modified);
            touchMetadata(name);
        }
        log.info("🧠 Input of {} rows saved for model instance [{}]", data.size(), name);
    }

    public List<Map<String, Object>> output(String name, List<Map<String, Object>> data, Map<String, Object> options) {
        handler.handleName(name);
        handler.handleData(data);
        Map<String, Object> safeOptions = options == null ? Map.of() : options;
        ModelInstance entry = entry(name);
        Object state;
        String type;
        synchronized (entry) {
            state = load(entry, false);
            type = entry.getType();
        }
        ModelPlugin<Object> plugin = models.get(type);
        List<Map<String, Object>> result = invoke(name, "output", () -> plugin.predict(state, data, safeOptions));
        log.debug("Output of {} rows produced by model instance [{}]", result.size(), name);
        return result;
    }

    /**
     * Merges editable metadata fields into the sidecar. The artifact is not touched.
     */
    public ModelMetadata update(String name, Map<String, Object> metadata) {
        handler.handleRead(name, exists(name));
        handler.handleMetadata(metadata);
        ModelInstance entry = entry(name);
        synchronized (entry) {
            ModelMetadata current = readMetadata(name);
            ModelMetadata updated;
            try {
                updated = objectMapper.updateValue(current.toBuilder().build(), metadata);
            } catch (IOException e) {
                throw new ValidationException("Invalid metadata: " + e.getMessage(), e);
            }
            updated.setUpdatedAt(ZonedDateTime.now(clock));
            writeMetadata(name, updated);
            log.info("📝 Metadata updated for model instance [{}]: {}", name, metadata.keySet());
            return updated;
        }
    }

    public void delete(String name) {
        handler.handleName(name);
        ModelInstance entry = entry(name);
        synchronized (entry) {
            try {
                boolean removed = Files.deleteIfExists(getFile(name));
                Files.deleteIfExists(getMetadataFile(name));
                entry.clear();
                instances.remove(name, entry);
                if (!removed) {
                    throw new NotFoundException("Model instance not found: " + name);
                }
            } catch (IOException e) {
                throw new StorageException("Unable to delete model instance " + name, e);
            }
        }
        log.info("🗑️ Deleted model instance [{}]", name);
    }

    /**
     * Snapshot of a model without forcing a load.
     */
    public ModelInstanceDTO get(String name) {
        handler.handleRead(name, exists(name));
        Path file = getFile(name);
        ModelInstance entry = instances.get(name);
        try {
            Instant lastModified = Files.getLastModifiedTime(file).toInstant();
            String type = entry != null && entry.getType() != null ? entry.getType() : ArtifactCodec.readType(file);
            return ModelInstanceDTO.builder()
                    .name(name)
                    .type(type)
                    .file(file.toString())
                    .loaded(entry != null && entry.isLoaded() && !entry.isStale(lastModified))
                    .lastLoaded(entry == null ? null : entry.getLastLoaded())
                    .lastModified(lastModified)
                    .metadata(readMetadata(name))
                    .build();
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Model instance not found: " + name);
        } catch (IOException e) {
            throw new StorageException("Unable to read model instance " + name, e);
        }
    }

    /**
     * Names of every model artifact in the folder, loaded or not.
     */
    public List<String> list() {
        try (Stream<Path> files = Files.list(folder)) {
            return files
                    .filter(Files::isRegularFile)
                    .map(path -> path.getFileName().toString())
                    .filter(fileName -> fileName.endsWith(suffix))
                    .map(fileName -> fileName.substring(0, fileName.length() - suffix.length()))
                    .filter(handler::isValidName)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageException("Unable to list models folder " + folder, e);
        }
    }

    /**
     * Drops the in-memory state of {@code name}; the next access reloads it from disk.
     */
    public void evict(String name) {
        ModelInstance entry = instances.remove(name);
        if (entry != null) {
            synchronized (entry) {
                entry.clear();
            }
            log.debug("Evicted model instance [{}] from cache", name);
        }
    }

    public List<ModelTypeDTO> types() {
        return models.describe();
    }

    private ModelInstance entry(String name) {
        return instances.computeIfAbsent(name, n -> new ModelInstance(n, getFile(n)));
    }

    private Instant lastModified(String name, ModelInstance entry) {
        try {
            return Files.getLastModifiedTime(getFile(name)).toInstant();
        } catch (NoSuchFileException e) {
            entry.clear();
            instances.remove(name, entry);
            throw new NotFoundException("Model instance not found: " + name);
        } catch (IOException e) {
            throw new StorageException("Unable to stat model instance " + name, e);
        }
    }

    private Artifact readArtifact(String name) {
        try {
            return ArtifactCodec.decode(Files.readAllBytes(getFile(name)));
        } catch (NoSuchFileException e) {
            throw new NotFoundException("Model instance not found: " + name);
        } catch (IOException e) {
            throw new StorageException("Unable to read model instance " + name, e);
        }
    }

    private Instant writeArtifact(String name, String type, byte[] payload) {
        Path target = getFile(name);
        writeAtomically(name, target, ArtifactCodec.encode(type, payload));
        try {
            return Files.getLastModifiedTime(target).toInstant();
        } catch (IOException e) {
            throw new StorageException("Unable to stat model instance " + name, e);
        }
    }

    // readers see either the old or the new file, never a partial one
    private void writeAtomically(String name, Path target, byte[] bytes) {
        Path tmp = null;
        try {
            tmp = Files.createTempFile(folder, "." + name, TEMP_SUFFIX);
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StorageException("Unable to write " + target, e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("⚠️ Could not remove temp file {}", tmp, e);
                }
            }
        }
    }

    private ModelMetadata readMetadata(String name) {
        Path file = getMetadataFile(name);
        if (!Files.isRegularFile(file)) {
            return ModelMetadata.builder().title(name).build();
        }
        try {
            return objectMapper.readValue(file.toFile(), ModelMetadata.class);
        } catch (IOException e) {
            throw new StorageException("Unable to read metadata of model instance " + name, e);
        }
    }

    private void writeMetadata(String name, ModelMetadata metadata) {
        try {
            writeAtomically(name, getMetadataFile(name), objectMapper.writeValueAsBytes(metadata));
        } catch (IOException e) {
            throw new StorageException("Unable to write metadata of model instance " + name, e);
        }
    }

    private void touchMetadata(String name) {
        ModelMetadata metadata = readMetadata(name);
        metadata.setUpdatedAt(ZonedDateTime.now(clock));
        writeMetadata(name, metadata);
    }

    private byte[] serialize(String name, ModelPlugin<Object> plugin, Object state) {
        try {
            return plugin.serialize(state);
        } catch (IOException e) {
            throw new StorageException("Unable to serialize model instance " + name, e);
        }
    }

    private <T> T invoke(String name, String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (IllegalArgumentException | IllegalStateException e) {
            throw new ValidationException("Model instance " + name + " rejected " + operation + ": " + e.getMessage(), e);
        } catch (ValidationException | ModelExecutionException | TaskCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelExecutionException("Model instance " + name + " failed during " + operation + ": " + e.getMessage(), e);
        }
    }
}
