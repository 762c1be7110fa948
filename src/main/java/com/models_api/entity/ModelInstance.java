package com.models_api.entity;

import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Cache entry for one model: the deserialized state, its backing file and when it was read.
 *
 * <p>{@code instance} is only trusted while the file's modification time is not newer than
 * {@code lastLoaded} and still equals the modification time seen at load. Callers synchronize
 * on the entry.</p>
 */
@Getter
@ToString(exclude = "instance")
public class ModelInstance {

    private final String name;
    private final Path file;
    private String type;
    private Object instance;
    private Instant lastLoaded;
    private Instant loadedModified;

    public ModelInstance(String name, Path file) {
        this.name = name;
        this.file = file;
    }

    public boolean isStale(Instant lastModified) {
        return instance == null
                || lastLoaded == null
                || lastModified.isAfter(lastLoaded)
                || !lastModified.equals(loadedModified);
    }

    public void loaded(String type, Object instance, Instant at, Instant fileModified) {
        this.type = type;
        this.instance = instance;
        this.loadedModified = fileModified;
        this.lastLoaded = at.isBefore(fileModified) ? fileModified : at;
    }

    public void clear() {
        this.instance = null;
        this.lastLoaded = null;
        this.loadedModified = null;
    }

    public boolean isLoaded() {
        return instance != null;
    }
}
