package com.hybridrag.embedding;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load-once holder for an expensive model handle. Concurrent first use runs the
 * loader exactly once; {@link #clear()} drops the handle so the next call reloads it.
 */
public final class LazyResource<T> {
    private static final Logger log = LoggerFactory.getLogger(LazyResource.class);

    private final String name;
    private final Supplier<T> loader;
    private volatile T value;

    public LazyResource(String name, Supplier<T> loader) {
        this.name = name;
        this.loader = loader;
    }

    public T get() {
        T current = value;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (value == null) {
                log.info("Loading model handle {}", name);
                try {
                    T loaded = loader.get();
                    if (loaded == null) {
                        throw new CapabilityUnavailableException("Loader for " + name + " returned no model");
                    }
                    value = loaded;
                } catch (CapabilityUnavailableException e) {
                    throw e;
                } catch (RuntimeException e) {
                    throw new CapabilityUnavailableException("Failed to load " + name + ": " + e.getMessage(), e);
                }
            }
            return value;
        }
    }

    public boolean isLoaded() {
        return value != null;
    }

    public synchronized void clear() {
        if (value != null) {
            log.info("Model handle {} cleared", name);
        }
        value = null;
    }

    public String name() {
        return name;
    }
}
