package com.example.hoopstats_backend.engine;

import com.example.hoopstats_backend.dto.ClassifierInfo;
import com.example.hoopstats_backend.engine.Interfaces.ActionClassifier;
import com.example.hoopstats_backend.exception.UnknownClassifierException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Maps short identifiers ({@code videomae}, {@code yolo}, ...) to classifier factories and keeps at most one live
 * instance per identifier. Instances are built lazily on first use and initialised once, even when several
 * callers ask for the same identifier concurrently.
 */
public class ClassifierRegistry {
    private static final Logger LOGGER = LoggerFactory.getLogger(ClassifierRegistry.class);

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public ClassifierRegistry register(String id, String displayName, Supplier<? extends ActionClassifier> factory) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(factory, "factory");
        if (registrations.putIfAbsent(id, new Registration(id, displayName, factory)) != null) {
            throw new IllegalStateException("Classifier already registered: " + id);
        }
        LOGGER.debug("Classifier registered id={} name={}", id, displayName);
        return this;
    }

    public boolean isRegistered(String id) {
        return id != null && registrations.containsKey(id);
    }

    /** Registered identifiers in alphabetical order. */
    public List<String> available() {
        List<String> ids = new ArrayList<>(registrations.keySet());
        ids.sort(null);
        return ids;
    }

    /**
     * Returns the shared classifier for {@code id}, creating and initialising it on first use.
     * A classifier whose initialisation failed is retried on the next call.
     *
     * @throws UnknownClassifierException when {@code id} is not registered.
     */
    public ActionClassifier get(String id) {
        Registration registration = id == null ? null : registrations.get(id);
        if (registration == null) {
            throw new UnknownClassifierException(id, available());
        }
        return registration.obtain();
    }

    public List<ClassifierInfo> info() {
        List<ClassifierInfo> out = new ArrayList<>();
        for (String id : available()) {
            Registration r = registrations.get(id);
            ActionClassifier instance = r.instance;
            out.add(new ClassifierInfo(id, r.displayName, instance != null, instance != null && instance.isReady()));
        }
        return out;
    }

    private static final class Registration {
        private final String id;
        private final String displayName;
        private final Supplier<? extends ActionClassifier> factory;
        private volatile ActionClassifier instance;

        private Registration(String id, String displayName, Supplier<? extends ActionClassifier> factory) {
            this.id = id;
            this.displayName = displayName;
            this.factory = factory;
        }

        private synchronized ActionClassifier obtain() {
            if (instance == null) {
                LOGGER.info("Initializing {} classifier...", displayName != null ? displayName : id);
                instance = factory.get();
            }
            if (!instance.isReady() && !instance.initialize()) {
                LOGGER.warn("Classifier {} is not ready after initialization", id);
            }
            return instance;
        }
    }
}
