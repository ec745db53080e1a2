package fr.lapetina.aimux.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reads the router configuration from YAML and keeps it current.
 *
 * Supports:
 * - A file on disk, falling back to a classpath resource of the same name
 * - Polling the file's directory and reloading when the file changes
 * - Listeners that see every accepted configuration and may veto it
 */
public final class ConfigLoader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<RouterConfig> currentConfig = new AtomicReference<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private final Path configPath;
    private final Yaml yaml;

    private volatile WatchService watcher;
    private volatile ScheduledExecutorService watchThread;
    private volatile long loadedModifiedAt;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        this.yaml = new Yaml(new Constructor(RouterConfig.class, new LoaderOptions()));
    }

    /**
     * Reads the configuration source and hands the result to the listeners.
     * If a listener rejects it, the previous configuration stays current.
     *
     * @throws ConfigurationException if the source is missing or malformed, or a listener rejects it
     */
    public synchronized RouterConfig load() {
        return accept(readSource());
    }

    /**
     * Same as {@link #load()} for a configuration that does not come from the configured path.
     */
    public synchronized RouterConfig loadFromStream(InputStream inputStream) {
        return accept(parse(inputStream, "stream"));
    }

    private RouterConfig accept(RouterConfig candidate) {
        RouterConfig previous = currentConfig.getAndSet(candidate);
        try {
            for (ConfigChangeListener listener : listeners) {
                notifyListener(listener, previous, candidate);
            }
        } catch (ConfigurationException e) {
            currentConfig.compareAndSet(candidate, previous);
            throw e;
        }
        return candidate;
    }

    private void notifyListener(ConfigChangeListener listener, RouterConfig previous, RouterConfig candidate) {
        try {
            listener.onConfigChanged(previous, candidate);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Config change listener failed: listener={}", listener, e);
        }
    }

    private RouterConfig readSource() {
        if (Files.isRegularFile(configPath)) {
            log.info("Reading configuration file: {}", configPath);
            try (InputStream in = Files.newInputStream(configPath)) {
                loadedModifiedAt = Files.getLastModifiedTime(configPath).toMillis();
                return parse(in, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot read configuration file " + configPath, e);
            }
        }

        String resource = configPath.toString().replace('\\', '/');
        while (resource.startsWith("/")) {
            resource = resource.substring(1);
        }
        try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration file not found: " + configPath);
            }
            log.info("Reading configuration resource: classpath:{}", resource);
            return parse(in, "classpath:" + resource);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration resource " + resource, e);
        }
    }

    private RouterConfig parse(InputStream in, String source) {
        try {
            RouterConfig parsed = yaml.load(in);
            return parsed != null ? parsed : new RouterConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    public RouterConfig getCurrentConfig() {
        return currentConfig.get();
    }

    public Path getConfigPath() {
        return configPath;
    }

    // ==================== HOT RELOAD ====================

    /**
     * Polls the configuration file's directory once a second and reloads when the file changes.
     * Does nothing for a classpath resource.
     */
    public synchronized void startWatching() {
        if (watchThread != null) {
            return;
        }
        if (!Files.isRegularFile(configPath)) {
            log.info("No configuration file on disk, hot reload disabled: {}", configPath);
            return;
        }

        Path directory = configPath.toAbsolutePath().getParent();
        try {
            watcher = FileSystems.getDefault().newWatchService();
            directory.register(watcher, StandardWatchEventKinds.ENTRY_CREATE, StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            log.error("Cannot watch {}, hot reload disabled", directory, e);
            return;
        }

        watchThread = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-watcher");
            t.setDaemon(true);
            return t;
        });
        watchThread.scheduleWithFixedDelay(this::drainWatchEvents, 1, 1, TimeUnit.SECONDS);
        log.info("Watching configuration file for changes: {}", configPath);
    }

    private void drainWatchEvents() {
        try {
            WatchKey key = watcher.poll();
            if (key == null) {
                return;
            }
            boolean touched = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (configPath.getFileName().equals(event.context())) {
                    touched = true;
                }
            }
            key.reset();

            if (touched && modifiedSinceLoad()) {
                log.info("Configuration file changed, reloading: {}", configPath);
                reload();
            }
        } catch (ClosedWatchServiceException e) {
            log.debug("Configuration watcher closed");
        } catch (RuntimeException e) {
            // Keep the scheduled task alive
            log.error("Error while checking configuration file {}", configPath, e);
        }
    }

    private boolean modifiedSinceLoad() {
        try {
            return Files.getLastModifiedTime(configPath).toMillis() > loadedModifiedAt;
        } catch (IOException e) {
            log.warn("Cannot stat configuration file {}: {}", configPath, e.getMessage());
            return false;
        }
    }

    /**
     * Loads again, logging instead of throwing when the new configuration is rejected.
     *
     * @return the configuration in effect afterwards
     */
    public RouterConfig reload() {
        try {
            return load();
        } catch (ConfigurationException e) {
            log.error("Configuration reload rejected, keeping current: problems={}", e.getProblems());
            return currentConfig.get();
        }
    }

    public void addListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ConfigChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (watchThread != null) {
            watchThread.shutdownNow();
            try {
                watchThread.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            watchThread = null;
        }
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException e) {
                log.warn("Failed to close configuration watcher", e);
            }
            watcher = null;
        }
    }

    /**
     * A configuration that could not be read or was rejected. The previous configuration stays in effect.
     */
    public static class ConfigurationException extends RuntimeException {

        private final List<String> problems;

        public ConfigurationException(String message) {
            super(message);
            this.problems = List.of(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
            this.problems = List.of(message);
        }

        public ConfigurationException(List<String> problems) {
            super("Invalid configuration: " + String.join("; ", problems));
            this.problems = List.copyOf(problems);
        }

        /**
         * Every problem found, in the order they were detected.
         */
        public List<String> getProblems() {
            return problems;
        }
    }
}
