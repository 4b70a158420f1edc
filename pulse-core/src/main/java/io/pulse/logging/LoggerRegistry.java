package io.pulse.logging;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Instance-scoped registry of named {@code java.util.logging} loggers.
 *
 * <p>Loggers are created lazily under a common namespace ({@code <namespace>.<name>})
 * and cached, so repeated lookups return the same instance. Output level, application
 * id and JSON output apply to every logger the registry owns, including ones created
 * later. Create one registry per application (or per test) and pass it, or the loggers
 * it hands out, to the components that log.
 *
 * <p>Registries are isolated only when their namespaces differ. The loggers live in the
 * JVM-wide {@link java.util.logging.LogManager}, so two registries created with the same
 * namespace hand out the same {@link Logger} objects, and level or output changes made
 * through one are visible through the other. Tests that need isolation use a distinct
 * namespace each.
 *
 * <p>This class is thread-safe.
 */
public final class LoggerRegistry {
    public static final String DEFAULT_NAMESPACE = "pulse";
    static final String VERSION = "1";

    private final String namespace;
    private final ConcurrentMap<String, Logger> loggers = new ConcurrentHashMap<>();
    private final Handler jsonHandler;

    private volatile LogLevel outputLevel = LogLevel.INFO;
    private volatile String appId = "";
    private volatile boolean jsonOutput;

    public LoggerRegistry() {
        this(DEFAULT_NAMESPACE);
    }

    /**
     * @param namespace prefix for the names of all loggers created by this registry
     */
    public LoggerRegistry(String namespace) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        if (namespace.isEmpty()) {
            throw new IllegalArgumentException("namespace must not be empty");
        }
        this.jsonHandler = new ConsoleHandler();
        this.jsonHandler.setLevel(Level.ALL);
        this.jsonHandler.setFormatter(new JsonLogFormatter(hostName(), VERSION, () -> this.appId));
    }

    /**
     * Returns the logger for {@code name}, creating it on first use.
     *
     * @param name the logger's short name, e.g. {@code "retry"}
     * @return the logger named {@code <namespace>.<name>}
     */
    public Logger get(String name) {
        Objects.requireNonNull(name, "name");
        return loggers.computeIfAbsent(name, this::create);
    }

    /**
     * Returns a snapshot of the loggers created so far, keyed by short name.
     *
     * @return an unmodifiable copy
     */
    public Map<String, Logger> loggers() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(loggers));
    }

    /**
     * Sets the output level of every logger owned by this registry.
     *
     * @param level the new level; {@link LogLevel#UNDEFINED} makes loggers inherit from their parent
     */
    public synchronized void setOutputLevel(LogLevel level) {
        this.outputLevel = Objects.requireNonNull(level, "level");
        for (Logger logger : loggers.values()) {
            logger.setLevel(level.julLevel());
        }
    }

    public LogLevel outputLevel() {
        return outputLevel;
    }

    /**
     * Sets the {@code app_id} written by JSON output. Defaults to an empty string.
     *
     * @param appId the application id
     */
    public void setAppId(String appId) {
        this.appId = Objects.requireNonNull(appId, "appId");
    }

    public String appId() {
        return appId;
    }

    /**
     * Switches every owned logger between JSON console output and the inherited handlers.
     *
     * @param enabled {@code true} to write one JSON object per record to the console
     */
    public synchronized void enableJsonOutput(boolean enabled) {
        this.jsonOutput = enabled;
        for (Logger logger : loggers.values()) {
            applyOutput(logger);
        }
    }

    public boolean isJsonOutput() {
        return jsonOutput;
    }

    private synchronized Logger create(String name) {
        Logger logger = Logger.getLogger(namespace + "." + name);
        logger.setLevel(outputLevel.julLevel());
        applyOutput(logger);
        return logger;
    }

    private void applyOutput(Logger logger) {
        logger.removeHandler(jsonHandler);
        if (jsonOutput) {
            logger.addHandler(jsonHandler);
        }
        logger.setUseParentHandlers(!jsonOutput);
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            Logger.getLogger(LoggerRegistry.class.getName())
                    .log(Level.FINE, "Could not resolve local host name", e);
            return "unknown";
        }
    }
}
