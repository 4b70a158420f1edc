package io.pulse.logging;

import io.pulse.util.Json;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Formatter;
import java.util.logging.Level;
import java.util.logging.LogRecord;

/**
 * {@link Formatter} that renders each record as one JSON object per line.
 *
 * <p>Fields: {@code time}, {@code level}, {@code type}, {@code scope} (logger name),
 * {@code msg}, {@code instance} (host name), {@code ver}, {@code app_id}. A thrown
 * exception's stack trace is appended to {@code msg}.
 */
public final class JsonLogFormatter extends Formatter {
    public static final String LOG_TYPE = "log";

    private final String instance;
    private final String version;
    private final Supplier<String> appId;

    /**
     * @param instance host or instance name written to every record
     * @param version  library or application version written to every record
     * @param appId    supplies the current application id; read per record so later
     *                 {@link LoggerRegistry#setAppId(String)} calls take effect
     */
    public JsonLogFormatter(String instance, String version, Supplier<String> appId) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.version = Objects.requireNonNull(version, "version");
        this.appId = Objects.requireNonNull(appId, "appId");
    }

    @Override
    public String format(LogRecord record) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("time", record.getInstant().toString());
        fields.put("level", levelName(record.getLevel()));
        fields.put("type", LOG_TYPE);
        fields.put("scope", record.getLoggerName() == null ? "" : record.getLoggerName());
        fields.put("msg", message(record));
        fields.put("instance", instance);
        fields.put("ver", version);
        fields.put("app_id", appId.get() == null ? "" : appId.get());
        return Json.appendObject(new StringBuilder(256), fields).append(System.lineSeparator()).toString();
    }

    private String message(LogRecord record) {
        String msg = formatMessage(record);
        if (record.getThrown() == null) {
            return msg;
        }
        StringWriter trace = new StringWriter();
        record.getThrown().printStackTrace(new PrintWriter(trace));
        return msg + System.lineSeparator() + trace;
    }

    static String levelName(Level level) {
        int value = level.intValue();
        if (value >= Level.SEVERE.intValue()) {
            return "error";
        }
        if (value >= Level.WARNING.intValue()) {
            return "warn";
        }
        if (value >= Level.INFO.intValue()) {
            return "info";
        }
        return "debug";
    }
}
