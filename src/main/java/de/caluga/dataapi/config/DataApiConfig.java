package de.caluga.dataapi.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Properties;

/**
 * Configuration of a client, split into connection, timeout, admin and logging settings.
 * Property keys look like <code>dataapi.connection.endpoint</code>, <code>dataapi.timeouts.requestTimeoutMs</code>,
 * <code>dataapi.admin.adminToken</code> or <code>dataapi.logging.commandFailed</code>.
 */
public class DataApiConfig {
    public static final String DEFAULT_PREFIX = "dataapi";

    private ConnectionSettings connectionSettings = new ConnectionSettings();
    private TimeoutSettings timeoutSettings = new TimeoutSettings();
    private AdminSettings adminSettings = new AdminSettings();
    private LoggingSettings loggingSettings = new LoggingSettings();

    public DataApiConfig() {
    }

    public DataApiConfig(String prefix, SettingResolver resolver) {
        if (prefix == null) prefix = DEFAULT_PREFIX;
        String p = prefix.isEmpty() ? "" : prefix + ".";
        connectionSettings.applyProperties(p + "connection", resolver);
        timeoutSettings.applyProperties(p + "timeouts", resolver);
        adminSettings.applyProperties(p + "admin", resolver);
        loggingSettings.applyProperties(p + "logging", resolver);
    }

    public static DataApiConfig fromProperties(Properties p) {
        return fromProperties(DEFAULT_PREFIX, p);
    }

    public static DataApiConfig fromProperties(String prefix, Properties p) {
        return new DataApiConfig(prefix, p::get);
    }

    /**
     * reads a nested JSON object like <code>{"connection":{"endpoint":"..."},"timeouts":{...}}</code>
     */
    public static DataApiConfig createFromJson(String json) throws JsonProcessingException {
        Map<String, Object> m = new ObjectMapper().readValue(json, new TypeReference<Map<String, Object>>() {});
        Properties p = new Properties();
        flatten("", m, p);
        return fromProperties("", p);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> m, Properties p) {
        for (Map.Entry<String, Object> e : m.entrySet()) {
            String k = prefix.isEmpty() ? e.getKey() : prefix + "." + e.getKey();

            if (e.getValue() instanceof Map) {
                flatten(k, (Map<String, Object>) e.getValue(), p);
            } else if (e.getValue() != null) {
                p.put(k, e.getValue().toString());
            }
        }
    }

    public Properties asProperties() {
        return asProperties(DEFAULT_PREFIX);
    }

    public Properties asProperties(String prefix) {
        String p = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
        Properties ret = new Properties();
        ret.putAll(connectionSettings.asProperties(p + "connection"));
        ret.putAll(timeoutSettings.asProperties(p + "timeouts"));
        ret.putAll(adminSettings.asProperties(p + "admin"));
        ret.putAll(loggingSettings.asProperties(p + "logging"));
        return ret;
    }

    public DataApiConfig copy() {
        DataApiConfig ret = new DataApiConfig();
        ret.connectionSettings = connectionSettings.copy();
        ret.timeoutSettings = timeoutSettings.copy();
        ret.adminSettings = adminSettings.copy();
        ret.loggingSettings = loggingSettings.copy();
        return ret;
    }

    public ConnectionSettings connectionSettings() {
        return connectionSettings;
    }

    public DataApiConfig setConnectionSettings(ConnectionSettings connectionSettings) {
        this.connectionSettings = connectionSettings;
        return this;
    }

    public TimeoutSettings timeoutSettings() {
        return timeoutSettings;
    }

    public DataApiConfig setTimeoutSettings(TimeoutSettings timeoutSettings) {
        this.timeoutSettings = timeoutSettings;
        return this;
    }

    public AdminSettings adminSettings() {
        return adminSettings;
    }

    public DataApiConfig setAdminSettings(AdminSettings adminSettings) {
        this.adminSettings = adminSettings;
        return this;
    }

    public LoggingSettings loggingSettings() {
        return loggingSettings;
    }

    public DataApiConfig setLoggingSettings(LoggingSettings loggingSettings) {
        this.loggingSettings = loggingSettings;
        return this;
    }
}
