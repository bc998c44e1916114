package de.caluga.dataapi.config;

import de.caluga.dataapi.events.DataApiEventType;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * per event outputs. Events without explicit configuration are only emitted ({@link LoggingOutput#EVENT}).
 * Property form: <code>commandFailed=event,stderr</code>, the name <code>all</code> addresses every event.
 */
public class LoggingSettings extends Settings {
    private Map<DataApiEventType, Set<LoggingOutput>> outputs = new EnumMap<>(DataApiEventType.class);

    /**
     * admin progress to stdout, failures and warnings to stderr, data api successes only as events
     */
    public LoggingSettings enableDefaults() {
        EnumSet<LoggingOutput> eventStdout = EnumSet.of(LoggingOutput.EVENT, LoggingOutput.STDOUT);
        EnumSet<LoggingOutput> eventStderr = EnumSet.of(LoggingOutput.EVENT, LoggingOutput.STDERR);
        setOutputs(DataApiEventType.ADMIN_COMMAND_STARTED, eventStdout);
        setOutputs(DataApiEventType.ADMIN_COMMAND_POLLING, eventStdout);
        setOutputs(DataApiEventType.ADMIN_COMMAND_SUCCEEDED, eventStdout);
        setOutputs(DataApiEventType.ADMIN_COMMAND_FAILED, eventStderr);
        setOutputs(DataApiEventType.ADMIN_COMMAND_WARNINGS, eventStderr);
        setOutputs(DataApiEventType.COMMAND_FAILED, eventStderr);
        setOutputs(DataApiEventType.COMMAND_WARNINGS, eventStderr);
        setOutputs(DataApiEventType.COMMAND_STARTED, EnumSet.of(LoggingOutput.EVENT));
        setOutputs(DataApiEventType.COMMAND_SUCCEEDED, EnumSet.of(LoggingOutput.EVENT));
        return this;
    }

    public LoggingSettings setOutputs(DataApiEventType type, LoggingOutput... out) {
        return setOutputs(type, out.length == 0 ? EnumSet.noneOf(LoggingOutput.class) : EnumSet.copyOf(Arrays.asList(out)));
    }

    public LoggingSettings setOutputs(DataApiEventType type, Set<LoggingOutput> out) {
        LoggingOutput print = null;

        for (LoggingOutput o : out) {
            if (!o.isPrint()) continue;

            if (print != null) {
                throw new IllegalArgumentException("Nonsensical logging configuration; conflicting outputs '" + print.getConfigName() + "' and '" + o.getConfigName() + "'");
            }

            print = o;
        }

        outputs.put(type, out.isEmpty() ? EnumSet.noneOf(LoggingOutput.class) : EnumSet.copyOf(out));
        return this;
    }

    public LoggingSettings setOutputsForAll(LoggingOutput... out) {
        for (DataApiEventType t : DataApiEventType.values()) {
            setOutputs(t, out);
        }

        return this;
    }

    public Set<LoggingOutput> getOutputs(DataApiEventType type) {
        Set<LoggingOutput> ret = outputs.get(type);
        return ret == null ? EnumSet.of(LoggingOutput.EVENT) : ret;
    }

    public boolean isConfigured(DataApiEventType type) {
        return outputs.containsKey(type);
    }

    /**
     * this configuration with every explicitly configured event of the other applied on top
     */
    public LoggingSettings layer(LoggingSettings other) {
        LoggingSettings ret = copy();
        if (other == null) return ret;

        for (Map.Entry<DataApiEventType, Set<LoggingOutput>> e : other.outputs.entrySet()) {
            ret.setOutputs(e.getKey(), e.getValue());
        }

        return ret;
    }

    @Override
    public Properties asProperties(String prefix) {
        if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";
        Properties p = new Properties();

        for (Map.Entry<DataApiEventType, Set<LoggingOutput>> e : outputs.entrySet()) {
            p.put(prefix + e.getKey().getEventName(), e.getValue().stream().map(LoggingOutput::getConfigName).collect(Collectors.joining(",")));
        }

        return p;
    }

    @Override
    public void applyProperties(String prefix, SettingResolver resolver) {
        if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";
        Object all = resolver.resolveSetting(prefix + "all");

        if (all != null) {
            for (DataApiEventType t : DataApiEventType.values()) {
                setOutputs(t, parse(all.toString()));
            }
        }

        for (DataApiEventType t : DataApiEventType.values()) {
            Object v = resolver.resolveSetting(prefix + t.getEventName());
            if (v != null) setOutputs(t, parse(v.toString()));
        }
    }

    private static Set<LoggingOutput> parse(String s) {
        Set<LoggingOutput> ret = EnumSet.noneOf(LoggingOutput.class);

        for (String n : s.replaceAll("[\\[\\]]", "").split(",")) {
            if (!n.isBlank()) ret.add(LoggingOutput.fromConfigName(n));
        }

        return ret;
    }
}
