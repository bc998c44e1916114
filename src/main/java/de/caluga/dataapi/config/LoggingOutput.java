package de.caluga.dataapi.config;

/**
 * where an event goes
 */
public enum LoggingOutput {
    /**
     * emitted to the listeners of the emitter hierarchy
     */
    EVENT("event", false),
    STDOUT("stdout", true),
    STDERR("stderr", true),
    STDOUT_VERBOSE("stdout:verbose", true),
    STDERR_VERBOSE("stderr:verbose", true),
    /**
     * formatted line written to slf4j
     */
    LOG("log", false);

    private final String configName;
    private final boolean print;

    LoggingOutput(String configName, boolean print) {
        this.configName = configName;
        this.print = print;
    }

    public String getConfigName() {
        return configName;
    }

    public boolean isPrint() {
        return print;
    }

    public boolean isVerbose() {
        return configName.endsWith(":verbose");
    }

    public static LoggingOutput fromConfigName(String name) {
        for (LoggingOutput o : values()) {
            if (o.configName.equalsIgnoreCase(name.trim())) return o;
        }

        throw new IllegalArgumentException("Unknown logging output '" + name + "'");
    }
}
