package de.caluga.dataapi.events;

import de.caluga.dataapi.config.LoggingOutput;
import de.caluga.dataapi.config.LoggingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Set;

/**
 * routes events to the emitter and/or stdout, stderr and slf4j, according to {@link LoggingSettings}.
 * One instance per emitter level, children get their own via {@link #forChild(HierarchicalEmitter, LoggingSettings)}.
 */
public class EventLogger {
    private static final Logger log = LoggerFactory.getLogger(EventLogger.class);

    private final HierarchicalEmitter emitter;
    private final LoggingSettings settings;
    private final PrintStream stdout;
    private final PrintStream stderr;

    public EventLogger(HierarchicalEmitter emitter, LoggingSettings settings) {
        this(emitter, settings, System.out, System.err);
    }

    public EventLogger(HierarchicalEmitter emitter, LoggingSettings settings, PrintStream stdout, PrintStream stderr) {
        this.emitter = emitter;
        this.settings = settings == null ? new LoggingSettings() : settings;
        this.stdout = stdout;
        this.stderr = stderr;
    }

    public EventLogger forChild(HierarchicalEmitter childEmitter, LoggingSettings override) {
        return new EventLogger(childEmitter, settings.layer(override), stdout, stderr);
    }

    public HierarchicalEmitter getEmitter() {
        return emitter;
    }

    public LoggingSettings getSettings() {
        return settings;
    }

    public void dispatch(DataApiEvent event) {
        Set<LoggingOutput> outputs = settings.getOutputs(event.getType());

        for (LoggingOutput o : outputs) {
            switch (o) {
                case EVENT:
                    emitter.emit(event.getType(), event);
                    break;
                case STDOUT:
                    stdout.println(event.format());
                    break;
                case STDERR:
                    stderr.println(event.format());
                    break;
                case STDOUT_VERBOSE:
                    stdout.println(event.formatVerbose());
                    break;
                case STDERR_VERBOSE:
                    stderr.println(event.formatVerbose());
                    break;
                case LOG:
                    if (event instanceof CommandFailedEvent || event instanceof AdminCommandFailedEvent
                            || event instanceof CommandWarningsEvent || event instanceof AdminCommandWarningsEvent) {
                        log.warn(event.format());
                    } else {
                        log.info(event.format());
                    }
                    break;
                default:
                    break;
            }
        }
    }
}
