package de.caluga.test.dataapi.events;

import de.caluga.dataapi.config.LoggingOutput;
import de.caluga.dataapi.config.LoggingSettings;
import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.events.CommandStartedEvent;
import de.caluga.dataapi.events.DataApiEvent;
import de.caluga.dataapi.events.DataApiEventType;
import de.caluga.dataapi.events.EventLogger;
import de.caluga.dataapi.events.HierarchicalEmitter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class EventLoggerTest {
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private HierarchicalEmitter emitter;
    private List<DataApiEvent> emitted;

    @BeforeEach
    public void setup() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        emitter = new HierarchicalEmitter(null);
        emitted = new ArrayList<>();
        emitter.on(DataApiEventType.COMMAND_STARTED, emitted::add);
    }

    private EventLogger logger(LoggingSettings settings) {
        return new EventLogger(emitter, settings,
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private static DataApiEvent started() {
        return new CommandStartedEvent("r1", Doc.of("insertOne", new Doc()), "ks", "people", "http://localhost", null);
    }

    @Test
    public void unconfiguredEventsAreOnlyEmitted() {
        logger(new LoggingSettings()).dispatch(started());

        assertThat(emitted).hasSize(1);
        assertThat(out.size()).isZero();
        assertThat(err.size()).isZero();
    }

    @Test
    public void printsToConfiguredStream() {
        LoggingSettings s = new LoggingSettings().setOutputs(DataApiEventType.COMMAND_STARTED, LoggingOutput.STDOUT);
        logger(s).dispatch(started());

        assertThat(emitted).isEmpty();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("[CommandStarted]: (ks.people) insertOne");
        assertThat(err.size()).isZero();
    }

    @Test
    public void verboseAndEvent() {
        LoggingSettings s = new LoggingSettings().setOutputs(DataApiEventType.COMMAND_STARTED, LoggingOutput.EVENT, LoggingOutput.STDERR_VERBOSE);
        logger(s).dispatch(started());

        assertThat(emitted).hasSize(1);
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("\"collection\" : \"people\"");
    }

    @Test
    public void emptyOutputsSilenceEvent() {
        LoggingSettings s = new LoggingSettings().setOutputs(DataApiEventType.COMMAND_STARTED);
        logger(s).dispatch(started());

        assertThat(emitted).isEmpty();
        assertThat(out.size()).isZero();
    }

    @Test
    public void conflictingPrintOutputsAreRejected() {
        assertThatThrownBy(() -> new LoggingSettings().setOutputs(DataApiEventType.COMMAND_FAILED, LoggingOutput.STDOUT, LoggingOutput.STDERR))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("conflicting outputs");
    }

    @Test
    public void defaults() {
        LoggingSettings s = new LoggingSettings().enableDefaults();

        assertThat(s.getOutputs(DataApiEventType.COMMAND_FAILED)).containsExactlyInAnyOrder(LoggingOutput.EVENT, LoggingOutput.STDERR);
        assertThat(s.getOutputs(DataApiEventType.ADMIN_COMMAND_POLLING)).containsExactlyInAnyOrder(LoggingOutput.EVENT, LoggingOutput.STDOUT);
        assertThat(s.getOutputs(DataApiEventType.COMMAND_SUCCEEDED)).containsExactly(LoggingOutput.EVENT);
    }

    @Test
    public void childLayersOverParent() {
        LoggingSettings parent = new LoggingSettings()
                .setOutputs(DataApiEventType.COMMAND_STARTED, LoggingOutput.STDOUT)
                .setOutputs(DataApiEventType.COMMAND_FAILED, LoggingOutput.STDERR);
        LoggingSettings child = new LoggingSettings().setOutputs(DataApiEventType.COMMAND_STARTED, LoggingOutput.EVENT);
        HierarchicalEmitter childEmitter = new HierarchicalEmitter(emitter);

        EventLogger childLogger = logger(parent).forChild(childEmitter, child);
        childLogger.dispatch(started());

        assertThat(emitted).hasSize(1);
        assertThat(out.size()).isZero();
        assertThat(childLogger.getSettings().getOutputs(DataApiEventType.COMMAND_FAILED)).containsExactly(LoggingOutput.STDERR);
        assertThat(parent.getOutputs(DataApiEventType.COMMAND_STARTED)).containsExactly(LoggingOutput.STDOUT);
    }
}
