package de.caluga.test.dataapi.support;

import de.caluga.dataapi.driver.timeouts.TimeSource;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * clock that only moves when told to. Sleeping advances it instantly.
 */
public class ManualTimeSource implements TimeSource {
    private final AtomicLong now;
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    public ManualTimeSource() {
        this(1_000_000L);
    }

    public ManualTimeSource(long start) {
        now = new AtomicLong(start);
    }

    @Override
    public long currentTimeMillis() {
        return now.get();
    }

    @Override
    public void sleep(long ms) {
        sleeps.add(ms);
        now.addAndGet(ms);
    }

    public void advance(long ms) {
        now.addAndGet(ms);
    }

    public List<Long> getSleeps() {
        return sleeps;
    }
}
