package de.caluga.dataapi.driver.timeouts;

/**
 * clock and sleep used by timeouts and polling, replaceable in tests
 */
public interface TimeSource {

    long currentTimeMillis();

    void sleep(long ms) throws InterruptedException;

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }
}
