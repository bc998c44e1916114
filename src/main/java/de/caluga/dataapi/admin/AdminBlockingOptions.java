package de.caluga.dataapi.admin;

/**
 * how long running admin operations wait for their target state
 */
public class AdminBlockingOptions {
    private boolean blocking = true;
    private long pollIntervalMs = 0;
    private Long timeout;

    public static AdminBlockingOptions nonBlocking() {
        return new AdminBlockingOptions().setBlocking(false);
    }

    public boolean isBlocking() {
        return blocking;
    }

    /**
     * false: return after the initiating request, without polling
     */
    public AdminBlockingOptions setBlocking(boolean blocking) {
        this.blocking = blocking;
        return this;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    /**
     * 0 uses the default of the operation
     */
    public AdminBlockingOptions setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
        return this;
    }

    public Long getTimeout() {
        return timeout;
    }

    /**
     * overall ms for the initiating request and all polls
     */
    public AdminBlockingOptions setTimeout(Long timeout) {
        this.timeout = timeout;
        return this;
    }
}
