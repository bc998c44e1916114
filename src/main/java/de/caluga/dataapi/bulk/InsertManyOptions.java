package de.caluga.dataapi.bulk;

import de.caluga.dataapi.driver.timeouts.TimeoutOverride;

public class InsertManyOptions {
    public static final int DEFAULT_CHUNK_SIZE = 50;
    public static final int DEFAULT_CONCURRENCY = 8;

    private boolean ordered = false;
    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private int concurrency = DEFAULT_CONCURRENCY;
    private TimeoutOverride timeout;

    public boolean isOrdered() {
        return ordered;
    }

    /**
     * true: chunks are sent one after the other, the first failure stops the insert
     */
    public InsertManyOptions setOrdered(boolean ordered) {
        this.ordered = ordered;
        return this;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public InsertManyOptions setChunkSize(int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunkSize must be positive: " + chunkSize);
        this.chunkSize = chunkSize;
        return this;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * number of chunks in flight at the same time, unordered inserts only
     */
    public InsertManyOptions setConcurrency(int concurrency) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be positive: " + concurrency);
        this.concurrency = concurrency;
        return this;
    }

    public TimeoutOverride getTimeout() {
        return timeout;
    }

    public InsertManyOptions setTimeout(TimeoutOverride timeout) {
        this.timeout = timeout;
        return this;
    }
}
