package de.caluga.dataapi.driver;

public class TooManyDocumentsToCountException extends DataApiDriverException {
    private final long limit;
    private final boolean hitServerLimit;

    public TooManyDocumentsToCountException(long limit, boolean hitServerLimit) {
        super("Too many documents to count (provided limit is " + limit + ")" + (hitServerLimit ? "; hit server count limit" : ""));
        this.limit = limit;
        this.hitServerLimit = hitServerLimit;
    }

    public long getLimit() {
        return limit;
    }

    public boolean isHitServerLimit() {
        return hitServerLimit;
    }
}
