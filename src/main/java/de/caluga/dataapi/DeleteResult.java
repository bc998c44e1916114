package de.caluga.dataapi;

public class DeleteResult {
    private final long deletedCount;

    public DeleteResult(long deletedCount) {
        this.deletedCount = deletedCount;
    }

    public long getDeletedCount() {
        return deletedCount;
    }

    @Override
    public String toString() {
        return "DeleteResult{deleted=" + deletedCount + "}";
    }
}
