package de.caluga.dataapi.driver;

public class CursorIsStartedException extends DataApiDriverException {
    public CursorIsStartedException(String message) {
        super(message);
    }
}
