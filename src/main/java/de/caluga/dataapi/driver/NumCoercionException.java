package de.caluga.dataapi.driver;

import de.caluga.dataapi.driver.serdes.NumRep;

import java.util.List;

public class NumCoercionException extends DataApiDriverException {
    private final List<String> path;
    private final Number value;
    private final String from;
    private final NumRep to;

    public NumCoercionException(List<String> path, Number value, String from, NumRep to) {
        super("Failed to coerce value from " + from + " to " + to.getConfigName() + " at path: " + String.join(".", path));
        this.path = path;
        this.value = value;
        this.from = from;
        this.to = to;
    }

    public List<String> getPath() {
        return path;
    }

    public Number getValue() {
        return value;
    }

    public String getFrom() {
        return from;
    }

    public NumRep getTo() {
        return to;
    }
}
