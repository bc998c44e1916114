package de.caluga.dataapi;

public enum ReturnDocument {
    BEFORE("before"), AFTER("after");

    private final String wireName;

    ReturnDocument(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }
}
