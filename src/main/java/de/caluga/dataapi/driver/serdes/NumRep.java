package de.caluga.dataapi.driver.serdes;

/**
 * java representation of a number read from a document
 */
public enum NumRep {
    /**
     * Integer, Long or Double; fails if that loses precision
     */
    NUMBER("number"),
    BIG_INTEGER("bigint"),
    BIG_DECIMAL("bignumber"),
    STRING("string"),
    /**
     * like NUMBER, but falls back to the decimal string instead of failing
     */
    NUMBER_OR_STRING("number_or_string");

    private final String configName;

    NumRep(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }
}
