package de.caluga.dataapi.admin;

/**
 * filters of <code>GET /databases</code>, null values are not sent
 */
public class ListDatabasesOptions {
    private String include;
    private String provider;
    private Integer limit;
    private String skip;

    /**
     * status filter, e.g. <code>ACTIVE</code>, <code>nonterminated</code> or <code>all</code>
     */
    public String getInclude() {
        return include;
    }

    public ListDatabasesOptions setInclude(String include) {
        this.include = include;
        return this;
    }

    /**
     * <code>AWS</code>, <code>GCP</code>, <code>AZURE</code> or <code>ALL</code>
     */
    public String getProvider() {
        return provider;
    }

    public ListDatabasesOptions setProvider(String provider) {
        this.provider = provider;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    public ListDatabasesOptions setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    /**
     * id of the database to start after
     */
    public String getSkip() {
        return skip;
    }

    public ListDatabasesOptions setSkip(String skip) {
        this.skip = skip;
        return this;
    }
}
