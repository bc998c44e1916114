package de.caluga.dataapi.config;

public class ConnectionSettings extends Settings {
    public static final String DEFAULT_KEYSPACE = "default_keyspace";
    public static final String DEFAULT_API_PATH = "api/json/v1";

    private String endpoint;
    private String token;
    private String keyspace = DEFAULT_KEYSPACE;
    private String embeddingApiKey;
    private String apiPath = DEFAULT_API_PATH;
    private String userAgent = "dataapi-java-client/1.0";
    private int httpVersion = 2;

    public String getEndpoint() {
        return endpoint;
    }

    public ConnectionSettings setEndpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public String getToken() {
        return token;
    }

    public ConnectionSettings setToken(String token) {
        this.token = token;
        return this;
    }

    public String getKeyspace() {
        return keyspace;
    }

    public ConnectionSettings setKeyspace(String keyspace) {
        this.keyspace = keyspace;
        return this;
    }

    public String getEmbeddingApiKey() {
        return embeddingApiKey;
    }

    public ConnectionSettings setEmbeddingApiKey(String embeddingApiKey) {
        this.embeddingApiKey = embeddingApiKey;
        return this;
    }

    public String getApiPath() {
        return apiPath;
    }

    public ConnectionSettings setApiPath(String apiPath) {
        this.apiPath = apiPath;
        return this;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public ConnectionSettings setUserAgent(String userAgent) {
        this.userAgent = userAgent;
        return this;
    }

    public int getHttpVersion() {
        return httpVersion;
    }

    /**
     * 1 or 2, the DevOps API always uses 1
     */
    public ConnectionSettings setHttpVersion(int httpVersion) {
        if (httpVersion != 1 && httpVersion != 2) {
            throw new IllegalArgumentException("httpVersion must be 1 or 2");
        }

        this.httpVersion = httpVersion;
        return this;
    }

    /**
     * endpoint and api path joined, without trailing slash
     */
    public String getBaseUrl() {
        if (endpoint == null) return null;
        String ep = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        if (apiPath == null || apiPath.isEmpty()) return ep;
        String path = apiPath.startsWith("/") ? apiPath.substring(1) : apiPath;
        return ep + "/" + path;
    }
}
