package de.caluga.dataapi.config;

public class AdminSettings extends Settings {
    public static final String DEFAULT_DEVOPS_ENDPOINT = "https://api.astra.datastax.com/v2";

    private String devOpsEndpoint = DEFAULT_DEVOPS_ENDPOINT;
    private String adminToken;
    private long maxPollingTimeMs = 12 * 60 * 1000;

    public String getDevOpsEndpoint() {
        return devOpsEndpoint;
    }

    public AdminSettings setDevOpsEndpoint(String devOpsEndpoint) {
        this.devOpsEndpoint = devOpsEndpoint;
        return this;
    }

    /**
     * token used for DevOps calls, falls back to the connection token when null
     */
    public String getAdminToken() {
        return adminToken;
    }

    public AdminSettings setAdminToken(String adminToken) {
        this.adminToken = adminToken;
        return this;
    }

    /**
     * overall ceiling for admin requests and their polling, if no timeout is given per call
     */
    public long getMaxPollingTimeMs() {
        return maxPollingTimeMs;
    }

    public AdminSettings setMaxPollingTimeMs(long maxPollingTimeMs) {
        this.maxPollingTimeMs = maxPollingTimeMs;
        return this;
    }
}
