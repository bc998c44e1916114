package de.caluga.dataapi.driver;

/**
 * Data API answered with a http status &gt;= 400 (other than 401)
 */
public class DataApiHttpException extends DataApiDriverException {
    private final int status;
    private final String body;

    public DataApiHttpException(int status, String body) {
        super("HTTP error: " + status + "; " + body);
        this.status = status;
        this.body = body;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }
}
