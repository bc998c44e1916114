package de.caluga.dataapi.driver.http;

import de.caluga.dataapi.driver.DataApiNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Fetcher} on top of the JDK http client. Keeps one client for HTTP/2 and one for HTTP/1.1.
 */
public class JdkHttpFetcher implements Fetcher {
    private final Logger log = LoggerFactory.getLogger(JdkHttpFetcher.class);
    private final HttpClient http2;
    private final HttpClient http1;

    public JdkHttpFetcher() {
        this(Duration.ofSeconds(10));
    }

    public JdkHttpFetcher(Duration connectTimeout) {
        http2 = HttpClient.newBuilder().version(HttpClient.Version.HTTP_2).connectTimeout(connectTimeout).build();
        http1 = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).connectTimeout(connectTimeout).build();
    }

    @Override
    public FetcherResponse fetch(FetcherRequest request) {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(request.getUrl()))
                .timeout(Duration.ofMillis(Math.max(1, request.getTimeoutMs())));
        HttpRequest.BodyPublisher body = request.getBody() == null ? HttpRequest.BodyPublishers.noBody() : HttpRequest.BodyPublishers.ofString(request.getBody());
        b.method(request.getMethod(), body);

        for (Map.Entry<String, String> e : request.getHeaders().entrySet()) {
            b.header(e.getKey(), e.getValue());
        }

        HttpClient client = request.isForceHttp1() ? http1 : http2;

        try {
            HttpResponse<String> resp = client.send(b.build(), HttpResponse.BodyHandlers.ofString());
            Map<String, String> headers = new LinkedHashMap<>();

            for (Map.Entry<String, List<String>> e : resp.headers().map().entrySet()) {
                if (!e.getValue().isEmpty()) headers.put(e.getKey(), e.getValue().get(0));
            }

            return new FetcherResponse(resp.statusCode(), resp.body(), headers, resp.version() == HttpClient.Version.HTTP_2 ? "HTTP/2" : "HTTP/1.1");
        } catch (HttpTimeoutException e) {
            log.debug("Request timed out: {}", request);
            throw request.mkTimeoutError();
        } catch (IOException e) {
            throw new DataApiNetworkException("Network error during " + request.getMethod() + " " + request.getUrl() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DataApiNetworkException("Interrupted during " + request.getMethod() + " " + request.getUrl(), e);
        }
    }
}
