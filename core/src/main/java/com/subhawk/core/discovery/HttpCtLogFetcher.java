package com.subhawk.core.discovery;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/** java.net.http 기반 CT 로그 질의. crt.sh 는 응답이 느린 편이라 타임아웃을 호출자가 정한다. */
public final class HttpCtLogFetcher implements CtLogFetcher {
    private final HttpClient client;
    private final Duration timeout;
    private final String userAgent;

    public HttpCtLogFetcher(Duration timeout, String userAgent) {
        this(HttpClient.newBuilder()
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(timeout)
                        .build(),
                timeout, userAgent);
    }

    public HttpCtLogFetcher(HttpClient client, Duration timeout, String userAgent) {
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? "SubHawk" : userAgent;
    }

    @Override
    public Response fetch(URI queryUri) {
        try {
            HttpRequest req = HttpRequest.newBuilder(queryUri)
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/json")
                    .GET()
                    .build();
            HttpResponse<String> res = client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return Response.ok(res.statusCode(), res.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Response.fail("interrupted");
        } catch (Exception e) {
            return Response.fail(e.toString());
        }
    }
}
