package com.subhawk.core.http;

import com.subhawk.core.api.IProber;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.ProbeResult;
import com.subhawk.core.model.ProbeStatus;
import com.subhawk.core.model.ScanConfig;
import com.subhawk.core.util.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 후보 호스트에 HTTPS → HTTP 순으로 GET 한 번을 보내고 상태코드와 본문 앞부분을 돌려준다.
 * 인증서 오류는 무시하고, HTTPS 가 TLS/연결 오류면 HTTP 로 한 번 더 시도한다.
 * limiter 가 있으면 요청(스킴별 시도)마다 토큰 하나.
 */
public class HttpProber implements IProber {

    private static final Logger LOG = LoggerFactory.getLogger(HttpProber.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    private final ScanConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)
    private final RateLimiter limiter; // null 이면 무제한

    public HttpProber(ScanConfig config) {
        this(config, (RateLimiter) null);
    }

    public HttpProber(ScanConfig config, RateLimiter limiter) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .sslContext(PermissiveTrustManager.sslContext())
                .build();
        this.sender = null;
        this.limiter = limiter;
        LOG.debug("TLS certificate validation disabled for probes");
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpProber(ScanConfig config, HttpSender testSender) {
        this(config, testSender, null);
    }

    public HttpProber(ScanConfig config, HttpSender testSender, RateLimiter limiter) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
        this.limiter = limiter;
    }

    public static HttpProber fromConfig(ScanConfig config, RateLimiter limiter) {
        return new HttpProber(config, limiter);
    }

    @Override
    public ProbeResult probe(Candidate candidate, Duration timeout) {
        Objects.requireNonNull(candidate, "candidate");
        Duration t = (timeout == null || timeout.isZero() || timeout.isNegative())
                ? config.getReadTimeout() : timeout;

        ScanConfig.Probe p = config.probe();
        ProbeResult first = attempt(candidate, "https", p.getHttpsPort(), 443, t);
        if (first.isOk() || !first.getStatus().retryOverHttp()) return first;

        LOG.debug("HTTPS probe of {} failed ({}), retrying over HTTP", candidate, first.getStatus());
        return attempt(candidate, "http", p.getHttpPort(), 80, t);
    }

    /** 기본 포트면 포트 생략 */
    static URI url(String scheme, String host, int port, int defaultPort) {
        return URI.create(scheme + "://" + host + (port == defaultPort ? "" : ":" + port) + "/");
    }

    private ProbeResult attempt(Candidate c, String scheme, int port, int defaultPort, Duration timeout) {
        URI url = null;
        try {
            // 밑줄 라벨(_domainkey 등)은 DNS 에선 유효하지만 URI 호스트로는 거부된다
            url = url(scheme, c.name(), port, defaultPort);
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(timeout)
                    .header("User-Agent", config.probe().getUserAgent())
                    .GET()
                    .build();
            if (limiter != null) limiter.acquire();
            HttpResponse<String> resp = send(req, timeout);
            String body = resp.body() == null ? "" : resp.body();
            int cap = config.probe().getMaxBodyBytes();
            if (body.length() > cap) body = body.substring(0, cap);
            return ProbeResult.ok(c, url, resp.statusCode(), body);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ProbeResult.failed(c, url, ProbeStatus.CONN_ERROR, "interrupted");
        } catch (IllegalArgumentException iae) {
            return ProbeResult.failed(c, url, ProbeStatus.CONN_ERROR, "invalid URL for " + c.name() + ": " + iae.getMessage());
        } catch (Exception e) {
            ProbeStatus st = classify(e);
            return ProbeResult.failed(c, url, st, describe(e));
        }
    }

    private HttpResponse<String> send(HttpRequest req, Duration timeout) throws Exception {
        if (sender != null) return sender.send(req);
        CompletableFuture<HttpResponse<String>> f = client.sendAsync(req,
                BoundedBodySubscriber.handler(config.probe().getMaxBodyBytes(), StandardCharsets.UTF_8));
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            f.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) throw (Exception) cause;
            throw e;
        }
    }

    /** 예외 → ProbeStatus. 원인 체인 어디든 SSLException 이 있으면 TLS_ERROR */
    static ProbeStatus classify(Throwable e) {
        for (Throwable x = e; x != null; x = x.getCause()) {
            if (x instanceof TimeoutException || x instanceof HttpTimeoutException) return ProbeStatus.TIMEOUT;
            if (x instanceof SSLException) return ProbeStatus.TLS_ERROR;
            if (x.getCause() == x) break;
        }
        return ProbeStatus.CONN_ERROR;
    }

    private static String describe(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) root = root.getCause();
        String msg = root.getMessage();
        return root.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }
}
