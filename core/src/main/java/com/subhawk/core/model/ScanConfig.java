package com.subhawk.core.model;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 스캔 설정 (subhawk.yml 매핑 대상). 순수 설정 보관용.
 * CLI 플래그는 YAML 값을 덮어쓴다(적용 순서는 cli 모듈 책임).
 */
public final class ScanConfig {

    private static final Pattern DOMAIN = Pattern.compile(
            "^(?=.{1,253}$)([a-z0-9_](?:[a-z0-9_-]{0,61}[a-z0-9])?\\.)+[a-z][a-z0-9-]{0,62}$");

    /** 패시브(인증서 투명성 로그) 수집 설정: YAML `passive:` 섹션 */
    public static final class Passive {
        private boolean enabled = true;
        private URI endpoint = URI.create("https://crt.sh/");

        public boolean isEnabled() { return enabled; }
        public Passive setEnabled(boolean v) { this.enabled = v; return this; }

        public URI getEndpoint() { return endpoint; }
        public Passive setEndpoint(URI endpoint) { this.endpoint = endpoint; return this; }
    }

    /** DNS 설정: YAML `dns:` 섹션. nameservers 가 비면 시스템 리졸버 사용 */
    public static final class Dns {
        private List<String> nameservers = List.of();

        public List<String> getNameservers() { return nameservers; }
        public Dns setNameservers(List<String> ns) {
            this.nameservers = (ns == null) ? List.of() : List.copyOf(ns);
            return this;
        }
    }

    /** HTTP 프로브 설정: YAML `probe:` 섹션 */
    public static final class Probe {
        private int maxBodyBytes = 64 * 1024;          // 본문 캡처 상한
        private String userAgent = "Mozilla/5.0 (compatible; SubHawk/1.0)";
        private int httpsPort = 443;
        private int httpPort = 80;

        public int getMaxBodyBytes() { return maxBodyBytes; }
        public Probe setMaxBodyBytes(int v) { this.maxBodyBytes = v; return this; }

        public String getUserAgent() { return userAgent; }
        public Probe setUserAgent(String v) { this.userAgent = v; return this; }

        public int getHttpsPort() { return httpsPort; }
        public Probe setHttpsPort(int v) { this.httpsPort = v; return this; }

        public int getHttpPort() { return httpPort; }
        public Probe setHttpPort(int v) { this.httpPort = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private String domain;                             // 대상 도메인 (필수)
    private List<String> wordlist = List.of();         // 액티브 열거용 라벨 목록
    private int concurrency = 10;                      // 워커 수
    private Duration timeout = Duration.ofSeconds(5);  // DNS/연결 타임아웃
    private Duration readTimeout;                      // 응답 읽기 타임아웃 (null → timeout)
    private int rps = 0;                               // 0 = 무제한
    private boolean followRedirects = true;
    private int maxCnameDepth = 10;
    private Path fingerprintsFile;                     // null → 내장 테이블
    private Path output;                               // null → 파일 출력 안 함

    private final Passive passive = new Passive();
    private final Dns dns = new Dns();
    private final Probe probe = new Probe();

    // ---------- getters ----------
    public String getDomain() { return domain; }
    public List<String> getWordlist() { return wordlist; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public Duration getReadTimeout() { return readTimeout != null ? readTimeout : timeout; }
    public int getRps() { return rps; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getMaxCnameDepth() { return maxCnameDepth; }
    public Path getFingerprintsFile() { return fingerprintsFile; }
    public Path getOutput() { return output; }

    public Passive passive() { return passive; }
    public Dns dns() { return dns; }
    public Probe probe() { return probe; }

    // ---------- fluent setters ----------
    /** 소문자/끝 점 제거로 정규화해서 보관 */
    public ScanConfig setDomain(String domain) {
        this.domain = (domain == null) ? null : Candidate.normalize(domain);
        return this;
    }
    public ScanConfig setWordlist(List<String> words) {
        this.wordlist = (words == null) ? List.of() : List.copyOf(words);
        return this;
    }
    public ScanConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public ScanConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScanConfig setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; return this; }
    public ScanConfig setRps(int rps) { this.rps = rps; return this; }
    public ScanConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanConfig setMaxCnameDepth(int v) { this.maxCnameDepth = v; return this; }
    public ScanConfig setFingerprintsFile(Path p) { this.fingerprintsFile = p; return this; }
    public ScanConfig setOutput(Path p) { this.output = p; return this; }

    /** 초 단위(소수 허용) 타임아웃. CLI `--timeout` 용 */
    public ScanConfig setTimeoutSeconds(double seconds) {
        if (!(seconds > 0)) throw new IllegalArgumentException("timeout must be > 0");
        this.timeout = Duration.ofMillis(Math.max(1L, Math.round(seconds * 1000)));
        return this;
    }

    public ScanConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    /** 설정 오류는 스캔 시작 전에 IllegalArgumentException 으로 중단시킨다. */
    public void validate() {
        requireValidDomain(domain);
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (readTimeout != null && (readTimeout.isNegative() || readTimeout.isZero()))
            throw new IllegalArgumentException("readTimeout must be > 0");
        if (rps < 0) throw new IllegalArgumentException("rps must be >= 0");
        if (maxCnameDepth < 1) throw new IllegalArgumentException("maxCnameDepth must be >= 1");
        Objects.requireNonNull(wordlist, "wordlist");

        Objects.requireNonNull(passive.getEndpoint(), "passive.endpoint");
        String scheme = passive.getEndpoint().getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https")))
            throw new IllegalArgumentException("passive.endpoint must be an http(s) URL");

        if (probe.getMaxBodyBytes() < 1) throw new IllegalArgumentException("probe.maxBodyBytes must be >= 1");
        if (!validPort(probe.getHttpsPort())) throw new IllegalArgumentException("probe.httpsPort out of range");
        if (!validPort(probe.getHttpPort())) throw new IllegalArgumentException("probe.httpPort out of range");
    }

    /** 대상 도메인 형식 검사. URL 이나 빈 값이면 IllegalArgumentException */
    public static void requireValidDomain(String domain) {
        if (domain == null || domain.isBlank())
            throw new IllegalArgumentException("domain is required");
        if (domain.contains("://") || domain.contains("/"))
            throw new IllegalArgumentException("domain must be a bare host name, not a URL: " + domain);
        if (!DOMAIN.matcher(domain.toLowerCase(Locale.ROOT)).matches())
            throw new IllegalArgumentException("invalid domain: " + domain);
    }

    private static boolean validPort(int p) { return p > 0 && p <= 65535; }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
