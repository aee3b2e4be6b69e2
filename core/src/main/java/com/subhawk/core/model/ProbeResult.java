package com.subhawk.core.model;

import java.net.URI;
import java.util.Objects;
import java.util.Optional;

/** 후보 하나에 대한 HTTP(S) 프로브 결과. 본문은 상한 길이까지만 보관. */
public final class ProbeResult {
    private final Candidate candidate;
    private final Integer httpStatus;   // 응답 없으면 null
    private final String bodySnippet;   // 응답 없으면 null
    private final ProbeStatus status;
    private final URI url;              // 최종 시도 URL
    private final String detail;        // 실패 원인 메시지

    private ProbeResult(Candidate candidate, Integer httpStatus, String bodySnippet,
                        ProbeStatus status, URI url, String detail) {
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.status = Objects.requireNonNull(status, "status");
        this.httpStatus = httpStatus;
        this.bodySnippet = bodySnippet;
        this.url = url;
        this.detail = detail;
    }

    public static ProbeResult ok(Candidate c, URI url, int httpStatus, String body) {
        return new ProbeResult(c, httpStatus, body == null ? "" : body, ProbeStatus.OK, url, null);
    }

    public static ProbeResult failed(Candidate c, URI url, ProbeStatus status, String detail) {
        if (status == ProbeStatus.OK) throw new IllegalArgumentException("failed() with OK status");
        return new ProbeResult(c, null, null, status, url, detail);
    }

    public Candidate getCandidate() { return candidate; }
    public Optional<Integer> getHttpStatus() { return Optional.ofNullable(httpStatus); }
    public Optional<String> getBodySnippet() { return Optional.ofNullable(bodySnippet); }
    public ProbeStatus getStatus() { return status; }
    public URI getUrl() { return url; }
    public Optional<String> getDetail() { return Optional.ofNullable(detail); }

    public boolean isOk() { return status == ProbeStatus.OK; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProbeResult p)) return false;
        return candidate.equals(p.candidate) && Objects.equals(httpStatus, p.httpStatus)
                && Objects.equals(bodySnippet, p.bodySnippet) && status == p.status
                && Objects.equals(url, p.url) && Objects.equals(detail, p.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(candidate, httpStatus, bodySnippet, status, url, detail);
    }

    @Override
    public String toString() {
        return "ProbeResult{" + candidate + ", " + status
                + (httpStatus != null ? ", http=" + httpStatus : "")
                + (detail != null ? ", detail=" + detail : "") + "}";
    }
}
