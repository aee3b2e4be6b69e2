package com.subhawk.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 후보 하나의 최종 판정. 리포트에 추가된 뒤에는 변경되지 않는다.
 * vulnerable=true 이면 service 와 evidence(1건 이상)가 반드시 있어야 한다.
 */
public final class Finding {
    private final Candidate subdomain;
    private final boolean vulnerable;
    private final String service;
    private final List<String> cname;
    private final List<String> evidence;
    private final Confidence confidence;
    private final String matchedSignature;

    private Finding(Builder b) {
        this.subdomain = b.subdomain;
        this.vulnerable = b.vulnerable;
        this.service = b.service;
        this.cname = List.copyOf(b.cname);
        this.evidence = List.copyOf(b.evidence);
        this.confidence = (b.confidence == null) ? Confidence.NONE : b.confidence;
        this.matchedSignature = b.matchedSignature;
    }

    public Candidate getSubdomain() { return subdomain; }
    public boolean isVulnerable() { return vulnerable; }
    public Optional<String> getService() { return Optional.ofNullable(service); }
    public List<String> getCname() { return cname; }
    public List<String> getEvidence() { return evidence; }
    public Confidence getConfidence() { return confidence; }
    /** HTTP 본문에서 일치한 시그니처 (CONFIRMED 일 때만) */
    public Optional<String> getMatchedSignature() { return Optional.ofNullable(matchedSignature); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Finding f)) return false;
        return vulnerable == f.vulnerable && subdomain.equals(f.subdomain)
                && Objects.equals(service, f.service) && cname.equals(f.cname)
                && evidence.equals(f.evidence) && confidence == f.confidence
                && Objects.equals(matchedSignature, f.matchedSignature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subdomain, vulnerable, service, cname, evidence, confidence, matchedSignature);
    }

    @Override
    public String toString() {
        return "Finding{" + subdomain + (vulnerable ? " VULNERABLE " + service : " ok") + ", evidence=" + evidence + "}";
    }

    // ----- 빌더 -----
    public static Builder builder(Candidate subdomain) { return new Builder(subdomain); }

    public static final class Builder {
        private final Candidate subdomain;
        private boolean vulnerable;
        private String service;
        private final List<String> cname = new ArrayList<>();
        private final List<String> evidence = new ArrayList<>();
        private Confidence confidence;
        private String matchedSignature;

        private Builder(Candidate subdomain) {
            this.subdomain = Objects.requireNonNull(subdomain, "subdomain");
        }

        public Builder vulnerable(boolean v) { this.vulnerable = v; return this; }
        public Builder service(String s) { this.service = s; return this; }
        public Builder cname(List<String> chain) { this.cname.clear(); if (chain != null) this.cname.addAll(chain); return this; }
        public Builder evidence(String line) { if (line != null && !line.isBlank()) this.evidence.add(line); return this; }
        public Builder confidence(Confidence c) { this.confidence = c; return this; }
        public Builder matchedSignature(String s) { this.matchedSignature = s; return this; }

        public Finding build() {
            if (vulnerable) {
                if (service == null || service.isBlank())
                    throw new IllegalStateException("vulnerable finding requires a service: " + subdomain);
                if (evidence.isEmpty())
                    throw new IllegalStateException("vulnerable finding requires evidence: " + subdomain);
            }
            return new Finding(this);
        }
    }
}
