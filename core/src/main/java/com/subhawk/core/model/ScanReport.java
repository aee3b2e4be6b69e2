package com.subhawk.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 스캔 결과 집계.
 * 스캔 중에는 {@link Builder} 만 오케스트레이터가 소유하고, build() 이후에는 읽기 전용이다.
 * findings 순서는 완료 순서(발견 순서 아님).
 */
public final class ScanReport {
    private final String domain;
    private final Instant timestamp;
    private final Instant finishedAt;
    private final SortedSet<Candidate> allCandidates;
    private final List<Finding> findings;
    private final List<Finding> vulnerableFindings;
    private final List<String> warnings;
    private final boolean completed;

    private ScanReport(Builder b, List<Finding> findingsCopy, Instant finishedAt, boolean completed) {
        this.domain = b.domain;
        this.timestamp = b.timestamp;
        this.finishedAt = finishedAt;
        this.allCandidates = Collections.unmodifiableSortedSet(new TreeSet<>(b.candidates));
        this.findings = List.copyOf(findingsCopy);
        this.vulnerableFindings = this.findings.stream().filter(Finding::isVulnerable).toList();
        this.warnings = List.copyOf(b.warnings);
        this.completed = completed;
    }

    public String getDomain() { return domain; }
    /** 스캔 시작 시각 */
    public Instant getTimestamp() { return timestamp; }
    public Instant getFinishedAt() { return finishedAt; }
    public SortedSet<Candidate> getAllCandidates() { return allCandidates; }
    public List<Finding> getFindings() { return findings; }
    public List<Finding> getVulnerableFindings() { return vulnerableFindings; }
    /** 비치명적 경고(패시브 수집 실패 등) */
    public List<String> getWarnings() { return warnings; }
    /** 취소 없이 모든 후보를 처리했으면 true */
    public boolean isCompleted() { return completed; }

    public static Builder builder(String domain, Instant startedAt) {
        return new Builder(domain, startedAt);
    }

    /**
     * 스캔 중 가변 상태. append() 는 여러 워커에서 호출되므로 단일 락으로 직렬화한다.
     */
    public static final class Builder {
        private final String domain;
        private final Instant timestamp;
        private final SortedSet<Candidate> candidates = new TreeSet<>();
        private final List<String> warnings = new ArrayList<>();
        private final List<Finding> findings = new ArrayList<>();
        private final Object lock = new Object();

        private Builder(String domain, Instant timestamp) {
            this.domain = Objects.requireNonNull(domain, "domain");
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        /** 스캔 시작 전(단일 스레드) 호출 */
        public Builder candidates(Collection<Candidate> all) {
            candidates.addAll(all);
            return this;
        }

        public Builder warning(String w) {
            synchronized (lock) {
                if (w != null && !w.isBlank()) warnings.add(w);
            }
            return this;
        }

        /** 완료된 Finding 을 추가(append-only). */
        public void append(Finding f) {
            Objects.requireNonNull(f, "finding");
            synchronized (lock) {
                findings.add(f);
            }
        }

        public ScanReport build(Instant finishedAt, boolean completed) {
            synchronized (lock) {
                return new ScanReport(this, new ArrayList<>(findings), finishedAt, completed);
            }
        }
    }
}
