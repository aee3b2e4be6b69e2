package com.subhawk.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong resolved      = new AtomicLong(0);   // CNAME 체인 확보
    private final AtomicLong unresolved    = new AtomicLong(0);   // NO_RECORD/NXDOMAIN/TIMEOUT/ERROR
    private final AtomicLong probed        = new AtomicLong(0);   // HTTP 프로브 수행
    private final AtomicLong probeFailures = new AtomicLong(0);   // 프로브 status != OK
    private final AtomicLong vulnerable    = new AtomicLong(0);
    private final AtomicLong sumWallMs     = new AtomicLong(0);   // 후보별 처리시간 합
    private final AtomicLong processed     = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    public void addResolution(boolean hasChain) {
        (hasChain ? resolved : unresolved).incrementAndGet();
    }
    public void addProbe(boolean ok) {
        probed.incrementAndGet();
        if (!ok) probeFailures.incrementAndGet();
    }
    public void addFinding(boolean isVulnerable, long wallMs) {
        processed.incrementAndGet();
        sumWallMs.addAndGet(wallMs);
        if (isVulnerable) vulnerable.incrementAndGet();
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long n = processed.get();
        long avg = sumWallMs.get() / Math.max(1, n);
        return new Snapshot(resolved.get(), unresolved.get(), probed.get(), probeFailures.get(),
                vulnerable.get(), n, maxObservedConcurrency.get(), avg);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long resolved;
        public final long unresolved;
        public final long probed;
        public final long probeFailures;
        public final long vulnerable;
        public final long processed;
        public final int  maxObservedConcurrency;
        public final long avgCandidateMs;
        public Snapshot(long resolved, long unresolved, long probed, long probeFailures,
                        long vulnerable, long processed, int maxCc, long avgMs) {
            this.resolved = resolved;
            this.unresolved = unresolved;
            this.probed = probed;
            this.probeFailures = probeFailures;
            this.vulnerable = vulnerable;
            this.processed = processed;
            this.maxObservedConcurrency = maxCc;
            this.avgCandidateMs = avgMs;
        }
    }
}
