package com.subhawk.core.service;

import com.subhawk.core.api.IProber;
import com.subhawk.core.api.IResolver;
import com.subhawk.core.api.ISubdomainSource;
import com.subhawk.core.discovery.DiscoveryResult;
import com.subhawk.core.discovery.SubdomainDiscovery;
import com.subhawk.core.dns.DnsResolver;
import com.subhawk.core.fingerprint.FingerprintMatcher;
import com.subhawk.core.fingerprint.FingerprintTable;
import com.subhawk.core.http.HttpProber;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.Confidence;
import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ProbeResult;
import com.subhawk.core.model.ProbeStatus;
import com.subhawk.core.model.ResolutionResult;
import com.subhawk.core.model.ResolutionStatus;
import com.subhawk.core.model.ScanConfig;
import com.subhawk.core.model.ScanReport;
import com.subhawk.core.model.ScanStats;
import com.subhawk.core.util.ProgressListener;
import com.subhawk.core.util.RateLimiter;
import com.subhawk.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스캔 오케스트레이터:
 *  - discover → (후보별) resolve → probe → match → 리포트 append
 *  - 기본 구현체(SubdomainDiscovery/DnsResolver/HttpProber)
 *  - DI 생성자는 테스트 주입용
 *  - 고정 스레드풀(동시성=concurrency) + 유계 큐 역압
 *  - rps 제한은 리졸버/프로버가 공유하는 RateLimiter 가 요청 단위로 건다
 *
 * 후보 하나는 한 워커가 끝까지 처리하고, Finding 은 완성된 것만 리포트에 들어간다.
 * 리졸버/프로버/매처가 런타임 예외를 던져도 해당 후보는 ERROR Finding 으로 남는다.
 */
public final class ScanOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanOrchestrator.class);

    /** 결과 수집 루프가 취소 플래그를 확인하는 주기 */
    private static final long POLL_MS = 200;

    private final ScanStats stats = new ScanStats();
    private final ScanConfig config;
    private final ISubdomainSource source;
    private final IResolver resolver;
    private final IProber prober;
    private final FingerprintMatcher matcher;

    /** 기본 구현. 사용자 지문 파일을 읽지 못하면 IOException */
    public ScanOrchestrator(ScanConfig config) throws IOException {
        this(config, RateLimiter.perSecondOrNull(config.getRps()));
    }

    private ScanOrchestrator(ScanConfig config, RateLimiter limiter) throws IOException {
        this(config,
                SubdomainDiscovery.fromConfig(config),
                DnsResolver.fromConfig(config, limiter),
                HttpProber.fromConfig(config, limiter),
                new FingerprintMatcher(FingerprintTable.loadOrDefault(config.getFingerprintsFile())));
    }

    /** DI/테스트용 */
    public ScanOrchestrator(ScanConfig config, ISubdomainSource source, IResolver resolver,
                            IProber prober, FingerprintMatcher matcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.source = Objects.requireNonNull(source, "source");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.matcher = Objects.requireNonNull(matcher, "matcher");
    }

    /* =========================
       실행 API
       ========================= */

    public ScanReport run() {
        return run(ProgressListener.NONE, null);
    }

    public ScanReport run(ProgressListener listener) {
        return run(listener, null);
    }

    /** 설정값으로 실행. cancelFlag 가 set 되면 completed=false 리포트를 돌려준다. */
    public ScanReport run(ProgressListener listener, AtomicBoolean cancelFlag) {
        return execute(config.getDomain(), config.getWordlist(), config.getConcurrency(),
                config.getTimeout(), config.getReadTimeout(), listener, cancelFlag);
    }

    /** 인자로 대상/워드리스트/동시성/타임아웃을 덮어써 실행 */
    public ScanReport run(String domain, List<String> wordlist, int concurrency, Duration timeout) {
        ScanConfig.requireValidDomain(Candidate.normalize(domain));
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isZero() || timeout.isNegative())
            throw new IllegalArgumentException("timeout must be > 0");
        return execute(Candidate.normalize(domain), wordlist == null ? List.of() : wordlist,
                concurrency, timeout, timeout, ProgressListener.NONE, null);
    }

    private ScanReport execute(String domain, List<String> wordlist, int concurrency,
                               Duration dnsTimeout, Duration probeTimeout,
                               ProgressListener listener, AtomicBoolean cancelFlag) {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean cancel = (cancelFlag != null) ? cancelFlag : new AtomicBoolean(false);
        final int cc = Math.max(1, concurrency);
        final Instant startedAt = Instant.now();

        LOG.info("Scan start: domain={}, cc={}, timeout={}ms, rps={}",
                domain, cc, dnsTimeout.toMillis(), config.getRps());
        SLOG.info("scan-start",
                "domain", domain,
                "cc", cc,
                "timeoutMs", dnsTimeout.toMillis(),
                "rps", config.getRps(),
                "wordlist", wordlist.size());

        // ---- 0) 후보 수집 ----
        notify(pl, 0.0, "discover", 0, -1);
        DiscoveryResult discovered = source.discover(domain, wordlist);
        List<Candidate> candidates = new ArrayList<>(discovered.candidates());

        ScanReport.Builder report = ScanReport.builder(domain, startedAt).candidates(candidates);
        discovered.warnings().forEach(report::warning);
        SLOG.info("discovery-done",
                "passive", discovered.passiveCount(),
                "active", discovered.activeCount(),
                "total", candidates.size(),
                "warnings", discovered.warnings().size());

        final int total = candidates.size();
        if (total == 0) {
            LOG.info("No candidates to scan for {}", domain);
            notify(pl, 1.0, "done", 0, 0);
            SLOG.info("scan-done", "total", 0, "vulnerable", 0, "completed", true);
            return report.build(Instant.now(), true);
        }

        notify(pl, 0.0, "scan", 0, total);

        // ---- 1) 고정 스레드풀(+역압) ----
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(cc * 2),
                new NamedThreadFactory("scan-worker"),
                (r, e) -> {
                    try { e.getQueue().put(r); }
                    catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new RejectedExecutionException("Interrupted while enqueueing", ie);
                    }
                }
        );

        final List<Future<Finding>> futures = new ArrayList<>(total);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);
        boolean cancelled = false;

        try {
            // ---- 2) 작업 제출 ----
            for (Candidate c : candidates) {
                if (isCancelled(cancel)) { cancelled = true; break; }
                try {
                    futures.add(exec.submit(() -> scanOne(c, dnsTimeout, probeTimeout, cancel,
                            report, inFlight, done, total, pl)));
                } catch (RejectedExecutionException rex) {
                    cancelled = true;
                    break;
                }
            }

            // ---- 3) 완료 대기 ----
            for (Future<Finding> f : futures) {
                if (cancelled) break;
                while (true) {
                    if (isCancelled(cancel)) { cancelled = true; break; }
                    try {
                        f.get(POLL_MS, TimeUnit.MILLISECONDS);
                        break;
                    } catch (TimeoutException te) {
                        // 계속 대기
                    } catch (CancellationException ce) {
                        break;
                    } catch (ExecutionException e) {
                        Throwable cause = (e.getCause() != null ? e.getCause() : e);
                        if (!(cause instanceof CancellationException)) {
                            LOG.warn("Scan task failed: {}", cause.toString());
                            SLOG.error("task-failed", cause, "cause", cause.toString());
                        }
                        break;
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        cancelled = true;
                        break;
                    }
                }
            }
        } finally {
            // ---- 4) 종료 ----
            exec.shutdownNow();
            try {
                if (!exec.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Workers did not stop within 30s");
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancelled = true;
            }
        }

        ScanReport built = report.build(Instant.now(), !cancelled);
        ScanStats.Snapshot s = stats.snapshot();
        notify(pl, 1.0, "done", done.get(), total);

        if (cancelled) {
            LOG.warn("Scan cancelled after {}/{} candidates", built.getFindings().size(), total);
        }
        LOG.info("Scan done. candidates={}, findings={}, vulnerable={}, maxObservedCC={}",
                total, built.getFindings().size(), built.getVulnerableFindings().size(),
                s.maxObservedConcurrency);
        SLOG.info("scan-done",
                "total", total,
                "findings", built.getFindings().size(),
                "vulnerable", built.getVulnerableFindings().size(),
                "maxObservedCC", s.maxObservedConcurrency,
                "avgCandidateMs", s.avgCandidateMs,
                "completed", !cancelled);
        return built;
    }

    /** 워커 한 건: 후보 하나를 끝까지 처리하고 Finding 을 append */
    private Finding scanOne(Candidate c, Duration dnsTimeout, Duration probeTimeout,
                            AtomicBoolean cancel, ScanReport.Builder report,
                            AtomicInteger inFlight, AtomicInteger done, int total,
                            ProgressListener pl) {
        checkCancel(cancel);

        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        long t0 = System.nanoTime();
        try {
            ResolutionResult rr;
            try {
                rr = resolver.resolve(c, dnsTimeout);
            } catch (CancellationException ce) {
                throw ce;
            } catch (RuntimeException e) {
                taskFault("resolve", c, e);
                rr = ResolutionResult.failed(c, ResolutionStatus.ERROR, List.of(), "resolver fault: " + e);
            }
            stats.addResolution(rr.status() == ResolutionStatus.RESOLVED);

            ProbeResult pr = null;
            if (rr.status() == ResolutionStatus.RESOLVED) {
                checkCancel(cancel);
                try {
                    pr = prober.probe(c, probeTimeout);
                } catch (CancellationException ce) {
                    throw ce;
                } catch (RuntimeException e) {
                    taskFault("probe", c, e);
                    pr = ProbeResult.failed(c, null, ProbeStatus.CONN_ERROR, "prober fault: " + e);
                }
                stats.addProbe(pr.isOk());
            }

            Finding f;
            try {
                f = matcher.match(rr, pr);
            } catch (RuntimeException e) {
                taskFault("match", c, e);
                f = Finding.builder(c)
                        .vulnerable(false)
                        .confidence(Confidence.NONE)
                        .cname(rr.cnameChain())
                        .evidence("Scan error: " + e)
                        .build();
            }

            // 중단된 워커는 결과를 버린다
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Interrupted before append: " + c);
            }
            report.append(f);

            long wallMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            stats.addFinding(f.isVulnerable(), wallMs);
            SLOG.debug("candidate-done",
                    "subdomain", c.name(),
                    "resolution", rr.status().name(),
                    "probe", pr == null ? null : pr.getStatus().name(),
                    "vulnerable", f.isVulnerable(),
                    "ms", wallMs);
            if (f.isVulnerable()) {
                String service = f.getService().orElse("?");
                LOG.warn("Potential takeover: {} -> {}", c, service);
                SLOG.warn("vulnerable",
                        "subdomain", c.name(),
                        "service", service,
                        "cname", f.getCname(),
                        "confidence", f.getConfidence().name());
            }

            int n = done.incrementAndGet();
            notify(pl, (double) n / (double) total, "scan", n, total);
            return f;
        } finally {
            inFlight.decrementAndGet();
        }
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    private static void taskFault(String stage, Candidate c, RuntimeException e) {
        LOG.warn("Scan task failed at {} for {}: {}", stage, c, e.toString());
        SLOG.error("task-failed", e, "stage", stage, "subdomain", c.name(), "cause", e.toString());
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || flag.get();
    }

    private static void checkCancel(AtomicBoolean flag) {
        if (isCancelled(flag)) throw new CancellationException();
    }

    private static void notify(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("Progress listener failed: {}", e.toString());
        }
    }

    public ScanConfig getConfig() { return config; }

    public ScanStats.Snapshot getRuntimeSnapshot() { return stats.snapshot(); }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
