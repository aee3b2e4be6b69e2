package com.subhawk.core.dns;

import com.subhawk.core.api.IResolver;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.ResolutionResult;
import com.subhawk.core.model.ResolutionStatus;
import com.subhawk.core.model.ScanConfig;
import com.subhawk.core.util.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * CNAME 체인 추적 리졸버.
 * - 첫 홉 결과로 상태를 분류(NO_RECORD/NXDOMAIN/TIMEOUT/ERROR)
 * - 이후 홉의 NXDOMAIN/무응답은 체인 종료로 보고 RESOLVED 유지(댕글링 타깃이 전형적인 takeover 케이스)
 * - 깊이 초과/루프 → ERROR
 * - limiter 가 있으면 홉(질의)마다 토큰 하나
 * 예외는 절대 호출자에게 전파하지 않는다.
 */
public final class DnsResolver implements IResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DnsResolver.class);

    private final DnsLookup dns;
    private final int maxDepth;
    private final RateLimiter limiter; // null 이면 무제한

    public DnsResolver(DnsLookup dns, int maxDepth) {
        this(dns, maxDepth, null);
    }

    public DnsResolver(DnsLookup dns, int maxDepth, RateLimiter limiter) {
        this.dns = Objects.requireNonNull(dns, "dns");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.maxDepth = maxDepth;
        this.limiter = limiter;
    }

    public static DnsResolver fromConfig(ScanConfig cfg, RateLimiter limiter) {
        return new DnsResolver(new JndiDnsLookup(cfg.dns().getNameservers()), cfg.getMaxCnameDepth(), limiter);
    }

    @Override
    public ResolutionResult resolve(Candidate candidate, Duration timeout) {
        Objects.requireNonNull(candidate, "candidate");
        List<String> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        seen.add(candidate.name());
        String current = candidate.name();

        while (true) {
            List<String> targets;
            try {
                if (limiter != null) limiter.acquire();
                targets = dns.cname(current, timeout);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                return ResolutionResult.failed(candidate, ResolutionStatus.ERROR, chain, "interrupted");
            } catch (DnsLookupException e) {
                if (chain.isEmpty()) {
                    LOG.debug("DNS {} for {}: {}", e.getKind(), current, e.getMessage());
                    return ResolutionResult.failed(candidate, e.getKind().status(), List.of(), detailOf(e));
                }
                LOG.debug("CNAME chain of {} ends at {} ({})", candidate, current, e.getKind());
                break;
            } catch (RuntimeException e) {
                LOG.warn("Unexpected resolver fault for {}: {}", current, e.toString());
                if (chain.isEmpty()) {
                    return ResolutionResult.failed(candidate, ResolutionStatus.ERROR, List.of(), e.toString());
                }
                break;
            }

            if (targets == null || targets.isEmpty()) {
                if (chain.isEmpty()) return ResolutionResult.noRecord(candidate);
                break;
            }

            String next = Candidate.normalize(targets.get(0));
            if (next.isEmpty()) {
                if (chain.isEmpty()) return ResolutionResult.noRecord(candidate);
                break;
            }
            if (chain.size() >= maxDepth) {
                return ResolutionResult.failed(candidate, ResolutionStatus.ERROR, chain,
                        "CNAME chain exceeds " + maxDepth + " hops");
            }
            if (!seen.add(next)) {
                return ResolutionResult.failed(candidate, ResolutionStatus.ERROR, chain,
                        "CNAME loop detected at " + next);
            }
            chain.add(next);
            current = next;
        }
        return ResolutionResult.resolved(candidate, chain);
    }

    private static String detailOf(DnsLookupException e) {
        return (e.getKind() == DnsLookupException.Kind.ERROR) ? e.getMessage() : null;
    }
}
