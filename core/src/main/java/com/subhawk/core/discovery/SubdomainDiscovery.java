package com.subhawk.core.discovery;

import com.subhawk.core.api.ISubdomainSource;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.ScanConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/** 패시브(CT 로그) + 액티브(워드리스트) 합집합. 결과는 소문자 정규화·중복제거됨. */
public final class SubdomainDiscovery implements ISubdomainSource {

    private static final Logger LOG = LoggerFactory.getLogger(SubdomainDiscovery.class);

    private final CertificateLogSource passive; // null 이면 패시브 비활성

    public SubdomainDiscovery(CertificateLogSource passive) {
        this.passive = passive;
    }

    /** 설정 기반 기본 구성 */
    public static SubdomainDiscovery fromConfig(ScanConfig cfg) {
        if (!cfg.passive().isEnabled()) return new SubdomainDiscovery(null);
        // crt.sh 는 느리므로 읽기 타임아웃 기준 4배까지 허용
        var fetcher = new HttpCtLogFetcher(cfg.getReadTimeout().multipliedBy(4), cfg.probe().getUserAgent());
        return new SubdomainDiscovery(new CertificateLogSource(fetcher, cfg.passive().getEndpoint()));
    }

    @Override
    public DiscoveryResult discover(String domain, List<String> wordlist) {
        SortedSet<Candidate> all = new TreeSet<>();
        List<String> warnings = new ArrayList<>();

        int passiveCount = 0;
        if (passive != null) {
            LOG.info("Starting passive subdomain enumeration...");
            CertificateLogSource.Result r = passive.query(domain);
            passiveCount = r.names().size();
            all.addAll(r.names());
            if (r.warning() != null) warnings.add(r.warning());
        }

        int activeCount = 0;
        if (wordlist != null && !wordlist.isEmpty()) {
            Set<Candidate> generated = WordlistSource.generate(domain, wordlist);
            activeCount = generated.size();
            all.addAll(generated);
            LOG.info("Generated {} candidates from wordlist", activeCount);
        }

        LOG.info("Total unique subdomains found: {}", all.size());
        return new DiscoveryResult(all, warnings, passiveCount, activeCount);
    }
}
