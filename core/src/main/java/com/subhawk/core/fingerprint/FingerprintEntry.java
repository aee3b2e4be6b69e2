package com.subhawk.core.fingerprint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 서비스 하나의 takeover 시그니처.
 * 패턴은 소문자로 정규화되고 정의 순서를 유지한다(매칭 결과 재현성).
 */
public record FingerprintEntry(String serviceName,
                               Set<String> cnamePatterns,
                               Set<String> httpPatterns,
                               boolean vulnerable) {

    public FingerprintEntry {
        Objects.requireNonNull(serviceName, "serviceName");
        if (serviceName.isBlank()) throw new IllegalArgumentException("serviceName is blank");
        cnamePatterns = lowerOrdered(cnamePatterns);
        httpPatterns = lowerOrdered(httpPatterns);
        if (cnamePatterns.isEmpty())
            throw new IllegalArgumentException("fingerprint '" + serviceName + "' has no cname patterns");
    }

    public static FingerprintEntry of(String service, List<String> cname, List<String> http, boolean vulnerable) {
        return new FingerprintEntry(service,
                new LinkedHashSet<>(cname == null ? List.of() : cname),
                new LinkedHashSet<>(http == null ? List.of() : http),
                vulnerable);
    }

    /** host 에 포함된 첫 CNAME 패턴 (대소문자 무시) */
    public Optional<String> matchCname(String host) {
        if (host == null) return Optional.empty();
        String h = host.toLowerCase(Locale.ROOT);
        for (String p : cnamePatterns) {
            if (h.contains(p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    /** 본문에 포함된 첫 HTTP 패턴 (대소문자 무시). lowerBody 는 호출자가 소문자화한 본문 */
    public Optional<String> matchHttp(String lowerBody) {
        if (lowerBody == null || lowerBody.isEmpty()) return Optional.empty();
        for (String p : httpPatterns) {
            if (lowerBody.contains(p)) return Optional.of(p);
        }
        return Optional.empty();
    }

    private static Set<String> lowerOrdered(Set<String> in) {
        if (in == null) return Set.of();
        List<String> out = new ArrayList<>(in.size());
        for (String s : in) {
            if (s == null || s.isBlank()) continue;
            String v = s.trim().toLowerCase(Locale.ROOT);
            if (!out.contains(v)) out.add(v);
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(out));
    }
}
