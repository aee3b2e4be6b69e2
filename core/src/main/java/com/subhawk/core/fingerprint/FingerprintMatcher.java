package com.subhawk.core.fingerprint;

import com.subhawk.core.model.Confidence;
import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ProbeResult;
import com.subhawk.core.model.ResolutionResult;
import com.subhawk.core.model.ResolutionStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * CNAME 체인 + HTTP 증거를 핑거프린트 테이블과 대조해 Finding 으로 분류한다.
 * 순수 계산(블로킹/부작용 없음)이라 워커 스레드에서 그대로 호출한다.
 *
 * 판정 순서:
 *  1) 해석 실패/체인 없음 → 비취약, evidence = 해석 상태
 *  2) CNAME 패턴이 맞는 엔트리 = 후보 서비스 집합 (테이블 순서)
 *  3) 후보 없음 → 비취약, "No matching service fingerprint"
 *  4) 프로브 OK 이고 HTTP 패턴이 맞는 후보가 있으면 CONFIRMED, 없으면 CNAME_ONLY
 *  5) 동률이면 테이블 순서상 첫 엔트리, 나머지는 "Ambiguous match" 로 기록
 */
public final class FingerprintMatcher {

    static final String CNAME_ONLY_LABEL = "CNAME-only match (no HTTP confirmation)";
    static final String NO_FINGERPRINT = "No matching service fingerprint";

    private final FingerprintTable table;

    public FingerprintMatcher(FingerprintTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    /** probe 는 프로브를 하지 않았으면 null */
    public Finding match(ResolutionResult resolution, ProbeResult probe) {
        Objects.requireNonNull(resolution, "resolution");
        Finding.Builder fb = Finding.builder(resolution.candidate()).cname(resolution.cnameChain());

        // 1) 해석 실패 (루프/깊이 초과로 부분 체인만 있는 ERROR 포함)
        if (resolution.status() != ResolutionStatus.RESOLVED || !resolution.hasChain()) {
            String line = resolution.status().evidence();
            if (resolution.detail() != null && !resolution.detail().isBlank()) {
                line = line + ": " + resolution.detail();
            }
            return fb.vulnerable(false).confidence(Confidence.NONE).evidence(line).build();
        }

        // 2) CNAME 후보 집합
        List<Hit> cnameHits = new ArrayList<>();
        for (FingerprintEntry e : table.entries()) {
            for (String host : resolution.cnameChain()) {
                if (e.matchCname(host).isPresent()) {
                    cnameHits.add(new Hit(e, host, null));
                    break;
                }
            }
        }

        // 3) 후보 없음
        if (cnameHits.isEmpty()) {
            return fb.vulnerable(false).confidence(Confidence.NONE)
                    .evidence("CNAME points to: " + String.join(" -> ", resolution.cnameChain()))
                    .evidence(NO_FINGERPRINT)
                    .build();
        }

        // 4) HTTP 확인
        boolean probeOk = probe != null && probe.isOk();
        List<Hit> httpHits = new ArrayList<>();
        if (probeOk) {
            String lowerBody = probe.getBodySnippet().orElse("").toLowerCase(Locale.ROOT);
            for (Hit h : cnameHits) {
                Optional<String> sig = h.entry().matchHttp(lowerBody);
                sig.ifPresent(s -> httpHits.add(new Hit(h.entry(), h.host(), s)));
            }
        }

        boolean confirmed = !httpHits.isEmpty();
        List<Hit> tied = confirmed ? httpHits : cnameHits;
        Hit chosen = tied.get(0); // 테이블 순서 유지 → 첫 엔트리 우선
        FingerprintEntry entry = chosen.entry();

        fb.vulnerable(entry.vulnerable())
          .service(entry.serviceName())
          .evidence("CNAME points to: " + chosen.host())
          .evidence("Service identified: " + entry.serviceName());

        if (confirmed) {
            fb.confidence(Confidence.CONFIRMED)
              .matchedSignature(chosen.signature());
            probe.getHttpStatus().ifPresent(code -> fb.evidence("HTTP Status: " + code));
        } else {
            fb.confidence(Confidence.CNAME_ONLY)
              .evidence(CNAME_ONLY_LABEL)
              .evidence(describeProbe(probe));
        }

        // 5) 동률 기록
        if (tied.size() > 1) {
            String others = tied.subList(1, tied.size()).stream()
                    .map(h -> h.entry().serviceName())
                    .collect(Collectors.joining(", "));
            fb.evidence("Ambiguous match: also matches " + others);
        }
        return fb.build();
    }

    private static String describeProbe(ProbeResult probe) {
        if (probe == null) return "HTTP probe not performed";
        if (probe.isOk()) {
            return "HTTP Status: " + probe.getHttpStatus().map(String::valueOf).orElse("?")
                    + " (no service signature in body)";
        }
        return "HTTP probe failed: " + probe.getStatus()
                + probe.getDetail().map(d -> " (" + d + ")").orElse("");
    }

    private record Hit(FingerprintEntry entry, String host, String signature) {}
}
