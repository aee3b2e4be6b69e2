package com.subhawk.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 후보 하나에 대한 DNS 해석 결과. 후보당 정확히 한 번 생성된다.
 *
 * @param candidate  대상 후보
 * @param cnameChain CNAME 홉 순서대로의 타깃 호스트 (없으면 빈 리스트)
 * @param status     해석 상태
 * @param detail     TIMEOUT/ERROR 시 원인 메시지 (없으면 null)
 */
public record ResolutionResult(Candidate candidate,
                               List<String> cnameChain,
                               ResolutionStatus status,
                               String detail) {

    public ResolutionResult {
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(status, "status");
        cnameChain = (cnameChain == null) ? List.of() : List.copyOf(cnameChain);
        if (status == ResolutionStatus.RESOLVED && cnameChain.isEmpty()) {
            throw new IllegalArgumentException("RESOLVED requires a non-empty CNAME chain");
        }
    }

    public static ResolutionResult resolved(Candidate c, List<String> chain) {
        return new ResolutionResult(c, chain, ResolutionStatus.RESOLVED, null);
    }

    public static ResolutionResult noRecord(Candidate c) {
        return new ResolutionResult(c, List.of(), ResolutionStatus.NO_RECORD, null);
    }

    public static ResolutionResult failed(Candidate c, ResolutionStatus status, List<String> partialChain, String detail) {
        return new ResolutionResult(c, partialChain, status, detail);
    }

    /** 프로브 대상 여부: RESOLVED + 체인 존재 */
    public boolean hasChain() {
        return status == ResolutionStatus.RESOLVED && !cnameChain.isEmpty();
    }

}
