package com.subhawk.core.discovery;

import com.subhawk.core.model.Candidate;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 수집 결과: 중복 제거된 후보 집합 + 비치명적 경고.
 *
 * @param candidates   정규화·중복제거된 후보 (이름순)
 * @param warnings     패시브 수집 실패 등
 * @param passiveCount 패시브 경로 후보 수
 * @param activeCount  워드리스트 경로 후보 수
 */
public record DiscoveryResult(SortedSet<Candidate> candidates,
                              List<String> warnings,
                              int passiveCount,
                              int activeCount) {

    public DiscoveryResult {
        candidates = Collections.unmodifiableSortedSet(new TreeSet<>(candidates == null ? Set.of() : candidates));
        warnings = (warnings == null) ? List.of() : List.copyOf(warnings);
    }

    public static DiscoveryResult empty() {
        return new DiscoveryResult(new TreeSet<>(), List.of(), 0, 0);
    }
}
