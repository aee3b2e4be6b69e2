// ISubdomainSource.java
package com.subhawk.core.api;

import com.subhawk.core.discovery.DiscoveryResult;

import java.util.List;

/** 서브도메인 수집 최소 계약: 도메인(+워드리스트)을 받아 정규화·중복제거된 후보를 돌려준다. */
public interface ISubdomainSource {
    /** wordlist 가 비어 있으면 액티브 생성 생략. 실패는 예외 대신 경고로 돌려준다. */
    DiscoveryResult discover(String domain, List<String> wordlist);
}
