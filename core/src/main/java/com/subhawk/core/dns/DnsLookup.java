package com.subhawk.core.dns;

import java.time.Duration;
import java.util.List;

/** 단일 DNS CNAME 질의. 체인 추적은 {@link DnsResolver} 책임. */
@FunctionalInterface
public interface DnsLookup {
    /**
     * @return name 의 CNAME 타깃들 (이름은 존재하지만 CNAME 이 없으면 빈 리스트)
     * @throws DnsLookupException NXDOMAIN / 타임아웃 / 기타 리졸버 오류
     */
    List<String> cname(String name, Duration timeout) throws DnsLookupException;
}
