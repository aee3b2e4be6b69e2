package com.subhawk.core.model;

/** 서비스 식별 신뢰도 */
public enum Confidence {
    /** 식별된 서비스 없음 */
    NONE,
    /** CNAME 패턴만 일치 (HTTP 확인 없음) */
    CNAME_ONLY,
    /** CNAME + HTTP 본문 시그니처 모두 일치 */
    CONFIRMED
}
