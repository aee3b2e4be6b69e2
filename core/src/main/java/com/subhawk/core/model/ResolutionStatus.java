package com.subhawk.core.model;

/** DNS 해석 결과 분류 */
public enum ResolutionStatus {
    RESOLVED("CNAME resolved"),
    NO_RECORD("No CNAME record"),
    NXDOMAIN("NXDOMAIN (name does not exist)"),
    TIMEOUT("DNS lookup timed out"),
    ERROR("DNS resolution error");

    private final String evidence;

    ResolutionStatus(String evidence) { this.evidence = evidence; }

    /** Finding evidence 에 그대로 들어가는 사람용 문구 */
    public String evidence() { return evidence; }
}
