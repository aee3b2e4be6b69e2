package com.subhawk.core.model;

/** HTTP(S) 프로브 결과 분류 */
public enum ProbeStatus {
    OK,
    CONN_ERROR,
    TIMEOUT,
    TLS_ERROR;

    /** HTTPS 실패 후 HTTP 재시도 대상인지 */
    public boolean retryOverHttp() {
        return this == CONN_ERROR || this == TLS_ERROR;
    }
}
