package com.subhawk.core.dns;

import com.subhawk.core.model.ResolutionStatus;

/** DNS 질의 실패. kind 는 ResolutionStatus 로 그대로 매핑된다. */
public class DnsLookupException extends Exception {

    public enum Kind {
        NXDOMAIN(ResolutionStatus.NXDOMAIN),
        TIMEOUT(ResolutionStatus.TIMEOUT),
        ERROR(ResolutionStatus.ERROR);

        private final ResolutionStatus status;
        Kind(ResolutionStatus status) { this.status = status; }
        public ResolutionStatus status() { return status; }
    }

    private final Kind kind;

    public DnsLookupException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DnsLookupException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
