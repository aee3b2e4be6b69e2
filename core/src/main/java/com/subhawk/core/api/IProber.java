// IProber.java
package com.subhawk.core.api;

import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.ProbeResult;

import java.time.Duration;

/** HTTP(S) 프로브 최소 계약: 연결 수준 장애는 ProbeStatus 로 정규화한다. */
@FunctionalInterface
public interface IProber extends AutoCloseable {
    ProbeResult probe(Candidate candidate, Duration timeout);
    @Override default void close() {}
}
