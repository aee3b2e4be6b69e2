// IResolver.java
package com.subhawk.core.api;

import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.ResolutionResult;

import java.time.Duration;

/** DNS 해석 최소 계약: 어떤 장애도 예외로 던지지 않고 상태로 정규화한다. */
@FunctionalInterface
public interface IResolver {
    ResolutionResult resolve(Candidate candidate, Duration timeout);
}
