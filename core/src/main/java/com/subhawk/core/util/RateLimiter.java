package com.subhawk.core.util;

/**
 * 토큰 버킷. 모든 워커가 하나를 공유해 초당 요청 수를 제한한다.
 * DNS 질의(CNAME 홉)와 HTTP 요청(스킴별 시도) 하나가 각각 토큰 하나씩 쓴다.
 */
public final class RateLimiter {
    private final long capacity;
    private final long refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        if (capacity < 1 || refillPerSecond < 1) {
            throw new IllegalArgumentException("capacity and refillPerSecond must be >= 1");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** rps <= 0 이면 제한 없음(null) */
    public static RateLimiter perSecondOrNull(int rps) {
        return rps > 0 ? new RateLimiter(rps, rps) : null;
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            long waitMs = (long) Math.ceil((1.0 - tokens) * 1000.0 / refillPerSecond);
            this.wait(Math.max(1, Math.min(waitMs, 50)));
        }
    }

    public synchronized double available() {
        refill();
        return tokens;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
