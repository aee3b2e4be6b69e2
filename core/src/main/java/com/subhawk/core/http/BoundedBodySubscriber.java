package com.subhawk.core.http;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * 본문을 limit 바이트까지만 모으고 나머지는 구독 취소로 버린다.
 * 거대한/끝없는 응답 본문에 묶이지 않기 위한 캡.
 */
final class BoundedBodySubscriber implements HttpResponse.BodySubscriber<String> {

    private final int limit;
    private final Charset charset;
    private final ByteArrayOutputStream buf;
    private final CompletableFuture<String> result = new CompletableFuture<>();
    private Flow.Subscription subscription;

    BoundedBodySubscriber(int limit, Charset charset) {
        this.limit = Math.max(1, limit);
        this.charset = charset;
        this.buf = new ByteArrayOutputStream(Math.min(this.limit, 8192));
    }

    static HttpResponse.BodyHandler<String> handler(int limit, Charset charset) {
        return info -> new BoundedBodySubscriber(limit, charset);
    }

    @Override
    public CompletionStage<String> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription s) {
        this.subscription = s;
        s.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> items) {
        if (result.isDone()) return;
        for (ByteBuffer bb : items) {
            int room = limit - buf.size();
            int n = Math.min(room, bb.remaining());
            if (n > 0) {
                byte[] chunk = new byte[n];
                bb.get(chunk);
                buf.write(chunk, 0, n);
            }
            if (buf.size() >= limit) {
                subscription.cancel();
                finish();
                return;
            }
        }
        subscription.request(1);
    }

    @Override
    public void onError(Throwable t) {
        result.completeExceptionally(t);
    }

    @Override
    public void onComplete() {
        finish();
    }

    private void finish() {
        result.complete(buf.toString(charset));
    }
}
