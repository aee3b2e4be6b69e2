package com.subhawk.core.discovery;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/** 모든 질의에 같은 응답을 돌려주고 요청 URI 를 기록한다. */
final class FakeCtLogFetcher implements CtLogFetcher {
    private final Response response;
    final List<URI> requested = new ArrayList<>();

    private FakeCtLogFetcher(Response response) {
        this.response = response;
    }

    static FakeCtLogFetcher ok(String json) {
        return new FakeCtLogFetcher(Response.ok(200, json));
    }
    static FakeCtLogFetcher status(int status) {
        return new FakeCtLogFetcher(Response.ok(status, "<html>busy</html>"));
    }
    static FakeCtLogFetcher fail(String err) {
        return new FakeCtLogFetcher(Response.fail(err));
    }

    @Override public Response fetch(URI queryUri) {
        requested.add(queryUri);
        return response;
    }
}
