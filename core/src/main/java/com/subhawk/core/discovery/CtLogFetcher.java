package com.subhawk.core.discovery;

import java.net.URI;
import java.util.Optional;

/** 인증서 투명성(CT) 로그 질의 전송 계층. 테스트에서는 가짜 구현으로 교체한다. */
public interface CtLogFetcher {
    final class Response {
        public final int status;                // HTTP status (0 이면 네트워크 오류 같은 비정상)
        public final String body;               // JSON 텍스트
        public final Optional<String> error;    // 오류 메시지

        public Response(int status, String body, String error) {
            this.status = status;
            this.body = (body == null) ? "" : body;
            this.error = Optional.ofNullable(error);
        }
        public static Response ok(int status, String body) {
            return new Response(status, body, null);
        }
        public static Response fail(String msg) {
            return new Response(0, "", msg);
        }
    }

    /** 질의 URI 를 GET 한다. 예외 대신 Response.fail 로 돌려준다. */
    Response fetch(URI queryUri);
}
