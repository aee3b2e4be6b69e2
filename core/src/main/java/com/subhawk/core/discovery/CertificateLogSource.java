package com.subhawk.core.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subhawk.core.model.Candidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 패시브 수집: CT 로그(crt.sh JSON)에서 `*.domain` / `domain` 인증서 이름을 뽑는다.
 * 네트워크/파싱 실패는 빈 집합 + 경고로 흡수하고 스캔을 멈추지 않는다.
 */
public final class CertificateLogSource {

    private static final Logger LOG = LoggerFactory.getLogger(CertificateLogSource.class);
    private static final ObjectMapper OM = new ObjectMapper();

    /** 조회 결과. warning 이 null 이면 정상 */
    public record Result(Set<Candidate> names, String warning) {
        public Result {
            names = Collections.unmodifiableSet(new TreeSet<>(names));
        }
        static Result failed(String warning) { return new Result(Set.of(), warning); }
    }

    private final CtLogFetcher fetcher;
    private final URI endpoint;

    public CertificateLogSource(CtLogFetcher fetcher, URI endpoint) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    }

    public Result query(String domain) {
        String d = Candidate.normalize(domain);
        URI uri = queryUri(endpoint, d);
        LOG.debug("CT log query: {}", uri);

        CtLogFetcher.Response res = fetcher.fetch(uri);
        if (res.error.isPresent()) {
            return warn("Certificate transparency query failed: " + res.error.get());
        }
        if (res.status != 200) {
            return warn("Certificate transparency query returned HTTP " + res.status);
        }
        try {
            Set<Candidate> names = parse(res.body, d);
            LOG.info("Found {} subdomains from certificate transparency logs", names.size());
            return new Result(names, null);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return warn("Certificate transparency response could not be parsed: " + e.getMessage());
        }
    }

    /** crt.sh 형식: `?q=%25.<domain>&output=json` */
    static URI queryUri(URI endpoint, String domain) {
        String base = endpoint.toString();
        String sep = base.contains("?") ? "&" : "?";
        return URI.create(base + sep + "q=%25." + URLEncoder.encode(domain, StandardCharsets.UTF_8) + "&output=json");
    }

    /**
     * 레코드 배열에서 name_value(개행 구분) 와 common_name 을 읽는다.
     * 와일드카드는 "*." 를 떼고, 그 결과가 도메인 자체이면 버린다.
     */
    static Set<Candidate> parse(String json, String domain) throws JsonProcessingException {
        Set<Candidate> out = new TreeSet<>();
        if (json == null || json.isBlank()) return out;

        JsonNode root = OM.readTree(json);
        if (!root.isArray()) {
            throw new IllegalArgumentException("expected a JSON array but got " + root.getNodeType());
        }
        for (JsonNode rec : root) {
            if (!rec.isObject()) continue;
            addNames(rec.path("name_value").asText(""), domain, out);
            addNames(rec.path("common_name").asText(""), domain, out);
        }
        return out;
    }

    private static void addNames(String field, String domain, Set<Candidate> out) {
        for (String raw : field.split("\\r?\\n")) {
            String name = Candidate.normalize(raw);
            boolean wildcard = false;
            if (name.startsWith("*.")) {
                name = name.substring(2);
                wildcard = true;
            }
            if (name.isEmpty() || name.contains("*") || name.contains(" ") || name.contains("@")) continue;

            Candidate c = Candidate.of(name);
            if (!c.isWithin(domain)) continue;
            // "*.example.com" 은 example.com 자체를 뜻하지 않는다
            if (wildcard && c.name().equals(Candidate.normalize(domain))) continue;
            out.add(c);
        }
    }

    private static Result warn(String msg) {
        LOG.warn(msg);
        return Result.failed(msg);
    }
}
