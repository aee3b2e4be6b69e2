package com.subhawk.core.fingerprint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 서비스 핑거프린트의 불변 순서 목록.
 * 프로세스 시작 시 한 번 로드하고 스캔 중에는 락 없이 공유한다.
 * 순서 = 파일 정의 순서 = 동률 시 우선순위.
 *
 * YAML 형식:
 * <pre>
 * - service: "GitHub Pages"
 *   cname: ["github.io"]
 *   http: ["There isn't a GitHub Pages site here"]
 *   vulnerable: true
 * </pre>
 * vulnerable 생략 시 true.
 */
public final class FingerprintTable {

    private static final Logger LOG = LoggerFactory.getLogger(FingerprintTable.class);

    /** 클래스패스 내장 테이블 */
    public static final String BUILTIN_RESOURCE = "/fingerprints.yml";

    private final List<FingerprintEntry> entries;

    public FingerprintTable(List<FingerprintEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        Set<String> names = new HashSet<>();
        for (FingerprintEntry e : entries) {
            if (!names.add(e.serviceName().toLowerCase(Locale.ROOT)))
                throw new IllegalArgumentException("duplicate fingerprint service: " + e.serviceName());
        }
        this.entries = List.copyOf(entries);
    }

    public List<FingerprintEntry> entries() { return entries; }
    public int size() { return entries.size(); }
    public boolean isEmpty() { return entries.isEmpty(); }

    // ---------- 로딩 ----------

    public static FingerprintTable loadDefault() {
        try (InputStream in = FingerprintTable.class.getResourceAsStream(BUILTIN_RESOURCE)) {
            if (in == null) throw new IllegalStateException("missing classpath resource " + BUILTIN_RESOURCE);
            return parse(in, "classpath:" + BUILTIN_RESOURCE);
        } catch (IOException e) {
            throw new IllegalStateException("failed to read " + BUILTIN_RESOURCE, e);
        }
    }

    /** path 가 null 이면 내장 테이블 */
    public static FingerprintTable loadOrDefault(Path path) throws IOException {
        return (path == null) ? loadDefault() : load(path);
    }

    public static FingerprintTable load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new IOException("fingerprint file not found at: " + path.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        }
    }

    /** 형식 오류는 IllegalArgumentException (설정 오류로 취급) */
    public static FingerprintTable parse(InputStream in, String source) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed fingerprint YAML in " + source + ": " + e.getMessage(), e);
        }
        if (!(root instanceof List<?> list)) {
            throw new IllegalArgumentException("fingerprint file " + source + " must be a YAML list");
        }

        List<FingerprintEntry> out = new ArrayList<>(list.size());
        int idx = 0;
        for (Object item : list) {
            idx++;
            if (!(item instanceof Map<?, ?> m)) {
                throw new IllegalArgumentException(source + " entry #" + idx + " is not a mapping");
            }
            Object service = m.get("service");
            if (service == null) {
                throw new IllegalArgumentException(source + " entry #" + idx + " has no 'service'");
            }
            Object vuln = m.get("vulnerable");
            boolean vulnerable = (vuln == null) || Boolean.parseBoolean(String.valueOf(vuln));
            out.add(FingerprintEntry.of(String.valueOf(service),
                    stringList(m.get("cname")), stringList(m.get("http")), vulnerable));
        }
        LOG.debug("Loaded {} fingerprints from {}", out.size(), source);
        return new FingerprintTable(out);
    }

    private static List<String> stringList(Object v) {
        if (v == null) return List.of();
        if (v instanceof List<?> l) {
            List<String> out = new ArrayList<>(l.size());
            for (Object o : l) if (o != null) out.add(String.valueOf(o));
            return out;
        }
        return List.of(String.valueOf(v));
    }
}
