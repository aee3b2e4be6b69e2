package com.subhawk.core.util;

import com.subhawk.core.discovery.WordlistSource;
import com.subhawk.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * subhawk.yml 을 읽어 ScanConfig 로 변환.
 *
 * 예상 YAML 키:
 * domain: example.com
 * wordlist: wordlists/common.txt     # 파일 경로(설정 파일 기준 상대경로)
 * concurrency: 10
 * timeoutMs: 5000
 * readTimeoutMs: 5000
 * rps: 0
 * followRedirects: true
 * maxCnameDepth: 10
 * passive:
 *   enabled: true
 *   endpoint: "https://crt.sh/"
 * dns:
 *   nameservers: ["8.8.8.8"]
 * probe:
 *   maxBodyBytes: 65536
 *   userAgent: "..."
 * fingerprints: fingerprints.yml
 * output: results.json
 *
 * validate() 는 호출하지 않는다. CLI 가 값을 덮어쓴 뒤 검증한다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static ScanConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.isRegularFile(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        Path baseDir = yamlPath.toAbsolutePath().getParent();
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in, baseDir);
        }
    }

    /** 상대 경로(wordlist/fingerprints/output)는 baseDir 기준으로 푼다. baseDir 가 null 이면 그대로. */
    public static ScanConfig load(InputStream in, Path baseDir) throws IOException {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("invalid YAML config: " + e.getMessage(), e);
        }

        ScanConfig cfg = ScanConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있으면 defaults 유지
            return cfg;
        }

        setString(map, "domain", cfg::setDomain);
        setInt(map, "concurrency", cfg::setConcurrency);
        setMs(map, "timeoutMs", cfg::setTimeout);
        setMs(map, "readTimeoutMs", cfg::setReadTimeout);
        setInt(map, "rps", cfg::setRps);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "maxCnameDepth", cfg::setMaxCnameDepth);

        Object wl = map.get("wordlist");
        if (wl != null) {
            Path p = resolve(baseDir, String.valueOf(wl));
            cfg.setWordlist(WordlistSource.read(p));
        }
        setString(map, "fingerprints", s -> cfg.setFingerprintsFile(resolve(baseDir, s)));
        setString(map, "output", s -> cfg.setOutput(resolve(baseDir, s)));

        Map<?, ?> passive = getMap(map, "passive");
        if (passive != null) {
            setBoolean(passive, "enabled", b -> cfg.passive().setEnabled(b));
            setString(passive, "endpoint", s -> cfg.passive().setEndpoint(uri(s)));
        }
        Map<?, ?> dns = getMap(map, "dns");
        if (dns != null) {
            setStringList(dns, "nameservers", l -> cfg.dns().setNameservers(l));
        }
        Map<?, ?> probe = getMap(map, "probe");
        if (probe != null) {
            setInt(probe, "maxBodyBytes", i -> cfg.probe().setMaxBodyBytes(i));
            setString(probe, "userAgent", s -> cfg.probe().setUserAgent(s));
        }
        return cfg;
    }

    // ------------ helpers ------------
    private static Path resolve(Path baseDir, String s) {
        Path p = Path.of(s.trim());
        return (baseDir == null || p.isAbsolute()) ? p : baseDir.resolve(p).normalize();
    }

    private static URI uri(String s) {
        try {
            return URI.create(s.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("passive.endpoint is not a valid URI: " + s, e);
        }
    }

    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o).trim());
        } else {
            // "a,b" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        // 0 이하는 validate() 에서 거른다
        setter.accept(Duration.ofMillis(ms));
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }
}
