package com.subhawk.core.discovery;

import com.subhawk.core.model.Candidate;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * 액티브 수집: 워드리스트 라벨 × 도메인으로 이름만 생성한다.
 * 존재 여부는 여기서 확인하지 않는다(Resolver 결과로 판단).
 */
public final class WordlistSource {

    private WordlistSource() {}

    /** `label.domain` 후보 생성. 공백 포함 항목은 건너뛴다. */
    public static Set<Candidate> generate(String domain, Collection<String> labels) {
        String d = Candidate.normalize(domain);
        Set<Candidate> out = new TreeSet<>();
        if (labels == null) return out;
        for (String raw : labels) {
            String label = Candidate.normalize(raw);
            if (label.isEmpty() || label.startsWith("#")) continue;
            if (label.chars().anyMatch(Character::isWhitespace)) continue;
            if (label.equals(d)) continue;
            if (label.endsWith("." + d)) {
                label = label.substring(0, label.length() - d.length() - 1);
            }
            while (label.startsWith(".")) label = label.substring(1);
            if (label.isEmpty()) continue;
            out.add(Candidate.of(label + "." + d));
        }
        return out;
    }

    /** 한 줄 한 라벨. 빈 줄과 '#' 주석 줄은 무시. 읽기 실패는 IOException(설정 오류) */
    public static List<String> read(Path file) throws IOException {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IOException("wordlist not readable: " + file.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return read(in);
        }
    }

    public static List<String> read(InputStream in) throws IOException {
        List<String> out = new ArrayList<>();
        try (BufferedReader r = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String s = line.strip();
                if (s.isEmpty() || s.startsWith("#")) continue;
                out.add(s);
            }
        }
        return out;
    }
}
