package com.subhawk.core.model;

import java.util.Locale;
import java.util.Objects;

/** 스캔 대상 서브도메인 이름. 소문자 + 끝 점 제거로 정규화된 FQDN. */
public record Candidate(String name) implements Comparable<Candidate> {

    public Candidate {
        Objects.requireNonNull(name, "name");
        name = normalize(name);
        if (name.isEmpty()) throw new IllegalArgumentException("candidate name is blank");
    }

    public static Candidate of(String name) {
        return new Candidate(name);
    }

    /** 호스트명 정규화: trim → 소문자 → 끝의 '.' 제거 */
    public static String normalize(String host) {
        if (host == null) return "";
        String h = host.trim().toLowerCase(Locale.ROOT);
        while (h.endsWith(".")) h = h.substring(0, h.length() - 1);
        return h;
    }

    /** name == domain 이거나 name 이 ".domain" 으로 끝나면 true */
    public boolean isWithin(String domain) {
        String d = normalize(domain);
        return name.equals(d) || name.endsWith("." + d);
    }

    @Override
    public int compareTo(Candidate o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return name;
    }
}
