package com.subhawk.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    private final Candidate c = Candidate.of("blog.example.com");

    @Test
    void vulnerable_finding_requires_service_and_evidence() {
        assertThatThrownBy(() -> Finding.builder(c).vulnerable(true).evidence("x").build())
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Finding.builder(c).vulnerable(true).service("GitHub Pages").build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blank_evidence_lines_are_dropped() {
        Finding f = Finding.builder(c).evidence("").evidence("  ").evidence("No CNAME record").build();
        assertThat(f.getEvidence()).containsExactly("No CNAME record");
        assertThat(f.isVulnerable()).isFalse();
        assertThat(f.getService()).isEmpty();
    }

    @Test
    void cname_and_evidence_lists_are_immutable() {
        Finding f = Finding.builder(c).vulnerable(true).service("GitHub Pages")
                .cname(List.of("acme.github.io")).evidence("CNAME points to: acme.github.io").build();
        assertThatThrownBy(() -> f.getCname().add("x")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> f.getEvidence().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
