package com.subhawk.core.model;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CandidateTest {

    @Test
    void names_are_lowercased_and_trailing_dot_removed() {
        assertThat(Candidate.of("  Blog.Example.COM. ").name()).isEqualTo("blog.example.com");
    }

    @Test
    void case_variants_collapse_into_one_member() {
        Set<Candidate> set = new TreeSet<>();
        set.add(Candidate.of("WWW.example.com"));
        set.add(Candidate.of("www.example.com"));
        set.add(Candidate.of("www.example.com."));
        assertThat(set).hasSize(1);
    }

    @Test
    void blank_name_is_rejected() {
        assertThatThrownBy(() -> Candidate.of("  . "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void within_checks_label_boundary() {
        Candidate c = Candidate.of("a.example.com");
        assertThat(c.isWithin("example.com")).isTrue();
        assertThat(c.isWithin("Example.com.")).isTrue();
        assertThat(Candidate.of("badexample.com").isWithin("example.com")).isFalse();
    }
}
