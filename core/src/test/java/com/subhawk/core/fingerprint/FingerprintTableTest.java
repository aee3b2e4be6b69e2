package com.subhawk.core.fingerprint;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FingerprintTableTest {

    @TempDir Path dir;

    private static FingerprintTable parse(String yaml) {
        return FingerprintTable.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)), "test");
    }

    @Test
    void bundled_table_has_nineteen_services_in_order() {
        FingerprintTable t = FingerprintTable.loadDefault();
        assertThat(t.size()).isEqualTo(19);
        assertThat(t.entries().get(0).serviceName()).isEqualTo("AWS/S3");
        assertThat(t.entries().get(1).serviceName()).isEqualTo("GitHub Pages");
        assertThat(t.entries().get(18).serviceName()).isEqualTo("Cloudfront");
        assertThat(t.entries()).allMatch(FingerprintEntry::vulnerable);
    }

    @Test
    void patterns_are_lowercased_and_matched_by_substring() {
        FingerprintEntry gh = FingerprintTable.loadDefault().entries().get(1);
        assertThat(gh.matchCname("acme.GitHub.io")).contains("github.io");
        assertThat(gh.matchHttp("<p>there isn't a github pages site here.</p>"))
                .contains("there isn't a github pages site here");
        assertThat(gh.matchCname("acme.gitlab.io")).isEmpty();
    }

    @Test
    void user_file_replaces_bundled_table() throws Exception {
        Path f = dir.resolve("fp.yml");
        Files.writeString(f, "- service: Acme\n  cname: [acme-cdn.net]\n  http: [No such site]\n  vulnerable: false\n");
        FingerprintTable t = FingerprintTable.loadOrDefault(f);
        assertThat(t.size()).isEqualTo(1);
        assertThat(t.entries().get(0).vulnerable()).isFalse();
        assertThat(t.entries().get(0).httpPatterns()).containsExactly("no such site");
    }

    @Test
    void vulnerable_defaults_to_true() {
        FingerprintTable t = parse("- service: X\n  cname: x.net\n");
        assertThat(t.entries().get(0).vulnerable()).isTrue();
        assertThat(t.entries().get(0).cnamePatterns()).containsExactly("x.net");
    }

    @Test
    void malformed_files_are_rejected() {
        assertThatThrownBy(() -> parse("service: X\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("- cname: [x.net]\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("- service: X\n  http: [a]\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("- service: X\n  cname: [a\n")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> parse("- service: X\n  cname: [a]\n- service: x\n  cname: [b]\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("duplicate");
    }

    @Test
    void missing_file_is_an_io_error() {
        assertThatThrownBy(() -> FingerprintTable.load(dir.resolve("none.yml"))).isInstanceOf(IOException.class);
    }

    @Test
    void entries_are_immutable() {
        FingerprintTable t = new FingerprintTable(List.of(FingerprintEntry.of("A", List.of("a.net"), List.of(), true)));
        assertThatThrownBy(() -> t.entries().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
