package com.subhawk.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ScanReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportExporterTest {

    @TempDir Path dir;

    private static ScanReport sample() {
        Candidate blog = Candidate.of("blog.example.com");
        Candidate www = Candidate.of("www.example.com");
        ScanReport.Builder b = ScanReport.builder("example.com", Instant.parse("2024-05-01T10:00:00Z"))
                .candidates(List.of(www, blog));
        b.append(Finding.builder(www).evidence("No CNAME record").build());
        b.append(Finding.builder(blog).vulnerable(true).service("GitHub Pages")
                .cname(List.of("acme.github.io"))
                .evidence("CNAME points to: acme.github.io")
                .evidence("Service identified: GitHub Pages")
                .evidence("HTTP Status: 404")
                .build());
        return b.build(Instant.parse("2024-05-01T10:00:05Z"), true);
    }

    @Test
    void writes_scan_info_subdomains_and_vulnerable_list() throws Exception {
        Path out = dir.resolve("nested/results.json");
        new JsonReportExporter().export(sample(), out);

        assertThat(out).exists();
        JsonNode root = new ObjectMapper().readTree(Files.readString(out));

        JsonNode info = root.get("scan_info");
        assertThat(info.get("domain").asText()).isEqualTo("example.com");
        assertThat(info.get("timestamp").asText()).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(info.get("total_subdomains").asInt()).isEqualTo(2);
        assertThat(info.get("vulnerable_count").asInt()).isEqualTo(1);
        assertThat(info.get("completed").asBoolean()).isTrue();

        assertThat(root.get("subdomains")).extracting(JsonNode::asText)
                .containsExactly("blog.example.com", "www.example.com");

        JsonNode v = root.get("vulnerable");
        assertThat(v).hasSize(1);
        assertThat(v.get(0).get("subdomain").asText()).isEqualTo("blog.example.com");
        assertThat(v.get(0).get("vulnerable").asBoolean()).isTrue();
        assertThat(v.get(0).get("service").asText()).isEqualTo("GitHub Pages");
        assertThat(v.get(0).get("cname").get(0).asText()).isEqualTo("acme.github.io");
        assertThat(v.get(0).get("evidence")).hasSize(3);
        assertThat(root.has("warnings")).isFalse();
    }

    @Test
    void empty_report_has_empty_arrays() throws Exception {
        ScanReport empty = ScanReport.builder("example.com", Instant.now())
                .warning("Certificate transparency query failed: timeout")
                .build(Instant.now(), true);
        JsonNode root = new ObjectMapper().readTree(new JsonReportExporter().toJson(empty));
        assertThat(root.get("subdomains")).isEmpty();
        assertThat(root.get("vulnerable")).isEmpty();
        assertThat(root.get("scan_info").get("vulnerable_count").asInt()).isZero();
        assertThat(root.get("warnings")).hasSize(1);
    }
}
