package com.subhawk.core.fingerprint;

import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.Confidence;
import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ProbeResult;
import com.subhawk.core.model.ProbeStatus;
import com.subhawk.core.model.ResolutionResult;
import com.subhawk.core.model.ResolutionStatus;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintMatcherTest {

    private static final Candidate BLOG = Candidate.of("blog.example.com");
    private static final URI BLOG_URL = URI.create("https://blog.example.com/");

    private final FingerprintMatcher matcher = new FingerprintMatcher(FingerprintTable.loadDefault());

    @Test
    void github_pages_takeover_is_confirmed() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("acme.github.io"));
        ProbeResult pr = ProbeResult.ok(BLOG, BLOG_URL, 404,
                "<html><body>There isn't a GitHub Pages site here.</body></html>");

        Finding f = matcher.match(rr, pr);

        assertThat(f.isVulnerable()).isTrue();
        assertThat(f.getService()).contains("GitHub Pages");
        assertThat(f.getCname()).containsExactly("acme.github.io");
        assertThat(f.getEvidence()).containsExactly(
                "CNAME points to: acme.github.io",
                "Service identified: GitHub Pages",
                "HTTP Status: 404");
        assertThat(f.getConfidence()).isEqualTo(Confidence.CONFIRMED);
        assertThat(f.getMatchedSignature()).contains("there isn't a github pages site here");
    }

    @Test
    void host_without_cname_is_not_vulnerable() {
        Candidate www = Candidate.of("www.example.com");
        Finding f = matcher.match(ResolutionResult.noRecord(www), null);

        assertThat(f.isVulnerable()).isFalse();
        assertThat(f.getService()).isEmpty();
        assertThat(f.getCname()).isEmpty();
        assertThat(f.getEvidence()).containsExactly("No CNAME record");
    }

    @Test
    void unresolved_statuses_are_never_vulnerable() {
        for (ResolutionStatus st : List.of(ResolutionStatus.NXDOMAIN, ResolutionStatus.TIMEOUT, ResolutionStatus.ERROR)) {
            ResolutionResult rr = ResolutionResult.failed(BLOG, st, List.of(), st == ResolutionStatus.ERROR ? "SERVFAIL" : null);
            ProbeResult pr = ProbeResult.ok(BLOG, BLOG_URL, 404, "There isn't a GitHub Pages site here");
            Finding f = matcher.match(rr, pr);
            assertThat(f.isVulnerable()).as(st.name()).isFalse();
            assertThat(f.getEvidence()).hasSize(1);
            assertThat(f.getEvidence().get(0)).startsWith(st.evidence());
        }
        Finding err = matcher.match(ResolutionResult.failed(BLOG, ResolutionStatus.ERROR, List.of(), "SERVFAIL"), null);
        assertThat(err.getEvidence()).containsExactly("DNS resolution error: SERVFAIL");
    }

    @Test
    void partial_chain_from_loop_is_not_vulnerable() {
        ResolutionResult rr = ResolutionResult.failed(BLOG, ResolutionStatus.ERROR,
                List.of("acme.github.io", "loop.github.io"), "CNAME loop detected at acme.github.io");
        Finding f = matcher.match(rr, null);
        assertThat(f.isVulnerable()).isFalse();
        assertThat(f.getCname()).containsExactly("acme.github.io", "loop.github.io");
        assertThat(f.getEvidence()).containsExactly("DNS resolution error: CNAME loop detected at acme.github.io");
    }

    @Test
    void matching_is_idempotent() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("acme.herokuapp.com"));
        ProbeResult pr = ProbeResult.ok(BLOG, BLOG_URL, 404, "No such app");
        assertThat(matcher.match(rr, pr)).isEqualTo(matcher.match(rr, pr));
    }

    @Test
    void unknown_cname_target_is_reported_but_not_vulnerable() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("lb.internal.example.net", "edge.example.net"));
        Finding f = matcher.match(rr, null);
        assertThat(f.isVulnerable()).isFalse();
        assertThat(f.getEvidence()).containsExactly(
                "CNAME points to: lb.internal.example.net -> edge.example.net",
                FingerprintMatcher.NO_FINGERPRINT);
    }

    @Test
    void cname_only_match_keeps_service_and_notes_missing_confirmation() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("shop.myshopify.com"));
        ProbeResult pr = ProbeResult.failed(BLOG, BLOG_URL, ProbeStatus.TIMEOUT, "HttpTimeoutException");

        Finding f = matcher.match(rr, pr);

        assertThat(f.isVulnerable()).isTrue();
        assertThat(f.getService()).contains("Shopify");
        assertThat(f.getConfidence()).isEqualTo(Confidence.CNAME_ONLY);
        assertThat(f.getEvidence()).contains(FingerprintMatcher.CNAME_ONLY_LABEL,
                "HTTP probe failed: TIMEOUT (HttpTimeoutException)");
        assertThat(f.getMatchedSignature()).isEmpty();
    }

    @Test
    void healthy_body_leaves_cname_only_confidence() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("acme.github.io"));
        ProbeResult pr = ProbeResult.ok(BLOG, BLOG_URL, 200, "<h1>Acme blog</h1>");
        Finding f = matcher.match(rr, pr);
        assertThat(f.getConfidence()).isEqualTo(Confidence.CNAME_ONLY);
        assertThat(f.getEvidence()).contains("HTTP Status: 200 (no service signature in body)");
    }

    @Test
    void tie_goes_to_first_table_entry_and_is_recorded() {
        FingerprintMatcher m = new FingerprintMatcher(new FingerprintTable(List.of(
                FingerprintEntry.of("First", List.of("shared-cdn.net"), List.of("gone"), true),
                FingerprintEntry.of("Second", List.of("cdn.net"), List.of("gone"), true))));
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("x.shared-cdn.net"));

        Finding f = m.match(rr, ProbeResult.ok(BLOG, BLOG_URL, 404, "site is GONE"));

        assertThat(f.getService()).contains("First");
        assertThat(f.getEvidence()).contains("Ambiguous match: also matches Second");
    }

    @Test
    void http_confirmation_narrows_ambiguous_cname_hits() {
        FingerprintMatcher m = new FingerprintMatcher(new FingerprintTable(List.of(
                FingerprintEntry.of("First", List.of("cdn.net"), List.of("first-missing"), true),
                FingerprintEntry.of("Second", List.of("cdn.net"), List.of("second-missing"), true))));
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("x.cdn.net"));

        Finding f = m.match(rr, ProbeResult.ok(BLOG, BLOG_URL, 404, "second-missing"));

        assertThat(f.getService()).contains("Second");
        assertThat(f.getConfidence()).isEqualTo(Confidence.CONFIRMED);
        assertThat(f.getEvidence()).noneMatch(e -> e.startsWith("Ambiguous"));
    }

    @Test
    void non_vulnerable_entry_identifies_service_without_flagging() {
        FingerprintMatcher m = new FingerprintMatcher(new FingerprintTable(List.of(
                FingerprintEntry.of("Managed CDN", List.of("managed-cdn.net"), List.of("unknown host"), false))));
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("x.managed-cdn.net"));

        Finding f = m.match(rr, ProbeResult.ok(BLOG, BLOG_URL, 404, "Unknown host"));

        assertThat(f.isVulnerable()).isFalse();
        assertThat(f.getService()).contains("Managed CDN");
    }

    @Test
    void deeper_chain_hop_is_matched() {
        ResolutionResult rr = ResolutionResult.resolved(BLOG, List.of("blog.cdn.example.net", "acme.github.io"));
        Finding f = matcher.match(rr, null);
        assertThat(f.getService()).contains("GitHub Pages");
        assertThat(f.getEvidence()).contains("CNAME points to: acme.github.io", "HTTP probe not performed");
    }
}
