package com.subhawk.core.model;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanConfigTest {

    private static ScanConfig valid() {
        return ScanConfig.defaults().setDomain("example.com");
    }

    @Test
    void defaults_are_sane() {
        ScanConfig cfg = valid();
        assertThat(cfg.getConcurrency()).isEqualTo(10);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getReadTimeout()).isEqualTo(cfg.getTimeout());
        assertThat(cfg.getRps()).isZero();
        assertThat(cfg.getWordlist()).isEmpty();
        assertThat(cfg.passive().isEnabled()).isTrue();
        assertThat(cfg.passive().getEndpoint()).isEqualTo(URI.create("https://crt.sh/"));
        assertThat(cfg.probe().getMaxBodyBytes()).isEqualTo(65536);
        assertThatCode(cfg::validate).doesNotThrowAnyException();
    }

    @Test
    void domain_is_normalized() {
        assertThat(ScanConfig.defaults().setDomain(" Example.COM. ").getDomain()).isEqualTo("example.com");
    }

    @Test
    void missing_or_malformed_domain_is_rejected() {
        assertThatThrownBy(() -> ScanConfig.defaults().validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("domain");
        assertThatThrownBy(() -> ScanConfig.defaults().setDomain("https://example.com").validate())
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("URL");
        assertThatThrownBy(() -> ScanConfig.defaults().setDomain("exa mple.com").validate())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void non_positive_limits_are_rejected() {
        assertThatThrownBy(() -> valid().setConcurrency(0).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setRps(-1).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setMaxCnameDepth(0).validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> valid().setTimeoutSeconds(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fractional_timeout_seconds_are_kept() {
        assertThat(valid().setTimeoutSeconds(2.5).getTimeoutMs()).isEqualTo(2500);
    }

    @Test
    void passive_endpoint_must_be_http() {
        ScanConfig cfg = valid();
        cfg.passive().setEndpoint(URI.create("ftp://crt.sh/"));
        assertThatThrownBy(cfg::validate).isInstanceOf(IllegalArgumentException.class);
    }
}
