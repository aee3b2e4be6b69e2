package com.subhawk.cli;

import com.subhawk.core.model.ScanConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class SubHawkCliTest {

    @TempDir Path dir;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();

    private SubHawkCli newCli() {
        return new SubHawkCli(new PrintStream(outBuf, true, StandardCharsets.UTF_8),
                new PrintStream(errBuf, true, StandardCharsets.UTF_8));
    }

    private String err() { return errBuf.toString(StandardCharsets.UTF_8); }

    @Test
    void options_map_onto_config() throws Exception {
        Path words = dir.resolve("words.txt");
        Files.writeString(words, "www\nblog\n");
        SubHawkCli cli = newCli();
        new CommandLine(cli).parseArgs("-d", "Example.com", "-w", words.toString(), "-t", "20",
                "--timeout", "2.5", "-o", dir.resolve("r.json").toString(), "--no-passive", "-v");

        ScanConfig cfg = cli.buildConfig();

        assertThat(cfg.getDomain()).isEqualTo("example.com");
        assertThat(cfg.getWordlist()).containsExactly("www", "blog");
        assertThat(cfg.getConcurrency()).isEqualTo(20);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.getOutput()).isEqualTo(dir.resolve("r.json"));
        assertThat(cfg.passive().isEnabled()).isFalse();
        assertThat(cli.verbose).isTrue();
    }

    @Test
    void defaults_apply_without_flags() throws Exception {
        SubHawkCli cli = newCli();
        new CommandLine(cli).parseArgs("-d", "example.com");
        ScanConfig cfg = cli.buildConfig();
        assertThat(cfg.getConcurrency()).isEqualTo(10);
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(cfg.getWordlist()).isEmpty();
        assertThat(cfg.passive().isEnabled()).isTrue();
    }

    @Test
    void cli_flags_override_yaml() throws Exception {
        Path yml = dir.resolve("subhawk.yml");
        Files.writeString(yml, "domain: from-yaml.com\nconcurrency: 3\npassive:\n  enabled: true\n");
        SubHawkCli cli = newCli();
        new CommandLine(cli).parseArgs("-c", yml.toString(), "-t", "7");

        ScanConfig cfg = cli.buildConfig();

        assertThat(cfg.getDomain()).isEqualTo("from-yaml.com");
        assertThat(cfg.getConcurrency()).isEqualTo(7);
    }

    @Test
    void timeout_flag_overrides_yaml_read_timeout() throws Exception {
        Path yml = dir.resolve("subhawk.yml");
        Files.writeString(yml, "domain: example.com\ntimeoutMs: 5000\nreadTimeoutMs: 5000\n");
        SubHawkCli cli = newCli();
        new CommandLine(cli).parseArgs("-c", yml.toString(), "--timeout", "20");

        ScanConfig cfg = cli.buildConfig();

        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(cfg.getReadTimeout()).isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void builtin_wordlist_is_loaded_from_classpath() throws Exception {
        SubHawkCli cli = newCli();
        new CommandLine(cli).parseArgs("-d", "example.com", "-w", "builtin");
        assertThat(cli.buildConfig().getWordlist()).contains("www", "blog", "shop").doesNotContain("");
    }

    @Test
    void missing_domain_exits_with_usage_code() {
        int code = new CommandLine(newCli()).execute("--no-passive");
        assertThat(code).isEqualTo(SubHawkCli.EXIT_USAGE);
        assertThat(err()).contains("domain is required");
    }

    @Test
    void unreadable_wordlist_exits_with_usage_code() {
        int code = new CommandLine(newCli()).execute("-d", "example.com", "-w", dir.resolve("nope.txt").toString());
        assertThat(code).isEqualTo(SubHawkCli.EXIT_USAGE);
        assertThat(err()).contains("wordlist");
    }

    @Test
    void invalid_values_exit_with_usage_code() {
        assertThat(new CommandLine(newCli()).execute("-d", "example.com", "-t", "0")).isEqualTo(2);
        assertThat(new CommandLine(newCli()).execute("-d", "example.com", "--timeout", "-1")).isEqualTo(2);
        assertThat(new CommandLine(newCli()).execute("-d", "https://example.com")).isEqualTo(2);
    }

    @Test
    void unknown_option_is_a_picocli_usage_error() {
        CommandLine cmd = new CommandLine(newCli());
        cmd.setErr(new java.io.PrintWriter(new java.io.StringWriter()));
        assertThat(cmd.execute("--bogus")).isEqualTo(2);
    }

    @Test
    void missing_fingerprint_file_exits_with_usage_code() {
        int code = new CommandLine(newCli()).execute("-d", "example.com", "--no-passive",
                "--fingerprints", dir.resolve("fp.yml").toString());
        assertThat(code).isEqualTo(SubHawkCli.EXIT_USAGE);
        assertThat(err()).contains("fingerprint");
    }
}
