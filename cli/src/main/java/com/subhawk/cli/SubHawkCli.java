package com.subhawk.cli;

import com.subhawk.cli.logging.LogSetup;
import com.subhawk.core.discovery.WordlistSource;
import com.subhawk.core.model.ScanConfig;
import com.subhawk.core.model.ScanReport;
import com.subhawk.core.service.ScanOrchestrator;
import com.subhawk.core.service.export.JsonReportExporter;
import com.subhawk.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SubHawk CLI 진입점.
 *
 * <pre>
 * subhawk -d example.com
 * subhawk -d example.com -w wordlist.txt -t 20 --timeout 3 -o results.json
 * subhawk -c subhawk.yml --no-passive -w builtin
 * </pre>
 *
 * 종료 코드: 0 스캔 완료(취약 여부 무관), 2 잘못된 호출/설정, 130 사용자 중단.
 */
@Command(
        name = "subhawk",
        description = "Find subdomains whose DNS points at unclaimed third-party resources",
        mixinStandardHelpOptions = true,
        version = "1.0.0"
)
public class SubHawkCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SubHawkCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INTERRUPTED = 130;

    /** 내장 워드리스트를 쓰기 위한 -w 값 */
    static final String BUILTIN_WORDLIST = "builtin";
    private static final String BUILTIN_RESOURCE = "/wordlists/common.txt";

    @Option(names = {"-d", "--domain"}, description = "Target domain (e.g. example.com)")
    String domain;

    @Option(names = {"-w", "--wordlist"},
            description = "Wordlist file for active enumeration, or 'builtin'")
    String wordlist;

    @Option(names = {"-t", "--threads"}, description = "Number of concurrent workers (default: 10)")
    Integer threads;

    @Option(names = {"--timeout"}, description = "Per-request timeout in seconds (default: 5)")
    Double timeout;

    @Option(names = {"-v", "--verbose"}, description = "Verbose output")
    boolean verbose;

    @Option(names = {"-o", "--output"}, description = "Write JSON results to this file")
    Path output;

    @Option(names = {"-c", "--config"}, description = "YAML configuration file")
    Path config;

    @Option(names = {"--fingerprints"}, description = "YAML fingerprint file replacing the bundled table")
    Path fingerprints;

    @Option(names = {"--no-passive"}, description = "Skip certificate transparency enumeration")
    boolean noPassive;

    private final PrintStream out;
    private final PrintStream err;

    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private final CountDownLatch finished = new CountDownLatch(1);
    private static final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public SubHawkCli() {
        this(System.out, System.err);
    }

    SubHawkCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SubHawkCli()).execute(args);
        // 종료 훅 실행 중 System.exit 를 부르면 멈춘다
        if (!shuttingDown.get()) System.exit(code);
    }

    @Override
    public Integer call() {
        ScanConfig cfg;
        try {
            cfg = buildConfig();
            cfg.validate();
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        ScanOrchestrator orchestrator;
        try {
            orchestrator = new ScanOrchestrator(cfg);
        } catch (IOException | IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        LogSetup.configure(Path.of("out"), verbose);

        Thread hook = new Thread(this::onShutdown, "subhawk-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            ConsoleSummary.banner(out, cfg.getDomain());
            ScanReport report = orchestrator.run((p, phase, done, total) -> {
                if ("scan".equals(phase) && done > 0 && (done % 50 == 0 || done == total)) {
                    LOG.info("Progress: {}/{} candidates", done, total);
                }
            }, cancel);

            ConsoleSummary.print(out, report);
            if (cfg.getOutput() != null) {
                try {
                    new JsonReportExporter().export(report, cfg.getOutput());
                    out.println("Results saved to: " + cfg.getOutput());
                } catch (IOException e) {
                    LOG.error("Failed to write results to {}", cfg.getOutput(), e);
                    err.println("Error: could not write " + cfg.getOutput() + ": " + e.getMessage());
                }
            }

            if (!report.isCompleted()) {
                err.println("Scan interrupted by user");
                return EXIT_INTERRUPTED;
            }
            return EXIT_OK;
        } finally {
            finished.countDown();
            if (!shuttingDown.get()) {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException e) {
                    LOG.debug("Shutdown already in progress");
                }
            }
        }
    }

    /** Ctrl+C: 스캔을 멈추고 부분 결과가 찍힐 때까지 잠깐 기다린다 */
    private void onShutdown() {
        shuttingDown.set(true);
        cancel.set(true);
        try {
            if (!finished.await(10, TimeUnit.SECONDS)) {
                err.println("Scan did not stop in time; exiting");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** YAML(있으면) 위에 CLI 옵션을 덮어쓴다. 검증은 호출 측에서. */
    ScanConfig buildConfig() throws IOException {
        ScanConfig cfg = (config != null) ? YamlConfigLoader.load(config) : ScanConfig.defaults();

        if (domain != null) cfg.setDomain(domain);
        if (wordlist != null) cfg.setWordlist(readWordlist(wordlist));
        if (threads != null) cfg.setConcurrency(threads);
        if (timeout != null) {
            // --timeout 은 DNS 와 HTTP 읽기 타임아웃을 함께 정한다
            cfg.setTimeoutSeconds(timeout);
            cfg.setReadTimeout(cfg.getTimeout());
        }
        if (output != null) cfg.setOutput(output);
        if (fingerprints != null) cfg.setFingerprintsFile(fingerprints);
        if (noPassive) cfg.passive().setEnabled(false);
        return cfg;
    }

    private static List<String> readWordlist(String value) throws IOException {
        if (BUILTIN_WORDLIST.equalsIgnoreCase(value.trim())) {
            try (InputStream in = SubHawkCli.class.getResourceAsStream(BUILTIN_RESOURCE)) {
                if (in == null) throw new IOException("builtin wordlist missing: " + BUILTIN_RESOURCE);
                return WordlistSource.read(in);
            }
        }
        return WordlistSource.read(Path.of(value));
    }
}
