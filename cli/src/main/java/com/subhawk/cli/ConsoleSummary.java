package com.subhawk.cli;

import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ScanReport;

import java.io.PrintStream;

/** 스캔 결과 요약을 콘솔에 찍는다. 색상 없음. */
final class ConsoleSummary {

    private static final String RULE = "=".repeat(60);

    private ConsoleSummary() {}

    static void banner(PrintStream out, String domain) {
        out.println(RULE);
        out.println("SubHawk - Subdomain Takeover Scanner");
        out.println(RULE);
        out.println("Target: " + domain);
        out.println();
    }

    static void print(PrintStream out, ScanReport report) {
        out.println();
        out.println(RULE);
        out.println("SCAN SUMMARY");
        out.println(RULE);
        out.println();
        out.println("Target: " + report.getDomain());
        out.println("Total Subdomains Scanned: " + report.getAllCandidates().size());
        out.println("Vulnerable Subdomains: " + report.getVulnerableFindings().size());
        if (!report.isCompleted()) {
            out.println("Scan interrupted: " + report.getFindings().size() + " of "
                    + report.getAllCandidates().size() + " candidates checked");
        }
        for (String w : report.getWarnings()) {
            out.println("Warning: " + w);
        }
        out.println();

        if (report.getVulnerableFindings().isEmpty()) {
            out.println("No vulnerable subdomains found!");
            out.println();
            return;
        }
        out.println("VULNERABLE SUBDOMAINS:");
        out.println();
        for (Finding f : report.getVulnerableFindings()) {
            out.println("[!] " + f.getSubdomain());
            out.println("    Service: " + f.getService().orElse("?"));
            out.println("    CNAME: " + String.join(", ", f.getCname()));
            for (String e : f.getEvidence()) {
                out.println("    └─ " + e);
            }
            out.println();
        }
    }
}
