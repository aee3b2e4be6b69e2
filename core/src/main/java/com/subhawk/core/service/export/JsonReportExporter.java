package com.subhawk.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.subhawk.core.model.Candidate;
import com.subhawk.core.model.Finding;
import com.subhawk.core.model.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 결과 JSON Exporter.
 * <pre>
 * {"scan_info": {"domain", "timestamp", "total_subdomains", "vulnerable_count", "completed"},
 *  "subdomains": [...],
 *  "vulnerable": [{"subdomain", "vulnerable", "service", "cname", "evidence"}]}
 * </pre>
 * subdomains 는 정렬 순, vulnerable 은 완료 순.
 */
public class JsonReportExporter implements ReportExporter {

    private static final Logger LOG = LoggerFactory.getLogger(JsonReportExporter.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    @Override
    public Path export(ScanReport report, Path out) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(out, toJson(report), StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
        LOG.info("Results saved to: {}", out);
        return out;
    }

    public String toJson(ScanReport report) {
        try {
            return mapper.writeValueAsString(toTree(report));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    ObjectNode toTree(ScanReport report) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode info = root.putObject("scan_info");
        info.put("domain", report.getDomain());
        info.putPOJO("timestamp", report.getTimestamp());
        info.put("total_subdomains", report.getAllCandidates().size());
        info.put("vulnerable_count", report.getVulnerableFindings().size());
        info.put("completed", report.isCompleted());

        ArrayNode subs = root.putArray("subdomains");
        for (Candidate c : report.getAllCandidates()) subs.add(c.name());

        ArrayNode vulns = root.putArray("vulnerable");
        for (Finding f : report.getVulnerableFindings()) {
            ObjectNode v = vulns.addObject();
            v.put("subdomain", f.getSubdomain().name());
            v.put("vulnerable", f.isVulnerable());
            v.put("service", f.getService().orElse(null));
            ArrayNode cname = v.putArray("cname");
            f.getCname().forEach(cname::add);
            ArrayNode ev = v.putArray("evidence");
            f.getEvidence().forEach(ev::add);
        }

        if (!report.getWarnings().isEmpty()) {
            ArrayNode w = root.putArray("warnings");
            report.getWarnings().forEach(w::add);
        }
        return root;
    }
}
