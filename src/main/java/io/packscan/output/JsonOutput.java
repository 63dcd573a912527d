package io.packscan.output;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.packscan.diff.DiffReport;
import io.packscan.model.Finding;
import io.packscan.model.ScanResult;

import java.io.IOException;
import java.io.OutputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes scan results as JSON:
 * {@code {"findings": [{name, location, message, signature, score, line, extra}], "summary": {...}}}.
 */
public class JsonOutput {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);

    private int minScore = 0;

    public JsonOutput minScore(int minScore) {
        this.minScore = minScore;
        return this;
    }

    public void write(ScanResult result, OutputStream out) throws IOException {
        List<Finding> findings = result.findingsAtLeast(minScore);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("findings", findings.size());
        summary.put("max_score", findings.stream().mapToInt(Finding::score).max().orElse(0));
        summary.put("locations_scanned", result.locationsScanned());
        summary.put("failed_locations", result.failedLocations());
        summary.put("skipped_locations", result.skippedLocations());

        writeDocument(findings, summary, null, out);
    }

    public void write(DiffReport report, OutputStream out) throws IOException {
        List<Finding> findings = report.findings().stream()
                .filter(f -> f.score() >= minScore)
                .toList();

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("findings", findings.size());
        summary.put("changes", report.changes().size());

        writeDocument(findings, summary, report.changes(), out);
    }

    private void writeDocument(List<Finding> findings,
                               Map<String, Object> summary,
                               List<String> changes,
                               OutputStream out) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("findings", findings.stream().map(JsonOutput::toMap).toList());
        if (changes != null) {
            document.put("changes", changes);
        }
        document.put("summary", summary);
        mapper.writeValue(out, document);
        out.write('\n');
        out.flush();
    }

    static Map<String, Object> toMap(Finding finding) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", finding.name());
        data.put("location", finding.location());
        data.put("message", finding.message());
        data.put("signature", finding.signature());
        data.put("score", finding.score());
        if (finding.lineNumber() > 0) {
            data.put("line", finding.lineNumber());
        }
        data.put("extra", finding.extra());
        return data;
    }
}
