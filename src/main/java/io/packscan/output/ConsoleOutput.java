package io.packscan.output;

import io.packscan.diff.DiffReport;
import io.packscan.model.Finding;
import io.packscan.model.ScanResult;

import java.io.PrintStream;
import java.util.List;
import java.util.Map;

/**
 * Outputs scan results to the console in a simple format.
 */
public class ConsoleOutput {

    private final PrintStream out;
    private int minScore = 0;
    private boolean showExtra = true;

    public ConsoleOutput() {
        this(System.out);
    }

    public ConsoleOutput(PrintStream out) {
        this.out = out;
    }

    public ConsoleOutput minScore(int minScore) {
        this.minScore = minScore;
        return this;
    }

    public ConsoleOutput showExtra(boolean show) {
        this.showExtra = show;
        return this;
    }

    public void print(ScanResult result) {
        List<Finding> findings = result.findingsAtLeast(minScore);
        printFindings(findings);
        out.printf("%d finding(s), %d location(s) scanned, %d failed, %d skipped%n",
                findings.size(), result.locationsScanned(), result.failedLocations(), result.skippedLocations());
    }

    public void print(DiffReport report) {
        for (String change : report.changes()) {
            out.println(change);
        }
        if (!report.changes().isEmpty()) {
            out.println();
        }
        List<Finding> findings = report.findings().stream()
                .filter(f -> f.score() >= minScore)
                .toList();
        printFindings(findings);
        out.printf("%d change(s), %d finding(s)%n", report.changes().size(), findings.size());
    }

    private void printFindings(List<Finding> findings) {
        for (Finding finding : findings) {
            out.printf("[%3d] %s: %s%n", finding.score(), finding.name(), finding.message());
            out.printf("      at %s%n", finding.displayLocation());
            if (showExtra) {
                for (Map.Entry<String, Object> entry : finding.extra().entrySet()) {
                    out.printf("      %s = %s%n", entry.getKey(), entry.getValue());
                }
            }
        }
    }
}
