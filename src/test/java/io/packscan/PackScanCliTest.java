package io.packscan;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PackScanCliTest {

    @TempDir
    Path tempDir;

    private static int run(String... args) {
        return new CommandLine(new PackScanCli()).execute(args);
    }

    private Path traversalZip() throws IOException {
        return TestArchives.zip(tempDir.resolve("pkg.zip"), Map.of("../../etc/passwd", "root"));
    }

    @Test
    void scan_exitCodeDependsOnFailThreshold() throws IOException {
        Path zip = traversalZip();
        Path report = tempDir.resolve("report.txt");

        assertThat(run("scan", zip.toString(), "-f", report.toString())).isZero();
        assertThat(run("scan", zip.toString(), "-f", report.toString(), "--fail-on", "50")).isEqualTo(2);
        assertThat(Files.readString(report)).contains("SuspiciousArchiveEntry");
    }

    @Test
    void scan_writesJsonReport() throws IOException {
        Path zip = traversalZip();
        Path report = tempDir.resolve("report.json");

        int exitCode = run("scan", zip.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.get("findings")).hasSize(1);
        assertThat(root.get("findings").get(0).get("score").asInt()).isEqualTo(50);
        assertThat(root.get("summary").get("locations_scanned").asInt()).isEqualTo(1);
    }

    @Test
    void scan_minScoreHidesFindingsFromReportAndExitCode() throws IOException {
        Path zip = traversalZip();
        Path report = tempDir.resolve("report.json");

        int exitCode = run("scan", zip.toString(), "-o", "json", "-f", report.toString(),
                "--min-score", "60", "--fail-on", "50");

        assertThat(exitCode).isZero();
        assertThat(new ObjectMapper().readTree(report.toFile()).get("findings")).isEmpty();
    }

    @Test
    void scan_configFileOverridesScores() throws IOException {
        Path zip = traversalZip();
        Path config = Files.writeString(tempDir.resolve("scores.yaml"), """
                scores:
                  suspicious-archive-entry-parent-reference: 100
                """);

        int exitCode = run("scan", zip.toString(), "-c", config.toString(),
                "-f", tempDir.resolve("out.txt").toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void errors_exitWithOne() throws IOException {
        Path zip = traversalZip();

        assertThat(run("scan", tempDir.resolve("missing.zip").toString())).isEqualTo(1);
        assertThat(run("scan", zip.toString(), "-c", tempDir.resolve("missing.yaml").toString())).isEqualTo(1);
        assertThat(run("scan")).isEqualTo(1);
        assertThat(run()).isEqualTo(1);
    }

    @Test
    void diff_reportsChangesInJson() throws IOException {
        Path a = Files.createDirectory(tempDir.resolve("a"));
        Path b = Files.createDirectory(tempDir.resolve("b"));
        Files.writeString(a.resolve("setup.py"), "version = 1");
        Files.writeString(b.resolve("setup.py"), "version = 2");
        Path report = tempDir.resolve("diff.json");

        int exitCode = run("diff", a.toString(), b.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertThat(root.get("changes").get(0).asText()).isEqualTo("M setup.py");
    }
}
