package io.packscan.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FindingTest {

    private static Finding finding(String signature, int score) {
        return Finding.builder()
                .name("Test")
                .location("pkg.zip")
                .signature(signature)
                .score(score)
                .build();
    }

    @Test
    void equals_comparesSignatureOnly() {
        Finding a = finding("kind#sub#x", 10);
        Finding b = Finding.builder().name("Other").signature("kind#sub#x").score(99).message("m").build();

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(Set.of(a, finding("kind#sub#y", 10))).hasSize(2);
    }

    @Test
    void signatureOf_joinsPartsWithHash() {
        assertThat(Finding.signatureOf("archive_anomaly", "size", "a.zip", "x")).isEqualTo("archive_anomaly#size#a.zip#x");
        assertThat(Finding.signatureOf("crypto", "gen_key", "f", 3)).isEqualTo("crypto#gen_key#f#3");
    }

    @Test
    void builder_keepsExtraOrderAndNullValues() {
        Finding finding = Finding.builder()
                .name("Test")
                .signature("s")
                .extra("b", 1)
                .extra("a", null)
                .build();

        assertThat(finding.extra().keySet()).containsExactly("b", "a");
        assertThat(finding.lineNumber()).isEqualTo(-1);
        assertThat(finding.displayLocation()).isEmpty();
    }

    @Test
    void constructor_requiresNameAndSignature() {
        assertThatThrownBy(() -> Finding.builder().signature("s").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Finding.builder().name("n").signature(" ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void displayLocation_appendsLine() {
        Finding finding = Finding.builder().name("n").signature("s").location("a.py").lineNumber(4).build();

        assertThat(finding.displayLocation()).isEqualTo("a.py:4");
    }

    @Test
    void scanResult_filtersAndSortsByScore() {
        ScanResult result = new ScanResult(
                List.of(finding("a", 10), finding("b", 100), finding("c", 0)), 3, 0, 0);

        assertThat(result.findingsAtLeast(10)).extracting(Finding::signature).containsExactly("b", "a");
        assertThat(result.maxScore()).isEqualTo(100);
        assertThat(result.hasFindingsAtLeast(101)).isFalse();
        assertThat(new ScanResult(null, 0, 0, 0).maxScore()).isZero();
    }
}
