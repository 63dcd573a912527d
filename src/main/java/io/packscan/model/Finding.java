package io.packscan.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single scored detection ("hit").
 * <p>
 * Two findings are equal iff their {@code signature} strings are equal. Signatures are built
 * deterministically as {@code <kind>#<subkind>#<discriminators...>} so that the same condition
 * at the same location always collapses to one finding.
 *
 * @param name       Type of the detection, e.g. {@code SuspiciousArchiveEntry}
 * @param location   Path of the scanned artifact the detection refers to
 * @param message    Human-readable description
 * @param signature  Stable deduplication key
 * @param score      Severity score
 * @param lineNumber Source line if the detection refers to code, -1 otherwise
 * @param extra      Ordered structured details; key names are a reporting contract
 */
public record Finding(
        String name,
        String location,
        String message,
        String signature,
        int score,
        int lineNumber,
        Map<String, Object> extra
) implements ScanItem {

    /**
     * Score assigned to the most severe detections.
     */
    public static final int MAX_SCORE = 100;

    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (signature == null || signature.isBlank()) {
            throw new IllegalArgumentException("signature cannot be null or blank");
        }
        if (location == null) {
            location = "";
        }
        if (message == null) {
            message = "";
        }
        // LinkedHashMap keeps insertion order and tolerates null values
        extra = extra == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Builds a signature from its parts joined with {@code #}.
     */
    public static String signatureOf(Object... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('#');
            }
            sb.append(parts[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Finding other && signature.equals(other.signature);
    }

    @Override
    public int hashCode() {
        return signature.hashCode();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String location;
        private String message;
        private String signature;
        private int score;
        private int lineNumber = -1;
        private final Map<String, Object> extra = new LinkedHashMap<>();

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder score(int score) {
            this.score = score;
            return this;
        }

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder extra(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public Finding build() {
            return new Finding(name, location, message, signature, score, lineNumber, extra);
        }
    }

    /**
     * Returns a display-friendly location string.
     */
    public String displayLocation() {
        if (lineNumber > 0) {
            return location + ":" + lineNumber;
        }
        return location;
    }
}
