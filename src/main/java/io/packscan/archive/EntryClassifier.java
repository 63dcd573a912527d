package io.packscan.archive;

import io.packscan.ScanConfig;
import io.packscan.model.Finding;
import io.packscan.model.ScanLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.regex.Pattern;

/**
 * Decides, before anything is written to disk, whether an archive entry may be extracted.
 * <p>
 * Checks run in a fixed order: absolute path, parent directory reference, links (tar only,
 * skipped without a finding), declared size. The first failing check decides.
 */
public class EntryClassifier {

    private static final Logger log = LoggerFactory.getLogger(EntryClassifier.class);

    public static final String SUSPICIOUS_ENTRY = "SuspiciousArchiveEntry";
    public static final String ARCHIVE_ANOMALY = "ArchiveAnomaly";

    private static final Pattern DRIVE_ROOT = Pattern.compile("^[A-Za-z]:[/\\\\].*");
    private static final Pattern SEPARATORS = Pattern.compile("[/\\\\]");

    /**
     * Container format; decides the score of oversized entries.
     */
    public enum Format {
        /**
         * Zip archives and the general case.
         */
        ZIP("archive-entry-size-exceeded", 10),

        /**
         * Regular files of tar archives.
         */
        TAR("archive-file-size-exceeded", Finding.MAX_SCORE);

        private final String sizeScoreName;
        private final int sizeDefaultScore;

        Format(String sizeScoreName, int sizeDefaultScore) {
            this.sizeScoreName = sizeScoreName;
            this.sizeDefaultScore = sizeDefaultScore;
        }
    }

    /**
     * What to do with an entry.
     */
    public enum Verdict {
        EXTRACT,
        REJECT,
        SKIP
    }

    /**
     * Outcome of classifying one entry.
     *
     * @param verdict What to do with the entry
     * @param finding The anomaly for rejected entries, null otherwise
     */
    public record Decision(Verdict verdict, Finding finding) {
        static Decision extract() {
            return new Decision(Verdict.EXTRACT, null);
        }

        static Decision skip() {
            return new Decision(Verdict.SKIP, null);
        }

        static Decision reject(Finding finding) {
            return new Decision(Verdict.REJECT, finding);
        }
    }

    private final ScanConfig config;
    private final Format format;
    private final Long maxSize;
    private final String location;

    /**
     * @param config   Scores and the global size limit
     * @param format   Container format of the archive
     * @param maxSize  Per call size limit; null applies the configured maximum
     * @param location Path of the archive, embedded in findings
     */
    public EntryClassifier(ScanConfig config, Format format, Long maxSize, String location) {
        this.config = config;
        this.format = format;
        this.maxSize = maxSize != null ? maxSize : config.maximumArchiveSize();
        this.location = location;
    }

    public Decision classify(ArchiveEntry entry) {
        String path = entry.path();
        if (isAbsolute(path)) {
            return Decision.reject(suspicious(path, "absolute_path", "suspicious-archive-entry-absolute-path"));
        }
        if (hasParentReference(path)) {
            return Decision.reject(suspicious(path, "parent_reference", "suspicious-archive-entry-parent-reference"));
        }
        if (entry.type() == ArchiveEntry.Type.DIRECTORY) {
            return Decision.extract();
        }
        if (entry.isLink()) {
            log.debug("Skipping {} entry '{}' in {}", entry.type().name().toLowerCase(), path, location);
            return Decision.skip();
        }
        if (entry.type() != ArchiveEntry.Type.FILE) {
            return Decision.skip();
        }
        if (maxSize != null && entry.size() > maxSize) {
            return Decision.reject(oversized(entry));
        }
        return Decision.extract();
    }

    /**
     * True if the path starts at a filesystem root.
     */
    public static boolean isAbsolute(String path) {
        return path.startsWith("/") || path.startsWith("\\") || DRIVE_ROOT.matcher(path).matches();
    }

    /**
     * True if any path component is exactly {@code ..}.
     */
    public static boolean hasParentReference(String path) {
        for (String part : SEPARATORS.split(path)) {
            if (part.equals("..")) {
                return true;
            }
        }
        return false;
    }

    private Finding suspicious(String path, String entryType, String scoreName) {
        return Finding.builder()
                .name(SUSPICIOUS_ENTRY)
                .location(location)
                .message("Archive contains an entry pointing outside of the extraction directory")
                .signature(Finding.signatureOf("suspicious_archive_entry", entryType, path, location))
                .score(config.scoreOrDefault(scoreName, 50))
                .extra("entry_type", entryType)
                .extra("entry_path", path)
                .build();
    }

    private Finding oversized(ArchiveEntry entry) {
        return Finding.builder()
                .name(ARCHIVE_ANOMALY)
                .location(location)
                .message("Archive contains a file that exceeds the configured maximum size")
                .signature(Finding.signatureOf("archive_anomaly", "size", location, entry.path()))
                .score(config.scoreOrDefault(format.sizeScoreName, format.sizeDefaultScore))
                .extra("archive_path", entry.path())
                .extra("reason", "file_size_exceeded")
                .extra("size", entry.size())
                .extra("limit", maxSize)
                .build();
    }

    /**
     * The single finding reported when the archive container cannot be read.
     */
    public static Finding readError(ScanConfig config, ScanLocation archive, Exception cause) {
        String location = archive.path().toString();
        return Finding.builder()
                .name(ARCHIVE_ANOMALY)
                .location(location)
                .message("Could not open the archive for analysis")
                .signature(Finding.signatureOf("archive_anomaly", "read_error", location))
                .score(config.scoreOrDefault("corrupted-archive", 10))
                .extra("reason", "archive_read_error")
                .extra("exc_message", cause.getMessage())
                .extra("exc_type", cause.getClass().getSimpleName())
                .extra("mime", archive.metadata().get(ScanLocation.MIME))
                .build();
    }
}
