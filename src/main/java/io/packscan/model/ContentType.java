package io.packscan.model;

import org.apache.commons.compress.archivers.ArchiveException;
import org.apache.commons.compress.archivers.ArchiveStreamFactory;
import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Content classification of a scan location, detected from magic bytes.
 */
public enum ContentType {
    GZIP_TAR("application/gzip"),
    BZIP2_TAR("application/x-bzip2"),
    ZIP("application/zip"),
    DIRECTORY("inode/directory"),
    UNSUPPORTED("application/octet-stream");

    private static final Logger log = LoggerFactory.getLogger(ContentType.class);

    private final String mimeType;

    ContentType(String mimeType) {
        this.mimeType = mimeType;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * True for the archive formats the archive analyzer unpacks.
     */
    public boolean isArchive() {
        return this == GZIP_TAR || this == BZIP2_TAR || this == ZIP;
    }

    /**
     * Detects the content type of a filesystem path. Unreadable or unknown content is
     * {@link #UNSUPPORTED}.
     */
    public static ContentType detect(Path path) {
        if (Files.isDirectory(path)) {
            return DIRECTORY;
        }
        if (!Files.isRegularFile(path)) {
            return UNSUPPORTED;
        }
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return detect(in);
        } catch (IOException e) {
            log.debug("Could not read {} for content detection: {}", path, e.getMessage());
            return UNSUPPORTED;
        }
    }

    /**
     * Detects the content type from a stream that supports mark/reset.
     */
    static ContentType detect(InputStream in) {
        ContentType compressed = detectCompressed(in);
        if (compressed != null) {
            return compressed;
        }
        try {
            String archiver = ArchiveStreamFactory.detect(in);
            return ArchiveStreamFactory.ZIP.equals(archiver) ? ZIP : UNSUPPORTED;
        } catch (ArchiveException e) {
            log.trace("No archive signature: {}", e.getMessage());
            return UNSUPPORTED;
        }
    }

    private static ContentType detectCompressed(InputStream in) {
        try {
            String compressor = CompressorStreamFactory.detect(in);
            if (CompressorStreamFactory.GZIP.equals(compressor)) {
                return GZIP_TAR;
            }
            if (CompressorStreamFactory.BZIP2.equals(compressor)) {
                return BZIP2_TAR;
            }
            return UNSUPPORTED;
        } catch (CompressorException e) {
            log.trace("No compressor signature: {}", e.getMessage());
            return null;
        }
    }
}
