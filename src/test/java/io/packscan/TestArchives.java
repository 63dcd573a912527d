package io.packscan;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds small archives for tests. Entry maps are written in iteration order; use a
 * {@link java.util.LinkedHashMap} when the order matters.
 */
public final class TestArchives {

    private TestArchives() {
    }

    public static Path zip(Path target, Map<String, String> entries) throws IOException {
        try (ZipOutputStream out = new ZipOutputStream(Files.newOutputStream(target))) {
            for (Map.Entry<String, String> entry : entries.entrySet()) {
                out.putNextEntry(new ZipEntry(entry.getKey()));
                if (!entry.getKey().endsWith("/")) {
                    out.write(entry.getValue().getBytes(StandardCharsets.UTF_8));
                }
                out.closeEntry();
            }
        }
        return target;
    }

    public static Path tarGz(Path target, Map<String, String> entries) throws IOException {
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(
                new GzipCompressorOutputStream(Files.newOutputStream(target)))) {
            writeTar(out, entries);
        }
        return target;
    }

    public static Path tarBz2(Path target, Map<String, String> entries) throws IOException {
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(
                new BZip2CompressorOutputStream(Files.newOutputStream(target)))) {
            writeTar(out, entries);
        }
        return target;
    }

    /**
     * A gzip compressed tar holding copies of existing files, keyed by entry name.
     */
    public static Path tarGzOfFiles(Path target, Map<String, Path> files) throws IOException {
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(
                new GzipCompressorOutputStream(Files.newOutputStream(target)))) {
            for (Map.Entry<String, Path> file : files.entrySet()) {
                TarArchiveEntry entry = new TarArchiveEntry(file.getKey());
                entry.setSize(Files.size(file.getValue()));
                out.putArchiveEntry(entry);
                Files.copy(file.getValue(), out);
                out.closeArchiveEntry();
            }
        }
        return target;
    }

    /**
     * A gzip compressed tar holding a regular file and a symbolic link to {@code linkTarget}.
     */
    public static Path tarGzWithSymlink(Path target, String file, String link, String linkTarget) throws IOException {
        try (TarArchiveOutputStream out = new TarArchiveOutputStream(
                new GzipCompressorOutputStream(Files.newOutputStream(target)))) {
            writeTar(out, Map.of(file, "content"));
            TarArchiveEntry symlink = new TarArchiveEntry(link, TarArchiveEntry.LF_SYMLINK);
            symlink.setLinkName(linkTarget);
            out.putArchiveEntry(symlink);
            out.closeArchiveEntry();
        }
        return target;
    }

    private static void writeTar(TarArchiveOutputStream out, Map<String, String> entries) throws IOException {
        out.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            byte[] content = entry.getValue().getBytes(StandardCharsets.UTF_8);
            TarArchiveEntry tarEntry = new TarArchiveEntry(entry.getKey(), true);
            if (!entry.getKey().endsWith("/")) {
                tarEntry.setSize(content.length);
            }
            out.putArchiveEntry(tarEntry);
            if (!entry.getKey().endsWith("/")) {
                out.write(content);
            }
            out.closeArchiveEntry();
        }
    }

    /**
     * A valid gzip stream whose content is not a tar archive.
     */
    public static Path corruptTarGz(Path target) throws IOException {
        try (OutputStream out = new GzipCompressorOutputStream(Files.newOutputStream(target))) {
            out.write("not a tar header ".repeat(64).getBytes(StandardCharsets.UTF_8));
        }
        return target;
    }

    /**
     * A zip local file header signature followed by garbage.
     */
    public static Path corruptZip(Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            out.write(new byte[]{'P', 'K', 0x03, 0x04});
            out.write("truncated".getBytes(StandardCharsets.UTF_8));
        }
        return target;
    }
}
