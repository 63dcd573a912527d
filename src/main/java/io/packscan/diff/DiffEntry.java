package io.packscan.diff;

import io.packscan.model.ScanLocation;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * One changed file between two scans.
 *
 * @param operation What happened to the file
 * @param name      Display name, relative to the compared roots
 * @param aPath     File on the "a" side, null if added
 * @param bPath     File on the "b" side, null if deleted
 * @param aScan     Location the "a" file belongs to
 * @param bScan     Location the "b" file belongs to
 * @param aMd5      Content hash of the "a" file, null if added
 * @param bMd5      Content hash of the "b" file, null if deleted
 */
public record DiffEntry(
        DiffOperation operation,
        String name,
        Path aPath,
        Path bPath,
        ScanLocation aScan,
        ScanLocation bScan,
        String aMd5,
        String bMd5
) {
    public DiffEntry {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (operation != DiffOperation.ADDED && (aPath == null || aScan == null)) {
            throw new IllegalArgumentException(operation + " requires the 'a' side");
        }
        if (operation != DiffOperation.DELETED && (bPath == null || bScan == null)) {
            throw new IllegalArgumentException(operation + " requires the 'b' side");
        }
    }

    /**
     * True if both sides exist and their content hashes differ.
     */
    public boolean contentChanged() {
        return aMd5 != null && bMd5 != null && !aMd5.equals(bMd5);
    }

    /**
     * Hex encoded MD5 of a file's content.
     */
    public static String md5(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
        try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    @Override
    public String toString() {
        return operation.code() + " " + name;
    }
}
