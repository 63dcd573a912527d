package io.packscan.archive;

/**
 * Format independent view of an archive member, as listed by the container.
 *
 * @param path Entry name as stored in the archive, not normalized
 * @param type Kind of member
 * @param size Declared uncompressed size in bytes, or -1 if the container does not declare it
 */
public record ArchiveEntry(String path, Type type, long size) {

    /**
     * Kind of archive member.
     */
    public enum Type {
        FILE,
        DIRECTORY,
        SYMLINK,
        HARDLINK,
        OTHER
    }

    public ArchiveEntry {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    public boolean isLink() {
        return type == Type.SYMLINK || type == Type.HARDLINK;
    }
}
